package pl.marcinmilkowski.hmm_tagger.hmm;

/**
 * A single annotated corpus position: the observed token and its gold tag.
 */
public record TrainingPair(String token, String tag) {

    public TrainingPair {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Training pair token must not be empty");
        }
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Training pair tag must not be empty (token: " + token + ")");
        }
    }

    @Override
    public String toString() {
        return token + "\t" + tag;
    }
}
