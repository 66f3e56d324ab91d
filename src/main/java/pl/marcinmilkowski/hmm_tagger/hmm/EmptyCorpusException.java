package pl.marcinmilkowski.hmm_tagger.hmm;

/**
 * Exception thrown when a model is trained from a corpus with no training pairs
 * or no sentence-initial tags.
 */
public class EmptyCorpusException extends RuntimeException {

    public EmptyCorpusException(String message) {
        super(message);
    }

    public EmptyCorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
