package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.Locale;

/**
 * How sentence boundaries are treated when counting tag transitions.
 */
public enum TransitionBoundaries {
    /**
     * Count every consecutive pair of the flattened tag sequence, including pairs
     * that bridge the end of one sentence and the start of the next.
     */
    FLATTENED,
    /**
     * Count only transitions inside a sentence. Needs a corpus grouped into sentences.
     */
    SENTENCE;

    public static TransitionBoundaries fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transition boundary mode: " + name
                + " (expected 'flattened' or 'sentence')", e);
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
