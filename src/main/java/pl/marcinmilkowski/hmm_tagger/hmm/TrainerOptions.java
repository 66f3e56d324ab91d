package pl.marcinmilkowski.hmm_tagger.hmm;

import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

/**
 * Training choices for {@link HmmTrainer}.
 */
public record TrainerOptions(Smoothing smoothing, TransitionBoundaries transitionBoundaries) {

    public TrainerOptions {
        if (smoothing == null) {
            throw new IllegalArgumentException("smoothing must not be null");
        }
        if (transitionBoundaries == null) {
            throw new IllegalArgumentException("transitionBoundaries must not be null");
        }
    }

    /**
     * Options with flattened transition counting.
     */
    public static TrainerOptions of(Smoothing smoothing) {
        return new TrainerOptions(smoothing, TransitionBoundaries.FLATTENED);
    }
}
