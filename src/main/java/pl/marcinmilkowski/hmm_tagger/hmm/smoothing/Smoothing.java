package pl.marcinmilkowski.hmm_tagger.hmm.smoothing;

import java.util.Locale;

/**
 * Emission smoothing policies a model can be trained with.
 */
public enum Smoothing {
    NONE(new NoSmoothing()),
    LAPLACE(new LaplaceSmoothing());

    private final SmoothingStrategy strategy;

    Smoothing(SmoothingStrategy strategy) {
        this.strategy = strategy;
    }

    public SmoothingStrategy strategy() {
        return strategy;
    }

    public static Smoothing fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown smoothing: " + name + " (expected 'none' or 'laplace')", e);
        }
    }

    public String configName() {
        return strategy.getName();
    }
}
