package pl.marcinmilkowski.hmm_tagger.hmm;

import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.util.Locale;

/**
 * Emission log-probability given to decode-time tokens that never occurred in training.
 */
public enum UnknownTokenPolicy {

    /**
     * Probability 0 under every tag. Any path through an unknown token scores
     * negative infinity.
     */
    ZERO {
        @Override
        public double logEmission(HmmModel model, int tag) {
            return LogProb.ZERO;
        }
    },

    /**
     * The tag's Laplace residual. Only valid for smoothed models.
     */
    RESIDUAL {
        @Override
        public double logEmission(HmmModel model, int tag) {
            return model.residualLogProb(tag);
        }

        @Override
        public void checkApplicable(HmmModel model) {
            if (!model.hasResidual()) {
                throw new IllegalArgumentException(
                    "Residual unknown-token policy needs a smoothed model, got " + model.smoothing().configName());
            }
        }
    },

    /**
     * Probability 1 under every tag, so transitions alone pick the tag.
     */
    UNIFORM {
        @Override
        public double logEmission(HmmModel model, int tag) {
            return LogProb.ONE;
        }
    };

    public abstract double logEmission(HmmModel model, int tag);

    /**
     * @throws IllegalArgumentException if the policy cannot be used with the model
     */
    public void checkApplicable(HmmModel model) {
    }

    public static UnknownTokenPolicy defaultFor(Smoothing smoothing) {
        return smoothing == Smoothing.LAPLACE ? RESIDUAL : ZERO;
    }

    public static UnknownTokenPolicy fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unknown-token policy: " + name
                + " (expected 'zero', 'residual' or 'uniform')", e);
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
