package pl.marcinmilkowski.hmm_tagger.hmm;

/**
 * Base-2 log-space probability arithmetic.
 *
 * All model tables store log2 probabilities. A probability of zero is represented
 * as negative infinity and is never handed to the logarithm.
 */
public final class LogProb {

    public static final double ZERO = Double.NEGATIVE_INFINITY;
    public static final double ONE = 0.0;

    private static final double LN_2 = Math.log(2.0);

    private LogProb() {
    }

    /**
     * log2 of a probability; 0 maps to {@link #ZERO}.
     *
     * @throws IllegalArgumentException if the probability is negative, above 1 or NaN
     */
    public static double log2(double probability) {
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Not a probability: " + probability);
        }
        if (probability == 0.0) {
            return ZERO;
        }
        return Math.log(probability) / LN_2;
    }

    /**
     * log2 of {@code count / total}. A zero count maps to {@link #ZERO}.
     */
    public static double log2Ratio(long count, long total) {
        if (total <= 0) {
            throw new IllegalArgumentException("Total must be positive, got " + total);
        }
        if (count == 0) {
            return ZERO;
        }
        return log2((double) count / (double) total);
    }

    /**
     * Back to probability space.
     */
    public static double exp2(double logProbability) {
        if (logProbability == ZERO) {
            return 0.0;
        }
        return Math.pow(2.0, logProbability);
    }
}
