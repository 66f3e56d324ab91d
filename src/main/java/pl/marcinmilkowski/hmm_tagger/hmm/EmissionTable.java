package pl.marcinmilkowski.hmm_tagger.hmm;

/**
 * Finalized emission log-probabilities, tag index by token index.
 *
 * A smoothed table also carries a per-tag residual: the log-probability reserved for
 * any token never observed under that tag. Unsmoothed tables have no residual.
 */
public final class EmissionTable {

    private final double[][] logProbs;
    private final double[] residualLogProbs;

    public EmissionTable(double[][] logProbs, double[] residualLogProbs) {
        if (residualLogProbs != null && residualLogProbs.length != logProbs.length) {
            throw new IllegalArgumentException("Residual count " + residualLogProbs.length
                + " does not match tag count " + logProbs.length);
        }
        this.logProbs = logProbs;
        this.residualLogProbs = residualLogProbs;
    }

    public double logProb(int tag, int token) {
        return logProbs[tag][token];
    }

    public boolean hasResidual() {
        return residualLogProbs != null;
    }

    /**
     * @throws IllegalStateException if the table was not smoothed
     */
    public double residualLogProb(int tag) {
        if (residualLogProbs == null) {
            throw new IllegalStateException("Unsmoothed emission table has no residual mass");
        }
        return residualLogProbs[tag];
    }

    public int tagCount() {
        return logProbs.length;
    }

    public int tokenCount() {
        return logProbs.length == 0 ? 0 : logProbs[0].length;
    }

    double[][] rows() {
        return logProbs;
    }

    double[] residuals() {
        return residualLogProbs;
    }
}
