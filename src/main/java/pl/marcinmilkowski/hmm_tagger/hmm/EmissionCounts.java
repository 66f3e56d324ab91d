package pl.marcinmilkowski.hmm_tagger.hmm;

/**
 * Raw (tag, token) emission counts and per-tag totals, indexed by {@link Vocabulary}.
 */
public final class EmissionCounts {

    private final int[][] counts;
    private final long[] tagTotals;
    private final int[] observedTypes;

    EmissionCounts(int[][] counts, long[] tagTotals) {
        this.counts = counts;
        this.tagTotals = tagTotals;
        this.observedTypes = new int[counts.length];
        for (int tag = 0; tag < counts.length; tag++) {
            int types = 0;
            for (int c : counts[tag]) {
                if (c > 0) types++;
            }
            observedTypes[tag] = types;
        }
    }

    public int tagCount() {
        return counts.length;
    }

    public int tokenCount() {
        return counts.length == 0 ? 0 : counts[0].length;
    }

    public int count(int tag, int token) {
        return counts[tag][token];
    }

    /**
     * Total number of corpus positions carrying the tag (C in the Laplace formula).
     */
    public long tagTotal(int tag) {
        return tagTotals[tag];
    }

    /**
     * Number of distinct tokens observed at least once under the tag.
     */
    public int observedTypes(int tag) {
        return observedTypes[tag];
    }
}
