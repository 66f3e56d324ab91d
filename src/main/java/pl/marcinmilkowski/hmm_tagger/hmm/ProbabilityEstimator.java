package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.Arrays;
import java.util.List;

/**
 * Maximum-likelihood estimates of the HMM parameters from labeled training data.
 *
 * All tables are returned in log base 2 and indexed by {@link Vocabulary}:
 * <ul>
 *   <li>initial: tag -> log P(tag starts a sentence)</li>
 *   <li>transition: (from, to) -> log P(to | from)</li>
 *   <li>emission: (tag, token) -> log P(token | tag)</li>
 * </ul>
 * Zero counts become negative infinity directly.
 */
public final class ProbabilityEstimator {

    private ProbabilityEstimator() {
    }

    /**
     * Estimate the initial-state distribution from one tag per training sentence.
     *
     * @throws EmptyCorpusException if no sentence-initial tags are given
     * @throws IllegalArgumentException if a tag is not in the tag set
     */
    public static double[] estimateInitial(List<String> sentenceInitialTags, Vocabulary vocabulary) {
        if (sentenceInitialTags.isEmpty()) {
            throw new EmptyCorpusException("No sentence-initial tags: the corpus has no sentences");
        }
        long[] counts = new long[vocabulary.tagCount()];
        for (String tag : sentenceInitialTags) {
            counts[requireTag(vocabulary, tag)]++;
        }
        double[] initial = new double[counts.length];
        for (int tag = 0; tag < counts.length; tag++) {
            initial[tag] = LogProb.log2Ratio(counts[tag], sentenceInitialTags.size());
        }
        return initial;
    }

    /**
     * Estimate transitions over the flattened tag sequence. Pairs that cross a
     * sentence boundary are counted like any other pair.
     */
    public static double[][] estimateTransition(List<String> tagSequence, Vocabulary vocabulary) {
        int n = vocabulary.tagCount();
        long[][] counts = new long[n][n];
        addTransitionCounts(tagSequence, vocabulary, counts);
        return normalizeTransitions(counts);
    }

    /**
     * Estimate transitions with the given boundary treatment.
     *
     * @throws IllegalArgumentException if sentence-aware counting is requested for a
     *         corpus without sentence grouping
     */
    public static double[][] estimateTransition(TrainingCorpus corpus, Vocabulary vocabulary,
                                                TransitionBoundaries boundaries) {
        if (boundaries == TransitionBoundaries.FLATTENED) {
            return estimateTransition(corpus.tagSequence(), vocabulary);
        }
        if (!corpus.hasSentenceBoundaries()) {
            throw new IllegalArgumentException(
                "Sentence-bounded transitions need a corpus grouped into sentences");
        }
        int n = vocabulary.tagCount();
        long[][] counts = new long[n][n];
        for (List<TrainingPair> sentence : corpus.sentences()) {
            String[] tags = new String[sentence.size()];
            for (int i = 0; i < tags.length; i++) {
                tags[i] = sentence.get(i).tag();
            }
            addTransitionCounts(Arrays.asList(tags), vocabulary, counts);
        }
        return normalizeTransitions(counts);
    }

    private static void addTransitionCounts(List<String> tags, Vocabulary vocabulary, long[][] counts) {
        if (tags.isEmpty()) {
            return;
        }
        int previous = requireTag(vocabulary, tags.get(0));
        for (int i = 1; i < tags.size(); i++) {
            int current = requireTag(vocabulary, tags.get(i));
            counts[previous][current]++;
            previous = current;
        }
    }

    // Rows are normalized by outgoing transitions, so a tag seen only in final
    // position keeps an all-zero row.
    private static double[][] normalizeTransitions(long[][] counts) {
        int n = counts.length;
        double[][] transition = new double[n][n];
        for (int from = 0; from < n; from++) {
            long outgoing = 0;
            for (long c : counts[from]) {
                outgoing += c;
            }
            for (int to = 0; to < n; to++) {
                transition[from][to] = outgoing == 0
                    ? LogProb.ZERO
                    : LogProb.log2Ratio(counts[from][to], outgoing);
            }
        }
        return transition;
    }

    /**
     * Count how often each tag emits each training token.
     */
    public static EmissionCounts countEmissions(List<TrainingPair> pairs, Vocabulary vocabulary) {
        int[][] counts = new int[vocabulary.tagCount()][vocabulary.size()];
        long[] totals = new long[vocabulary.tagCount()];
        for (TrainingPair pair : pairs) {
            int tag = requireTag(vocabulary, pair.tag());
            int token = vocabulary.tokenIndex(pair.token());
            if (token < 0) {
                throw new IllegalArgumentException("Token not in training vocabulary: " + pair.token());
            }
            counts[tag][token]++;
            totals[tag]++;
        }
        return new EmissionCounts(counts, totals);
    }

    /**
     * Unsmoothed emission estimate: {@code count / tagTotal}. Tokens never observed
     * under a tag get negative infinity.
     */
    public static EmissionTable estimateEmission(EmissionCounts counts) {
        int n = counts.tagCount();
        int v = counts.tokenCount();
        double[][] emission = new double[n][v];
        for (int tag = 0; tag < n; tag++) {
            long total = counts.tagTotal(tag);
            for (int token = 0; token < v; token++) {
                emission[tag][token] = total == 0
                    ? LogProb.ZERO
                    : LogProb.log2Ratio(counts.count(tag, token), total);
            }
        }
        return new EmissionTable(emission, null);
    }

    /**
     * Count and estimate emissions in one step.
     */
    public static EmissionTable estimateEmission(List<TrainingPair> pairs, Vocabulary vocabulary) {
        return estimateEmission(countEmissions(pairs, vocabulary));
    }

    private static int requireTag(Vocabulary vocabulary, String tag) {
        int index = vocabulary.tagIndex(tag);
        if (index < 0) {
            throw new IllegalArgumentException("Tag not in tag set: " + tag);
        }
        return index;
    }
}
