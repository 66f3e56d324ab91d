package pl.marcinmilkowski.hmm_tagger.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Most-likely tag sequence for an observation sequence under an {@link HmmModel}.
 *
 * Standard Viterbi dynamic programming over a T x N chart of log2 scores with a
 * parallel backpointer chart:
 * <pre>
 *   v[0][j] = initial[j] + emission[j][o_0]
 *   v[t][j] = max_i (v[t-1][i] + transition[i][j]) + emission[j][o_t]
 * </pre>
 * Ties (including ties at negative infinity) go to the predecessor or final tag that
 * comes last in natural tag order. Runs in O(T * N^2) time and O(T * N) space; the
 * chart is allocated per call, so one decoder can serve concurrent callers.
 */
public class ViterbiDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecoder.class);

    static final int ORIGIN = -1;

    private final HmmModel model;
    private final UnknownTokenPolicy unknownTokenPolicy;

    public ViterbiDecoder(HmmModel model, UnknownTokenPolicy unknownTokenPolicy) {
        if (model == null) {
            throw new NullPointerException("model must not be null.");
        }
        if (unknownTokenPolicy == null) {
            throw new NullPointerException("unknownTokenPolicy must not be null.");
        }
        unknownTokenPolicy.checkApplicable(model);
        this.model = model;
        this.unknownTokenPolicy = unknownTokenPolicy;
    }

    public ViterbiDecoder(HmmModel model) {
        this(model, UnknownTokenPolicy.defaultFor(model.smoothing()));
    }

    /**
     * Decode one observation sequence.
     *
     * @throws EmptyInputException if there are no observations
     */
    public DecodeResult decode(List<String> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new EmptyInputException("Cannot decode an empty observation sequence");
        }

        int steps = observations.size();
        int n = model.tagCount();
        EmissionOverlay emissions = new EmissionOverlay(model, unknownTokenPolicy, observations);

        double[][] viterbi = new double[steps][n];
        int[][] backpointer = new int[steps][n];
        List<Integer> degenerateSteps = new ArrayList<>();

        // Initialization
        for (int j = 0; j < n; j++) {
            viterbi[0][j] = model.initialLogProb(j) + emissions.logEmission(0, j);
            backpointer[0][j] = ORIGIN;
        }
        checkDegenerate(viterbi[0], 0, degenerateSteps);

        // Recursion
        for (int t = 1; t < steps; t++) {
            double[] previous = viterbi[t - 1];
            for (int j = 0; j < n; j++) {
                double best = Double.NEGATIVE_INFINITY;
                int bestTag = 0;
                for (int i = 0; i < n; i++) {
                    double score = previous[i] + model.transitionLogProb(i, j);
                    if (score >= best) {
                        best = score;
                        bestTag = i;
                    }
                }
                viterbi[t][j] = best + emissions.logEmission(t, j);
                backpointer[t][j] = bestTag;
            }
            checkDegenerate(viterbi[t], t, degenerateSteps);
        }

        // Termination
        double[] last = viterbi[steps - 1];
        int finalTag = argmax(last);

        List<String> tags = backtrack(backpointer, finalTag);

        if (!degenerateSteps.isEmpty()) {
            logger.warn("Degenerate decode: every tag scored -inf at {} of {} steps (first at step {}, token '{}')",
                degenerateSteps.size(), steps, degenerateSteps.get(0), observations.get(degenerateSteps.get(0)));
        } else {
            logger.debug("Decoded {} tokens ({} unknown), log2 p = {}", steps, emissions.unknownCount(), last[finalTag]);
        }

        return new DecodeResult(tags, last[finalTag], degenerateSteps, emissions.unknownCount());
    }

    /**
     * Decode and return only the tags.
     */
    public List<String> decodeTags(List<String> observations) {
        return decode(observations).tags();
    }

    // Index of the maximum; later indexes win ties.
    static int argmax(double[] scores) {
        int best = 0;
        for (int j = 1; j < scores.length; j++) {
            if (scores[j] >= scores[best]) {
                best = j;
            }
        }
        return best;
    }

    private List<String> backtrack(int[][] backpointer, int finalTag) {
        int steps = backpointer.length;
        String[] path = new String[steps];
        int tag = finalTag;
        int t = steps - 1;
        while (tag != ORIGIN) {
            if (t < 0) {
                throw new IllegalStateException("Backtracking ran past the first step without reaching the origin");
            }
            path[t] = model.vocabulary().tag(tag);
            tag = backpointer[t][tag];
            t--;
        }
        if (t != -1) {
            throw new IllegalStateException("Backtracking reached the origin early at step " + (t + 1));
        }
        return Arrays.asList(path);
    }

    private static void checkDegenerate(double[] scores, int step, List<Integer> degenerateSteps) {
        for (double score : scores) {
            if (score != Double.NEGATIVE_INFINITY) {
                return;
            }
        }
        degenerateSteps.add(step);
    }

    public HmmModel getModel() {
        return model;
    }

    public UnknownTokenPolicy getUnknownTokenPolicy() {
        return unknownTokenPolicy;
    }
}
