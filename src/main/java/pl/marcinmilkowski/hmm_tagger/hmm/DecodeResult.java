package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.List;

/**
 * Output of one Viterbi decode.
 *
 * @param tags best tag per observation, first to last
 * @param logProbability log2 score of the best path (negative infinity if no path is possible)
 * @param degenerateSteps steps at which every tag scored negative infinity
 * @param unknownTokens number of observations not seen in training
 */
public record DecodeResult(
    List<String> tags,
    double logProbability,
    List<Integer> degenerateSteps,
    int unknownTokens
) {
    public DecodeResult {
        tags = List.copyOf(tags);
        degenerateSteps = List.copyOf(degenerateSteps);
    }

    /**
     * True when at least one step could not distinguish any tag and the output was
     * decided by tie-breaking alone.
     */
    public boolean isDegenerate() {
        return !degenerateSteps.isEmpty();
    }

    public int length() {
        return tags.size();
    }
}
