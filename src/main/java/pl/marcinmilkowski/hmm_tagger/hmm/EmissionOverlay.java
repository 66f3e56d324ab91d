package pl.marcinmilkowski.hmm_tagger.hmm;

import java.util.List;

/**
 * Read-only emission view for one observation sequence.
 *
 * Each observation is resolved to a training token id once. Known tokens read the
 * model's table; unknown tokens read a per-tag column computed from the
 * {@link UnknownTokenPolicy}. The model itself is never modified.
 */
final class EmissionOverlay {

    private final HmmModel model;
    private final int[] tokenIds;
    private final double[] unknownColumn;
    private final int unknownCount;

    EmissionOverlay(HmmModel model, UnknownTokenPolicy policy, List<String> observations) {
        this.model = model;
        this.tokenIds = new int[observations.size()];
        Vocabulary vocabulary = model.vocabulary();
        int unknown = 0;
        for (int t = 0; t < tokenIds.length; t++) {
            tokenIds[t] = vocabulary.tokenIndex(observations.get(t));
            if (tokenIds[t] < 0) unknown++;
        }
        this.unknownCount = unknown;

        this.unknownColumn = new double[model.tagCount()];
        if (unknown > 0) {
            for (int tag = 0; tag < unknownColumn.length; tag++) {
                unknownColumn[tag] = policy.logEmission(model, tag);
            }
        }
    }

    double logEmission(int step, int tag) {
        int token = tokenIds[step];
        return token < 0 ? unknownColumn[tag] : model.emissionLogProb(tag, token);
    }

    int unknownCount() {
        return unknownCount;
    }
}
