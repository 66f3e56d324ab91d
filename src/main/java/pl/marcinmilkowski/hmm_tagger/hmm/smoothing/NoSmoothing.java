package pl.marcinmilkowski.hmm_tagger.hmm.smoothing;

import pl.marcinmilkowski.hmm_tagger.hmm.EmissionCounts;
import pl.marcinmilkowski.hmm_tagger.hmm.EmissionTable;
import pl.marcinmilkowski.hmm_tagger.hmm.ProbabilityEstimator;

/**
 * Relative-frequency emissions with no mass reserved for unseen tokens.
 */
public class NoSmoothing implements SmoothingStrategy {

    @Override
    public EmissionTable smooth(EmissionCounts counts, int vocabularySize) {
        return ProbabilityEstimator.estimateEmission(counts);
    }

    @Override
    public String getName() {
        return "none";
    }
}
