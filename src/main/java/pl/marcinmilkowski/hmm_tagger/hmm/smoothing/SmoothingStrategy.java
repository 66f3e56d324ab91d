package pl.marcinmilkowski.hmm_tagger.hmm.smoothing;

import pl.marcinmilkowski.hmm_tagger.hmm.EmissionCounts;
import pl.marcinmilkowski.hmm_tagger.hmm.EmissionTable;

/**
 * Turns raw emission counts into a finalized emission table.
 */
public interface SmoothingStrategy {

    /**
     * @param counts per (tag, token) emission counts
     * @param vocabularySize number of distinct training tokens
     */
    EmissionTable smooth(EmissionCounts counts, int vocabularySize);

    /**
     * Get the name of this strategy.
     */
    String getName();
}
