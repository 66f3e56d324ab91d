package pl.marcinmilkowski.hmm_tagger.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.util.List;

/**
 * Builds an {@link HmmModel} from annotated training data.
 *
 * Training either succeeds with a complete model or throws; no partial model is
 * ever returned. The same corpus and options always produce identical tables.
 */
public final class HmmTrainer {

    private static final Logger logger = LoggerFactory.getLogger(HmmTrainer.class);

    private HmmTrainer() {
    }

    /**
     * Train from flat (token, tag) pairs and the tag of each sentence's first token.
     * Transitions are counted over the flattened tag sequence.
     *
     * @throws EmptyCorpusException if there are no pairs or no sentence-initial tags
     */
    public static HmmModel train(List<TrainingPair> trainingPairs, List<String> sentenceInitialTags,
                                 Smoothing smoothing) {
        return train(TrainingCorpus.ofPairs(trainingPairs, sentenceInitialTags), TrainerOptions.of(smoothing));
    }

    /**
     * Train from a corpus.
     *
     * @throws EmptyCorpusException if the corpus is empty
     * @throws IllegalArgumentException if sentence-bounded transitions are requested
     *         for a corpus without sentence grouping
     */
    public static HmmModel train(TrainingCorpus corpus, TrainerOptions options) {
        if (corpus.isEmpty()) {
            throw new EmptyCorpusException("Cannot train a model from an empty corpus");
        }
        long start = System.currentTimeMillis();

        Vocabulary vocabulary = Vocabulary.fromPairs(corpus.pairs());
        double[] initial = ProbabilityEstimator.estimateInitial(corpus.sentenceInitialTags(), vocabulary);
        double[][] transition = ProbabilityEstimator.estimateTransition(
            corpus, vocabulary, options.transitionBoundaries());
        EmissionCounts counts = ProbabilityEstimator.countEmissions(corpus.pairs(), vocabulary);
        EmissionTable emission = options.smoothing().strategy().smooth(counts, vocabulary.size());

        HmmModel model = new HmmModel(vocabulary, initial, transition, emission,
            options.smoothing(), options.transitionBoundaries());

        logger.info("Trained HMM from {} tokens in {} sentences: {} tags, vocabulary {}, smoothing={}, transitions={} ({} ms)",
            corpus.size(), corpus.sentenceCount(), vocabulary.tagCount(), vocabulary.size(),
            options.smoothing().configName(), options.transitionBoundaries().configName(),
            System.currentTimeMillis() - start);
        return model;
    }
}
