package pl.marcinmilkowski.hmm_tagger.hmm.smoothing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.hmm_tagger.hmm.EmissionCounts;
import pl.marcinmilkowski.hmm_tagger.hmm.EmissionTable;
import pl.marcinmilkowski.hmm_tagger.hmm.LogProb;

/**
 * Add-one (Laplace) smoothing of emission probabilities.
 *
 * For a tag with total count C and a vocabulary of V training tokens:
 * <pre>
 *   P(token | tag) = (count(tag, token) + 1) / (C + V)
 *   residual(tag)  = 1 / (C + V)
 * </pre>
 * Every cell whose count is zero ends up with exactly the residual, which is also
 * the value handed to tokens never seen in training.
 */
public class LaplaceSmoothing implements SmoothingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(LaplaceSmoothing.class);

    @Override
    public EmissionTable smooth(EmissionCounts counts, int vocabularySize) {
        if (vocabularySize <= 0) {
            throw new IllegalArgumentException("Vocabulary size must be positive, got " + vocabularySize);
        }
        int n = counts.tagCount();
        int v = counts.tokenCount();
        double[][] emission = new double[n][v];
        double[] residual = new double[n];

        for (int tag = 0; tag < n; tag++) {
            double denominator = (double) counts.tagTotal(tag) + vocabularySize;
            residual[tag] = LogProb.log2(1.0 / denominator);
            for (int token = 0; token < v; token++) {
                int c = counts.count(tag, token);
                emission[tag][token] = c == 0
                    ? residual[tag]
                    : LogProb.log2((c + 1.0) / denominator);
            }
        }

        logger.debug("Laplace smoothing applied: {} tags, V={}", n, vocabularySize);
        return new EmissionTable(emission, residual);
    }

    @Override
    public String getName() {
        return "laplace";
    }
}
