package pl.marcinmilkowski.hmm_tagger.hmm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ViterbiDecoder.
 */
class ViterbiDecoderTest {

    private HmmModel unsmoothed;
    private HmmModel smoothed;

    @BeforeEach
    void setUp() {
        unsmoothed = HmmTrainer.train(SampleCorpora.animals(), TrainerOptions.of(Smoothing.NONE));
        smoothed = HmmTrainer.train(SampleCorpora.animals(), TrainerOptions.of(Smoothing.LAPLACE));
    }

    @Test
    void testDecodeKnownSentence() {
        ViterbiDecoder decoder = new ViterbiDecoder(unsmoothed);

        DecodeResult result = decoder.decode(List.of("the", "dog", "runs"));

        assertEquals(List.of("DET", "NOUN", "VERB"), result.tags());
        assertFalse(result.isDegenerate());
        assertEquals(0, result.unknownTokens());
        // 0.8 * 0.75 * 0.75 * 0.6 * 1.0 * 0.4
        assertEquals(LogProb.log2(0.8 * 0.75 * 0.75 * 0.6 * 0.4), result.logProbability(), 1e-9);
    }

    @Test
    @DisplayName("Single token: tag is argmax of initial + emission")
    void testSingleToken() {
        ViterbiDecoder decoder = new ViterbiDecoder(smoothed);
        Vocabulary vocabulary = smoothed.vocabulary();

        for (String token : List.of("the", "dog", "big", "runs")) {
            int tokenId = vocabulary.tokenIndex(token);
            int expected = 0;
            for (int j = 1; j < smoothed.tagCount(); j++) {
                double score = smoothed.initialLogProb(j) + smoothed.emissionLogProb(j, tokenId);
                double best = smoothed.initialLogProb(expected) + smoothed.emissionLogProb(expected, tokenId);
                if (score >= best) {
                    expected = j;
                }
            }
            List<String> tags = decoder.decodeTags(List.of(token));
            assertEquals(List.of(vocabulary.tag(expected)), tags, "token " + token);
        }
    }

    @Test
    void testOutputLengthMatchesInput() {
        ViterbiDecoder decoder = new ViterbiDecoder(smoothed);
        List<String> observations = List.of("the", "big", "cat", "sleeps", "a", "dog", "runs", "zebra");

        assertEquals(observations.size(), decoder.decode(observations).length());
    }

    @Test
    void testDeterministic() {
        ViterbiDecoder decoder = new ViterbiDecoder(smoothed);
        List<String> observations = List.of("dogs", "sleeps", "the", "unknown", "cat");

        DecodeResult first = decoder.decode(observations);
        DecodeResult second = decoder.decode(observations);

        assertEquals(first.tags(), second.tags());
        assertEquals(first.logProbability(), second.logProbability());
    }

    @Test
    @DisplayName("Empty observation sequence is rejected before decoding")
    void testEmptyInput() {
        ViterbiDecoder decoder = new ViterbiDecoder(unsmoothed);

        assertThrows(EmptyInputException.class, () -> decoder.decode(List.of()));
        assertThrows(EmptyInputException.class, () -> decoder.decode(null));
    }

    @Test
    @DisplayName("Unknown token under the smoothed model is not degenerate")
    void testUnknownTokenSmoothed() {
        DecodeResult result = new ViterbiDecoder(smoothed).decode(List.of("the", "cat", "flies"));

        assertFalse(result.isDegenerate());
        assertEquals(1, result.unknownTokens());
        assertEquals(List.of("DET", "NOUN", "VERB"), result.tags());
    }

    @Test
    @DisplayName("Unknown token under the unsmoothed zero policy is degenerate but still decoded")
    void testUnknownTokenUnsmoothed() {
        DecodeResult result = new ViterbiDecoder(unsmoothed, UnknownTokenPolicy.ZERO)
            .decode(List.of("the", "cat", "flies"));

        assertTrue(result.isDegenerate());
        assertEquals(List.of(2), result.degenerateSteps());
        assertEquals(Double.NEGATIVE_INFINITY, result.logProbability());
        assertEquals(List.of("DET", "NOUN", "VERB"), result.tags());
    }

    @Test
    void testUniformPolicyLetsTransitionsDecide() {
        DecodeResult result = new ViterbiDecoder(unsmoothed, UnknownTokenPolicy.UNIFORM)
            .decode(List.of("the", "cat", "flies"));

        assertFalse(result.isDegenerate());
        assertEquals(List.of("DET", "NOUN", "VERB"), result.tags());
    }

    @Test
    @DisplayName("Ties go to the tag that comes last in natural order")
    void testTieBreaking() {
        HmmModel tied = HmmTrainer.train(TrainingCorpus.ofSentences(List.of(
            SampleCorpora.sentence("x/A"),
            SampleCorpora.sentence("x/B")
        )), TrainerOptions.of(Smoothing.NONE));

        assertEquals(List.of("B"), new ViterbiDecoder(tied).decodeTags(List.of("x")));
    }

    @Test
    @DisplayName("All -inf everywhere still yields one tag per token")
    void testFullyDegenerate() {
        DecodeResult result = new ViterbiDecoder(unsmoothed).decode(List.of("zebra", "yak"));

        assertEquals(List.of(0, 1), result.degenerateSteps());
        assertEquals(List.of("VERB", "VERB"), result.tags());
    }

    @Test
    void testResidualPolicyNeedsSmoothedModel() {
        assertThrows(IllegalArgumentException.class,
            () -> new ViterbiDecoder(unsmoothed, UnknownTokenPolicy.RESIDUAL));
    }

    @Test
    void testModelIsNotModifiedByDecoding() {
        double[][] before = smoothed.emissionTable();
        new ViterbiDecoder(smoothed).decode(List.of("zebra", "the", "yak"));

        assertArrayEquals(before, smoothed.emissionTable());
        assertEquals(Double.NEGATIVE_INFINITY, smoothed.emissionLogProb("NOUN", "zebra"));
    }

    @Test
    void testArgmaxPrefersLaterIndexOnTie() {
        assertEquals(2, ViterbiDecoder.argmax(new double[] {-1.0, -3.0, -1.0}));
        assertEquals(1, ViterbiDecoder.argmax(new double[] {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY}));
    }
}
