package pl.marcinmilkowski.hmm_tagger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.hmm_tagger.hmm.HmmModel;
import pl.marcinmilkowski.hmm_tagger.hmm.HmmTrainer;
import pl.marcinmilkowski.hmm_tagger.hmm.TrainerOptions;
import pl.marcinmilkowski.hmm_tagger.hmm.TrainingCorpus;
import pl.marcinmilkowski.hmm_tagger.hmm.TrainingPair;
import pl.marcinmilkowski.hmm_tagger.hmm.TransitionBoundaries;
import pl.marcinmilkowski.hmm_tagger.hmm.UnknownTokenPolicy;
import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaggerConfig.
 */
class TaggerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Bundled defaults: laplace, flattened, residual")
    void testDefaults() {
        TaggerConfig config = TaggerConfig.defaults();

        assertEquals("1.0", config.getVersion());
        assertEquals(Smoothing.LAPLACE, config.getSmoothing());
        assertEquals(TransitionBoundaries.FLATTENED, config.getTransitionBoundaries());
        assertEquals(UnknownTokenPolicy.RESIDUAL, config.getUnknownTokenPolicy());
        assertTrue(config.getDecodeThreads() >= 1);
    }

    @Test
    void testParseAllFields() {
        TaggerConfig config = TaggerConfig.parse("{\"version\":\"2\",\"smoothing\":\"none\","
            + "\"transition_boundaries\":\"sentence\",\"unknown_token_policy\":\"uniform\",\"decode_threads\":3}");

        assertEquals(Smoothing.NONE, config.getSmoothing());
        assertEquals(TransitionBoundaries.SENTENCE, config.getTransitionBoundaries());
        assertEquals(UnknownTokenPolicy.UNIFORM, config.getUnknownTokenPolicy());
        assertEquals(3, config.getDecodeThreads());
        assertEquals(Smoothing.NONE, config.trainerOptions().smoothing());
        assertEquals(TransitionBoundaries.SENTENCE, config.trainerOptions().transitionBoundaries());
    }

    @Test
    void testPolicyFollowsModelWhenUnset() {
        TaggerConfig config = TaggerConfig.parse("{\"version\":\"1.0\",\"smoothing\":\"laplace\"}");
        HmmModel unsmoothed = HmmTrainer.train(
            TrainingCorpus.ofSentences(List.of(List.of(new TrainingPair("x", "A")))),
            TrainerOptions.of(Smoothing.NONE));

        assertEquals(UnknownTokenPolicy.RESIDUAL, config.getUnknownTokenPolicy());
        assertEquals(UnknownTokenPolicy.ZERO, config.unknownTokenPolicyFor(unsmoothed));
    }

    @Test
    void testInvalidConfigs() {
        assertThrows(IllegalArgumentException.class, () -> TaggerConfig.parse("{not json"));
        assertThrows(IllegalArgumentException.class, () -> TaggerConfig.parse("{\"version\":\"1.0\"}"));
        assertThrows(IllegalArgumentException.class, () -> TaggerConfig.parse("{\"smoothing\":\"none\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> TaggerConfig.parse("{\"version\":\"1.0\",\"smoothing\":\"good-turing\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> TaggerConfig.parse("{\"version\":\"1.0\",\"smoothing\":\"laplace\",\"decode_threads\":0}"));
        assertThrows(IllegalArgumentException.class,
            () -> TaggerConfig.parse("{\"version\":\"1.0\",\"smoothing\":\"laplace\",\"decode_threads\":2.7}"));
        assertThrows(IllegalArgumentException.class,
            () -> TaggerConfig.parse("{\"version\":\"1.0\",\"smoothing\":\"laplace\",\"decode_threads\":\"four\"}"));
    }

    @Test
    @DisplayName("Null values fall back to the same defaults as absent keys")
    void testNullValuesUseDefaults() {
        TaggerConfig config = TaggerConfig.parse("{\"version\":\"1\",\"smoothing\":\"none\","
            + "\"transition_boundaries\":null,\"unknown_token_policy\":null,\"decode_threads\":null}");

        assertEquals(TransitionBoundaries.FLATTENED, config.getTransitionBoundaries());
        assertEquals(UnknownTokenPolicy.ZERO, config.getUnknownTokenPolicy());
        assertTrue(config.getDecodeThreads() >= 1);
    }

    @Test
    void testWholeNumberThreadsAccepted() {
        TaggerConfig config = TaggerConfig.parse("{\"version\":\"1\",\"smoothing\":\"none\",\"decode_threads\":4}");

        assertEquals(4, config.getDecodeThreads());
        assertEquals(4, config.toJson().getIntValue("decode_threads"));
    }

    @Test
    @DisplayName("Residual policy is rejected for unsmoothed training")
    void testResidualNeedsLaplace() {
        assertThrows(IllegalArgumentException.class, () -> TaggerConfig.parse(
            "{\"version\":\"1.0\",\"smoothing\":\"none\",\"unknown_token_policy\":\"residual\"}"));
    }

    @Test
    void testLoadAndExport() throws IOException {
        Path file = tempDir.resolve("tagger.json");
        Files.writeString(file, "{\"version\":\"1.1\",\"smoothing\":\"none\",\"decode_threads\":2}");

        TaggerConfig config = TaggerConfig.load(file);

        assertEquals("1.1", config.getVersion());
        assertEquals("none", config.toJson().getString("smoothing"));
        assertEquals("zero", config.toJson().getString("unknown_token_policy"));
        assertEquals("flattened", config.toJson().getString("transition_boundaries"));
        assertEquals(2, config.toJson().getIntValue("decode_threads"));
    }

    @Test
    void testLoadMissingFile() {
        assertThrows(IOException.class, () -> TaggerConfig.load(tempDir.resolve("absent.json")));
    }
}
