package pl.marcinmilkowski.hmm_tagger.hmm;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TrainingCorpus and TrainingPair.
 */
class TrainingCorpusTest {

    @Test
    void testSentenceInitialTagsOnePerSentence() {
        TrainingCorpus corpus = SampleCorpora.animals();

        assertEquals(List.of("DET", "DET", "DET", "NOUN", "DET"), corpus.sentenceInitialTags());
        assertEquals(5, corpus.sentenceCount());
        assertEquals(15, corpus.size());
        assertTrue(corpus.hasSentenceBoundaries());
    }

    @Test
    void testTagSequenceIsFlattened() {
        TrainingCorpus corpus = TrainingCorpus.ofSentences(List.of(
            SampleCorpora.sentence("a/X", "b/Y"),
            SampleCorpora.sentence("c/Z")
        ));

        assertEquals(List.of("X", "Y", "Z"), corpus.tagSequence());
    }

    @Test
    void testFlatCorpusHasNoSentences() {
        TrainingCorpus corpus = TrainingCorpus.ofPairs(SampleCorpora.pairsWithTags("A", "B"), List.of("A"));

        assertFalse(corpus.hasSentenceBoundaries());
        assertThrows(IllegalStateException.class, corpus::sentences);
        assertEquals(1, corpus.sentenceCount());
    }

    @Test
    void testEmptySentenceRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> TrainingCorpus.ofSentences(List.of(SampleCorpora.sentence("a/X"), List.of())));
    }

    @Test
    void testPairValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TrainingPair("", "NOUN"));
        assertThrows(IllegalArgumentException.class, () -> new TrainingPair("dog", null));
        assertEquals("dog\tNOUN", new TrainingPair("dog", "NOUN").toString());
    }
}
