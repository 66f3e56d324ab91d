package pl.marcinmilkowski.hmm_tagger.corpus;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UntaggedTextReaderTest {

    @Test
    void testSentencesAcrossLines() throws IOException {
        List<List<String>> sentences = UntaggedTextReader.parse("Der Service\nwar  sehr gut .\n\n\nDie Preise\n");

        assertEquals(2, sentences.size());
        assertEquals(List.of("Der", "Service", "war", "sehr", "gut", "."), sentences.get(0));
        assertEquals(List.of("Die", "Preise"), sentences.get(1));
    }

    @Test
    void testEmptyText() throws IOException {
        assertTrue(UntaggedTextReader.parse("").isEmpty());
        assertTrue(UntaggedTextReader.parse("\n \n").isEmpty());
    }
}
