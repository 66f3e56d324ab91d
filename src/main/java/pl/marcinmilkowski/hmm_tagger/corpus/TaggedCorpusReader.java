package pl.marcinmilkowski.hmm_tagger.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.hmm_tagger.hmm.TrainingCorpus;
import pl.marcinmilkowski.hmm_tagger.hmm.TrainingPair;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a two-column tagged corpus.
 *
 * Format: one {@code token<whitespace>tag} pair per line, sentences separated by
 * one or more blank lines.
 * <pre>
 *   Sehr	ADV
 *   gute	ADJ
 *   Beratung	NOUN
 *
 *   Nur	ADV
 *   ...
 * </pre>
 */
public final class TaggedCorpusReader {

    private static final Logger logger = LoggerFactory.getLogger(TaggedCorpusReader.class);

    private TaggedCorpusReader() {
    }

    public static TrainingCorpus read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Tagged corpus not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TrainingCorpus corpus = read(reader);
            logger.info("Read {} tokens in {} sentences from {}", corpus.size(), corpus.sentenceCount(), path);
            return corpus;
        }
    }

    public static TrainingCorpus parse(String text) throws IOException {
        return read(new StringReader(text));
    }

    public static TrainingCorpus read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);

        List<List<TrainingPair>> sentences = new ArrayList<>();
        List<TrainingPair> sentence = new ArrayList<>();
        String line;
        int lineNumber = 0;

        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();

            if (trimmed.isEmpty()) {
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                    sentence = new ArrayList<>();
                }
                continue;
            }

            String[] columns = trimmed.split("\\s+");
            if (columns.length != 2) {
                throw new CorpusFormatException(
                    "Expected 'token tag' but found " + columns.length + " column(s): " + trimmed, lineNumber);
            }
            sentence.add(new TrainingPair(columns[0], columns[1]));
        }
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }

        return TrainingCorpus.ofSentences(sentences);
    }
}
