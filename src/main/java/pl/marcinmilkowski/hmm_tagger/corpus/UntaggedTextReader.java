package pl.marcinmilkowski.hmm_tagger.corpus;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads untagged text to decode: tokens split on whitespace, sentences separated by
 * blank lines. Within a sentence, tokens may be spread over any number of lines.
 */
public final class UntaggedTextReader {

    private UntaggedTextReader() {
    }

    public static List<List<String>> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Input text not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<List<String>> parse(String text) throws IOException {
        return read(new StringReader(text));
    }

    public static List<List<String>> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);

        List<List<String>> sentences = new ArrayList<>();
        List<String> sentence = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (!sentence.isEmpty()) {
                    sentences.add(List.copyOf(sentence));
                    sentence.clear();
                }
            } else {
                sentence.addAll(Arrays.asList(trimmed.split("\\s+")));
            }
        }
        if (!sentence.isEmpty()) {
            sentences.add(List.copyOf(sentence));
        }
        return sentences;
    }
}
