package pl.marcinmilkowski.hmm_tagger.corpus;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes decoded sentences as {@code token\ttag} lines with a blank line between
 * sentences, the same layout {@link TaggedCorpusReader} reads.
 */
public final class TaggedOutputWriter {

    private TaggedOutputWriter() {
    }

    public static void write(Path path, List<List<String>> sentences, List<List<String>> tags) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, sentences, tags);
        }
    }

    public static String format(List<List<String>> sentences, List<List<String>> tags) {
        StringWriter out = new StringWriter();
        try {
            write(out, sentences, tags);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter failed", e);
        }
        return out.toString();
    }

    /**
     * @throws IllegalArgumentException if sentence and tag counts differ
     */
    public static void write(Writer writer, List<List<String>> sentences, List<List<String>> tags) throws IOException {
        if (sentences.size() != tags.size()) {
            throw new IllegalArgumentException("Got " + sentences.size() + " sentences but "
                + tags.size() + " tag sequences");
        }
        for (int s = 0; s < sentences.size(); s++) {
            List<String> tokens = sentences.get(s);
            List<String> sentenceTags = tags.get(s);
            if (tokens.size() != sentenceTags.size()) {
                throw new IllegalArgumentException("Sentence " + s + " has " + tokens.size()
                    + " tokens but " + sentenceTags.size() + " tags");
            }
            if (s > 0) {
                writer.write('\n');
            }
            for (int i = 0; i < tokens.size(); i++) {
                writer.write(tokens.get(i));
                writer.write('\t');
                writer.write(sentenceTags.get(i));
                writer.write('\n');
            }
        }
    }
}
