package pl.marcinmilkowski.hmm_tagger.corpus;

import java.io.IOException;

/**
 * Exception thrown when a corpus file does not follow the expected layout.
 */
public class CorpusFormatException extends IOException {

    private final int lineNumber;

    public CorpusFormatException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
