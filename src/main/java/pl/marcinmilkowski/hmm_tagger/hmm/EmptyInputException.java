package pl.marcinmilkowski.hmm_tagger.hmm;

/**
 * Exception thrown when decoding is requested for a zero-length observation sequence.
 */
public class EmptyInputException extends RuntimeException {

    public EmptyInputException(String message) {
        super(message);
    }

    public EmptyInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
