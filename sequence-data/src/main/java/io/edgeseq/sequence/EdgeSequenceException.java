package io.edgeseq.sequence;

/**
 * Fatal condition that aborts a run with a non-zero exit status.
 */
public class EdgeSequenceException extends RuntimeException {
    public EdgeSequenceException(String message) {
        super(message);
    }

    public EdgeSequenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
