package io.edgeseq.sequence.index;

import io.edgeseq.sequence.EdgeSequenceException;

public class IndexLoadException extends EdgeSequenceException {
    public IndexLoadException(String message) {
        super(message);
    }

    public IndexLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
