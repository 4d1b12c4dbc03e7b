package io.edgeseq.checkpoint;

import java.nio.file.Path;

/**
 * A checkpoint file exists but cannot be parsed. There is no partial recovery: the operator
 * has to delete the file, which forces the phase to restart from scratch.
 */
public class CheckpointCorruptedException extends RuntimeException {
    private final Path file;

    public CheckpointCorruptedException(Path file, Throwable cause) {
        super("Checkpoint " + file + " is unreadable; delete it to restart this phase from the beginning", cause);
        this.file = file;
    }

    public Path file() { return file; }
}
