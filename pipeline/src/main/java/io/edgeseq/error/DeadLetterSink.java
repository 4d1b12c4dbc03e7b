package io.edgeseq.error;

import java.io.IOException;

/**
 * Receives units of work that could not be processed, so they can be audited after the run.
 */
public interface DeadLetterSink extends AutoCloseable {
    /**
     * @param stage    where the failure happened, e.g. "parse" or "build"
     * @param position stream row, chunk number or entity index of the failed unit
     * @param reason   short machine-friendly reason
     * @param detail   free text, may be null
     */
    void acceptFailure(String stage, long position, String reason, String detail);

    /** Number of failures offered so far, including ones not written because of a cap. */
    long failureCount();

    @Override
    default void close() throws IOException {}
}
