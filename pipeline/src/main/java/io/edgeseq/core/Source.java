package io.edgeseq.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces records in increasing {@code seq} order.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record, or empty once the source is exhausted.
     * A read failure is thrown rather than skipped: losing input silently would break resume accounting.
     */
    Optional<Record<T>> poll() throws IOException;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
