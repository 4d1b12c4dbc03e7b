package io.edgeseq.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sink consumes records in seq then subSeq order.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() throws IOException {}
}
