package io.edgeseq.core;

import java.util.List;

/**
 * Sink capability to consume all outputs of one input unit at once.
 * When {@code acceptBatch} returns, the batch must be durable: the runtime commits progress right after.
 */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws Exception;

    @Override
    default void accept(Record<T> record) throws Exception {
        acceptBatch(List.of(record));
    }
}
