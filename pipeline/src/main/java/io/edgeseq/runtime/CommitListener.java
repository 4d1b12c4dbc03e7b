package io.edgeseq.runtime;

/**
 * Persists progress. Called only after every unit up to and including {@code lastCompletedSeq}
 * has been handed to the sink and the sink has returned.
 */
@FunctionalInterface
public interface CommitListener {
    void commit(long lastCompletedSeq) throws Exception;

    CommitListener NONE = seq -> {};
}
