package io.edgeseq.runtime;

/**
 * Outcome of one {@link Pipeline#run()}.
 *
 * @param unitsRead       input records polled from the source
 * @param unitsCompleted  input records transformed and sunk
 * @param unitsFailed     input records sent to the dead letter sink
 * @param outputs         output records handed to the sink
 * @param commits         commit calls issued
 * @param lastCommittedSeq seq passed to the last commit, or -1
 * @param stopped         whether the run ended because of {@link Pipeline#stop()}
 */
public record RunStats(long unitsRead,
                       long unitsCompleted,
                       long unitsFailed,
                       long outputs,
                       long commits,
                       long lastCommittedSeq,
                       boolean stopped) {
}
