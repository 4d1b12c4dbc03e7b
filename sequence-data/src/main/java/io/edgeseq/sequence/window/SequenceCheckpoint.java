package io.edgeseq.sequence.window;

/**
 * Durable windowing progress.
 *
 * @param lastEntityIndex         highest dense index finalized so far, or -1
 * @param processedEntityIndices  sorted dense indices whose artifact is durable
 * @param maxTemporalKey          the bound pinned by the first run, reused on resume
 * @param windowLength            K the artifacts were built with
 * @param featureWidth            F the artifacts were built with
 */
public record SequenceCheckpoint(int lastEntityIndex,
                                 int[] processedEntityIndices,
                                 long maxTemporalKey,
                                 int windowLength,
                                 int featureWidth) {
}
