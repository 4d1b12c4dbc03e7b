package io.edgeseq.sequence.spool;

/**
 * An entry addressed to the spool of {@code entityId} in {@code direction}.
 */
public record SpoolAppend(long entityId, Direction direction, SpoolEntry entry) {
}
