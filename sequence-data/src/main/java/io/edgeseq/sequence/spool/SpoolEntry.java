package io.edgeseq.sequence.spool;

/**
 * One edge as seen from one endpoint.
 *
 * @param offset   1-based row number of the edge in the stream; identifies the edge across replays
 * @param txId     temporal key
 * @param features edge features, shared with other entries of the same edge and never mutated
 */
public record SpoolEntry(long offset, long txId, float[] features) {
}
