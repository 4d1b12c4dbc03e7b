package io.edgeseq.sequence.scan;

/**
 * One row of the edge stream.
 *
 * @param offset 1-based data row number within the stream
 */
public record EdgeRecord(long offset, long src, long dst, long txId, float[] features) {
}
