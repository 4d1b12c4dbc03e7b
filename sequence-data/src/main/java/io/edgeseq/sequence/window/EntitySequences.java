package io.edgeseq.sequence.window;

/**
 * Windowed sequences of one entity. Each flow is {@code K} rows of {@code featureWidth + 1} floats, pre-padded
 * with zero rows; the last column is the temporal proxy.
 *
 * @param nInOriginal   distinct inbound entries before windowing
 * @param nOutOriginal  distinct outbound entries before windowing
 * @param overflowRows  kept rows whose txId exceeds the max temporal key
 * @param duplicates    replayed spool entries dropped while reading
 * @param corruptLines  unparseable spool lines skipped while reading
 * @param readFailures  directions whose spool could not be read and were treated as empty
 */
public record EntitySequences(long entityId,
                              int denseIndex,
                              float[][] inFlow,
                              float[][] outFlow,
                              int nInOriginal,
                              int nOutOriginal,
                              int overflowRows,
                              long duplicates,
                              long corruptLines,
                              int readFailures) {

    public boolean hasOverflow() {
        return overflowRows > 0;
    }
}
