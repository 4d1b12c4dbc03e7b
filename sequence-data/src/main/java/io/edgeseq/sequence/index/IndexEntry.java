package io.edgeseq.sequence.index;

/**
 * One entity of the upstream index.
 *
 * @param label 0 (licit), 1 (suspicious) or {@link #MISSING_LABEL}
 */
public record IndexEntry(long entityId, int denseIndex, int label) {
    public static final int MISSING_LABEL = -1;

    public boolean hasLabel() {
        return label != MISSING_LABEL;
    }
}
