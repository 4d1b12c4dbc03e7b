package io.edgeseq.sequence.scan;

public enum SkipReason {
    COLUMN_COUNT,
    BAD_ENTITY_ID,
    BAD_TX_ID,
    BAD_FEATURE
}
