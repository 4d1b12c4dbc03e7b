package io.edgeseq.sequence.spool;

/**
 * Which side of an edge an entity was on. An entity receives INBOUND entries as {@code dst}
 * and OUTBOUND entries as {@code src}.
 */
public enum Direction {
    INBOUND("in"),
    OUTBOUND("out");

    private final String suffix;

    Direction(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() { return suffix; }
}
