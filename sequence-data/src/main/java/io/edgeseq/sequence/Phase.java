package io.edgeseq.sequence;

/** Which part of a run to execute. */
public enum Phase {
    ALL, EXTRACT, WINDOW;

    boolean extracts() { return this != WINDOW; }
    boolean windows() { return this != EXTRACT; }
}
