package io.edgeseq.core;

/**
 * A unit of work flowing through a pipeline: a payload plus its position.
 * {@code seq} is the position of the input unit (chunk number, entity index); {@code subSeq}
 * orders the fan-out a transform produces from one input.
 */
public final class Record<T> {
    private final long seq;
    private final int subSeq;
    private final T payload;

    public Record(long seq, int subSeq, T payload) {
        this.seq = seq;
        this.subSeq = subSeq;
        this.payload = payload;
    }

    public static <T> Record<T> of(long seq, T payload) {
        return new Record<>(seq, 0, payload);
    }

    public long seq() { return seq; }
    public int subSeq() { return subSeq; }
    public T payload() { return payload; }

    /** Same position, different payload. */
    public <R> Record<R> withPayload(int subSeq, R payload) {
        return new Record<>(seq, subSeq, payload);
    }

    @Override
    public String toString() {
        return "Record{seq=" + seq + ", subSeq=" + subSeq + ", payload=" + payload + '}';
    }
}
