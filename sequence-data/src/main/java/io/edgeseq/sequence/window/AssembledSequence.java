package io.edgeseq.sequence.window;

/**
 * Sequences plus the resolved label.
 *
 * @param labelMissing the index had no label and {@code label} is the default 0
 */
public record AssembledSequence(EntitySequences sequences, int label, boolean labelMissing) {

    public SequenceArtifact toArtifact() {
        return new SequenceArtifact(sequences.entityId(), sequences.denseIndex(), label,
                sequences.nInOriginal(), sequences.nOutOriginal(), sequences.inFlow(), sequences.outFlow());
    }
}
