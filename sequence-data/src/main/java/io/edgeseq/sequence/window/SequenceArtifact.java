package io.edgeseq.sequence.window;

/**
 * The finalized, model-ready bundle for one entity.
 *
 * @param label 0 or 1
 */
public record SequenceArtifact(long entityId,
                               int denseIndex,
                               int label,
                               int nInOriginal,
                               int nOutOriginal,
                               float[][] inFlow,
                               float[][] outFlow) {
}
