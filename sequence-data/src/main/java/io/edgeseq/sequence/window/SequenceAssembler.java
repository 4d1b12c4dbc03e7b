package io.edgeseq.sequence.window;

import io.edgeseq.core.Record;
import io.edgeseq.core.Transform;
import io.edgeseq.sequence.index.IndexEntry;

import java.util.List;

/** Builds the windows of one entity and attaches its label, defaulting a missing label to 0. */
public class SequenceAssembler implements Transform<IndexEntry, AssembledSequence> {
    public static final int DEFAULT_LABEL = 0;

    private final SequenceBuilder builder;
    private final long maxTemporalKey;

    public SequenceAssembler(SequenceBuilder builder, long maxTemporalKey) {
        this.builder = builder;
        this.maxTemporalKey = maxTemporalKey;
    }

    @Override
    public List<Record<AssembledSequence>> apply(Record<IndexEntry> input) {
        IndexEntry entry = input.payload();
        EntitySequences seq = builder.build(entry.entityId(), entry.denseIndex(), maxTemporalKey);
        boolean missing = !entry.hasLabel();
        return List.of(input.withPayload(0, new AssembledSequence(seq, missing ? DEFAULT_LABEL : entry.label(), missing)));
    }
}
