package io.edgeseq.sequence.window;

import io.edgeseq.core.BatchSink;
import io.edgeseq.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Writes each entity's artifact, then marks the entity processed. */
public class SequenceArtifactSink implements BatchSink<AssembledSequence> {
    private static final Logger log = LoggerFactory.getLogger(SequenceArtifactSink.class);
    private static final int WARN_LIMIT = 20;

    private final SequenceArtifactCodec codec;
    private final SequenceCheckpointManager checkpoints;
    private final WindowTally tally;
    private final long maxTemporalKey;
    private int labelWarnings;
    private int overflowWarnings;

    public SequenceArtifactSink(SequenceArtifactCodec codec, SequenceCheckpointManager checkpoints, WindowTally tally,
                                long maxTemporalKey) {
        this.codec = codec;
        this.checkpoints = checkpoints;
        this.tally = tally;
        this.maxTemporalKey = maxTemporalKey;
    }

    @Override
    public void acceptBatch(List<Record<AssembledSequence>> records) throws Exception {
        for (Record<AssembledSequence> r : records) {
            AssembledSequence s = r.payload();
            EntitySequences seq = s.sequences();
            codec.write(s.toArtifact());
            checkpoints.markProcessed(seq.denseIndex(), seq.entityId());
            tally.add(s);
            if (s.labelMissing() && labelWarnings++ < WARN_LIMIT) {
                log.warn("Entity {} has no label, defaulting to {}", seq.entityId(), SequenceAssembler.DEFAULT_LABEL);
            }
            if (seq.hasOverflow() && overflowWarnings++ < WARN_LIMIT) {
                log.warn("Entity {} has {} row(s) with txId above max temporal key {}; proxy exceeds 1",
                        seq.entityId(), seq.overflowRows(), maxTemporalKey);
            }
        }
    }
}
