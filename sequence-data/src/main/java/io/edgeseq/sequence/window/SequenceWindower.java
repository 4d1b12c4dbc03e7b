package io.edgeseq.sequence.window;

import com.codahale.metrics.MetricRegistry;
import io.edgeseq.error.DeadLetterSink;
import io.edgeseq.metrics.Metrics;
import io.edgeseq.retry.RetryPolicy;
import io.edgeseq.runtime.Pipeline;
import io.edgeseq.runtime.PipelineBuilder;
import io.edgeseq.runtime.RunStats;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.index.IndexEntry;
import io.edgeseq.sequence.scan.ScanCheckpoint;
import io.edgeseq.sequence.spool.SpoolStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Windowing phase: builds one artifact per unfinished entity in index order and checkpoints every
 * {@code checkpointEvery} entities. An entity whose build keeps failing goes to the dead letter sink and stays
 * unmarked, so the next run retries it.
 */
public class SequenceWindower {
    private static final Logger log = LoggerFactory.getLogger(SequenceWindower.class);

    public record Result(RunStats stats, WindowTally tally, long alreadyDone, long maxTemporalKey) {
    }

    private final EntityIndex index;
    private final SpoolStore spools;
    private final SequenceBuilder builder;
    private final SequenceArtifactCodec codec;
    private final SequenceCheckpointManager checkpoints;
    private final TemporalKeyResolver keyResolver;
    private final int checkpointEvery;
    private final boolean deleteSpools;
    private final RetryPolicy retry;
    private final DeadLetterSink failedEntities;
    private final MetricRegistry registry;
    private final long progressEvery;
    private final AtomicReference<Pipeline<IndexEntry, AssembledSequence>> active = new AtomicReference<>();
    private volatile boolean stopRequested;

    public SequenceWindower(EntityIndex index, SpoolStore spools, SequenceBuilder builder, SequenceArtifactCodec codec,
                            SequenceCheckpointManager checkpoints, TemporalKeyResolver keyResolver,
                            int checkpointEvery, boolean deleteSpools, RetryPolicy retry,
                            DeadLetterSink failedEntities, MetricRegistry registry, long progressEvery) {
        this.index = index;
        this.spools = spools;
        this.builder = builder;
        this.codec = codec;
        this.checkpoints = checkpoints;
        this.keyResolver = keyResolver;
        this.checkpointEvery = checkpointEvery;
        this.deleteSpools = deleteSpools;
        this.retry = retry;
        this.failedEntities = failedEntities;
        this.registry = registry;
        this.progressEvery = progressEvery;
    }

    public Result run(ScanCheckpoint scan) throws Exception {
        checkpoints.load();
        long maxKey;
        if (checkpoints.maxTemporalKey().isPresent()) {
            maxKey = checkpoints.maxTemporalKey().getAsLong();
            log.info("Reusing pinned max temporal key {}", maxKey);
        } else {
            maxKey = keyResolver.resolve(scan, index, spools);
            checkpoints.pinMaxTemporalKey(maxKey);
        }
        if (deleteSpools) checkpoints.onFinalized(spools::delete);

        EntitySource source = new EntitySource(index, checkpoints::isProcessed);
        WindowTally tally = new WindowTally(new Metrics(registry));
        Pipeline<IndexEntry, AssembledSequence> pipeline = new PipelineBuilder<IndexEntry, AssembledSequence>()
                .name("window")
                .source(source)
                .transform(new SequenceAssembler(builder, maxKey))
                .sink(new SequenceArtifactSink(codec, checkpoints, tally, maxKey))
                .onCommit(checkpoints)
                .commitEvery(checkpointEvery)
                .retry(retry)
                .deadLetters(failedEntities)
                .logProgressEvery(progressEvery)
                .metrics(registry)
                .build();
        active.set(pipeline);
        if (stopRequested) pipeline.stop();
        RunStats stats;
        try {
            stats = pipeline.run();
        } finally {
            active.set(null);
        }
        log.info("Windowing {}: {} entities built, {} failed, {} already done, {} of {} finalized",
                stats.stopped() ? "paused" : "finished", tally.processed(), stats.unitsFailed(), source.skipped(),
                checkpoints.processedCount(), index.size());
        return new Result(stats, tally, source.skipped(), maxKey);
    }

    public void stop() {
        stopRequested = true;
        Pipeline<IndexEntry, AssembledSequence> p = active.get();
        if (p != null) p.stop();
    }
}
