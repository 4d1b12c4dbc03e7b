package io.edgeseq.sequence.scan;

import com.codahale.metrics.MetricRegistry;
import io.edgeseq.error.DeadLetterSink;
import io.edgeseq.metrics.Metrics;
import io.edgeseq.retry.RetryPolicy;
import io.edgeseq.runtime.Pipeline;
import io.edgeseq.runtime.PipelineBuilder;
import io.edgeseq.runtime.RunStats;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.spool.SpoolStore;
import io.edgeseq.source.LineChunk;
import io.edgeseq.source.LineChunkSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Extraction phase: streams the edge file chunk by chunk, routes rows touching an indexed entity to its spools,
 * and checkpoints every {@code checkpointEvery} chunks. Resumes after the last durable checkpoint.
 */
public class StreamScanner {
    private static final Logger log = LoggerFactory.getLogger(StreamScanner.class);

    private final Path stream;
    private final int chunkSize;
    private final int checkpointEvery;
    private final int featureWidth;
    private final EntityIndex index;
    private final SpoolStore spools;
    private final ScanCheckpointManager checkpoints;
    private final RetryPolicy retry;
    private final DeadLetterSink skippedRows;
    private final MetricRegistry registry;
    private final long progressEvery;
    private final AtomicReference<Pipeline<LineChunk, RoutedChunk>> active = new AtomicReference<>();
    private volatile boolean stopRequested;

    public StreamScanner(Path stream, int chunkSize, int checkpointEvery, int featureWidth, EntityIndex index,
                         SpoolStore spools, ScanCheckpointManager checkpoints, RetryPolicy retry,
                         DeadLetterSink skippedRows, MetricRegistry registry, long progressEvery) {
        this.stream = stream;
        this.chunkSize = chunkSize;
        this.checkpointEvery = checkpointEvery;
        this.featureWidth = featureWidth;
        this.index = index;
        this.spools = spools;
        this.checkpoints = checkpoints;
        this.retry = retry;
        this.skippedRows = skippedRows;
        this.registry = registry;
        this.progressEvery = progressEvery;
    }

    /** Runs the scan to completion or until {@link #stop()}; returns the final checkpoint state. */
    public ScanCheckpoint scan() throws Exception {
        ScanCheckpoint start = checkpoints.load(stream, chunkSize);
        if (start.completed()) {
            log.info("Scan of {} already completed ({} chunks); skipping extraction", stream, start.lastChunkIndex());
            return start;
        }
        try (LineChunkSource source = new LineChunkSource(stream, chunkSize)) {
            EdgeRowParser parser = EdgeRowParser.fromHeader(source.header(), featureWidth);
            if (start.startsFresh()) {
                spools.initialize(index.entityIds());
            }
            if (start.lastChunkIndex() > 0) {
                long skipped = source.skipChunks(start.lastChunkIndex());
                if (skipped < start.lastChunkIndex()) {
                    throw new IOException("Stream " + stream + " has only " + skipped + " chunks but the checkpoint covers "
                            + start.lastChunkIndex() + "; was the stream truncated?");
                }
                log.info("Resuming scan of {} at chunk {}", stream, start.lastChunkIndex() + 1);
            } else {
                log.info("Starting scan of {} with chunk size {}", stream, chunkSize);
            }
            Pipeline<LineChunk, RoutedChunk> pipeline = new PipelineBuilder<LineChunk, RoutedChunk>()
                    .name("scan")
                    .source(source)
                    .transform(new ChunkRouter(parser, index::contains, skippedRows))
                    .sink(new ScanSink(spools, checkpoints, new Metrics(registry)))
                    .onCommit(checkpoints)
                    .commitEvery(checkpointEvery)
                    .retry(retry)
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
            if (!stats.stopped()) {
                checkpoints.markCompleted();
            }
        }
        ScanCheckpoint end = checkpoints.current();
        log.info("Scan {}: {} chunks, {} rows read, {} skipped, {} records routed",
                end.completed() ? "finished" : "paused", end.lastChunkIndex(), end.rowsRead(), end.rowsSkipped(),
                end.totalRecordsRouted());
        return end;
    }

    public void stop() {
        stopRequested = true;
        Pipeline<LineChunk, RoutedChunk> p = active.get();
        if (p != null) p.stop();
    }
}
