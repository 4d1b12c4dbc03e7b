package io.edgeseq.sequence;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.edgeseq.error.FileDeadLetterSink;
import io.edgeseq.metrics.Metrics;
import io.edgeseq.retry.ExponentialBackoffRetryPolicy;
import io.edgeseq.retry.RetryPolicy;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.scan.ScanCheckpoint;
import io.edgeseq.sequence.scan.ScanCheckpointManager;
import io.edgeseq.sequence.scan.StreamScanner;
import io.edgeseq.sequence.spool.SpoolStore;
import io.edgeseq.sequence.window.SequenceArtifactCodec;
import io.edgeseq.sequence.window.SequenceBuilder;
import io.edgeseq.sequence.window.SequenceCheckpointManager;
import io.edgeseq.sequence.window.SequenceWindower;
import io.edgeseq.sequence.window.TemporalKeyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Runs extraction, then windowing. Both phases resume from their own checkpoints, so the job can be rerun after
 * a crash or a {@link #requestStop()} with the same configuration and picks up where the last durable checkpoint
 * left off.
 */
public class EdgeSequenceJob {
    private static final Logger log = LoggerFactory.getLogger(EdgeSequenceJob.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SequenceConfig config;
    private final EntityIndex index;
    private final SpoolStore spools;
    private final ScanCheckpointManager scanCheckpoints;
    private final SequenceCheckpointManager sequenceCheckpoints;
    private final MetricRegistry registry;
    private final RetryPolicy retry;

    private volatile boolean stopRequested;
    private volatile StreamScanner scanner;
    private volatile SequenceWindower windower;

    public EdgeSequenceJob(SequenceConfig config, EntityIndex index, SpoolStore spools,
                           ScanCheckpointManager scanCheckpoints, SequenceCheckpointManager sequenceCheckpoints,
                           MetricRegistry registry) {
        this(config, index, spools, scanCheckpoints, sequenceCheckpoints, registry,
                new ExponentialBackoffRetryPolicy(3, 100, 2_000));
    }

    public EdgeSequenceJob(SequenceConfig config, EntityIndex index, SpoolStore spools,
                           ScanCheckpointManager scanCheckpoints, SequenceCheckpointManager sequenceCheckpoints,
                           MetricRegistry registry, RetryPolicy retry) {
        this.config = config.validate();
        this.index = index;
        this.spools = spools;
        this.scanCheckpoints = scanCheckpoints;
        this.sequenceCheckpoints = sequenceCheckpoints;
        this.registry = registry;
        this.retry = retry;
    }

    /** Wires a job with the stores the configuration describes. */
    public static EdgeSequenceJob create(SequenceConfig config, EntityIndex index, MetricRegistry registry) {
        return new EdgeSequenceJob(config, index,
                new SpoolStore(config.spoolDir(), config.featureWidth(), config.fsync()),
                new ScanCheckpointManager(config.scanCheckpointFile()),
                new SequenceCheckpointManager(config.sequenceCheckpointFile(), config.windowLength(), config.featureWidth()),
                registry);
    }

    public RunSummary run() throws Exception {
        return run(Phase.ALL);
    }

    public RunSummary run(Phase phase) throws Exception {
        log.info("Starting {} run: stream={}, index={} ({} entities), workDir={}, C={}, K={}, F={}",
                phase, config.streamPath(), config.indexPath(), index.size(), config.workDir(),
                config.chunkSize(), config.windowLength(), config.featureWidth());
        Files.createDirectories(config.workDir());
        Metrics metrics = new Metrics(registry);
        metrics.registerJvmMemory();
        Slf4jReporter reporter = metrics.startReporter(config.metricsReportSeconds());
        try (FileDeadLetterSink skippedRows = new FileDeadLetterSink(
                     config.deadLetterDir().resolve("skipped_rows.jsonl"), config.maxDeadLetters());
             FileDeadLetterSink failedEntities = new FileDeadLetterSink(
                     config.deadLetterDir().resolve("failed_entities.jsonl"), config.maxDeadLetters())) {

            ScanCheckpoint scan = phase.extracts() ? extract(skippedRows) : scanCheckpoints.load(config.streamPath(), config.chunkSize());
            if (phase.extracts()) logMemory(metrics, "extract");
            if (!phase.windows() || stopRequested) {
                return summarize(scan, null);
            }
            if (!scan.completed()) {
                throw new EdgeSequenceException("Extraction of " + config.streamPath()
                        + " has not completed; run the extract phase first");
            }
            SequenceWindower.Result result = window(scan, failedEntities);
            logMemory(metrics, "window");
            return summarize(scan, result);
        } finally {
            if (reporter != null) {
                reporter.report();
                reporter.stop();
            }
        }
    }

    private ScanCheckpoint extract(FileDeadLetterSink skippedRows) throws Exception {
        StreamScanner s = new StreamScanner(config.streamPath(), config.chunkSize(), config.scanCheckpointEvery(),
                config.featureWidth(), index, spools, scanCheckpoints, retry, skippedRows, registry,
                config.scanProgressEvery());
        scanner = s;
        if (stopRequested) s.stop();
        try {
            return s.scan();
        } finally {
            scanner = null;
            skippedRows.flush();
        }
    }

    private SequenceWindower.Result window(ScanCheckpoint scan, FileDeadLetterSink failedEntities) throws Exception {
        SequenceBuilder builder = new SequenceBuilder(spools, config.windowLength());
        SequenceArtifactCodec codec = new SequenceArtifactCodec(config.sequenceDir(), config.windowLength(),
                builder.rowWidth(), config.fsync());
        TemporalKeyResolver resolver = new TemporalKeyResolver(config.temporalKeyMode(), config.maxTemporalKey(),
                config.sampleSize(), config.safetyMargin());
        SequenceWindower w = new SequenceWindower(index, spools, builder, codec, sequenceCheckpoints, resolver,
                config.sequenceCheckpointEvery(), config.deleteSpools(), retry, failedEntities, registry,
                config.windowProgressEvery());
        windower = w;
        if (stopRequested) w.stop();
        try {
            return w.run(scan);
        } finally {
            windower = null;
            failedEntities.flush();
        }
    }

    private RunSummary summarize(ScanCheckpoint scan, SequenceWindower.Result w) throws IOException {
        long files = 0, bytes = 0;
        if (w != null && Files.isDirectory(config.sequenceDir())) {
            try (Stream<Path> s = Files.list(config.sequenceDir())) {
                for (Path p : (Iterable<Path>) s::iterator) {
                    String name = p.getFileName().toString();
                    if (name.startsWith("seq_") && name.endsWith(".bin")) {
                        files++;
                        bytes += Files.size(p);
                    }
                }
            }
        }
        boolean stopped = stopRequested || (w != null && w.stats().stopped());
        RunSummary summary = new RunSummary(
                scan.lastChunkIndex(), scan.rowsRead(), scan.rowsSkipped(), scan.totalRecordsRouted(), scan.completed(),
                index.size(),
                w == null ? 0 : w.tally().processed(),
                w == null ? 0 : w.alreadyDone(),
                w == null ? 0 : w.stats().unitsFailed(),
                w == null ? 0 : w.tally().emptyIn(),
                w == null ? 0 : w.tally().emptyOut(),
                w == null ? 0 : w.tally().missingLabels(),
                w == null ? 0 : w.tally().temporalOverflow(),
                w == null ? 0 : w.tally().spoolReadFailures(),
                w == null ? 0 : w.tally().duplicatesDropped(),
                w == null ? 0 : w.tally().corruptLines(),
                w == null ? 0 : w.maxTemporalKey(),
                files, bytes, stopped, config.strictTemporalKey());
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(config.workDir().resolve("run_summary.json").toFile(), summary);
        log.info("{}", summary.format());
        if (summary.missingLabels() > 0) {
            log.warn("{} entities had no label and were written with label 0", summary.missingLabels());
        }
        if (summary.temporalOverflow() > 0) {
            log.warn("{} entities have txIds above max temporal key {}; their proxy column exceeds 1",
                    summary.temporalOverflow(), summary.maxTemporalKey());
        }
        return summary;
    }

    private static void logMemory(Metrics metrics, String phase) {
        long mb = 1024 * 1024;
        log.info("Memory after {}: heap {} MB used of {} MB max, non-heap {} MB used", phase,
                metrics.jvmMemory("heap.used") / mb, metrics.jvmMemory("heap.max") / mb,
                metrics.jvmMemory("non-heap.used") / mb);
    }

    /** Stops at the next chunk or entity boundary, after committing. Safe to call from any thread. */
    public void requestStop() {
        stopRequested = true;
        StreamScanner s = scanner;
        if (s != null) s.stop();
        SequenceWindower w = windower;
        if (w != null) w.stop();
    }

    public SequenceConfig config() { return config; }
}
