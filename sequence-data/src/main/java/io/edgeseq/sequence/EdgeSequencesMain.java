package io.edgeseq.sequence;

import com.google.inject.Guice;
import com.google.inject.ProvisionException;
import io.edgeseq.checkpoint.CheckpointCorruptedException;
import io.edgeseq.sequence.window.TemporalKeyMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI that turns an edge stream into one fixed-shape sequence artifact per indexed entity.
 * Options left unset fall back to {@code edgeseq.*} system properties, {@code EDGESEQ_*} variables, then defaults.
 */
@CommandLine.Command(name = "edge-sequences", mixinStandardHelpOptions = true, version = "edge-sequences 0.1.0",
        description = "Extract per-entity temporal sequences from an edge stream, resuming from checkpoints")
public final class EdgeSequencesMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(EdgeSequencesMain.class);

    @CommandLine.Option(names = {"-s", "--stream"}, description = "Edge stream CSV (optionally .gz)")
    Path stream;

    @CommandLine.Option(names = {"-i", "--index"}, description = "Entity index CSV (entityId,denseIndex,label)")
    Path index;

    @CommandLine.Option(names = {"-w", "--work-dir"}, description = "Directory for spools, checkpoints, sequences and dead letters")
    Path workDir;

    @CommandLine.Option(names = "--phase", description = "ALL, EXTRACT or WINDOW (default: ${DEFAULT-VALUE})", defaultValue = "ALL")
    Phase phase;

    @CommandLine.Option(names = {"-c", "--chunk-size"}, description = "Rows per chunk")
    Integer chunkSize;

    @CommandLine.Option(names = {"-k", "--window"}, description = "Window length K")
    Integer windowLength;

    @CommandLine.Option(names = "--feature-width", description = "Feature columns per edge")
    Integer featureWidth;

    @CommandLine.Option(names = "--scan-checkpoint-every", description = "Chunks between scan checkpoints")
    Integer scanCheckpointEvery;

    @CommandLine.Option(names = "--sequence-checkpoint-every", description = "Entities between sequence checkpoints")
    Integer sequenceCheckpointEvery;

    @CommandLine.Option(names = "--temporal-key-mode", description = "AUTO, FIXED, OBSERVED or SAMPLED")
    TemporalKeyMode temporalKeyMode;

    @CommandLine.Option(names = "--max-temporal-key", description = "Fixed normalisation bound for txId")
    Long maxTemporalKey;

    @CommandLine.Option(names = "--sample-size", description = "Inbound spools sampled to estimate the bound")
    Integer sampleSize;

    @CommandLine.Option(names = "--safety-margin", description = "Multiplier applied to an observed or sampled max txId")
    Double safetyMargin;

    @CommandLine.Option(names = "--no-fsync", description = "Skip forcing spool and artifact writes to disk")
    boolean noFsync;

    @CommandLine.Option(names = "--delete-spools", description = "Delete an entity's spools once its artifact is checkpointed")
    boolean deleteSpools;

    @CommandLine.Option(names = "--strict-temporal-key", description = "Exit with status 3 if any txId exceeds the bound")
    boolean strictTemporalKey;

    @CommandLine.Option(names = "--metrics-every", description = "Seconds between metric reports (0 disables)")
    Long metricsReportSeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new EdgeSequencesMain()).execute(args);
        System.exit(code);
    }

    SequenceConfig config() {
        SequenceConfig.Builder b = SequenceConfig.fromEnv().toBuilder();
        if (stream != null) b.streamPath(stream);
        if (index != null) b.indexPath(index);
        if (workDir != null) b.workDir(workDir);
        if (chunkSize != null) b.chunkSize(chunkSize);
        if (windowLength != null) b.windowLength(windowLength);
        if (featureWidth != null) b.featureWidth(featureWidth);
        if (scanCheckpointEvery != null) b.scanCheckpointEvery(scanCheckpointEvery);
        if (sequenceCheckpointEvery != null) b.sequenceCheckpointEvery(sequenceCheckpointEvery);
        if (temporalKeyMode != null) b.temporalKeyMode(temporalKeyMode);
        if (maxTemporalKey != null) b.fixedMaxTemporalKey(maxTemporalKey);
        if (sampleSize != null) b.sampleSize(sampleSize);
        if (safetyMargin != null) b.safetyMargin(safetyMargin);
        if (noFsync) b.fsync(false);
        if (deleteSpools) b.deleteSpools(true);
        if (strictTemporalKey) b.strictTemporalKey(true);
        if (metricsReportSeconds != null) b.metricsReportSeconds(metricsReportSeconds);
        return b.build();
    }

    @Override
    public Integer call() {
        SequenceConfig cfg;
        try {
            cfg = config().validate();
        } catch (ConfigurationException | IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return RunSummary.EXIT_USAGE;
        }
        try {
            EdgeSequenceJob job = Guice.createInjector(new EdgeSequencesModule(cfg)).getInstance(EdgeSequenceJob.class);
            CountDownLatch done = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                job.requestStop();
                try {
                    // give the run a chance to commit before the JVM exits
                    done.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "edge-sequences-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                RunSummary summary = job.run(phase);
                System.out.println(summary.format());
                if (summary.exitCode() == RunSummary.EXIT_TEMPORAL_OVERFLOW) {
                    log.error("Strict temporal key check failed: {} entities exceed max temporal key {}",
                            summary.temporalOverflow(), summary.maxTemporalKey());
                }
                return summary.exitCode();
            } finally {
                done.countDown();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("JVM is shutting down, shutdown hook stays registered");
                }
            }
        } catch (ProvisionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Startup failed: {}", cause.getMessage(), cause);
            return RunSummary.EXIT_FATAL;
        } catch (CheckpointCorruptedException e) {
            log.error("{}", e.getMessage(), e);
            return RunSummary.EXIT_FATAL;
        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return RunSummary.EXIT_FATAL;
        }
    }
}
