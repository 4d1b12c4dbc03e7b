package io.edgeseq.sequence;

import io.edgeseq.sequence.window.TemporalKeyMode;

import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Run configuration. Everything a run writes lives below {@code workDir}.
 *
 * @param fixedMaxTemporalKey 0 when not configured
 */
public record SequenceConfig(
        Path streamPath,
        Path indexPath,
        Path workDir,
        int chunkSize,
        int windowLength,
        int featureWidth,
        int scanCheckpointEvery,
        int sequenceCheckpointEvery,
        TemporalKeyMode temporalKeyMode,
        long fixedMaxTemporalKey,
        int sampleSize,
        double safetyMargin,
        boolean fsync,
        boolean deleteSpools,
        boolean strictTemporalKey,
        long maxDeadLetters,
        long scanProgressEvery,
        long windowProgressEvery,
        long metricsReportSeconds
) {
    public static final int DEFAULT_CHUNK_SIZE = 50_000;
    public static final int DEFAULT_WINDOW_LENGTH = 50;
    public static final int DEFAULT_FEATURE_WIDTH = 95;

    public Path spoolDir() { return workDir.resolve("spools"); }
    public Path checkpointDir() { return workDir.resolve("checkpoints"); }
    public Path sequenceDir() { return workDir.resolve("sequences"); }
    public Path deadLetterDir() { return workDir.resolve("dead-letters"); }
    public Path scanCheckpointFile() { return checkpointDir().resolve("scan_checkpoint.json"); }
    public Path sequenceCheckpointFile() { return checkpointDir().resolve("sequence_checkpoint.json"); }

    public OptionalLong maxTemporalKey() {
        return fixedMaxTemporalKey > 0 ? OptionalLong.of(fixedMaxTemporalKey) : OptionalLong.empty();
    }

    /** Rejects values no run could use. */
    public SequenceConfig validate() {
        if (streamPath == null) throw new ConfigurationException("stream path is required");
        if (indexPath == null) throw new ConfigurationException("entity index path is required");
        if (workDir == null) throw new ConfigurationException("work directory is required");
        positive("chunk size", chunkSize);
        positive("window length", windowLength);
        positive("feature width", featureWidth);
        positive("scan checkpoint interval", scanCheckpointEvery);
        positive("sequence checkpoint interval", sequenceCheckpointEvery);
        positive("sample size", sampleSize);
        if (fixedMaxTemporalKey < 0) throw new ConfigurationException("max temporal key must be positive: " + fixedMaxTemporalKey);
        if (temporalKeyMode == TemporalKeyMode.FIXED && fixedMaxTemporalKey == 0) {
            throw new ConfigurationException("temporal key mode FIXED needs a max temporal key");
        }
        if (!(safetyMargin >= 1.0) || Double.isInfinite(safetyMargin)) {
            throw new ConfigurationException("safety margin must be a finite value >= 1: " + safetyMargin);
        }
        if (maxDeadLetters < 0) throw new ConfigurationException("max dead letters must not be negative: " + maxDeadLetters);
        return this;
    }

    private static void positive(String name, long value) {
        if (value <= 0) throw new ConfigurationException(name + " must be positive: " + value);
    }

    /** Defaults overridden by {@code edgeseq.*} system properties, then {@code EDGESEQ_*} environment variables. */
    public static SequenceConfig fromEnv() {
        Builder b = builder();
        String stream = setting("stream", null);
        if (stream != null) b.streamPath(Path.of(stream));
        String index = setting("index", null);
        if (index != null) b.indexPath(Path.of(index));
        b.workDir(Path.of(setting("work.dir", "./edgeseq-work")));
        b.chunkSize(Integer.parseInt(setting("chunk.size", String.valueOf(DEFAULT_CHUNK_SIZE))));
        b.windowLength(Integer.parseInt(setting("window.length", String.valueOf(DEFAULT_WINDOW_LENGTH))));
        b.featureWidth(Integer.parseInt(setting("feature.width", String.valueOf(DEFAULT_FEATURE_WIDTH))));
        b.scanCheckpointEvery(Integer.parseInt(setting("scan.checkpoint.every", "100")));
        b.sequenceCheckpointEvery(Integer.parseInt(setting("sequence.checkpoint.every", "10000")));
        b.temporalKeyMode(TemporalKeyMode.valueOf(setting("temporal.key.mode", "AUTO").toUpperCase(Locale.ROOT)));
        b.fixedMaxTemporalKey(Long.parseLong(setting("max.temporal.key", "0")));
        b.sampleSize(Integer.parseInt(setting("sample.size", "100")));
        b.safetyMargin(Double.parseDouble(setting("safety.margin", "1.1")));
        b.fsync(Boolean.parseBoolean(setting("fsync", "true")));
        b.deleteSpools(Boolean.parseBoolean(setting("delete.spools", "false")));
        b.strictTemporalKey(Boolean.parseBoolean(setting("strict.temporal.key", "false")));
        b.maxDeadLetters(Long.parseLong(setting("max.dead.letters", "10000")));
        b.scanProgressEvery(Long.parseLong(setting("scan.progress.every", "20")));
        b.windowProgressEvery(Long.parseLong(setting("window.progress.every", "10000")));
        b.metricsReportSeconds(Long.parseLong(setting("metrics.report.seconds", "0")));
        return b.build();
    }

    private static String setting(String key, String def) {
        String env = "EDGESEQ_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
        return System.getProperty("edgeseq." + key, System.getenv().getOrDefault(env, def));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .streamPath(streamPath).indexPath(indexPath).workDir(workDir)
                .chunkSize(chunkSize).windowLength(windowLength).featureWidth(featureWidth)
                .scanCheckpointEvery(scanCheckpointEvery).sequenceCheckpointEvery(sequenceCheckpointEvery)
                .temporalKeyMode(temporalKeyMode).fixedMaxTemporalKey(fixedMaxTemporalKey)
                .sampleSize(sampleSize).safetyMargin(safetyMargin)
                .fsync(fsync).deleteSpools(deleteSpools).strictTemporalKey(strictTemporalKey)
                .maxDeadLetters(maxDeadLetters).scanProgressEvery(scanProgressEvery)
                .windowProgressEvery(windowProgressEvery).metricsReportSeconds(metricsReportSeconds);
    }

    public static final class Builder {
        private Path streamPath;
        private Path indexPath;
        private Path workDir = Path.of("./edgeseq-work");
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int windowLength = DEFAULT_WINDOW_LENGTH;
        private int featureWidth = DEFAULT_FEATURE_WIDTH;
        private int scanCheckpointEvery = 100;
        private int sequenceCheckpointEvery = 10_000;
        private TemporalKeyMode temporalKeyMode = TemporalKeyMode.AUTO;
        private long fixedMaxTemporalKey;
        private int sampleSize = 100;
        private double safetyMargin = 1.1;
        private boolean fsync = true;
        private boolean deleteSpools;
        private boolean strictTemporalKey;
        private long maxDeadLetters = 10_000;
        private long scanProgressEvery = 20;
        private long windowProgressEvery = 10_000;
        private long metricsReportSeconds;

        private Builder() {}

        public Builder streamPath(Path v) { this.streamPath = v; return this; }
        public Builder indexPath(Path v) { this.indexPath = v; return this; }
        public Builder workDir(Path v) { this.workDir = v; return this; }
        public Builder chunkSize(int v) { this.chunkSize = v; return this; }
        public Builder windowLength(int v) { this.windowLength = v; return this; }
        public Builder featureWidth(int v) { this.featureWidth = v; return this; }
        public Builder scanCheckpointEvery(int v) { this.scanCheckpointEvery = v; return this; }
        public Builder sequenceCheckpointEvery(int v) { this.sequenceCheckpointEvery = v; return this; }
        public Builder temporalKeyMode(TemporalKeyMode v) { this.temporalKeyMode = v; return this; }
        public Builder fixedMaxTemporalKey(long v) { this.fixedMaxTemporalKey = v; return this; }
        public Builder sampleSize(int v) { this.sampleSize = v; return this; }
        public Builder safetyMargin(double v) { this.safetyMargin = v; return this; }
        public Builder fsync(boolean v) { this.fsync = v; return this; }
        public Builder deleteSpools(boolean v) { this.deleteSpools = v; return this; }
        public Builder strictTemporalKey(boolean v) { this.strictTemporalKey = v; return this; }
        public Builder maxDeadLetters(long v) { this.maxDeadLetters = v; return this; }
        public Builder scanProgressEvery(long v) { this.scanProgressEvery = v; return this; }
        public Builder windowProgressEvery(long v) { this.windowProgressEvery = v; return this; }
        public Builder metricsReportSeconds(long v) { this.metricsReportSeconds = v; return this; }

        public SequenceConfig build() {
            return new SequenceConfig(streamPath, indexPath, workDir, chunkSize, windowLength, featureWidth,
                    scanCheckpointEvery, sequenceCheckpointEvery, temporalKeyMode, fixedMaxTemporalKey, sampleSize,
                    safetyMargin, fsync, deleteSpools, strictTemporalKey, maxDeadLetters, scanProgressEvery,
                    windowProgressEvery, metricsReportSeconds);
        }
    }
}
