package io.edgeseq.sequence;

/**
 * End-of-run counts for data-quality auditing. Non-zero failure counts are reported, not fatal.
 *
 * @param maxTemporalKey 0 when the windowing phase did not run
 */
public record RunSummary(
        long chunksScanned,
        long rowsRead,
        long rowsSkipped,
        long recordsRouted,
        boolean scanCompleted,
        long entitiesTotal,
        long entitiesBuilt,
        long entitiesAlreadyDone,
        long entitiesFailed,
        long emptyIn,
        long emptyOut,
        long missingLabels,
        long temporalOverflow,
        long spoolReadFailures,
        long duplicatesDropped,
        long corruptSpoolLines,
        long maxTemporalKey,
        long artifactFiles,
        long artifactBytes,
        boolean stopped,
        boolean strictTemporalKey
) {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_TEMPORAL_OVERFLOW = 3;

    public int exitCode() {
        if (strictTemporalKey && temporalOverflow > 0) return EXIT_TEMPORAL_OVERFLOW;
        return EXIT_OK;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run summary").append(stopped ? " (stopped early, rerun to resume)" : "").append('\n');
        sb.append(String.format("  scan: %,d chunks, %,d rows read, %,d rows skipped, %,d records routed%s%n",
                chunksScanned, rowsRead, rowsSkipped, recordsRouted, scanCompleted ? "" : " (incomplete)"));
        sb.append(String.format("  entities: %,d total, %,d built, %,d already done, %,d failed%n",
                entitiesTotal, entitiesBuilt, entitiesAlreadyDone, entitiesFailed));
        sb.append(String.format("  empty in-flow: %,d, empty out-flow: %,d, missing labels (defaulted to 0): %,d%n",
                emptyIn, emptyOut, missingLabels));
        sb.append(String.format("  temporal overflow: %,d entities (max temporal key %,d)%n", temporalOverflow, maxTemporalKey));
        sb.append(String.format("  spools: %,d read failures, %,d duplicates dropped, %,d corrupt lines%n",
                spoolReadFailures, duplicatesDropped, corruptSpoolLines));
        sb.append(String.format("  artifacts: %,d files, %.2f MiB", artifactFiles, artifactBytes / (1024.0 * 1024.0)));
        return sb.toString();
    }
}
