package io.edgeseq.sequence.scan;

import com.codahale.metrics.Counter;
import io.edgeseq.core.BatchSink;
import io.edgeseq.core.Record;
import io.edgeseq.metrics.Metrics;
import io.edgeseq.sequence.spool.SpoolStore;

import java.util.List;

/**
 * Writes each routed chunk to the spools, then folds its tallies into the scan checkpoint state.
 * The spool write is durable before the tallies move, so the next checkpoint save never runs ahead of the data.
 */
public class ScanSink implements BatchSink<RoutedChunk> {
    private final SpoolStore spools;
    private final ScanCheckpointManager checkpoints;
    private final Counter routed;
    private final Counter skipped;
    private final Counter filesTouched;

    public ScanSink(SpoolStore spools, ScanCheckpointManager checkpoints, Metrics metrics) {
        this.spools = spools;
        this.checkpoints = checkpoints;
        this.routed = metrics.counter("scan.records.routed");
        this.skipped = metrics.counter("scan.rows.skipped");
        this.filesTouched = metrics.counter("scan.spools.touched");
    }

    @Override
    public void acceptBatch(List<Record<RoutedChunk>> records) throws Exception {
        for (Record<RoutedChunk> r : records) {
            RoutedChunk chunk = r.payload();
            int touched = spools.appendAll(chunk.appends());
            checkpoints.recordChunk(chunk);
            routed.inc(chunk.appends().size());
            skipped.inc(chunk.rowsSkipped());
            filesTouched.inc(touched);
        }
    }
}
