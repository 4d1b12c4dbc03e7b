package io.edgeseq.sequence.scan;

/**
 * Durable scan progress. Every chunk numbered {@code <= lastChunkIndex} has been routed to the spools and
 * forced to disk; a resumed scan starts at {@code lastChunkIndex + 1}. Chunk numbers start at 1, so
 * {@code lastChunkIndex == 0} is the zero state.
 *
 * @param maxTxIdRouted largest txId routed to any spool, or -1
 * @param chunkSize     chunk size the indices refer to
 * @param streamPath    absolute path of the scanned stream
 * @param completed     the whole stream has been scanned
 */
public record ScanCheckpoint(long lastChunkIndex,
                             long totalRecordsRouted,
                             long rowsRead,
                             long rowsSkipped,
                             long maxTxIdRouted,
                             int chunkSize,
                             String streamPath,
                             boolean completed) {

    public static ScanCheckpoint initial(String streamPath, int chunkSize) {
        return new ScanCheckpoint(0, 0, 0, 0, -1, chunkSize, streamPath, false);
    }

    public boolean startsFresh() {
        return lastChunkIndex == 0 && !completed;
    }

    ScanCheckpoint plus(RoutedChunk chunk) {
        return new ScanCheckpoint(chunk.chunkNumber(),
                totalRecordsRouted + chunk.appends().size(),
                rowsRead + chunk.rowsRead(),
                rowsSkipped + chunk.rowsSkipped(),
                Math.max(maxTxIdRouted, chunk.maxTxId()),
                chunkSize, streamPath, false);
    }

    ScanCheckpoint asCompleted() {
        return new ScanCheckpoint(lastChunkIndex, totalRecordsRouted, rowsRead, rowsSkipped, maxTxIdRouted,
                chunkSize, streamPath, true);
    }
}
