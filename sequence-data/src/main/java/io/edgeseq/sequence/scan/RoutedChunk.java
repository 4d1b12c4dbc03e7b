package io.edgeseq.sequence.scan;

import io.edgeseq.sequence.spool.SpoolAppend;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one chunk contributes: the spool appends plus the tallies the scan checkpoint accumulates.
 *
 * @param maxTxId largest txId among routed rows, or -1 when nothing was routed
 */
public record RoutedChunk(long chunkNumber,
                          long rowsRead,
                          Map<SkipReason, Long> skipped,
                          List<SpoolAppend> appends,
                          long maxTxId) {

    public RoutedChunk {
        skipped = skipped.isEmpty() ? Map.of() : new EnumMap<>(skipped);
        appends = List.copyOf(appends);
    }

    public long rowsSkipped() {
        long n = 0;
        for (long v : skipped.values()) n += v;
        return n;
    }
}
