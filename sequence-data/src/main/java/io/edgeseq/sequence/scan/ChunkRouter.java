package io.edgeseq.sequence.scan;

import io.edgeseq.core.Record;
import io.edgeseq.core.Transform;
import io.edgeseq.error.DeadLetterSink;
import io.edgeseq.sequence.spool.Direction;
import io.edgeseq.sequence.spool.SpoolAppend;
import io.edgeseq.sequence.spool.SpoolEntry;
import io.edgeseq.source.LineChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongPredicate;

/**
 * Filters a chunk to rows touching a target entity and routes each such row to the outbound spool of
 * {@code src} and the inbound spool of {@code dst}, independently. Malformed rows are counted and sent
 * to the dead letter sink.
 */
public class ChunkRouter implements Transform<LineChunk, RoutedChunk> {
    private static final Logger log = LoggerFactory.getLogger(ChunkRouter.class);
    private static final int WARN_LIMIT = 20;

    private final EdgeRowParser parser;
    private final LongPredicate targets;
    private final DeadLetterSink deadLetters;
    private long warned;

    public ChunkRouter(EdgeRowParser parser, LongPredicate targets, DeadLetterSink deadLetters) {
        this.parser = parser;
        this.targets = targets;
        this.deadLetters = deadLetters;
    }

    @Override
    public List<Record<RoutedChunk>> apply(Record<LineChunk> input) {
        LineChunk chunk = input.payload();
        List<SpoolAppend> appends = new ArrayList<>();
        Map<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);
        long maxTxId = -1;
        List<String> lines = chunk.lines();
        for (int i = 0; i < lines.size(); i++) {
            long offset = chunk.firstRowOffset() + i;
            ParsedRow row = parser.parse(lines.get(i), offset);
            if (row instanceof ParsedRow.Skipped s) {
                skipped.merge(s.reason(), 1L, Long::sum);
                reportSkipped(s);
                continue;
            }
            EdgeRecord edge = ((ParsedRow.Parsed) row).edge();
            boolean out = targets.test(edge.src());
            boolean in = targets.test(edge.dst());
            if (!out && !in) continue;
            SpoolEntry entry = new SpoolEntry(edge.offset(), edge.txId(), edge.features());
            if (out) appends.add(new SpoolAppend(edge.src(), Direction.OUTBOUND, entry));
            if (in) appends.add(new SpoolAppend(edge.dst(), Direction.INBOUND, entry));
            maxTxId = Math.max(maxTxId, edge.txId());
        }
        RoutedChunk routed = new RoutedChunk(chunk.chunkNumber(), lines.size(), skipped, appends, maxTxId);
        return List.of(input.withPayload(0, routed));
    }

    private void reportSkipped(ParsedRow.Skipped s) {
        if (deadLetters != null) deadLetters.acceptFailure("parse", s.offset(), s.reason().name(), s.detail());
        if (warned < WARN_LIMIT) {
            warned++;
            log.warn("Skipping malformed row {}: {} ({}){}", s.offset(), s.reason(), s.detail(),
                    warned == WARN_LIMIT ? "; further malformed rows are only counted" : "");
        }
    }
}
