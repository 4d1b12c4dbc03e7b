package io.edgeseq.sequence.scan;

/**
 * Outcome of parsing one stream row. A malformed row is a value, not an exception, so the scan can count it
 * and move on.
 */
public sealed interface ParsedRow permits ParsedRow.Parsed, ParsedRow.Skipped {

    record Parsed(EdgeRecord edge) implements ParsedRow {
    }

    record Skipped(long offset, SkipReason reason, String detail) implements ParsedRow {
    }
}
