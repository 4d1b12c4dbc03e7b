package io.edgeseq.source;

import java.util.List;

/**
 * Up to chunk-size consecutive data lines of a text stream.
 *
 * @param chunkNumber    1-based chunk number
 * @param firstRowOffset 1-based data row number of {@code lines.get(0)}
 */
public record LineChunk(long chunkNumber, long firstRowOffset, List<String> lines) {
    public int size() { return lines.size(); }
}
