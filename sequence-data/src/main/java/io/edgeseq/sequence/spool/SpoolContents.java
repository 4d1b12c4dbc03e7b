package io.edgeseq.sequence.spool;

import java.util.List;

/**
 * What {@link SpoolStore#read} found in one spool.
 *
 * @param entries      distinct entries in arrival order
 * @param duplicates   entries dropped because their offset was already seen (replayed chunks)
 * @param corruptLines lines that could not be parsed
 * @param present      whether the spool file exists
 */
public record SpoolContents(List<SpoolEntry> entries, long duplicates, long corruptLines, boolean present) {
    public static SpoolContents absent() {
        return new SpoolContents(List.of(), 0, 0, false);
    }
}
