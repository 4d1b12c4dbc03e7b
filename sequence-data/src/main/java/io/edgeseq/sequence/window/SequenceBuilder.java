package io.edgeseq.sequence.window;

import io.edgeseq.sequence.spool.Direction;
import io.edgeseq.sequence.spool.SpoolContents;
import io.edgeseq.sequence.spool.SpoolEntry;
import io.edgeseq.sequence.spool.SpoolStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns an entity's two spools into fixed-shape windows.
 * <p>
 * Per direction: entries are sorted by txId (ties by stream offset), the last {@code K} are kept, a column
 * {@code txId / maxTemporalKey} is appended and the result is right-aligned in a {@code K x (F+1)} matrix whose
 * leading rows stay zero.
 */
public class SequenceBuilder {
    private static final Logger log = LoggerFactory.getLogger(SequenceBuilder.class);
    private static final Comparator<SpoolEntry> TEMPORAL_ORDER =
            Comparator.comparingLong(SpoolEntry::txId).thenComparingLong(SpoolEntry::offset);

    private final SpoolStore spools;
    private final int windowLength;
    private final int featureWidth;

    public SequenceBuilder(SpoolStore spools, int windowLength) {
        if (windowLength < 1) throw new IllegalArgumentException("windowLength must be positive: " + windowLength);
        this.spools = spools;
        this.windowLength = windowLength;
        this.featureWidth = spools.featureWidth();
    }

    public int windowLength() { return windowLength; }
    public int rowWidth() { return featureWidth + 1; }

    public EntitySequences build(long entityId, int denseIndex, long maxTemporalKey) {
        if (maxTemporalKey <= 0) throw new IllegalArgumentException("maxTemporalKey must be positive: " + maxTemporalKey);
        Window in = window(entityId, Direction.INBOUND, maxTemporalKey);
        Window out = window(entityId, Direction.OUTBOUND, maxTemporalKey);
        return new EntitySequences(entityId, denseIndex, in.matrix, out.matrix, in.original, out.original,
                in.overflow + out.overflow, in.duplicates + out.duplicates, in.corrupt + out.corrupt,
                (in.failed ? 1 : 0) + (out.failed ? 1 : 0));
    }

    private Window window(long entityId, Direction direction, long maxTemporalKey) {
        float[][] matrix = new float[windowLength][featureWidth + 1];
        SpoolContents contents;
        try {
            contents = spools.read(entityId, direction);
        } catch (IOException e) {
            log.warn("Cannot read {} spool of entity {}, treating it as empty: {}", direction.suffix(), entityId, e.toString());
            return new Window(matrix, 0, 0, 0, 0, true);
        }
        List<SpoolEntry> entries = new ArrayList<>(contents.entries());
        entries.sort(TEMPORAL_ORDER);
        int n = entries.size();
        int keep = Math.min(n, windowLength);
        int pad = windowLength - keep;
        int overflow = 0;
        for (int i = 0; i < keep; i++) {
            SpoolEntry e = entries.get(n - keep + i);
            float[] row = matrix[pad + i];
            System.arraycopy(e.features(), 0, row, 0, featureWidth);
            row[featureWidth] = (float) ((double) e.txId() / maxTemporalKey);
            if (e.txId() > maxTemporalKey) overflow++;
        }
        return new Window(matrix, n, overflow, contents.duplicates(), contents.corruptLines(), false);
    }

    private record Window(float[][] matrix, int original, int overflow, long duplicates, long corrupt, boolean failed) {
    }
}
