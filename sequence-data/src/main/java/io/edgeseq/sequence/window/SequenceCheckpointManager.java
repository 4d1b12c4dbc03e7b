package io.edgeseq.sequence.window;

import io.edgeseq.checkpoint.JsonCheckpointStore;
import io.edgeseq.runtime.CommitListener;
import io.edgeseq.sequence.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.OptionalLong;

/**
 * Tracks which entities have a durable artifact, independently of the scan checkpoint.
 * <p>
 * An entity is marked only after its artifact file is in place. {@link #commit} persists the processed set; entities
 * marked since the previous commit are then handed to the {@link FinalizedListener}, which may delete their spools
 * because no later run will read them again.
 */
public class SequenceCheckpointManager implements CommitListener {
    private static final Logger log = LoggerFactory.getLogger(SequenceCheckpointManager.class);

    @FunctionalInterface
    public interface FinalizedListener {
        void finalized(long entityId) throws IOException;
    }

    private final JsonCheckpointStore<SequenceCheckpoint> store;
    private final int windowLength;
    private final int featureWidth;
    private final BitSet processed = new BitSet();
    private final List<Long> pendingFinalized = new ArrayList<>();
    private FinalizedListener finalizedListener;
    private long maxTemporalKey = -1;
    private int lastEntityIndex = -1;

    public SequenceCheckpointManager(Path file, int windowLength, int featureWidth) {
        this.store = new JsonCheckpointStore<>(file, SequenceCheckpoint.class);
        this.windowLength = windowLength;
        this.featureWidth = featureWidth;
    }

    public void onFinalized(FinalizedListener listener) {
        this.finalizedListener = listener;
    }

    /**
     * Restores the processed set and pinned max temporal key. A checkpoint written with another window length or
     * feature width is rejected, since its artifacts would not match the ones this run writes.
     */
    public void load() throws IOException {
        processed.clear();
        pendingFinalized.clear();
        maxTemporalKey = -1;
        lastEntityIndex = -1;
        SequenceCheckpoint cp = store.load().orElse(null);
        if (cp == null) return;
        if (cp.windowLength() != windowLength || cp.featureWidth() != featureWidth) {
            throw new ConfigurationException("Sequence checkpoint " + store.file() + " was written with K="
                    + cp.windowLength() + ", F=" + cp.featureWidth() + " but this run uses K=" + windowLength
                    + ", F=" + featureWidth);
        }
        if (cp.processedEntityIndices() != null) {
            for (int i : cp.processedEntityIndices()) processed.set(i);
        }
        maxTemporalKey = cp.maxTemporalKey();
        lastEntityIndex = cp.lastEntityIndex();
        log.info("Loaded sequence checkpoint: {} entities done, last index {}, max temporal key {}",
                processed.cardinality(), lastEntityIndex, maxTemporalKey);
    }

    public OptionalLong maxTemporalKey() {
        return maxTemporalKey > 0 ? OptionalLong.of(maxTemporalKey) : OptionalLong.empty();
    }

    /** Pins the bound and saves it, so a resumed run normalises with the same value. */
    public void pinMaxTemporalKey(long value) throws IOException {
        if (value <= 0) throw new IllegalArgumentException("maxTemporalKey must be positive: " + value);
        if (maxTemporalKey > 0 && maxTemporalKey != value) {
            throw new IllegalStateException("max temporal key already pinned to " + maxTemporalKey);
        }
        maxTemporalKey = value;
        save();
    }

    public boolean isProcessed(int denseIndex) {
        return processed.get(denseIndex);
    }

    public int processedCount() {
        return processed.cardinality();
    }

    /** Records an entity whose artifact is durable. */
    public void markProcessed(int denseIndex, long entityId) {
        processed.set(denseIndex);
        lastEntityIndex = Math.max(lastEntityIndex, denseIndex);
        pendingFinalized.add(entityId);
    }

    public void save() throws IOException {
        store.save(new SequenceCheckpoint(lastEntityIndex, processed.stream().toArray(), maxTemporalKey,
                windowLength, featureWidth));
    }

    @Override
    public void commit(long lastCompletedSeq) throws IOException {
        save();
        log.debug("Sequence checkpoint saved at entity {} ({} done)", lastCompletedSeq, processed.cardinality());
        if (finalizedListener != null) {
            for (long entityId : pendingFinalized) {
                try {
                    finalizedListener.finalized(entityId);
                } catch (IOException e) {
                    // a leftover spool is never read again once its entity is checkpointed
                    log.warn("Could not release spools of finalized entity {}: {}", entityId, e.toString());
                }
            }
        }
        pendingFinalized.clear();
    }

    public Path file() { return store.file(); }
}
