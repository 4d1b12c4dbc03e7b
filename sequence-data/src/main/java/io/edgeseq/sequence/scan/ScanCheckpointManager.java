package io.edgeseq.sequence.scan;

import io.edgeseq.checkpoint.JsonCheckpointStore;
import io.edgeseq.runtime.CommitListener;
import io.edgeseq.sequence.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Owns the scan checkpoint. Chunk tallies are folded in as chunks reach the spools; {@link #save} persists the
 * running state. The pipeline calls {@link #commit} every F chunks, always after the spool writes for those chunks
 * have returned.
 */
public class ScanCheckpointManager implements CommitListener {
    private static final Logger log = LoggerFactory.getLogger(ScanCheckpointManager.class);

    private final JsonCheckpointStore<ScanCheckpoint> store;
    private ScanCheckpoint current;

    public ScanCheckpointManager(Path file) {
        this.store = new JsonCheckpointStore<>(file, ScanCheckpoint.class);
    }

    /**
     * Loads the durable checkpoint for this stream and chunk size, or the zero state when there is none.
     * A checkpoint written for another stream or chunk size is rejected: its chunk indices would not line up.
     */
    public ScanCheckpoint load(Path stream, int chunkSize) throws IOException {
        String streamPath = stream.toAbsolutePath().normalize().toString();
        ScanCheckpoint loaded = store.load().orElse(null);
        if (loaded == null) {
            current = ScanCheckpoint.initial(streamPath, chunkSize);
            return current;
        }
        if (loaded.chunkSize() != chunkSize) {
            throw new ConfigurationException("Scan checkpoint " + store.file() + " was written with chunk size "
                    + loaded.chunkSize() + ", configured chunk size is " + chunkSize);
        }
        if (loaded.streamPath() != null && !loaded.streamPath().equals(streamPath)) {
            throw new ConfigurationException("Scan checkpoint " + store.file() + " belongs to stream "
                    + loaded.streamPath() + ", not " + streamPath);
        }
        current = loaded;
        log.info("Loaded scan checkpoint: chunk {}, {} records routed, {} rows read, {} skipped{}",
                loaded.lastChunkIndex(), loaded.totalRecordsRouted(), loaded.rowsRead(), loaded.rowsSkipped(),
                loaded.completed() ? " (completed)" : "");
        return current;
    }

    public ScanCheckpoint current() {
        if (current == null) throw new IllegalStateException("load() has not been called");
        return current;
    }

    /** Folds in a chunk whose spool appends are durable. */
    public void recordChunk(RoutedChunk chunk) {
        ScanCheckpoint c = current();
        if (chunk.chunkNumber() != c.lastChunkIndex() + 1) {
            throw new IllegalStateException("Chunk " + chunk.chunkNumber() + " recorded after chunk " + c.lastChunkIndex());
        }
        current = c.plus(chunk);
    }

    /** Persists the running state, which must cover exactly the chunks up to {@code chunkIndex}. */
    public void save(long chunkIndex) throws IOException {
        ScanCheckpoint c = current();
        if (c.lastChunkIndex() != chunkIndex) {
            throw new IllegalStateException("Checkpoint for chunk " + chunkIndex + " requested but state covers chunk " + c.lastChunkIndex());
        }
        store.save(c);
        log.debug("Scan checkpoint saved at chunk {}", chunkIndex);
    }

    @Override
    public void commit(long lastCompletedSeq) throws IOException {
        save(lastCompletedSeq);
    }

    public void markCompleted() throws IOException {
        current = current().asCompleted();
        store.save(current);
        log.info("Scan completed at chunk {}", current.lastChunkIndex());
    }

    public Path file() { return store.file(); }
}
