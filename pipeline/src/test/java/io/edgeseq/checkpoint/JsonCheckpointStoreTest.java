package io.edgeseq.checkpoint;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonCheckpointStoreTest {
    public record Progress(long last, long total) {}

    private Path tmp;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("ckpt");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (var s = Files.walk(tmp)) {
            s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    @Test
    void absentCheckpointLoadsEmpty() throws Exception {
        var store = new JsonCheckpointStore<>(tmp.resolve("scan.json"), Progress.class);
        assertTrue(store.load().isEmpty());
        assertFalse(store.exists());
    }

    @Test
    void saveReplacesPreviousValue() throws Exception {
        var store = new JsonCheckpointStore<>(tmp.resolve("nested/scan.json"), Progress.class);
        store.save(new Progress(1, 10));
        store.save(new Progress(2, 25));
        assertEquals(new Progress(2, 25), store.load().orElseThrow());
        assertFalse(Files.exists(tmp.resolve("nested/scan.json.tmp")));
    }

    @Test
    void staleTempFileDoesNotShadowCheckpoint() throws Exception {
        Path file = tmp.resolve("scan.json");
        var store = new JsonCheckpointStore<>(file, Progress.class);
        store.save(new Progress(3, 30));
        // simulates a crash halfway through the next save
        Files.writeString(tmp.resolve("scan.json.tmp"), "{\"last\":4,\"tot");
        assertEquals(new Progress(3, 30), store.load().orElseThrow());
        store.save(new Progress(4, 40));
        assertEquals(new Progress(4, 40), store.load().orElseThrow());
    }

    @Test
    void corruptCheckpointIsFatal() throws Exception {
        Path file = tmp.resolve("scan.json");
        Files.writeString(file, "not json at all");
        var store = new JsonCheckpointStore<>(file, Progress.class);
        CheckpointCorruptedException e = assertThrows(CheckpointCorruptedException.class, store::load);
        assertEquals(file, e.file());
    }
}
