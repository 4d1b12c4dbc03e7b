package io.edgeseq.source;

import io.edgeseq.core.Record;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class LineChunkSourceTest {
    private Path tmp;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("chunks");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (var s = Files.walk(tmp)) {
            s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    @Test
    void emits_fixed_size_chunks_in_order() throws Exception {
        Path f = tmp.resolve("rows.csv");
        Files.writeString(f, "h\na\nb\nc\nd\ne\nf\ng\n");
        var src = new LineChunkSource(f, 3);
        assertEquals("h", src.header());
        Record<LineChunk> r1 = src.poll().orElseThrow();
        Record<LineChunk> r2 = src.poll().orElseThrow();
        Record<LineChunk> r3 = src.poll().orElseThrow();
        assertEquals(List.of("a", "b", "c"), r1.payload().lines());
        assertEquals(List.of("d", "e", "f"), r2.payload().lines());
        assertEquals(List.of("g"), r3.payload().lines());
        assertEquals(1, r1.seq());
        assertEquals(3, r3.seq());
        assertEquals(4, r2.payload().firstRowOffset());
        assertEquals(7, r3.payload().firstRowOffset());
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
    }

    @Test
    void exact_multiple_finishes_on_next_poll() throws Exception {
        Path f = tmp.resolve("rows.csv");
        Files.writeString(f, "h\na\nb\n");
        var src = new LineChunkSource(f, 2);
        assertEquals(2, src.poll().orElseThrow().payload().size());
        assertFalse(src.isFinished());
        assertTrue(src.poll().isEmpty());
        assertTrue(src.isFinished());
    }

    @Test
    void skip_chunks_keeps_numbering_and_offsets() throws Exception {
        Path f = tmp.resolve("rows.csv");
        Files.writeString(f, "h\n1\n2\n3\n4\n5\n");
        var src = new LineChunkSource(f, 2);
        assertEquals(2, src.skipChunks(2));
        Record<LineChunk> r = src.poll().orElseThrow();
        assertEquals(3, r.seq());
        assertEquals(5, r.payload().firstRowOffset());
        assertEquals(List.of("5"), r.payload().lines());
    }

    @Test
    void skipping_past_the_end_reports_actual_count() throws Exception {
        Path f = tmp.resolve("rows.csv");
        Files.writeString(f, "h\n1\n2\n3\n");
        var src = new LineChunkSource(f, 2);
        assertEquals(2, src.skipChunks(10));
        assertTrue(src.isFinished());
        assertTrue(src.poll().isEmpty());
    }

    @Test
    void reads_gzip_streams() throws Exception {
        Path f = tmp.resolve("rows.csv.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(f))) {
            out.write("h\nx\ny\n".getBytes(StandardCharsets.UTF_8));
        }
        var src = new LineChunkSource(f, 10);
        assertEquals(List.of("x", "y"), src.poll().orElseThrow().payload().lines());
    }

    @Test
    void missing_or_empty_stream_fails_at_construction() throws Exception {
        assertThrows(IOException.class, () -> new LineChunkSource(tmp.resolve("nope.csv"), 10));
        Path empty = tmp.resolve("empty.csv");
        Files.writeString(empty, "");
        assertThrows(IOException.class, () -> new LineChunkSource(empty, 10));
    }
}
