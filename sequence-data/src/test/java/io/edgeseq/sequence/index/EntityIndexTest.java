package io.edgeseq.sequence.index;

import io.edgeseq.sequence.EdgeStreams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EntityIndexTest {
    private Path tmp;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("index");
    }

    @AfterEach
    void cleanup() throws IOException {
        EdgeStreams.deleteRecursively(tmp);
    }

    @Test
    void loads_ids_dense_indices_and_labels() throws Exception {
        EntityIndex index = EntityIndex.load(EdgeStreams.index(tmp.resolve("idx.csv"),
                "500,2,illicit", "100,0,licit", "300,1,", "", "700,3,1"));
        assertEquals(4, index.size());
        assertArrayEquals(new long[]{100, 300, 500, 700}, index.entityIds().toArray());
        assertEquals(2, index.denseIndex(500).getAsInt());
        assertTrue(index.denseIndex(999).isEmpty());
        assertFalse(index.contains(999));
        assertEquals(1, index.label(500).getAsInt());
        assertEquals(0, index.label(100).getAsInt());
        assertTrue(index.label(300).isEmpty());
        assertFalse(index.entry(1).hasLabel());
        assertEquals(1, index.missingLabelCount());
    }

    @Test
    void column_order_follows_the_header() throws Exception {
        Path f = tmp.resolve("idx.csv");
        Files.writeString(f, "label,idx,clId\nsuspicious,0,42\n");
        EntityIndex index = EntityIndex.load(f);
        assertEquals(42, index.entityId(0));
        assertEquals(1, index.label(42).getAsInt());
    }

    @Test
    void broken_indexes_are_fatal() throws Exception {
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(tmp.resolve("missing.csv")));
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(EdgeStreams.index(tmp.resolve("dup.csv"), "1,0,0", "2,0,1")));
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(EdgeStreams.index(tmp.resolve("gap.csv"), "1,0,0", "2,2,1")));
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(EdgeStreams.index(tmp.resolve("same.csv"), "1,0,0", "1,1,1")));
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(EdgeStreams.index(tmp.resolve("label.csv"), "1,0,maybe")));
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(EdgeStreams.index(tmp.resolve("id.csv"), "x,0,0")));
        Path noHeader = tmp.resolve("cols.csv");
        Files.writeString(noHeader, "id,index\n1,0\n");
        assertThrows(IndexLoadException.class, () -> EntityIndex.load(noHeader));
    }
}
