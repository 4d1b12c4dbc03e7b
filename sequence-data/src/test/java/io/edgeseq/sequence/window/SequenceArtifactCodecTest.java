package io.edgeseq.sequence.window;

import io.edgeseq.sequence.EdgeStreams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SequenceArtifactCodecTest {
    private Path tmp;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("artifacts");
    }

    @AfterEach
    void cleanup() throws IOException {
        EdgeStreams.deleteRecursively(tmp);
    }

    private static float[][] matrix(int k, int w, float base) {
        float[][] m = new float[k][w];
        for (int i = 0; i < k; i++) for (int j = 0; j < w; j++) m[i][j] = base + i * w + j;
        return m;
    }

    @Test
    void writes_the_documented_layout_atomically() throws Exception {
        SequenceArtifactCodec codec = new SequenceArtifactCodec(tmp.resolve("seq"), 2, 3, true);
        SequenceArtifact a = new SequenceArtifact(-42L, 17, 1, 5, 0, matrix(2, 3, 1f), new float[2][3]);
        Path file = codec.write(a);

        assertEquals("seq_00000017.bin", file.getFileName().toString());
        assertEquals(35 + 2 * 2 * 3 * 4, Files.size(file));
        assertFalse(Files.exists(file.resolveSibling("seq_00000017.bin.tmp")));
        byte[] head = Arrays.copyOf(Files.readAllBytes(file), 4);
        assertArrayEquals("ESEQ".getBytes(java.nio.charset.StandardCharsets.US_ASCII), head);

        SequenceArtifact back = SequenceArtifactCodec.read(file);
        assertEquals(-42L, back.entityId());
        assertEquals(17, back.denseIndex());
        assertEquals(1, back.label());
        assertEquals(5, back.nInOriginal());
        assertEquals(0, back.nOutOriginal());
        assertArrayEquals(a.inFlow(), back.inFlow());
        assertArrayEquals(a.outFlow(), back.outFlow());
    }

    @Test
    void rejects_matrices_of_the_wrong_shape() {
        SequenceArtifactCodec codec = new SequenceArtifactCodec(tmp, 2, 3, false);
        assertThrows(IllegalArgumentException.class,
                () -> codec.write(new SequenceArtifact(1, 0, 0, 0, 0, new float[3][3], new float[2][3])));
        assertThrows(IllegalArgumentException.class,
                () -> codec.write(new SequenceArtifact(1, 0, 0, 0, 0, new float[2][3], new float[2][4])));
    }

    @Test
    void truncated_or_foreign_files_are_rejected() throws Exception {
        SequenceArtifactCodec codec = new SequenceArtifactCodec(tmp, 2, 3, false);
        Path file = codec.write(new SequenceArtifact(1, 0, 0, 0, 0, new float[2][3], new float[2][3]));
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length - 4));
        assertThrows(IOException.class, () -> SequenceArtifactCodec.read(file));

        Path other = tmp.resolve("other.bin");
        Files.writeString(other, "definitely not a sequence artifact file");
        assertThrows(IOException.class, () -> SequenceArtifactCodec.read(other));
    }
}
