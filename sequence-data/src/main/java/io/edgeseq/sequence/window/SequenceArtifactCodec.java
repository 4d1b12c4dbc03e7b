package io.edgeseq.sequence.window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Binary layout of {@code seq_<denseIndex>.bin}, big-endian:
 * <pre>
 *   magic "ESEQ" | version u16 | K i32 | width i32 | entityId i64 | denseIndex i32 | label i8 | nIn i32 | nOut i32
 *   inFlow  K*width f32, row-major
 *   outFlow K*width f32, row-major
 * </pre>
 * Files are written to a temp name and renamed into place.
 */
public class SequenceArtifactCodec {
    private static final Logger log = LoggerFactory.getLogger(SequenceArtifactCodec.class);

    static final int MAGIC = 0x45534551; // "ESEQ"
    static final short VERSION = 1;
    private static final int HEADER_BYTES = 4 + 2 + 4 + 4 + 8 + 4 + 1 + 4 + 4;

    private final Path dir;
    private final int windowLength;
    private final int rowWidth;
    private final boolean fsync;

    public SequenceArtifactCodec(Path dir, int windowLength, int rowWidth, boolean fsync) {
        this.dir = dir;
        this.windowLength = windowLength;
        this.rowWidth = rowWidth;
        this.fsync = fsync;
    }

    public Path dir() { return dir; }

    public Path fileFor(int denseIndex) {
        return dir.resolve(String.format("seq_%08d.bin", denseIndex));
    }

    public Path write(SequenceArtifact artifact) throws IOException {
        checkShape(artifact.inFlow(), "inFlow");
        checkShape(artifact.outFlow(), "outFlow");
        ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + 2 * windowLength * rowWidth * Float.BYTES)
                .order(ByteOrder.BIG_ENDIAN);
        buf.putInt(MAGIC)
                .putShort(VERSION)
                .putInt(windowLength)
                .putInt(rowWidth)
                .putLong(artifact.entityId())
                .putInt(artifact.denseIndex())
                .put((byte) artifact.label())
                .putInt(artifact.nInOriginal())
                .putInt(artifact.nOutOriginal());
        putMatrix(buf, artifact.inFlow());
        putMatrix(buf, artifact.outFlow());
        buf.flip();

        Files.createDirectories(dir);
        Path target = fileFor(artifact.denseIndex());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buf.hasRemaining()) ch.write(buf);
            if (fsync) ch.force(true);
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.trace("Wrote {}", target);
        return target;
    }

    private void checkShape(float[][] m, String name) {
        if (m.length != windowLength) {
            throw new IllegalArgumentException(name + " has " + m.length + " rows, expected " + windowLength);
        }
        for (float[] row : m) {
            if (row.length != rowWidth) {
                throw new IllegalArgumentException(name + " row has width " + row.length + ", expected " + rowWidth);
            }
        }
    }

    private static void putMatrix(ByteBuffer buf, float[][] m) {
        for (float[] row : m) {
            for (float v : row) buf.putFloat(v);
        }
    }

    /** Reads an artifact written by any codec instance; the shape comes from the file header. */
    public static SequenceArtifact read(Path file) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(Files.readAllBytes(file)).order(ByteOrder.BIG_ENDIAN);
        if (buf.remaining() < HEADER_BYTES || buf.getInt() != MAGIC) {
            throw new IOException(file + " is not a sequence artifact");
        }
        short version = buf.getShort();
        if (version != VERSION) throw new IOException(file + " has unsupported format version " + version);
        int k = buf.getInt();
        int width = buf.getInt();
        long entityId = buf.getLong();
        int denseIndex = buf.getInt();
        int label = buf.get();
        int nIn = buf.getInt();
        int nOut = buf.getInt();
        long expected = 2L * k * width * Float.BYTES;
        if (k < 0 || width < 0 || buf.remaining() != expected) {
            throw new IOException(file + " is truncated: " + buf.remaining() + " payload bytes, expected " + expected);
        }
        return new SequenceArtifact(entityId, denseIndex, label, nIn, nOut, getMatrix(buf, k, width), getMatrix(buf, k, width));
    }

    private static float[][] getMatrix(ByteBuffer buf, int rows, int width) {
        float[][] m = new float[rows][width];
        for (float[] row : m) {
            for (int j = 0; j < width; j++) row[j] = buf.getFloat();
        }
        return m;
    }
}
