package io.edgeseq.sequence.spool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PrimitiveIterator;
import java.util.Set;
import java.util.stream.LongStream;

/**
 * Durable, append-only record logs, one per (entity, direction).
 * <p>
 * Layout: {@code <root>/<shard>/e<entityId>_<in|out>.csv} where shard is {@code floorMod(entityId, 256)} in hex.
 * Every file starts with the header {@code offset,txId,feat_1..feat_F}. Appends for one chunk are grouped per
 * spool, written with a single open per spool and forced to disk before {@link #appendAll} returns, so a
 * checkpoint written afterwards never claims data that is not on disk.
 * <p>
 * Appends are at-least-once: a chunk replayed after a crash is appended again, and {@link #read} drops entries
 * whose offset it has already seen.
 */
public class SpoolStore {
    private static final Logger log = LoggerFactory.getLogger(SpoolStore.class);
    private static final int SHARDS = 256;

    private final Path root;
    private final int featureWidth;
    private final boolean fsync;
    private final byte[] headerBytes;
    private final String header;

    public SpoolStore(Path root, int featureWidth, boolean fsync) {
        if (featureWidth < 1) throw new IllegalArgumentException("featureWidth must be positive: " + featureWidth);
        this.root = root;
        this.featureWidth = featureWidth;
        this.fsync = fsync;
        StringBuilder h = new StringBuilder("offset,txId");
        for (int i = 1; i <= featureWidth; i++) h.append(",feat_").append(i);
        this.header = h.toString();
        this.headerBytes = (header + "\n").getBytes(StandardCharsets.UTF_8);
    }

    public Path root() { return root; }
    public int featureWidth() { return featureWidth; }
    public String header() { return header; }

    public Path pathFor(long entityId, Direction direction) {
        String shard = String.format("%02x", Math.floorMod(entityId, SHARDS));
        return root.resolve(shard).resolve("e" + entityId + "_" + direction.suffix() + ".csv");
    }

    /**
     * Pre-creates an empty, headered spool pair for every entity. Existing spools are left untouched, so this is
     * safe to repeat after a crash during initialization. Afterwards a missing spool means "never written".
     */
    public void initialize(LongStream entityIds) throws IOException {
        for (int s = 0; s < SHARDS; s++) {
            Files.createDirectories(root.resolve(String.format("%02x", s)));
        }
        long created = 0, entities = 0;
        PrimitiveIterator.OfLong it = entityIds.iterator();
        while (it.hasNext()) {
            long id = it.nextLong();
            for (Direction d : Direction.values()) {
                if (createIfAbsent(pathFor(id, d))) created++;
            }
            entities++;
            if (entities % 100_000 == 0) log.info("Initialized spools for {} entities", entities);
        }
        log.info("Spool store {} initialized: {} entities, {} new spool files", root, entities, created);
    }

    private boolean createIfAbsent(Path file) throws IOException {
        try {
            Files.write(file, headerBytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    public void append(long entityId, Direction direction, SpoolEntry entry) throws IOException {
        appendAll(List.of(new SpoolAppend(entityId, direction, entry)));
    }

    /**
     * Appends a batch, typically all entries routed from one chunk, and makes it durable.
     * Returns the number of spool files touched.
     */
    public int appendAll(List<SpoolAppend> appends) throws IOException {
        if (appends.isEmpty()) return 0;
        Map<Path, StringBuilder> grouped = new LinkedHashMap<>();
        for (SpoolAppend a : appends) {
            if (a.entry().features().length != featureWidth) {
                throw new IllegalArgumentException("Entry at offset " + a.entry().offset() + " has "
                        + a.entry().features().length + " features, expected " + featureWidth);
            }
            StringBuilder sb = grouped.computeIfAbsent(pathFor(a.entityId(), a.direction()), p -> new StringBuilder());
            formatLine(sb, a.entry());
        }
        for (Map.Entry<Path, StringBuilder> e : grouped.entrySet()) {
            writeSpool(e.getKey(), e.getValue().toString().getBytes(StandardCharsets.UTF_8));
        }
        return grouped.size();
    }

    private void writeSpool(Path file, byte[] bytes) throws IOException {
        try (FileChannel ch = openForAppend(file)) {
            long pos = ch.size();
            if (pos > 0) {
                ByteBuffer last = ByteBuffer.allocate(1);
                ch.read(last, pos - 1);
                if (last.get(0) != '\n') {
                    // tail torn by a crash mid-append: drop the partial line, the replayed chunk rewrites it
                    long end = lastLineEnd(ch, pos);
                    log.warn("Spool {} had a torn tail of {} byte(s), truncating it before appending", file, pos - end);
                    ch.truncate(end);
                    pos = end;
                }
            }
            if (pos == 0) {
                pos += writeFully(ch, ByteBuffer.wrap(headerBytes), pos);
            }
            writeFully(ch, ByteBuffer.wrap(bytes), pos);
            if (fsync) ch.force(false);
        }
    }

    private static FileChannel openForAppend(Path file) throws IOException {
        try {
            return FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE, StandardOpenOption.CREATE);
        } catch (NoSuchFileException e) {
            Files.createDirectories(file.getParent());
            return FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE, StandardOpenOption.CREATE);
        }
    }

    /** Position just past the last newline before {@code size}, or 0 when there is none. */
    private static long lastLineEnd(FileChannel ch, long size) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(4096);
        long end = size;
        while (end > 0) {
            long start = Math.max(0, end - buf.capacity());
            buf.clear();
            buf.limit((int) (end - start));
            while (buf.hasRemaining()) {
                if (ch.read(buf, start + buf.position()) < 0) break;
            }
            for (int i = buf.position() - 1; i >= 0; i--) {
                if (buf.get(i) == '\n') return start + i + 1;
            }
            end = start;
        }
        return 0;
    }

    private static int writeFully(FileChannel ch, ByteBuffer buf, long position) throws IOException {
        int written = 0;
        while (buf.hasRemaining()) {
            written += ch.write(buf, position + written);
        }
        return written;
    }

    private static void formatLine(StringBuilder sb, SpoolEntry entry) {
        sb.append(entry.offset()).append(',').append(entry.txId());
        for (float f : entry.features()) sb.append(',').append(f);
        sb.append('\n');
    }

    /**
     * Reads every distinct entry of a spool in arrival order. Unparseable lines are skipped and counted;
     * an I/O failure is thrown to the caller.
     */
    public SpoolContents read(long entityId, Direction direction) throws IOException {
        Path file = pathFor(entityId, direction);
        if (!Files.exists(file)) return SpoolContents.absent();
        List<SpoolEntry> entries = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        long duplicates = 0, corrupt = 0;
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String first = br.readLine();
            if (first == null) return new SpoolContents(List.of(), 0, 0, true);
            // a header torn during initialization is a prefix of the expected one
            if (!first.equals(header) && !(first.length() > 0 && header.startsWith(first))) {
                throw new IOException("Spool " + file + " has unexpected header (feature width changed?): "
                        + abbreviate(first));
            }
            String line;
            while ((line = br.readLine()) != null) {
                SpoolEntry entry = parseLine(line);
                if (entry == null) {
                    corrupt++;
                    continue;
                }
                if (!seen.add(entry.offset())) {
                    duplicates++;
                    continue;
                }
                entries.add(entry);
            }
        }
        if (corrupt > 0) log.warn("Spool {} contains {} unparseable line(s)", file, corrupt);
        return new SpoolContents(entries, duplicates, corrupt, true);
    }

    private SpoolEntry parseLine(String line) {
        String[] parts = line.split(",", -1);
        if (parts.length != featureWidth + 2) return null;
        try {
            long offset = Long.parseLong(parts[0]);
            long txId = Long.parseLong(parts[1]);
            float[] features = new float[featureWidth];
            for (int i = 0; i < featureWidth; i++) {
                features[i] = Float.parseFloat(parts[i + 2]);
            }
            return new SpoolEntry(offset, txId, features);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Deletes both spools of an entity. */
    public void delete(long entityId) throws IOException {
        for (Direction d : Direction.values()) {
            Files.deleteIfExists(pathFor(entityId, d));
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }
}
