package io.edgeseq.sequence.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.LongStream;

/**
 * Immutable mapping from raw entity id to dense index and binary label, produced upstream.
 * <p>
 * File format: CSV with header {@code entityId,denseIndex,label}. Dense indices must cover {@code 0..n-1}
 * exactly once. Labels are {@code 0}, {@code 1}, {@code licit}, {@code suspicious}, {@code illicit}, or empty.
 */
public final class EntityIndex {
    private static final Logger log = LoggerFactory.getLogger(EntityIndex.class);

    private final long[] entityIds;
    private final byte[] labels;
    private final Map<Long, Integer> denseByEntity;
    private final int missingLabels;

    private EntityIndex(long[] entityIds, byte[] labels) {
        this.entityIds = entityIds;
        this.labels = labels;
        this.denseByEntity = new HashMap<>(Math.max(16, entityIds.length * 4 / 3 + 1));
        int missing = 0;
        for (int i = 0; i < entityIds.length; i++) {
            Integer prev = denseByEntity.put(entityIds[i], i);
            if (prev != null) {
                throw new IndexLoadException("Entity " + entityIds[i] + " appears at dense indices " + prev + " and " + i);
            }
            if (labels[i] == IndexEntry.MISSING_LABEL) missing++;
        }
        this.missingLabels = missing;
    }

    /** Builds an index from entries whose dense indices form {@code 0..n-1} in any order. */
    public static EntityIndex of(List<IndexEntry> entries) {
        long[] ids = new long[entries.size()];
        byte[] labels = new byte[entries.size()];
        boolean[] seen = new boolean[entries.size()];
        for (IndexEntry e : entries) {
            int idx = e.denseIndex();
            if (idx < 0 || idx >= entries.size()) {
                throw new IndexLoadException("Dense index " + idx + " of entity " + e.entityId() + " is outside 0.." + (entries.size() - 1));
            }
            if (seen[idx]) throw new IndexLoadException("Dense index " + idx + " is assigned twice");
            seen[idx] = true;
            ids[idx] = e.entityId();
            labels[idx] = (byte) e.label();
        }
        return new EntityIndex(ids, labels);
    }

    public static EntityIndex load(Path file) {
        List<IndexEntry> entries = new java.util.ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = br.readLine();
            if (header == null) throw new IndexLoadException("Entity index " + file + " is empty");
            int[] cols = resolveColumns(header, file);
            String line;
            long lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                String[] parts = line.split(",", -1);
                if (parts.length <= Math.max(cols[0], Math.max(cols[1], cols[2]))) {
                    throw new IndexLoadException(file + ":" + lineNo + ": expected at least " + (Math.max(cols[0], Math.max(cols[1], cols[2])) + 1) + " columns");
                }
                try {
                    long entityId = Long.parseLong(parts[cols[0]].trim());
                    int dense = Integer.parseInt(parts[cols[1]].trim());
                    int label = parseLabel(parts[cols[2]]);
                    entries.add(new IndexEntry(entityId, dense, label));
                } catch (IllegalArgumentException e) {
                    throw new IndexLoadException(file + ":" + lineNo + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new IndexLoadException("Cannot read entity index " + file, e);
        }
        EntityIndex index = of(entries);
        log.info("Loaded entity index {}: {} entities, {} without label", file, index.size(), index.missingLabels);
        return index;
    }

    private static int[] resolveColumns(String header, Path file) {
        String[] names = header.split(",", -1);
        int entity = -1, dense = -1, label = -1;
        for (int i = 0; i < names.length; i++) {
            String n = names[i].trim().replace("\"", "");
            switch (n) {
                case "entityId", "clId" -> entity = i;
                case "denseIndex", "idx" -> dense = i;
                case "label" -> label = i;
                default -> { }
            }
        }
        if (entity < 0 || dense < 0 || label < 0) {
            throw new IndexLoadException("Entity index " + file + " header must contain entityId, denseIndex and label: " + header);
        }
        return new int[]{entity, dense, label};
    }

    static int parseLabel(String raw) {
        String v = raw.trim().replace("\"", "").toLowerCase(Locale.ROOT);
        return switch (v) {
            case "" -> IndexEntry.MISSING_LABEL;
            case "0", "licit" -> 0;
            case "1", "suspicious", "illicit", "ilicit" -> 1;
            default -> throw new IllegalArgumentException("unknown label '" + raw + "'");
        };
    }

    public int size() { return entityIds.length; }

    public boolean contains(long entityId) { return denseByEntity.containsKey(entityId); }

    public OptionalInt denseIndex(long entityId) {
        Integer i = denseByEntity.get(entityId);
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    public IndexEntry entry(int denseIndex) {
        return new IndexEntry(entityIds[denseIndex], denseIndex, labels[denseIndex]);
    }

    public long entityId(int denseIndex) { return entityIds[denseIndex]; }

    /** Label of the entity, empty when the index has no label for it or the entity is unknown. */
    public OptionalInt label(long entityId) {
        Integer i = denseByEntity.get(entityId);
        if (i == null || labels[i] == IndexEntry.MISSING_LABEL) return OptionalInt.empty();
        return OptionalInt.of(labels[i]);
    }

    public int missingLabelCount() { return missingLabels; }

    /** Entity ids in dense index order. */
    public LongStream entityIds() { return Arrays.stream(entityIds); }
}
