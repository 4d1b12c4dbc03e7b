package io.edgeseq.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores a single checkpoint value as JSON and replaces it atomically.
 * <p>
 * {@link #save} writes {@code <file>.tmp}, forces it to disk and renames it over the target,
 * so a reader sees either the previous checkpoint or the new one, never a torn file.
 */
public class JsonCheckpointStore<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonCheckpointStore.class);

    private final Path file;
    private final Path tmp;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonCheckpointStore(Path file, Class<T> type) {
        this(file, type, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public JsonCheckpointStore(Path file, Class<T> type, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.tmp = file.resolveSibling(file.getFileName() + ".tmp");
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path file() { return file; }

    public boolean exists() { return Files.exists(file); }

    public Optional<T> load() throws IOException {
        if (!Files.exists(file)) return Optional.empty();
        byte[] bytes = Files.readAllBytes(file);
        try {
            T value = mapper.readValue(bytes, type);
            if (value == null) throw new CheckpointCorruptedException(file, null);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptedException(file, e);
        }
    }

    public void save(T value) throws IOException {
        Objects.requireNonNull(value, "value");
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            java.nio.ByteBuffer buf = java.nio.ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true);
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Checkpoint written to {} ({} bytes)", file, bytes.length);
    }

    public void delete() throws IOException {
        Files.deleteIfExists(tmp);
        Files.deleteIfExists(file);
    }
}
