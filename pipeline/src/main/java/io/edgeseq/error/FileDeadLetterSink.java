package io.edgeseq.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends one JSON object per failure to a JSONL file. Only the first {@code maxEntries} failures are
 * written; the rest are counted so a badly broken input cannot fill the disk with dead letters.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final long maxEntries;
    private final BufferedWriter writer;
    private long offered;

    public FileDeadLetterSink(Path file, long maxEntries) throws IOException {
        this.file = file;
        this.maxEntries = Math.max(0, maxEntries);
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    @Override
    public synchronized void acceptFailure(String stage, long position, String reason, String detail) {
        offered++;
        if (offered > maxEntries) {
            if (offered == maxEntries + 1) {
                log.warn("Dead letter cap of {} reached for {}; further failures are only counted", maxEntries, file);
            }
            return;
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("stage", stage);
        node.put("position", position);
        node.put("reason", reason);
        if (detail != null) node.put("detail", detail);
        try {
            writer.write(MAPPER.writeValueAsString(node));
            writer.newLine();
        } catch (IOException e) {
            // the dead letter file is an audit aid; the failure itself is already counted
            log.warn("Could not write dead letter to {}: {}", file, e.toString());
        }
    }

    @Override
    public synchronized long failureCount() {
        return offered;
    }

    public Path file() { return file; }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }

    /** Flushes buffered entries, typically at a checkpoint. */
    public synchronized void flush() throws IOException {
        writer.flush();
    }
}
