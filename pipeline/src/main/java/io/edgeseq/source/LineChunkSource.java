package io.edgeseq.source;

import io.edgeseq.core.Record;
import io.edgeseq.core.Source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Streams a text file as fixed-size chunks of lines so the whole file is never loaded.
 * The first line is the header and is not part of any chunk. Files ending in {@code .gz} are decompressed.
 * Deterministic order: chunk N always holds data rows {@code (N-1)*chunkSize+1 .. N*chunkSize}.
 */
public class LineChunkSource implements Source<LineChunk> {
    private final Path file;
    private final int chunkSize;
    private final BufferedReader reader;
    private final String header;
    private long nextChunk = 1;
    private long nextRow = 1;
    private boolean finished;

    public LineChunkSource(Path file, int chunkSize) throws IOException {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        this.file = file;
        this.chunkSize = chunkSize;
        this.reader = open(file);
        try {
            this.header = reader.readLine();
        } catch (IOException e) {
            reader.close();
            throw e;
        }
        if (header == null) {
            reader.close();
            throw new IOException("Stream " + file + " is empty; a header line is required");
        }
    }

    private static BufferedReader open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        try {
            if (file.getFileName().toString().endsWith(".gz")) {
                in = new GZIPInputStream(in, 1 << 16);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 1 << 20);
    }

    public String header() { return header; }
    public Path file() { return file; }
    public int chunkSize() { return chunkSize; }

    /**
     * Skips {@code n} whole chunks without keeping their lines. Returns how many were actually skipped,
     * which is less than {@code n} only when the stream ends first.
     */
    public long skipChunks(long n) throws IOException {
        long skipped = 0;
        while (skipped < n && !finished) {
            int lines = 0;
            while (lines < chunkSize && reader.readLine() != null) lines++;
            if (lines == 0) {
                markFinished();
                break;
            }
            nextRow += lines;
            nextChunk++;
            skipped++;
            if (lines < chunkSize) markFinished();
        }
        return skipped;
    }

    @Override
    public Optional<Record<LineChunk>> poll() throws IOException {
        if (finished) return Optional.empty();
        List<String> lines = new ArrayList<>(chunkSize);
        String line;
        while (lines.size() < chunkSize && (line = reader.readLine()) != null) {
            lines.add(line);
        }
        if (lines.isEmpty()) {
            markFinished();
            return Optional.empty();
        }
        LineChunk chunk = new LineChunk(nextChunk, nextRow, lines);
        nextChunk++;
        nextRow += lines.size();
        if (lines.size() < chunkSize) markFinished();
        return Optional.of(Record.of(chunk.chunkNumber(), chunk));
    }

    private void markFinished() throws IOException {
        finished = true;
        reader.close();
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        reader.close();
    }
}
