package io.edgeseq.sequence;

import com.codahale.metrics.MetricRegistry;
import io.edgeseq.retry.RetryPolicy;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.scan.ScanCheckpointManager;
import io.edgeseq.sequence.spool.Direction;
import io.edgeseq.sequence.spool.SpoolAppend;
import io.edgeseq.sequence.spool.SpoolContents;
import io.edgeseq.sequence.spool.SpoolStore;
import io.edgeseq.sequence.window.SequenceArtifact;
import io.edgeseq.sequence.window.SequenceArtifactCodec;
import io.edgeseq.sequence.window.SequenceCheckpointManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static io.edgeseq.sequence.EdgeStreams.header;
import static io.edgeseq.sequence.EdgeStreams.row;
import static org.junit.jupiter.api.Assertions.*;

public class EdgeSequenceJobTest {
    private static final int F = 2;

    private Path tmp;
    private Path stream;
    private Path indexFile;
    private EntityIndex index;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("job");
        List<String> rows = new ArrayList<>();
        // entities 1..4 are indexed; 9 is not
        long tx = 1;
        for (int i = 0; i < 6; i++) {
            rows.add(row(1, 2, tx * 10, F));
            rows.add(row(3, 1, tx * 10 + 3, F));
            rows.add(row(9, 3, tx * 10 + 5, F));
            rows.add(row(2, 9, tx * 10 + 1, F));
            tx++;
        }
        rows.add(3, "broken,row");
        rows.add(row(2, 2, 15, F));
        stream = EdgeStreams.write(tmp.resolve("edges.csv"), header(F), rows);
        indexFile = EdgeStreams.index(tmp.resolve("index.csv"), "1,0,1", "2,1,0", "3,2,", "4,3,licit");
        index = EntityIndex.load(indexFile);
    }

    @AfterEach
    void cleanup() throws IOException {
        EdgeStreams.deleteRecursively(tmp);
    }

    private SequenceConfig.Builder config(String workDir) {
        return SequenceConfig.builder()
                .streamPath(stream)
                .indexPath(indexFile)
                .workDir(tmp.resolve(workDir))
                .chunkSize(4)
                .windowLength(3)
                .featureWidth(F)
                .scanCheckpointEvery(2)
                .sequenceCheckpointEvery(2)
                .fixedMaxTemporalKey(100)
                .fsync(false);
    }

    private EdgeSequenceJob job(SequenceConfig cfg, SpoolStore spools) {
        return new EdgeSequenceJob(cfg, index, spools,
                new ScanCheckpointManager(cfg.scanCheckpointFile()),
                new SequenceCheckpointManager(cfg.sequenceCheckpointFile(), cfg.windowLength(), cfg.featureWidth()),
                new MetricRegistry(), RetryPolicy.none());
    }

    private static Map<String, byte[]> artifacts(SequenceConfig cfg) throws IOException {
        Map<String, byte[]> out = new TreeMap<>();
        try (Stream<Path> s = Files.list(cfg.sequenceDir())) {
            for (Path p : (Iterable<Path>) s::iterator) out.put(p.getFileName().toString(), Files.readAllBytes(p));
        }
        return out;
    }

    private static void assertSameArtifacts(Map<String, byte[]> expected, Map<String, byte[]> actual) {
        assertEquals(expected.keySet(), actual.keySet());
        for (String name : expected.keySet()) {
            assertArrayEquals(expected.get(name), actual.get(name), name);
        }
    }

    /** Spool store that dies right after the Nth chunk reached disk, before any checkpoint could cover it. */
    static class CrashingSpoolStore extends SpoolStore {
        private final int crashAfter;
        private int calls;

        CrashingSpoolStore(SequenceConfig cfg, int crashAfter) {
            super(cfg.spoolDir(), cfg.featureWidth(), cfg.fsync());
            this.crashAfter = crashAfter;
        }

        @Override
        public int appendAll(List<SpoolAppend> appends) throws IOException {
            int touched = super.appendAll(appends);
            if (++calls == crashAfter) throw new IOException("simulated crash after chunk " + calls);
            return touched;
        }
    }

    @Test
    void builds_one_artifact_per_entity_with_summary_counts() throws Exception {
        SequenceConfig cfg = config("work").build();
        MetricRegistry registry = new MetricRegistry();
        RunSummary summary = EdgeSequenceJob.create(cfg, index, registry).run();
        assertTrue(registry.getGauges().containsKey("jvm.memory.heap.used"));

        assertEquals(7, summary.chunksScanned());
        assertEquals(26, summary.rowsRead());
        assertEquals(1, summary.rowsSkipped());
        assertTrue(summary.scanCompleted());
        assertEquals(4, summary.entitiesBuilt());
        assertEquals(4, summary.artifactFiles());
        assertEquals(1, summary.missingLabels());
        assertEquals(1, summary.emptyIn());   // entity 4
        assertEquals(1, summary.emptyOut());  // entity 4
        assertEquals(0, summary.temporalOverflow());
        assertEquals(RunSummary.EXIT_OK, summary.exitCode());
        assertEquals(100, summary.maxTemporalKey());
        assertFalse(summary.stopped());
        assertTrue(Files.exists(cfg.workDir().resolve("run_summary.json")));
        assertTrue(Files.readString(cfg.deadLetterDir().resolve("skipped_rows.jsonl")).contains("COLUMN_COUNT"));

        SequenceArtifactCodec codec = new SequenceArtifactCodec(cfg.sequenceDir(), 3, F + 1, false);
        SequenceArtifact e1 = SequenceArtifactCodec.read(codec.fileFor(0));
        assertEquals(1, e1.entityId());
        assertEquals(1, e1.label());
        assertEquals(6, e1.nInOriginal());   // from 3
        assertEquals(6, e1.nOutOriginal());  // to 2
        // latest inbound of entity 1 are txIds 43, 53, 63
        assertEquals(43.5f, e1.inFlow()[0][0]);
        assertEquals(63.5f, e1.inFlow()[2][0]);
        assertEquals(0.63f, e1.inFlow()[2][F]);

        SequenceArtifact e2 = SequenceArtifactCodec.read(codec.fileFor(1));
        assertEquals(7, e2.nInOriginal());   // six from 1 plus the self-loop
        assertEquals(7, e2.nOutOriginal());  // six to 9 plus the self-loop

        SequenceArtifact e3 = SequenceArtifactCodec.read(codec.fileFor(2));
        assertEquals(0, e3.label());

        SequenceArtifact e4 = SequenceArtifactCodec.read(codec.fileFor(3));
        assertEquals(0, e4.nInOriginal());
        for (float[] r : e4.outFlow()) assertArrayEquals(new float[F + 1], r);
    }

    @Test
    void two_clean_runs_produce_identical_bytes() throws Exception {
        SequenceConfig a = config("a").fixedMaxTemporalKey(0).build();
        SequenceConfig b = config("b").fixedMaxTemporalKey(0).build();
        EdgeSequenceJob.create(a, index, new MetricRegistry()).run();
        EdgeSequenceJob.create(b, index, new MetricRegistry()).run();
        assertSameArtifacts(artifacts(a), artifacts(b));
    }

    @Test
    void crash_at_any_chunk_resumes_to_the_uninterrupted_result() throws Exception {
        SequenceConfig clean = config("clean").build();
        EdgeSequenceJob.create(clean, index, new MetricRegistry()).run();
        Map<String, byte[]> expected = artifacts(clean);

        for (int crashAfter = 1; crashAfter <= 7; crashAfter++) {
            SequenceConfig cfg = config("crash-" + crashAfter).build();
            EdgeSequenceJob crashing = job(cfg, new CrashingSpoolStore(cfg, crashAfter));
            assertThrows(IOException.class, crashing::run);

            RunSummary resumed = job(cfg, new SpoolStore(cfg.spoolDir(), F, false)).run();
            assertTrue(resumed.scanCompleted());
            assertEquals(26, resumed.rowsRead(), "rows after crash at chunk " + crashAfter);
            assertSameArtifacts(expected, artifacts(cfg));
        }
    }

    @Test
    void replayed_chunks_are_dropped_when_spools_are_read() throws Exception {
        SequenceConfig cfg = config("replay").scanCheckpointEvery(100).build();
        assertThrows(IOException.class, job(cfg, new CrashingSpoolStore(cfg, 5))::run);
        RunSummary resumed = job(cfg, new SpoolStore(cfg.spoolDir(), F, false)).run();
        assertTrue(resumed.duplicatesDropped() > 0);

        SpoolContents in1 = new SpoolStore(cfg.spoolDir(), F, false).read(1, Direction.INBOUND);
        assertEquals(6, in1.entries().size());
    }

    @Test
    void stop_during_windowing_resumes_without_rebuilding_finished_entities() throws Exception {
        SequenceConfig clean = config("clean").build();
        EdgeSequenceJob.create(clean, index, new MetricRegistry()).run();

        SequenceConfig cfg = config("stopped").sequenceCheckpointEvery(1).build();
        AtomicInteger reads = new AtomicInteger();
        EdgeSequenceJob[] holder = new EdgeSequenceJob[1];
        SpoolStore stopping = new SpoolStore(cfg.spoolDir(), F, false) {
            @Override
            public SpoolContents read(long entityId, Direction direction) throws IOException {
                // second entity's outbound read: stop once it is done
                if (reads.incrementAndGet() == 4) holder[0].requestStop();
                return super.read(entityId, direction);
            }
        };
        holder[0] = job(cfg, stopping);
        RunSummary first = holder[0].run();
        assertTrue(first.stopped());
        assertEquals(2, first.entitiesBuilt());

        RunSummary second = job(cfg, new SpoolStore(cfg.spoolDir(), F, false)).run();
        assertFalse(second.stopped());
        assertEquals(2, second.entitiesAlreadyDone());
        assertEquals(2, second.entitiesBuilt());
        assertSameArtifacts(artifacts(clean), artifacts(cfg));
    }

    @Test
    void strict_mode_reports_temporal_overflow_with_exit_status() throws Exception {
        SequenceConfig cfg = config("strict").fixedMaxTemporalKey(50).strictTemporalKey(true).build();
        RunSummary summary = EdgeSequenceJob.create(cfg, index, new MetricRegistry()).run();
        assertTrue(summary.temporalOverflow() > 0);
        assertEquals(RunSummary.EXIT_TEMPORAL_OVERFLOW, summary.exitCode());

        SequenceConfig lenient = config("lenient").fixedMaxTemporalKey(50).build();
        assertEquals(RunSummary.EXIT_OK, EdgeSequenceJob.create(lenient, index, new MetricRegistry()).run().exitCode());
    }

    @Test
    void windowing_requires_a_completed_extraction() throws Exception {
        SequenceConfig cfg = config("window-only").build();
        EdgeSequenceJob job = EdgeSequenceJob.create(cfg, index, new MetricRegistry());
        assertThrows(EdgeSequenceException.class, () -> job.run(Phase.WINDOW));

        RunSummary extracted = EdgeSequenceJob.create(cfg, index, new MetricRegistry()).run(Phase.EXTRACT);
        assertTrue(extracted.scanCompleted());
        assertEquals(0, extracted.entitiesBuilt());
        RunSummary windowed = EdgeSequenceJob.create(cfg, index, new MetricRegistry()).run(Phase.WINDOW);
        assertEquals(4, windowed.entitiesBuilt());
    }

    @Test
    void spools_are_deleted_once_their_entity_is_checkpointed() throws Exception {
        SequenceConfig cfg = config("cleanup").deleteSpools(true).build();
        EdgeSequenceJob.create(cfg, index, new MetricRegistry()).run();
        SpoolStore spools = new SpoolStore(cfg.spoolDir(), F, false);
        for (long id : index.entityIds().toArray()) {
            assertFalse(Files.exists(spools.pathFor(id, Direction.INBOUND)));
            assertFalse(Files.exists(spools.pathFor(id, Direction.OUTBOUND)));
        }
        RunSummary again = EdgeSequenceJob.create(cfg, index, new MetricRegistry()).run();
        assertEquals(4, again.entitiesAlreadyDone());
        assertEquals(0, again.entitiesBuilt());
    }
}
