package io.edgeseq.sequence.window;

import io.edgeseq.sequence.ConfigurationException;
import io.edgeseq.sequence.EdgeStreams;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.index.IndexEntry;
import io.edgeseq.sequence.scan.ScanCheckpoint;
import io.edgeseq.sequence.spool.Direction;
import io.edgeseq.sequence.spool.SpoolEntry;
import io.edgeseq.sequence.spool.SpoolStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

public class TemporalKeyResolverTest {
    private Path tmp;
    private SpoolStore spools;
    private EntityIndex index;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("temporal");
        spools = new SpoolStore(tmp, 1, false);
        index = EntityIndex.of(List.of(new IndexEntry(10, 0, 0), new IndexEntry(20, 1, 1), new IndexEntry(30, 2, 0)));
        spools.initialize(index.entityIds());
    }

    @AfterEach
    void cleanup() throws IOException {
        EdgeStreams.deleteRecursively(tmp);
    }

    private static ScanCheckpoint scanWithMax(long maxTx) {
        return new ScanCheckpoint(4, 10, 100, 0, maxTx, 25, "/edges.csv", true);
    }

    @Test
    void fixed_value_wins_in_auto_mode() {
        TemporalKeyResolver r = new TemporalKeyResolver(TemporalKeyMode.AUTO, OptionalLong.of(500), 100, 1.1);
        assertEquals(500, r.resolve(scanWithMax(1000), index, spools));
    }

    @Test
    void auto_uses_observed_max_with_margin() {
        TemporalKeyResolver r = new TemporalKeyResolver(TemporalKeyMode.AUTO, OptionalLong.empty(), 100, 1.1);
        assertEquals(1100, r.resolve(scanWithMax(1000), index, spools));
    }

    @Test
    void sampled_reads_only_the_first_inbound_spools() throws Exception {
        spools.append(10, Direction.INBOUND, new SpoolEntry(1, 40, new float[]{0}));
        spools.append(20, Direction.INBOUND, new SpoolEntry(2, 50, new float[]{0}));
        spools.append(30, Direction.INBOUND, new SpoolEntry(3, 9000, new float[]{0}));
        spools.append(30, Direction.OUTBOUND, new SpoolEntry(3, 9000, new float[]{0}));
        TemporalKeyResolver r = new TemporalKeyResolver(TemporalKeyMode.SAMPLED, OptionalLong.empty(), 2, 1.1);
        assertEquals(55, r.resolve(scanWithMax(9000), index, spools));
    }

    @Test
    void sampling_nothing_falls_back() {
        TemporalKeyResolver r = new TemporalKeyResolver(TemporalKeyMode.AUTO, OptionalLong.empty(), 100, 1.1);
        assertEquals(TemporalKeyResolver.FALLBACK_MAX_TEMPORAL_KEY, r.resolve(scanWithMax(-1), index, spools));
    }

    @Test
    void explicit_modes_require_their_input() {
        assertThrows(ConfigurationException.class,
                () -> new TemporalKeyResolver(TemporalKeyMode.FIXED, OptionalLong.empty(), 1, 1.1).resolve(null, index, spools));
        assertThrows(ConfigurationException.class,
                () -> new TemporalKeyResolver(TemporalKeyMode.OBSERVED, OptionalLong.empty(), 1, 1.1).resolve(scanWithMax(-1), index, spools));
    }
}
