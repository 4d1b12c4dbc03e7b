package io.edgeseq.sequence.window;

import io.edgeseq.sequence.ConfigurationException;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.scan.ScanCheckpoint;
import io.edgeseq.sequence.spool.Direction;
import io.edgeseq.sequence.spool.SpoolContents;
import io.edgeseq.sequence.spool.SpoolEntry;
import io.edgeseq.sequence.spool.SpoolStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * Computes {@code maxTemporalKey}, the single constant every txId is divided by. It is resolved once, before
 * the first entity is built, so the proxy column is comparable across entities.
 */
public class TemporalKeyResolver {
    private static final Logger log = LoggerFactory.getLogger(TemporalKeyResolver.class);

    /** Used when sampling finds no txId at all. */
    public static final long FALLBACK_MAX_TEMPORAL_KEY = 800_000_000L;

    private final TemporalKeyMode mode;
    private final OptionalLong fixed;
    private final int sampleSize;
    private final double margin;

    public TemporalKeyResolver(TemporalKeyMode mode, OptionalLong fixed, int sampleSize, double margin) {
        this.mode = mode;
        this.fixed = fixed;
        this.sampleSize = sampleSize;
        this.margin = margin;
    }

    public long resolve(ScanCheckpoint scan, EntityIndex index, SpoolStore spools) {
        switch (mode) {
            case FIXED:
                return fixedValue();
            case OBSERVED:
                if (scan == null || scan.maxTxIdRouted() < 0) {
                    throw new ConfigurationException("Temporal key mode OBSERVED needs a scan checkpoint with a routed txId");
                }
                return observed(scan);
            case SAMPLED:
                return sampled(index, spools);
            case AUTO:
            default:
                if (fixed.isPresent()) return fixedValue();
                if (scan != null && scan.maxTxIdRouted() > 0) return observed(scan);
                return sampled(index, spools);
        }
    }

    private long fixedValue() {
        long v = fixed.orElseThrow(() -> new ConfigurationException("Temporal key mode FIXED needs a max temporal key value"));
        if (v <= 0) throw new ConfigurationException("Max temporal key must be positive: " + v);
        log.info("Using fixed max temporal key {}", v);
        return v;
    }

    private long observed(ScanCheckpoint scan) {
        long v = withMargin(scan.maxTxIdRouted());
        log.info("Max temporal key {} from observed max txId {} (margin {})", v, scan.maxTxIdRouted(), margin);
        return v;
    }

    private long sampled(EntityIndex index, SpoolStore spools) {
        long max = -1;
        int sampled = 0;
        for (int i = 0; i < index.size() && sampled < sampleSize; i++) {
            long entityId = index.entityId(i);
            SpoolContents contents;
            try {
                contents = spools.read(entityId, Direction.INBOUND);
            } catch (IOException e) {
                log.warn("Skipping inbound spool of entity {} while sampling: {}", entityId, e.toString());
                continue;
            }
            if (!contents.present()) continue;
            sampled++;
            for (SpoolEntry entry : contents.entries()) max = Math.max(max, entry.txId());
        }
        if (max <= 0) {
            log.warn("No txId found in {} sampled spools; falling back to max temporal key {}", sampled, FALLBACK_MAX_TEMPORAL_KEY);
            return FALLBACK_MAX_TEMPORAL_KEY;
        }
        long v = withMargin(max);
        log.info("Max temporal key {} estimated from {} sampled spools (max txId {}, margin {})", v, sampled, max, margin);
        return v;
    }

    private long withMargin(long max) {
        return Math.max(1L, (long) (max * margin));
    }
}
