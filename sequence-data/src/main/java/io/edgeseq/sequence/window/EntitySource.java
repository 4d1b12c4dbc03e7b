package io.edgeseq.sequence.window;

import io.edgeseq.core.Record;
import io.edgeseq.core.Source;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.index.IndexEntry;

import java.util.Optional;
import java.util.function.IntPredicate;

/** Entities in dense index order, minus those already finalized. The record seq is the dense index. */
public class EntitySource implements Source<IndexEntry> {
    private final EntityIndex index;
    private final IntPredicate done;
    private int next;
    private long skipped;

    public EntitySource(EntityIndex index, IntPredicate done) {
        this.index = index;
        this.done = done;
    }

    @Override
    public Optional<Record<IndexEntry>> poll() {
        while (next < index.size()) {
            int i = next++;
            if (done.test(i)) {
                skipped++;
                continue;
            }
            return Optional.of(Record.of(i, index.entry(i)));
        }
        return Optional.empty();
    }

    @Override
    public boolean isFinished() {
        return next >= index.size();
    }

    /** Entities passed over because they were already finalized. */
    public long skipped() {
        return skipped;
    }
}
