package io.edgeseq.sequence.window;

import com.codahale.metrics.Counter;
import io.edgeseq.metrics.Metrics;

/** Per-run data-quality counts of the windowing phase, mirrored into the metric registry. */
public class WindowTally {
    private final Counter processed;
    private final Counter emptyIn;
    private final Counter emptyOut;
    private final Counter missingLabels;
    private final Counter temporalOverflow;
    private final Counter spoolReadFailures;
    private final Counter duplicatesDropped;
    private final Counter corruptLines;

    public WindowTally(Metrics metrics) {
        this.processed = metrics.counter("window.entities.processed");
        this.emptyIn = metrics.counter("window.entities.emptyIn");
        this.emptyOut = metrics.counter("window.entities.emptyOut");
        this.missingLabels = metrics.counter("window.entities.missingLabel");
        this.temporalOverflow = metrics.counter("window.entities.temporalOverflow");
        this.spoolReadFailures = metrics.counter("window.spools.readFailures");
        this.duplicatesDropped = metrics.counter("window.spools.duplicatesDropped");
        this.corruptLines = metrics.counter("window.spools.corruptLines");
    }

    void add(AssembledSequence s) {
        EntitySequences seq = s.sequences();
        processed.inc();
        if (seq.nInOriginal() == 0) emptyIn.inc();
        if (seq.nOutOriginal() == 0) emptyOut.inc();
        if (s.labelMissing()) missingLabels.inc();
        if (seq.hasOverflow()) temporalOverflow.inc();
        spoolReadFailures.inc(seq.readFailures());
        duplicatesDropped.inc(seq.duplicates());
        corruptLines.inc(seq.corruptLines());
    }

    public long processed() { return processed.getCount(); }
    public long emptyIn() { return emptyIn.getCount(); }
    public long emptyOut() { return emptyOut.getCount(); }
    public long missingLabels() { return missingLabels.getCount(); }
    public long temporalOverflow() { return temporalOverflow.getCount(); }
    public long spoolReadFailures() { return spoolReadFailures.getCount(); }
    public long duplicatesDropped() { return duplicatesDropped.getCount(); }
    public long corruptLines() { return corruptLines.getCount(); }
}
