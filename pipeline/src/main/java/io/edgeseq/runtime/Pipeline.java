package io.edgeseq.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.edgeseq.core.BatchSink;
import io.edgeseq.core.Record;
import io.edgeseq.core.Source;
import io.edgeseq.core.Transform;
import io.edgeseq.error.DeadLetterSink;
import io.edgeseq.metrics.Metrics;
import io.edgeseq.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded source -> transform -> sink loop with write-ahead commits.
 * <p>
 * Each input record is a unit: its outputs go to the sink in one {@link BatchSink#acceptBatch} call, and only
 * after that call returns can a commit cover the unit. Commits happen every {@code commitEvery} completed units
 * and once more when the run ends or is stopped. A stop request is honoured between units only.
 */
public class Pipeline<I, O> {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final String name;
    private final Source<I> source;
    private final Transform<I, O> transform;
    private final BatchSink<O> sink;
    private final CommitListener commitListener;
    private final int commitEvery;
    private final RetryPolicy retryPolicy;
    private final DeadLetterSink deadLetters;
    private final long progressEvery;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Timer commitTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;
    private final Counter commitCounter;

    Pipeline(String name,
             Source<I> source,
             Transform<I, O> transform,
             BatchSink<O> sink,
             CommitListener commitListener,
             int commitEvery,
             RetryPolicy retryPolicy,
             DeadLetterSink deadLetters,
             long progressEvery,
             Metrics metrics) {
        this.name = Objects.requireNonNull(name);
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.commitListener = Objects.requireNonNull(commitListener);
        this.commitEvery = Math.max(1, commitEvery);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.deadLetters = deadLetters;
        this.progressEvery = Math.max(0, progressEvery);
        this.sourceTimer = metrics.timer(name + ".source.time");
        this.transformTimer = metrics.timer(name + ".transform.time");
        this.sinkTimer = metrics.timer(name + ".sink.time");
        this.commitTimer = metrics.timer(name + ".commit.time");
        this.inMeter = metrics.meter(name + ".input.rate");
        this.outMeter = metrics.meter(name + ".output.rate");
        this.errorMeter = metrics.meter(name + ".error.rate");
        this.commitCounter = metrics.counter(name + ".commits");
    }

    /** Requests a stop at the next unit boundary. Safe to call from any thread. */
    public void stop() { stopRequested.set(true); }

    public boolean isRunning() { return running.get(); }
    public boolean isStopRequested() { return stopRequested.get(); }

    public RunStats run() throws Exception {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("pipeline " + name + " is already running");
        }
        long read = 0, completed = 0, failed = 0, outputs = 0, commits = 0;
        long lastSeq = -1, lastCommitted = -1, sinceCommit = 0;
        boolean stopped = false;
        try {
            while (true) {
                if (stopRequested.get()) {
                    stopped = true;
                    break;
                }
                Optional<Record<I>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = source.poll();
                }
                if (next.isEmpty()) {
                    if (source.isFinished()) break;
                    continue;
                }
                Record<I> in = next.get();
                read++;
                inMeter.mark();

                int produced = process(in);
                if (produced < 0) {
                    failed++;
                } else {
                    completed++;
                    outputs += produced;
                }
                lastSeq = in.seq();
                sinceCommit++;

                if (sinceCommit >= commitEvery) {
                    commit(lastSeq);
                    commits++;
                    lastCommitted = lastSeq;
                    sinceCommit = 0;
                }
                if (progressEvery > 0 && read % progressEvery == 0) {
                    log.info("[{}] {} units read, {} completed, {} failed, {} outputs", name, read, completed, failed, outputs);
                }
            }
            if (lastSeq >= 0 && lastSeq != lastCommitted) {
                commit(lastSeq);
                commits++;
                lastCommitted = lastSeq;
            }
        } finally {
            running.set(false);
        }
        if (stopped) {
            log.info("[{}] stopped on request after {} units; last committed seq {}", name, read, lastCommitted);
        }
        return new RunStats(read, completed, failed, outputs, commits, lastCommitted, stopped);
    }

    /**
     * Transforms and sinks one unit. Returns the number of outputs, or -1 when the unit went to the dead
     * letter sink. Throws when retries are exhausted and no dead letter sink is configured.
     */
    private int process(Record<I> in) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                List<Record<O>> outs;
                try (Timer.Context ignored = transformTimer.time()) {
                    outs = transform.apply(in);
                }
                if (outs == null) outs = List.of();
                if (outs.size() > 1) {
                    outs = new ArrayList<>(outs);
                    outs.sort(Comparator.comparingInt(Record::subSeq));
                }
                try (Timer.Context ignored = sinkTimer.time()) {
                    sink.acceptBatch(outs);
                }
                outMeter.mark(outs.size());
                return outs.size();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception e) {
                errorMeter.mark();
                if (retryPolicy.shouldRetry(attempt, e)) {
                    long backoff = retryPolicy.backoffMillis(attempt);
                    log.warn("[{}] unit {} failed on attempt {}, retrying in {} ms: {}", name, in.seq(), attempt, backoff, e.toString());
                    Thread.sleep(backoff);
                    continue;
                }
                if (deadLetters == null) throw e;
                log.warn("[{}] unit {} failed after {} attempt(s): {}", name, in.seq(), attempt, e.toString());
                deadLetters.acceptFailure(name, in.seq(), e.getClass().getSimpleName(), String.valueOf(e.getMessage()));
                return -1;
            }
        }
    }

    private void commit(long seq) throws Exception {
        try (Timer.Context ignored = commitTimer.time()) {
            commitListener.commit(seq);
        }
        commitCounter.inc();
    }
}
