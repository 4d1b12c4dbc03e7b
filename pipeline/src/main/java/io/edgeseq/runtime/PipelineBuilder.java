package io.edgeseq.runtime;

import com.codahale.metrics.MetricRegistry;
import io.edgeseq.core.BatchSink;
import io.edgeseq.core.Source;
import io.edgeseq.core.Transform;
import io.edgeseq.error.DeadLetterSink;
import io.edgeseq.metrics.Metrics;
import io.edgeseq.retry.RetryPolicy;

import java.util.Objects;

public class PipelineBuilder<I, O> {
    private String name = "pipeline";
    private Source<I> source;
    private Transform<I, O> transform;
    private BatchSink<O> sink;
    private CommitListener commitListener = CommitListener.NONE;
    private int commitEvery = 1;
    private RetryPolicy retryPolicy = RetryPolicy.none();
    private DeadLetterSink deadLetters;
    private long progressEvery;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public PipelineBuilder<I, O> name(String n) { this.name = n; return this; }
    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public PipelineBuilder<I, O> sink(BatchSink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> onCommit(CommitListener c) { this.commitListener = c; return this; }
    public PipelineBuilder<I, O> commitEvery(int n) { this.commitEvery = Math.max(1, n); return this; }
    public PipelineBuilder<I, O> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public PipelineBuilder<I, O> deadLetters(DeadLetterSink d) { this.deadLetters = d; return this; }
    public PipelineBuilder<I, O> logProgressEvery(long units) { this.progressEvery = Math.max(0, units); return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(commitListener, "commitListener");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        return new Pipeline<>(name, source, transform, sink, commitListener, commitEvery, retryPolicy,
                deadLetters, progressEvery, new Metrics(metricRegistry));
    }
}
