package io.edgeseq.sequence;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.edgeseq.sequence.index.EntityIndex;
import io.edgeseq.sequence.scan.ScanCheckpointManager;
import io.edgeseq.sequence.spool.SpoolStore;
import io.edgeseq.sequence.window.SequenceCheckpointManager;

public class EdgeSequencesModule extends AbstractModule {
    private final SequenceConfig config;

    public EdgeSequencesModule(SequenceConfig config) { this.config = config.validate(); }

    @Override
    protected void configure() {
        bind(SequenceConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton EntityIndex entityIndex() { return EntityIndex.load(config.indexPath()); }

    @Provides @Singleton SpoolStore spoolStore() { return new SpoolStore(config.spoolDir(), config.featureWidth(), config.fsync()); }

    @Provides @Singleton ScanCheckpointManager scanCheckpoints() { return new ScanCheckpointManager(config.scanCheckpointFile()); }

    @Provides @Singleton SequenceCheckpointManager sequenceCheckpoints() {
        return new SequenceCheckpointManager(config.sequenceCheckpointFile(), config.windowLength(), config.featureWidth());
    }

    @Provides @Singleton EdgeSequenceJob job(EntityIndex index, SpoolStore spools, ScanCheckpointManager scan,
                                             SequenceCheckpointManager sequences, MetricRegistry registry) {
        return new EdgeSequenceJob(config, index, spools, scan, sequences, registry);
    }
}
