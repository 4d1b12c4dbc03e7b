package io.edgeseq.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;
import com.codahale.metrics.jvm.MemoryUsageGaugeSet;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

public class Metrics {
    public static final String JVM_MEMORY = "jvm.memory";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Registers heap, non-heap and pool usage gauges under {@value #JVM_MEMORY}. Repeated calls are no-ops. */
    public void registerJvmMemory() {
        if (registry.getGauges().containsKey(JVM_MEMORY + ".heap.used")) return;
        registry.register(JVM_MEMORY, new MemoryUsageGaugeSet());
    }

    /** Current value of a {@link #registerJvmMemory()} gauge such as {@code heap.used}, or -1 when not registered. */
    public long jvmMemory(String name) {
        Gauge<?> g = registry.getGauges().get(JVM_MEMORY + "." + name);
        if (g == null || !(g.getValue() instanceof Number n)) return -1;
        return n.longValue();
    }

    /**
     * Starts a reporter that logs every metric through SLF4J at the given period. Returns null when disabled.
     */
    public Slf4jReporter startReporter(long periodSeconds) {
        if (periodSeconds <= 0) return null;
        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.edgeseq.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();
        reporter.start(periodSeconds, TimeUnit.SECONDS);
        return reporter;
    }
}
