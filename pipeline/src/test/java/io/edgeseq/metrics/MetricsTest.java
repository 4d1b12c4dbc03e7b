package io.edgeseq.metrics;

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTest {

    @Test
    void jvm_memory_gauges_register_once_and_report_heap_usage() {
        MetricRegistry registry = new MetricRegistry();
        Metrics metrics = new Metrics(registry);
        assertEquals(-1, metrics.jvmMemory("heap.used"));

        metrics.registerJvmMemory();
        int registered = registry.getGauges().size();
        metrics.registerJvmMemory();

        assertEquals(registered, registry.getGauges().size());
        assertTrue(registry.getGauges().containsKey(Metrics.JVM_MEMORY + ".heap.used"));
        assertTrue(metrics.jvmMemory("heap.used") > 0);
        assertTrue(registry.getGauges().containsKey(Metrics.JVM_MEMORY + ".non-heap.used"));
    }

    @Test
    void reporter_is_disabled_for_non_positive_periods() {
        Metrics metrics = new Metrics(new MetricRegistry());
        assertNull(metrics.startReporter(0));
    }
}
