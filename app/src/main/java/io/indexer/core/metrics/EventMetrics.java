package io.indexer.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public final class EventMetrics {
    private static final Counter published;
    private static final Counter rejected;
    private static final Counter delivered;
    private static final Counter dropped;

    static {
        MeterRegistry registry = IndexerMetrics.registry();
        published = Counter.builder("events.published")
                .description("Events accepted into the bus ingress queue")
                .register(registry);
        rejected = Counter.builder("events.rejected")
                .description("Events refused because the bus was saturated or stopped")
                .register(registry);
        delivered = Counter.builder("events.delivered")
                .description("Events enqueued to a subscriber")
                .register(registry);
        dropped = Counter.builder("events.dropped")
                .description("Events dropped because a subscriber queue was full")
                .register(registry);
    }

    private EventMetrics() {}

    public static void recordPublished() {
        published.increment();
    }

    public static void recordRejected() {
        rejected.increment();
    }

    public static void recordDelivered() {
        delivered.increment();
    }

    public static void recordDropped() {
        dropped.increment();
    }
}
