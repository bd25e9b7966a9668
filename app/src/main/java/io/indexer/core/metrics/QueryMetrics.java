package io.indexer.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

public final class QueryMetrics {
    private static final MeterRegistry REGISTRY = IndexerMetrics.registry();

    private QueryMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String operation, String outcome) {
        Timer timer = Timer
                .builder("indexer.query.duration")
                .description("Query engine call duration")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(REGISTRY);
        sample.stop(timer);
    }
}
