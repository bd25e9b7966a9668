package io.indexer.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class IndexerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksIndexed = registry.counter("indexer.blocks.indexed");
    private static final Counter blocksRolledBack = registry.counter("indexer.blocks.rolledback");
    private static final Counter decodeFailures = Counter.builder("indexer.decode.failures")
            .description("Logs or extra data skipped because they did not decode")
            .register(registry);
    private static final Timer indexTime = registry.timer("indexer.block.index.time");

    public static <T> T recordIndexing(Supplier<T> indexingLogic) {
        return indexTime.record(indexingLogic);
    }

    public static void incrementBlocks() {
        blocksIndexed.increment();
    }

    public static void incrementRollbacks() {
        blocksRolledBack.increment();
    }

    public static void recordDecodeFailures(int count) {
        decodeFailures.increment(count);
    }

    /** Counts a failed index phase; {@code phase} is "primary" or "extended". */
    public static void recordIndexFailure(String phase) {
        Counter.builder("indexer.index.failures")
                .description("Index phases that failed and must be retried")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
