package io.indexer.core.events;

public record BusStats(long published, long delivered, long dropped, long rejected, int subscribers) {
}
