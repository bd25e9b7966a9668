package io.indexer.core.events;

import io.indexer.core.protocol.Log;

import java.util.Objects;

public record LogEvent(Log log) implements ChainEvent {
    public LogEvent {
        Objects.requireNonNull(log, "log");
    }

    @Override
    public EventType type() {
        return EventType.LOG;
    }

    @Override
    public long blockNumber() {
        return log.blockNumber();
    }
}
