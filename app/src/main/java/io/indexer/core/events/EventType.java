package io.indexer.core.events;

public enum EventType {
    BLOCK,
    TRANSACTION,
    LOG
}
