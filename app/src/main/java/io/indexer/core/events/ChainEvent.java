package io.indexer.core.events;

/** Something the indexer publishes after a height is committed. */
public interface ChainEvent {

    EventType type();

    long blockNumber();
}
