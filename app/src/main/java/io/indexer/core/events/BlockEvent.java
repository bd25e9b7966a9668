package io.indexer.core.events;

import io.indexer.core.protocol.Block;

import java.util.Objects;

public record BlockEvent(Block block) implements ChainEvent {
    public BlockEvent {
        Objects.requireNonNull(block, "block");
    }

    @Override
    public EventType type() {
        return EventType.BLOCK;
    }

    @Override
    public long blockNumber() {
        return block.number();
    }
}
