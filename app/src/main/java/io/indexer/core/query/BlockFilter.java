package io.indexer.core.query;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;

/**
 * Block list filter. Any field may be null. A number bound makes the query use oldest-first
 * paging over the given range; timestamp and miner only narrow the blocks of the selected page.
 */
public record BlockFilter(Long numberFrom, Long numberTo, Long timestampFrom, Long timestampTo, Address miner) {

    public static final BlockFilter NONE = new BlockFilter(null, null, null, null, null);

    public static BlockFilter range(long from, long to) {
        return new BlockFilter(from, to, null, null, null);
    }

    public boolean hasNumberFilter() {
        return numberFrom != null || numberTo != null;
    }

    public boolean hasTimestampFilter() {
        return timestampFrom != null || timestampTo != null;
    }

    public boolean hasMinerFilter() {
        return miner != null;
    }

    public boolean matches(Block block) {
        if (timestampFrom != null && block.timestamp() < timestampFrom) {
            return false;
        }
        if (timestampTo != null && block.timestamp() > timestampTo) {
            return false;
        }
        return miner == null || miner.equals(block.miner());
    }
}
