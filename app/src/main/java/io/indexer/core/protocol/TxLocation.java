package io.indexer.core.protocol;

import java.util.Objects;

/** Where a transaction lives: block height, block hash and position inside the block. */
public record TxLocation(long blockHeight, Hash blockHash, int txIndex) {
    public TxLocation {
        Objects.requireNonNull(blockHash, "blockHash");
        if (blockHeight < 0 || txIndex < 0) {
            throw new IllegalArgumentException("negative location");
        }
    }
}
