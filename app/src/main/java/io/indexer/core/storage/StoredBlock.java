package io.indexer.core.storage;

import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Receipt;

import java.util.List;

/** A block together with the receipts stored for it, as written (no derived fields). */
public record StoredBlock(Block block, List<Receipt> receipts) {
    public StoredBlock {
        receipts = List.copyOf(receipts);
    }
}
