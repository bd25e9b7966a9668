package io.indexer.core.storage;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;

import java.util.List;

/** Write side of the Chain Data Store. All writes are idempotent upserts keyed by canonical id. */
public interface ChainWriter {

    /**
     * Stores the block and its transactions, replacing whatever was stored at that height. Stored
     * receipts of transactions still at the same position are kept.
     */
    void setBlock(OperationContext ctx, Block block);

    void setBlocks(OperationContext ctx, List<Block> blocks);

    void setTransaction(OperationContext ctx, Transaction tx, TxLocation location);

    void setReceipt(OperationContext ctx, Receipt receipt);

    void setReceipts(OperationContext ctx, List<Receipt> receipts);

    /** Block, transactions and receipts in one atomic write. */
    void setBlockWithReceipts(OperationContext ctx, Block block, List<Receipt> receipts);

    /**
     * Removes the block, its transactions, receipts, logs, the hash mapping and every secondary record
     * derived from it. Missing heights are a no-op.
     */
    void deleteBlock(OperationContext ctx, long height);
}
