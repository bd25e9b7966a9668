package io.indexer.core.storage;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the Chain Data Store. Point lookups throw
 * {@link io.indexer.core.error.NotFoundException} when the key is absent.
 */
public interface ChainReader {

    /**
     * Highest contiguous height whose raw data is indexed.
     *
     * @throws io.indexer.core.error.NotFoundException when nothing has been indexed yet; treat as an empty chain
     */
    long getLatestHeight(OperationContext ctx);

    Block getBlock(OperationContext ctx, long height);

    Block getBlockByHash(OperationContext ctx, Hash hash);

    /** Blocks in {@code [startHeight, endHeight]}, ascending. Missing heights are skipped. */
    List<Block> getBlocks(OperationContext ctx, long startHeight, long endHeight);

    LocatedTransaction getTransaction(OperationContext ctx, Hash txHash);

    /**
     * Looks up several hashes concurrently. The result has one slot per input hash,
     * in input order; absent transactions are {@link Optional#empty()}.
     */
    List<Optional<LocatedTransaction>> getTransactions(OperationContext ctx, List<Hash> txHashes);

    List<Transaction> getTransactionsByBlock(OperationContext ctx, long height);

    /** Receipt with gas used, effective gas price and contract address derived from block context. */
    Receipt getReceipt(OperationContext ctx, Hash txHash);

    /** Receipts of the block ordered by transaction index; missing receipts are skipped. */
    List<Receipt> getReceiptsByBlockNumber(OperationContext ctx, long height);

    boolean hasBlock(OperationContext ctx, long height);

    boolean hasTransaction(OperationContext ctx, Hash txHash);

    boolean hasReceipt(OperationContext ctx, Hash txHash);

    long getBlockCount(OperationContext ctx);

    long getTransactionCount(OperationContext ctx);
}
