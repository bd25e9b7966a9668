package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.CancelledException;
import io.indexer.core.error.IndexerException;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.error.StorageUnavailableException;
import io.indexer.core.events.BlockEvent;
import io.indexer.core.events.ChainEvent;
import io.indexer.core.events.EventBus;
import io.indexer.core.events.LogEvent;
import io.indexer.core.events.TransactionEvent;
import io.indexer.core.metrics.IndexerMetrics;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.KvChainStore;
import io.indexer.core.storage.StoredBlock;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Secondary Index Maintainer.
 *
 * <p>A height is indexed in two phases. The primary phase writes the block, its transactions and
 * receipts together with the mandatory families in one batch and advances the raw watermark. The
 * extended phase writes the remaining families in a second batch and advances the fully-indexed
 * watermark. A failed phase leaves no partial writes; callers retry the failed phase for that height.
 *
 * <p>Re-indexing a height first removes every record derived from what was stored there, so each
 * phase is idempotent. A given height must not be indexed from two threads at once.
 */
public final class BlockIndexer {
    private static final Logger LOG = Logger.getLogger(BlockIndexer.class.getName());

    private final KvChainStore store;
    private final IndexCatalog catalog;
    private final EventBus bus;

    /**
     * {@code bus} may be null, in which case nothing is published. The indexer attaches itself to the
     * store so that {@link KvChainStore#deleteBlock} also drops this catalog's records.
     */
    public BlockIndexer(KvChainStore store, IndexCatalog catalog, EventBus bus) {
        this.store = store;
        this.catalog = catalog;
        this.bus = bus;
        store.attachDerivedRecords(this::unstageAll);
    }

    public IndexCatalog catalog() {
        return catalog;
    }

    /** Runs both phases for a height. */
    public void index(OperationContext ctx, BlockBundle bundle) {
        indexPrimary(ctx, bundle);
        indexExtended(ctx, bundle);
    }

    public void indexPrimary(OperationContext ctx, BlockBundle bundle) {
        long height = bundle.height();
        guarded("primary", height, () -> {
            IndexerMetrics.recordIndexing(() -> {
                writePrimary(ctx, bundle);
                return null;
            });
            return null;
        });
        IndexerMetrics.incrementBlocks();
        publishCommitted(bundle);
    }

    public void indexExtended(OperationContext ctx, BlockBundle bundle) {
        long height = bundle.height();
        guarded("extended", height, () -> {
            writeExtended(ctx, bundle);
            return null;
        });
    }

    /**
     * Removes a height and every record derived from it. Returns false when nothing is stored there.
     */
    public boolean rollback(OperationContext ctx, long height) {
        if (height < 0) {
            throw new InvalidInputException("height must be >= 0: " + height);
        }
        boolean removed = guarded("rollback", height, () -> store.removeBlock(ctx, height));
        if (removed) {
            IndexerMetrics.incrementRollbacks();
            LOG.info(() -> "Rolled back block " + height);
        }
        return removed;
    }

    /** Removes every stored height from the newest down to {@code height}, returning how many went. */
    public int rollbackFrom(OperationContext ctx, long height) {
        long latest;
        try {
            latest = store.getLatestHeight(ctx);
        } catch (NotFoundException e) {
            return 0;
        }
        int removed = 0;
        for (long h = latest; h >= height; h--) {
            ctx.checkActive();
            if (rollback(ctx, h)) {
                removed++;
            }
        }
        return removed;
    }

    private void writePrimary(OperationContext ctx, BlockBundle bundle) {
        ctx.checkActive();
        Block block = bundle.block();
        long height = block.number();
        Optional<StoredBlock> previous = store.loadStored(ctx, height);
        IndexBatch batch;
        try (KeyValueDB.Batch kv = store.db().newBatch()) {
            batch = new IndexBatch(ctx, store.db(), kv);
            KvChainStore.CounterDelta delta = store.stageBlock(ctx, kv, block, bundle.receipts());
            if (previous.isPresent()) {
                for (IndexFamily family : catalog.families()) {
                    family.unstage(batch, previous.get());
                }
            }
            for (IndexFamily family : catalog.mandatory()) {
                ctx.checkActive();
                family.stage(batch, bundle);
            }
            store.stageRawMarker(kv, height);
            ctx.checkActive();
            store.commit(kv, delta, batch::runCommitHooks);
        }
        if (previous.isPresent()) {
            store.rollbackFullWatermark(height);
            LOG.fine(() -> "Re-indexed block " + height + " in place");
        }
        store.markRawIndexed(height);
        reportDecodeFailures(height, batch.decodeFailures());
    }

    private void writeExtended(OperationContext ctx, BlockBundle bundle) {
        ctx.checkActive();
        long height = bundle.height();
        if (!store.hasBlock(ctx, height)) {
            throw new InvalidInputException("block " + height + " has no primary data yet");
        }
        IndexBatch batch;
        try (KeyValueDB.Batch kv = store.db().newBatch()) {
            batch = new IndexBatch(ctx, store.db(), kv);
            for (IndexFamily family : catalog.extended()) {
                ctx.checkActive();
                family.stage(batch, bundle);
            }
            store.stageFullMarker(kv, height);
            ctx.checkActive();
            store.commit(kv, KvChainStore.CounterDelta.NONE, batch::runCommitHooks);
        }
        store.markFullyIndexed(height);
        reportDecodeFailures(height, batch.decodeFailures());
    }

    private Runnable unstageAll(OperationContext ctx, KeyValueDB.Batch kv, StoredBlock stored) {
        IndexBatch batch = new IndexBatch(ctx, store.db(), kv);
        for (IndexFamily family : catalog.families()) {
            family.unstage(batch, stored);
        }
        return batch::runCommitHooks;
    }

    private <T> T guarded(String phase, long height, Supplier<T> work) {
        try {
            return work.get();
        } catch (InvalidInputException | CancelledException e) {
            throw e;
        } catch (IndexerException e) {
            IndexerMetrics.recordIndexFailure(phase);
            LOG.log(Level.WARNING, "Index phase " + phase + " failed for block " + height, e);
            throw e;
        } catch (RuntimeException e) {
            IndexerMetrics.recordIndexFailure(phase);
            LOG.log(Level.WARNING, "Index phase " + phase + " failed for block " + height, e);
            throw new StorageUnavailableException(phase + " indexing of block " + height + " failed", e);
        }
    }

    private static void reportDecodeFailures(long height, List<String> failures) {
        if (failures.isEmpty()) {
            return;
        }
        IndexerMetrics.recordDecodeFailures(failures.size());
        LOG.warning(() -> "Block " + height + ": skipped " + failures.size() + " undecodable item(s), first: " + failures.get(0));
    }

    private void publishCommitted(BlockBundle bundle) {
        if (bus == null) {
            return;
        }
        Block block = bundle.block();
        publish(new BlockEvent(block));
        Map<Hash, Receipt> receipts = bundle.receiptsByTx();
        List<Transaction> txs = block.transactions();
        for (int i = 0; i < txs.size(); i++) {
            Transaction tx = txs.get(i);
            Receipt receipt = receipts.get(tx.hash());
            publish(new TransactionEvent(tx, new TxLocation(block.number(), block.hash(), i), receipt));
            if (receipt != null) {
                for (Log log : receipt.logs()) {
                    publish(new LogEvent(log));
                }
            }
        }
    }

    private void publish(ChainEvent event) {
        if (!bus.publish(event)) {
            LOG.fine(() -> "Event bus refused " + event.type() + " event for block " + event.blockNumber());
        }
    }
}
