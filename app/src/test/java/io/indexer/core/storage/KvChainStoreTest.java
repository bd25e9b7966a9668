package io.indexer.core.storage;

import io.indexer.core.OperationContext;
import io.indexer.core.error.CancelledException;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.error.ReadOnlyStoreException;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class KvChainStoreTest {
    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;

    @BeforeEach
    void open() {
        store = new KvChainStore(new InMemoryKeyValueDB());
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void emptyStoreHasNoLatestHeight() {
        assertThrows(NotFoundException.class, () -> store.getLatestHeight(ctx));
        assertEquals(0L, store.getBlockCount(ctx));
        assertEquals(-1L, store.getFullyIndexedHeight(ctx));
    }

    @Test
    void blockRoundTripsByHeightAndHash() {
        Block b = block(0, List.of(legacyTx("tx-0", addr(1), addr(2), 5)));
        store.setBlockWithReceipts(ctx, b, receipts(b, List.of()));

        Block byHeight = store.getBlock(ctx, 0);
        assertEquals(b, byHeight);
        assertEquals(b.timestamp(), byHeight.timestamp());
        assertEquals(1, byHeight.transactions().size());
        assertEquals(hash("tx-0"), byHeight.transactions().get(0).hash());
        assertEquals(b, store.getBlockByHash(ctx, b.hash()));
        assertTrue(store.hasBlock(ctx, 0));
        assertTrue(store.hasTransaction(ctx, hash("tx-0")));
        assertTrue(store.hasReceipt(ctx, hash("tx-0")));
    }

    @Test
    void transactionLookupCarriesItsLocation() {
        Block b = block(3, List.of(legacyTx("a", addr(1), addr(2), 1), legacyTx("b", addr(1), addr(3), 1)));
        store.setBlock(ctx, b);

        LocatedTransaction located = store.getTransaction(ctx, hash("b"));
        assertEquals(3L, located.location().blockHeight());
        assertEquals(1, located.location().txIndex());
        assertEquals(b.hash(), located.location().blockHash());
    }

    @Test
    void batchedLookupPreservesOrderAndMarksMissingSlots() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1), legacyTx("b", addr(1), addr(3), 1)));
        store.setBlock(ctx, b);

        List<Optional<LocatedTransaction>> out = store.getTransactions(ctx, List.of(hash("b"), hash("missing"), hash("a")));
        assertEquals(3, out.size());
        assertEquals(hash("b"), out.get(0).orElseThrow().transaction().hash());
        assertTrue(out.get(1).isEmpty());
        assertEquals(hash("a"), out.get(2).orElseThrow().transaction().hash());
    }

    @Test
    void receiptsCarryDerivedGasAndPrice() {
        Transaction first = dynamicFeeTx("first", addr(1), addr(2), 20, 110);
        Transaction second = dynamicFeeTx("second", addr(1), addr(2), 20, 200);
        Block b = block(0, List.of(first, second));
        List<Receipt> raw = List.of(
                receipt(b, 0, Receipt.STATUS_SUCCESS, 21_000, List.of()),
                receipt(b, 1, Receipt.STATUS_SUCCESS, 51_000, List.of()));
        store.setBlockWithReceipts(ctx, b, raw);

        Receipt r0 = store.getReceipt(ctx, first.hash());
        assertEquals(21_000L, r0.gasUsed());
        assertEquals(BigInteger.valueOf(110), r0.effectiveGasPrice());

        Receipt r1 = store.getReceipt(ctx, second.hash());
        assertEquals(30_000L, r1.gasUsed());
        assertEquals(BigInteger.valueOf(120), r1.effectiveGasPrice());

        List<Receipt> byBlock = store.getReceiptsByBlockNumber(ctx, 0);
        assertEquals(2, byBlock.size());
        assertEquals(21_000L, byBlock.get(0).gasUsed());
        assertEquals(30_000L, byBlock.get(1).gasUsed());
    }

    @Test
    void blocksReturnsAscendingInclusiveRangeSkippingGaps() {
        store.setBlock(ctx, emptyBlock(0));
        store.setBlock(ctx, emptyBlock(1));
        store.setBlock(ctx, emptyBlock(3));

        List<Block> blocks = store.getBlocks(ctx, 0, 3);
        assertEquals(List.of(0L, 1L, 3L), blocks.stream().map(Block::number).toList());
    }

    @Test
    void plainWritesDoNotAdvanceTheWatermarks() {
        InMemoryKeyValueDB db = new InMemoryKeyValueDB();
        KvChainStore writer = new KvChainStore(db);
        writer.setBlock(ctx, emptyBlock(0));
        writer.setBlock(ctx, emptyBlock(1));

        assertThrows(NotFoundException.class, () -> writer.getLatestHeight(ctx));
        assertEquals(-1L, writer.getFullyIndexedHeight(ctx));

        KvChainStore reopened = new KvChainStore(db);
        assertThrows(NotFoundException.class, () -> reopened.getLatestHeight(ctx));
        assertTrue(reopened.hasBlock(ctx, 1));
    }

    @Test
    void rawMarkerDrivesTheWatermarkOnReopen() {
        InMemoryKeyValueDB db = new InMemoryKeyValueDB();
        KvChainStore writer = new KvChainStore(db);
        for (long h = 0; h < 3; h++) {
            try (KeyValueDB.Batch batch = db.newBatch()) {
                KvChainStore.CounterDelta delta = writer.stageBlock(ctx, batch, emptyBlock(h), List.of());
                if (h != 1) {
                    writer.stageRawMarker(batch, h);
                }
                writer.commit(batch, delta);
            }
        }

        assertEquals(0L, new KvChainStore(db).getLatestHeight(ctx));
    }

    @Test
    void upsertDoesNotDoubleCount() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1)));
        store.setBlock(ctx, b);
        store.setBlock(ctx, b);

        assertEquals(1L, store.getBlockCount(ctx));
        assertEquals(1L, store.getTransactionCount(ctx));
    }

    @Test
    void reUpsertingTheSameBlockKeepsItsReceipts() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1)));
        Log log = log(addr(9), List.of(hash("topic")), new byte[0], 0, hash("a"), 0, 0);
        store.setBlockWithReceipts(ctx, b, receipts(b, List.of(log)));

        store.setBlock(ctx, b);

        assertTrue(store.hasReceipt(ctx, hash("a")));
        assertEquals(1, store.getLogsByBlock(ctx, 0).size());
        assertEquals(1, store.getReceiptsByBlockNumber(ctx, 0).size());
    }

    @Test
    void replacingABlockDropsReceiptsOfTransactionsThatLeft() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1)));
        store.setBlockWithReceipts(ctx, b, receipts(b, List.of()));

        Block replacement = block(0, List.of(legacyTx("b", addr(1), addr(3), 1)));
        store.setBlock(ctx, replacement);

        assertFalse(store.hasReceipt(ctx, hash("a")));
        assertFalse(store.hasTransaction(ctx, hash("a")));
        assertTrue(store.hasTransaction(ctx, hash("b")));
        assertEquals(1L, store.getTransactionCount(ctx));
    }

    @Test
    void concurrentWritesOfOneTransactionCountItOnce() throws Exception {
        Transaction tx = legacyTx("shared", addr(1), addr(2), 1);
        TxLocation location = new TxLocation(0, hash("block-0"), 0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> writes = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                writes.add(pool.submit(() -> {
                    start.await();
                    store.setTransaction(ctx, tx, location);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : writes) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1L, store.getTransactionCount(ctx));
    }

    @Test
    void deleteRemovesBlockHashMappingAndCounters() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1)));
        Log log = log(addr(9), List.of(hash("topic")), new byte[0], 0, hash("a"), 0, 0);
        store.setBlockWithReceipts(ctx, b, receipts(b, List.of(log)));
        assertEquals(1, store.getLogsByBlock(ctx, 0).size());

        store.deleteBlock(ctx, 0);

        assertThrows(NotFoundException.class, () -> store.getBlock(ctx, 0));
        assertThrows(NotFoundException.class, () -> store.getBlockByHash(ctx, b.hash()));
        assertThrows(NotFoundException.class, () -> store.getTransaction(ctx, hash("a")));
        assertThrows(NotFoundException.class, () -> store.getReceipt(ctx, hash("a")));
        assertTrue(store.getLogsByBlock(ctx, 0).isEmpty());
        assertEquals(0L, store.getBlockCount(ctx));
        assertEquals(0L, store.getTransactionCount(ctx));
        assertThrows(NotFoundException.class, () -> store.getLatestHeight(ctx));
    }

    @Test
    void logsScanInHeightOrder() {
        for (long h = 0; h < 3; h++) {
            Hash tx = hash("tx-" + h);
            Block b = block(h, List.of(legacyTx("tx-" + h, addr(1), addr(2), 0)));
            store.setBlockWithReceipts(ctx, b, receipts(b, List.of(
                    log(addr(9), List.of(), new byte[0], h, tx, 0, 0),
                    log(addr(9), List.of(), new byte[0], h, tx, 0, 1))));
        }
        List<Log> seen = new ArrayList<>();
        store.scanLogs(ctx, 1, 2, seen::add);

        assertEquals(4, seen.size());
        assertEquals(1L, seen.get(0).blockNumber());
        assertEquals(1, seen.get(1).logIndex());
        assertEquals(2L, seen.get(3).blockNumber());
        assertTrue(store.getLog(ctx, 2, 0, 1).isPresent());
        assertTrue(store.getLog(ctx, 2, 0, 2).isEmpty());
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(InvalidInputException.class, () -> store.getBlock(ctx, -1));
        assertThrows(InvalidInputException.class, () -> store.getBlocks(ctx, 5, 4));

        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1)));
        Receipt bad = new Receipt(hash("a"), 7, 21_000, 0, null, null, null, List.of(), 0, b.hash(), 0);
        assertThrows(InvalidInputException.class, () -> store.setBlockWithReceipts(ctx, b, List.of(bad)));
        assertFalse(store.hasBlock(ctx, 0));
    }

    @Test
    void cancelledContextStopsReads() {
        store.setBlock(ctx, emptyBlock(0));
        OperationContext cancelled = OperationContext.cancellable();
        cancelled.cancel();
        assertThrows(CancelledException.class, () -> store.getBlock(cancelled, 0));
    }

    @Test
    void readOnlyStoreRejectsWrites() {
        KvChainStore readOnly = new KvChainStore(new InMemoryKeyValueDB(true));
        try {
            assertThrows(ReadOnlyStoreException.class, () -> readOnly.setBlock(ctx, emptyBlock(0)));
        } finally {
            readOnly.close();
        }
    }
}
