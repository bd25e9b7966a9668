package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.InMemoryKeyValueDB;
import io.indexer.core.storage.KvChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class BalanceIndexTest {
    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;
    private BalanceIndex balances;
    private BlockIndexer indexer;

    @BeforeEach
    void setUp() {
        store = new KvChainStore(new InMemoryKeyValueDB());
        balances = new BalanceIndex(store.db());
        indexer = new BlockIndexer(store, new IndexCatalog(List.of(new AddressIndex(store.db()), balances)), null);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void legacyTransferChargesFeesAndMovesValue() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1000)));
        Map<Address, BigInteger> deltas = BalanceIndex.deltas(new BlockBundle(b, receipts(b, List.of())));

        // 21000 gas at 150, of which 100 is burned
        assertEquals(BigInteger.valueOf(-21_000L * 150 - 1000), deltas.get(addr(1)));
        assertEquals(BigInteger.valueOf(1000), deltas.get(addr(2)));
        assertEquals(BigInteger.valueOf(21_000L * 50), deltas.get(MINER));
    }

    @Test
    void dynamicFeeUsesTheEffectivePriceAndCumulativeGas() {
        Block b = block(0, List.of(
                legacyTx("a", addr(1), addr(2), 0),
                dynamicFeeTx("b", addr(3), addr(4), 20, 200)));
        Map<Address, BigInteger> deltas = BalanceIndex.deltas(new BlockBundle(b, receipts(b, List.of())));

        // second receipt has cumulative 42000, so it used 21000 at min(100 + 20, 200)
        assertEquals(BigInteger.valueOf(-21_000L * 120), deltas.get(addr(3)));
        assertNull(deltas.get(addr(4)));
        assertEquals(BigInteger.valueOf(21_000L * 50 + 21_000L * 20), deltas.get(MINER));
    }

    @Test
    void failedTransactionStillPaysForGas() {
        Block b = block(0, List.of(legacyTx("a", addr(1), addr(2), 1000)));
        Receipt failed = receipt(b, 0, Receipt.STATUS_FAILED, 21_000, List.of());
        Map<Address, BigInteger> deltas = BalanceIndex.deltas(new BlockBundle(b, List.of(failed)));

        assertEquals(BigInteger.valueOf(-21_000L * 150), deltas.get(addr(1)));
        assertNull(deltas.get(addr(2)));
    }

    @Test
    void feePayerCoversGasForDelegatedTransactions() {
        Transaction tx = legacyTx("a", addr(1), addr(2), 10).toBuilder().feePayer(addr(9)).build();
        Block b = block(0, List.of(tx));
        Map<Address, BigInteger> deltas = BalanceIndex.deltas(new BlockBundle(b, receipts(b, List.of())));

        assertEquals(BigInteger.valueOf(-21_000L * 150), deltas.get(addr(9)));
        assertEquals(BigInteger.valueOf(-10), deltas.get(addr(1)));
    }

    @Test
    void successfulNestedCallsMoveValue() {
        Transaction tx = legacyTx("a", addr(1), addr(2), 0);
        Block b = block(0, List.of(tx));
        List<InternalCall> trace = List.of(
                new InternalCall("CALL", addr(1), addr(2), BigInteger.ZERO, 21_000, 21_000, 0, null),
                new InternalCall("CALL", addr(2), addr(5), BigInteger.valueOf(40), 5_000, 100, 1, null),
                new InternalCall("CALL", addr(2), addr(6), BigInteger.valueOf(7), 5_000, 100, 1, "execution reverted"));
        Map<Address, BigInteger> deltas = BalanceIndex.deltas(
                new BlockBundle(b, receipts(b, List.of()), Map.of(tx.hash(), trace)));

        assertEquals(BigInteger.valueOf(-40), deltas.get(addr(2)));
        assertEquals(BigInteger.valueOf(40), deltas.get(addr(5)));
        assertNull(deltas.get(addr(6)));
    }

    @Test
    void balancesAccumulateAcrossIndexedBlocks() {
        for (long h = 0; h < 3; h++) {
            Block b = block(h, List.of(legacyTx("tx-" + h, addr(1), addr(2), 1000)));
            indexer.index(ctx, new BlockBundle(b, receipts(b, List.of())));
        }

        assertEquals(BigInteger.valueOf(2000), balances.getBalanceAt(ctx, addr(2), 1));
        assertEquals(BigInteger.valueOf(3000), balances.getBalanceAt(ctx, addr(2), 10));

        List<BalanceChange> history = balances.getBalanceHistory(ctx, addr(2), 1, 2, PageRequest.oldestFirst(0, 10));
        assertEquals(List.of(1L, 2L), history.stream().map(BalanceChange::blockNumber).toList());
        assertEquals(BigInteger.valueOf(2000), history.get(0).balance());
        assertEquals(BigInteger.valueOf(3000), history.get(1).balance());

        List<BalanceChange> newest = balances.getBalanceHistory(ctx, addr(2), 0, 2, PageRequest.newestFirst(0, 1));
        assertEquals(2L, newest.get(0).blockNumber());
    }

    @Test
    void snapshotAnchorsLaterReads() {
        for (long h = 0; h < 3; h++) {
            Block b = block(h, List.of(legacyTx("tx-" + h, addr(1), addr(2), 1000)));
            indexer.index(ctx, new BlockBundle(b, receipts(b, List.of())));
        }
        balances.setBalanceSnapshot(ctx, addr(2), 1, BigInteger.valueOf(50_000));

        assertEquals(BigInteger.valueOf(50_000), balances.getBalanceAt(ctx, addr(2), 1));
        assertEquals(BigInteger.valueOf(51_000), balances.getBalanceAt(ctx, addr(2), 2));
        assertEquals(BigInteger.valueOf(1000), balances.getBalanceAt(ctx, addr(2), 0));
    }

    @Test
    void rollbackRemovesTheBlocksDeltas() {
        for (long h = 0; h < 2; h++) {
            Block b = block(h, List.of(legacyTx("tx-" + h, addr(1), addr(2), 1000)));
            indexer.index(ctx, new BlockBundle(b, receipts(b, List.of())));
        }
        assertTrue(indexer.rollback(ctx, 1));
        assertEquals(BigInteger.valueOf(1000), balances.getBalanceAt(ctx, addr(2), 5));
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(InvalidInputException.class, () -> balances.getBalanceAt(ctx, addr(1), -1));
        assertThrows(InvalidInputException.class, () -> balances.setBalanceSnapshot(ctx, addr(1), 0, BigInteger.valueOf(-1)));
        assertThrows(InvalidInputException.class, () ->
                balances.getBalanceHistory(ctx, addr(1), 5, 4, PageRequest.oldestFirst(0, 10)));
    }
}
