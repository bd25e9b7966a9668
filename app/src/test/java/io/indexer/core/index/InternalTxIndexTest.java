package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
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

public class InternalTxIndexTest {
    private static final Address ROUTER = addr(0x40);
    private static final Address POOL = addr(0x41);
    private static final Address VAULT = addr(0x42);

    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;
    private InternalTxIndex internal;
    private BlockIndexer indexer;

    @BeforeEach
    void setUp() {
        store = new KvChainStore(new InMemoryKeyValueDB());
        internal = new InternalTxIndex(store.db());
        indexer = new BlockIndexer(store, new IndexCatalog(List.of(new AddressIndex(store.db()), internal)), null);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void nestedFramesAreKeyedByTransactionAndCallIndex() {
        Transaction tx = indexSwap(0, "swap-0");

        List<InternalTransaction> calls = internal.getInternalTransactions(ctx, tx.hash());
        assertEquals(List.of(0, 1, 2), calls.stream().map(InternalTransaction::index).toList());

        InternalTransaction first = calls.get(0);
        assertEquals("CALL", first.type());
        assertEquals(ROUTER, first.from());
        assertEquals(POOL, first.to());
        assertEquals(BigInteger.valueOf(40), first.value());
        assertEquals(1, first.depth());
        assertEquals(0L, first.blockNumber());

        assertEquals("CREATE", calls.get(1).type());
        assertNull(calls.get(1).to());
        assertEquals("execution reverted", calls.get(2).error());
    }

    @Test
    void transactionWithoutTraceHasNoInternalCalls() {
        Transaction tx = legacyTx("plain", addr(1), addr(2), 1);
        indexer.index(ctx, bundle(block(0, List.of(tx))));

        assertTrue(internal.getInternalTransactions(ctx, tx.hash()).isEmpty());
        assertEquals(0L, internal.countInternalTransactions(ctx, addr(1), true));
    }

    @Test
    void addressBucketsSeparateSendersFromReceivers() {
        indexSwap(0, "swap-0");

        assertEquals(2L, internal.countInternalTransactions(ctx, ROUTER, true));
        assertEquals(0L, internal.countInternalTransactions(ctx, ROUTER, false));
        assertEquals(1L, internal.countInternalTransactions(ctx, POOL, false));
        assertEquals(1L, internal.countInternalTransactions(ctx, POOL, true));
        assertEquals(1L, internal.countInternalTransactions(ctx, VAULT, false));
    }

    @Test
    void addressPagesRunAcrossHeights() {
        indexSwap(0, "swap-0");
        Transaction later = indexSwap(1, "swap-1");

        List<InternalTransaction> newest = internal.getInternalTransactionsByAddress(ctx, ROUTER, true, PageRequest.newestFirst(0, 1));
        assertEquals(1, newest.size());
        assertEquals(later.hash(), newest.get(0).txHash());

        List<InternalTransaction> all = internal.getInternalTransactionsByAddress(ctx, ROUTER, true, PageRequest.oldestFirst(0, 10));
        assertEquals(List.of(0L, 0L, 1L, 1L), all.stream().map(InternalTransaction::blockNumber).toList());
        assertEquals(4L, internal.countInternalTransactions(ctx, ROUTER, true));
    }

    @Test
    void rollbackRemovesTheHeightsCalls() {
        indexSwap(0, "swap-0");
        Transaction later = indexSwap(1, "swap-1");

        assertTrue(indexer.rollback(ctx, 1));

        assertTrue(internal.getInternalTransactions(ctx, later.hash()).isEmpty());
        assertEquals(2L, internal.countInternalTransactions(ctx, ROUTER, true));
        assertEquals(1L, internal.countInternalTransactions(ctx, VAULT, false));
    }

    /** A router call fanning out to a pool transfer, a failed deployment and a reverted vault call. */
    private Transaction indexSwap(long height, String seed) {
        Transaction tx = legacyTx(seed, addr(1), ROUTER, 0);
        Block b = block(height, List.of(tx));
        Map<Hash, List<InternalCall>> traces = Map.of(tx.hash(), List.of(
                new InternalCall("CALL", addr(1), ROUTER, BigInteger.ZERO, 100_000, 80_000, 0, null),
                new InternalCall("CALL", ROUTER, POOL, BigInteger.valueOf(40), 50_000, 30_000, 1, null),
                new InternalCall("CREATE", ROUTER, null, BigInteger.ZERO, 20_000, 20_000, 1, "out of gas"),
                new InternalCall("CALL", POOL, VAULT, BigInteger.ONE, 10_000, 2_000, 2, "execution reverted")));
        indexer.index(ctx, new BlockBundle(b, receipts(b, List.of()), traces));
        return tx;
    }
}
