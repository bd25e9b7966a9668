package io.indexer.core.query;

import io.indexer.core.OperationContext;
import io.indexer.core.config.IndexerConfig;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.index.BlockBundle;
import io.indexer.core.index.BlockIndexer;
import io.indexer.core.index.IndexCatalog;
import io.indexer.core.index.SystemEventDecoders;
import io.indexer.core.index.TokenTransfer;
import io.indexer.core.index.TransferDirection;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Secp256k1SignerRecovery;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.InMemoryKeyValueDB;
import io.indexer.core.storage.KvChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class QueryEngineTest {
    private static final Address TOKEN = addr(0x50);

    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;
    private IndexCatalog catalog;
    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        store = new KvChainStore(new InMemoryKeyValueDB());
        catalog = IndexCatalog.standard(store, new Secp256k1SignerRecovery(), SystemEventDecoders.initialize(), null);
        engine = new QueryEngine(store, catalog);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void emptyChainYieldsEmptyPages() {
        Connection<Block> blocks = engine.blocks(ctx, BlockFilter.NONE, Pagination.first(10));
        assertTrue(blocks.nodes().isEmpty());
        assertEquals(0L, blocks.totalCount());
        assertFalse(blocks.pageInfo().hasNextPage());

        assertTrue(engine.transactions(ctx, TransactionFilter.NONE, Pagination.first(10)).nodes().isEmpty());
        assertTrue(engine.logs(ctx, LogFilter.NONE, Pagination.first(10)).nodes().isEmpty());
    }

    @Test
    void latestBlocksComeNewestFirst() {
        indexChain(5);

        Connection<Block> page = engine.blocks(ctx, BlockFilter.NONE, Pagination.of(0, 2));
        assertEquals(List.of(4L, 3L), numbers(page));
        assertTrue(page.pageInfo().hasNextPage());
        assertFalse(page.pageInfo().hasPreviousPage());
        assertEquals(5L, page.totalCount());
        assertTrue(page.exactTotalCount());
        assertEquals("4", page.pageInfo().startCursor());
        assertEquals("3", page.pageInfo().endCursor());

        Connection<Block> last = engine.blocks(ctx, BlockFilter.NONE, Pagination.of(4, 2));
        assertEquals(List.of(0L), numbers(last));
        assertFalse(last.pageInfo().hasNextPage());
        assertTrue(last.pageInfo().hasPreviousPage());
    }

    @Test
    void explicitRangePagesOldestFirst() {
        indexChain(5);

        Connection<Block> page = engine.blocks(ctx, BlockFilter.range(1, 3), Pagination.of(0, 2));
        assertEquals(List.of(1L, 2L), numbers(page));
        assertTrue(page.pageInfo().hasNextPage());

        Connection<Block> next = engine.blocks(ctx, BlockFilter.range(1, 3), Pagination.of(2, 2));
        assertEquals(List.of(3L), numbers(next));
        assertFalse(next.pageInfo().hasNextPage());
    }

    @Test
    void invertedBlockRangeIsRejected() {
        indexChain(2);
        assertThrows(InvalidInputException.class, () -> engine.blocks(ctx, BlockFilter.range(3, 1), Pagination.first(10)));
        assertThrows(InvalidInputException.class, () -> engine.transactions(ctx,
                new TransactionFilter(3L, 1L, null, null, null), Pagination.first(10)));
    }

    @Test
    void minerFilterGivesInexactTotal() {
        indexChain(3);
        BlockFilter other = new BlockFilter(null, null, null, null, addr(0x77));
        Connection<Block> page = engine.blocks(ctx, other, Pagination.first(10));
        assertTrue(page.nodes().isEmpty());
        assertEquals(0L, page.totalCount());
        assertFalse(page.exactTotalCount());
    }

    @Test
    void unfilteredTransactionsUseTheAggregateCounter() {
        indexChain(5);

        Connection<TransactionNode> page = engine.transactions(ctx, TransactionFilter.NONE, Pagination.first(3));
        assertEquals(10L, page.totalCount());
        assertTrue(page.exactTotalCount());
        assertEquals(3, page.nodes().size());
        TransactionNode newest = page.nodes().get(0);
        assertEquals(4L, newest.location().blockHeight());
        assertEquals(1, newest.location().txIndex());
        assertEquals(hash("tx-4-1").hex(), page.pageInfo().startCursor());
        assertTrue(page.pageInfo().hasNextPage());
    }

    @Test
    void senderFilterCountsMatches() {
        indexChain(5);

        Connection<TransactionNode> page = engine.transactions(ctx,
                new TransactionFilter(null, null, addr(1), null, null), Pagination.first(10));
        assertEquals(5L, page.totalCount());
        assertTrue(page.exactTotalCount());
        for (TransactionNode n : page.nodes()) {
            assertEquals(addr(1), n.transaction().from());
        }
    }

    @Test
    void wideRangesAreClampedToTheBlockSpan() {
        indexChain(5);
        QueryEngine narrow = new QueryEngine(store, catalog, 1, 10, 100);

        Connection<TransactionNode> page = narrow.transactions(ctx,
                new TransactionFilter(0L, 4L, addr(1), null, null), Pagination.first(10));
        assertEquals(2, page.nodes().size());
        assertEquals(2L, page.totalCount());
        assertFalse(page.exactTotalCount());
    }

    @Test
    void configuredLimitsReachTheEngine() {
        indexChain(5);
        IndexerConfig config = IndexerConfig.defaults().withMaxBlockSpan(1);
        QueryEngine configured = new QueryEngine(store, catalog, config.maxBlockSpan,
                config.defaultPageSize, config.maxPageSize);

        assertEquals(config.defaultPageSize, configured.pagination(0, null).limit());
        assertEquals(config.maxPageSize, configured.pagination(0, Integer.MAX_VALUE).limit());
        Connection<TransactionNode> page = configured.transactions(ctx,
                new TransactionFilter(0L, 4L, addr(1), null, null), configured.pagination(0, null));
        assertEquals(2, page.nodes().size());
        assertFalse(page.exactTotalCount());
    }

    @Test
    void logsFilterByEmitterNewestFirst() {
        indexChain(5);

        Connection<Log> page = engine.logs(ctx, new LogFilter(null, null, Set.of(TOKEN), List.of()), Pagination.first(10));
        assertEquals(2, page.nodes().size());
        assertEquals(4L, page.nodes().get(0).blockNumber());
        assertEquals(2L, page.nodes().get(1).blockNumber());
        assertEquals(hash("tx-4-0").hex() + ":0", page.pageInfo().startCursor());
    }

    @Test
    void addressTransactionsPageThroughTheIndex() {
        indexChain(5);

        Connection<Hash> page = engine.addressTransactions(ctx, addr(1), Pagination.first(2));
        assertEquals(List.of(hash("tx-4-0"), hash("tx-3-0")), page.nodes());
        assertEquals(5L, page.totalCount());
        assertTrue(page.pageInfo().hasNextPage());

        Connection<Hash> tail = engine.addressTransactions(ctx, addr(1), Pagination.of(4, 2));
        assertEquals(List.of(hash("tx-0-0")), tail.nodes());
        assertFalse(tail.pageInfo().hasNextPage());
    }

    @Test
    void tokenTransferTotalIsALowerBound() {
        indexChain(5);

        Connection<TokenTransfer> page = engine.tokenTransfers(ctx, addr(2), TransferDirection.TO, Pagination.first(1));
        assertEquals(1, page.nodes().size());
        assertEquals(4L, page.nodes().get(0).blockNumber());
        assertTrue(page.pageInfo().hasNextPage());
        assertEquals(2L, page.totalCount());
        assertFalse(page.exactTotalCount());
    }

    /** Blocks 0..n-1 with two transactions each. Heights 2 and 4 carry a token transfer in their first transaction. */
    private void indexChain(int n) {
        BlockIndexer indexer = new BlockIndexer(store, catalog, null);
        for (int h = 0; h < n; h++) {
            Transaction t0 = legacyTx("tx-" + h + "-0", addr(1), addr(2), 10);
            Transaction t1 = legacyTx("tx-" + h + "-1", addr(3), addr(4), 10);
            Block b = block(h, List.of(t0, t1));
            List<Log> logs = h % 2 == 0 && h > 0
                    ? List.of(erc20Transfer(TOKEN, addr(1), addr(2), 500, h, t0.hash(), 0, 0))
                    : List.of();
            indexer.index(ctx, new BlockBundle(b, receipts(b, logs)));
        }
    }

    private static List<Long> numbers(Connection<Block> page) {
        return page.nodes().stream().map(Block::number).toList();
    }
}
