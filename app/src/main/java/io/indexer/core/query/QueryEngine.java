package io.indexer.core.query;

import io.indexer.core.OperationContext;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.index.AddressIndexReader;
import io.indexer.core.index.IndexCatalog;
import io.indexer.core.index.LogIndexReader;
import io.indexer.core.index.LogQuery;
import io.indexer.core.index.PageRequest;
import io.indexer.core.index.TokenIndexReader;
import io.indexer.core.index.TokenTransfer;
import io.indexer.core.index.TransferDirection;
import io.indexer.core.metrics.QueryMetrics;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;
import io.indexer.core.storage.KvChainStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Query & Pagination Engine: connection-shaped pages over blocks, transactions, logs and the
 * per-address indexes.
 *
 * <p>Every query reads the latest height once and does all range math against that value, so a
 * store advancing underneath cannot make one page inconsistent with itself. Transaction and log
 * scans cover at most {@code maxBlockSpan + 1} heights.
 */
public final class QueryEngine {
    private static final Logger LOG = Logger.getLogger(QueryEngine.class.getName());
    public static final int DEFAULT_MAX_BLOCK_SPAN = 1000;

    private final KvChainStore store;
    private final IndexCatalog catalog;
    private final int maxBlockSpan;
    private final int defaultLimit;
    private final int maxLimit;

    public QueryEngine(KvChainStore store, IndexCatalog catalog) {
        this(store, catalog, DEFAULT_MAX_BLOCK_SPAN, Pagination.DEFAULT_LIMIT, Pagination.DEFAULT_MAX_LIMIT);
    }

    public QueryEngine(KvChainStore store, IndexCatalog catalog, int maxBlockSpan, int defaultLimit, int maxLimit) {
        if (maxBlockSpan <= 0 || defaultLimit <= 0 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException("invalid query limits: span=" + maxBlockSpan
                    + " default=" + defaultLimit + " max=" + maxLimit);
        }
        this.store = store;
        this.catalog = catalog;
        this.maxBlockSpan = maxBlockSpan;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /** Normalizes raw caller input with this engine's default and maximum page sizes. */
    public Pagination pagination(Integer offset, Integer limit) {
        return Pagination.of(offset, limit, defaultLimit, maxLimit);
    }

    // -------------- blocks ----------------

    public Connection<Block> blocks(OperationContext ctx, BlockFilter filter, Pagination page) {
        return timed("blocks", () -> {
            Pagination p = cap(page);
            long latest;
            try {
                latest = store.getLatestHeight(ctx);
            } catch (NotFoundException e) {
                return Connection.empty(false);
            }
            // decided before the range is defaulted below
            boolean userRequestedRange = filter.hasNumberFilter();
            long numberFrom = filter.numberFrom() == null ? 0 : filter.numberFrom();
            long numberTo = userRequestedRange && filter.numberTo() != null ? filter.numberTo() : latest;
            if (numberFrom < 0 || numberFrom > numberTo) {
                throw new InvalidInputException("invalid block range: numberFrom (" + numberFrom
                        + ") > numberTo (" + numberTo + ")");
            }

            var range = userRequestedRange
                    ? BlockRange.forward(numberFrom, numberTo, p.offset(), p.limit())
                    : BlockRange.reverse(latest, p.offset(), p.limit());
            if (range.isEmpty()) {
                return Connection.empty(p.offset() > 0);
            }
            BlockRange r = range.get();
            List<Block> blocks = new ArrayList<>();
            for (Block b : store.getBlocks(ctx, r.startBlock(), r.endBlock())) {
                if (filter.matches(b)) {
                    blocks.add(b);
                }
            }
            if (!userRequestedRange) {
                Collections.reverse(blocks);
            }

            long total;
            boolean exact;
            if (filter.hasTimestampFilter() || filter.hasMinerFilter()) {
                total = blocks.size();
                exact = false;
            } else {
                total = store.getBlockCount(ctx);
                exact = true;
            }
            return Connection.of(blocks, total, exact, r.hasNextPage(), r.hasPreviousPage(),
                    b -> Long.toString(b.number()));
        });
    }

    // -------------- transactions ----------------

    public Connection<TransactionNode> transactions(OperationContext ctx, TransactionFilter filter, Pagination page) {
        return timed("transactions", () -> {
            Pagination p = cap(page);
            long latest;
            try {
                latest = store.getLatestHeight(ctx);
            } catch (NotFoundException e) {
                return Connection.empty(false);
            }
            ScanWindow w = normalize(filter.blockFrom(), filter.blockTo(), latest);
            List<TransactionNode> matches = new ArrayList<>();
            if (!w.isEmpty()) {
                for (Block block : store.getBlocks(ctx, w.from(), w.to())) {
                    List<Transaction> txs = block.transactions();
                    for (int i = 0; i < txs.size(); i++) {
                        Transaction tx = txs.get(i);
                        if (filter.matches(tx)) {
                            matches.add(new TransactionNode(tx, new TxLocation(block.number(), block.hash(), i), block.timestamp()));
                        }
                    }
                }
            }
            Collections.reverse(matches);

            long total;
            boolean exact;
            if (!filter.hasAddressFilter() && filter.type() == null && !filter.hasRange()) {
                total = store.getTransactionCount(ctx);
                exact = true;
            } else {
                total = matches.size();
                exact = !w.clamped();
            }
            return slice(matches, total, exact, p, n -> n.transaction().hash().hex());
        });
    }

    // -------------- logs ----------------

    public Connection<Log> logs(OperationContext ctx, LogFilter filter, Pagination page) {
        return timed("logs", () -> {
            Pagination p = cap(page);
            long latest;
            try {
                latest = store.getLatestHeight(ctx);
            } catch (NotFoundException e) {
                return Connection.empty(false);
            }
            ScanWindow w = normalize(filter.blockFrom(), filter.blockTo(), latest);
            List<Log> matches = w.isEmpty()
                    ? new ArrayList<>()
                    : new ArrayList<>(catalog.require(LogIndexReader.class)
                            .getLogs(ctx, new LogQuery(w.from(), w.to(), filter.addresses(), filter.topics())));
            Collections.reverse(matches);
            return slice(matches, matches.size(), !w.clamped(), p, QueryEngine::logCursor);
        });
    }

    // -------------- address-scoped ----------------

    /** Transaction hashes touching an address, newest first. The total comes from the index count. */
    public Connection<Hash> addressTransactions(OperationContext ctx, Address address, Pagination page) {
        return timed("addressTransactions", () -> {
            Pagination p = cap(page);
            AddressIndexReader reader = catalog.require(AddressIndexReader.class);
            List<Hash> hashes = new ArrayList<>(reader.getAddressTransactions(ctx, address,
                    PageRequest.newestFirst(p.offset(), p.limit() + 1)));
            boolean hasMore = hashes.size() > p.limit();
            if (hasMore) {
                hashes = hashes.subList(0, p.limit());
            }
            long total = reader.getAddressTransactionCount(ctx, address);
            return Connection.of(hashes, total, true, hasMore, p.offset() > 0, Hash::hex);
        });
    }

    /**
     * Token transfers touching an address, newest first. No per-address transfer counter exists, so
     * the total is the lower bound {@code offset + returned (+1 when more remain)}.
     */
    public Connection<TokenTransfer> tokenTransfers(OperationContext ctx, Address address, TransferDirection direction,
                                                    Pagination page) {
        return timed("tokenTransfers", () -> {
            Pagination p = cap(page);
            TokenIndexReader reader = catalog.require(TokenIndexReader.class);
            List<TokenTransfer> transfers = new ArrayList<>(reader.getTokenTransfersByAddress(ctx, address, direction,
                    PageRequest.newestFirst(p.offset(), p.limit() + 1)));
            boolean hasMore = transfers.size() > p.limit();
            if (hasMore) {
                transfers = transfers.subList(0, p.limit());
            }
            long lowerBound = (long) p.offset() + transfers.size() + (hasMore ? 1 : 0);
            return Connection.of(transfers, lowerBound, false, hasMore, p.offset() > 0,
                    t -> t.txHash().hex() + ":" + t.logIndex());
        });
    }

    // -------------- helpers ----------------

    /** Inclusive scan window; {@code clamped} is set when the span limit cut it short. */
    private record ScanWindow(long from, long to, boolean clamped) {
        boolean isEmpty() {
            return from > to;
        }
    }

    private ScanWindow normalize(Long blockFrom, Long blockTo, long latest) {
        long from = blockFrom == null ? 0 : blockFrom;
        if (from < 0) {
            throw new InvalidInputException("blockNumberFrom must be >= 0: " + from);
        }
        if (blockTo != null && from > blockTo) {
            throw new InvalidInputException("invalid block range: blockNumberFrom (" + from
                    + ") > blockNumberTo (" + blockTo + ")");
        }
        // a window starting above the latest height is empty
        long to = Math.min(blockTo == null ? latest : blockTo, latest);
        boolean clamped = false;
        if (to - from > maxBlockSpan) {
            long requested = to;
            to = from + maxBlockSpan;
            clamped = true;
            long cut = to;
            LOG.fine(() -> "Block range " + from + ".." + requested + " clamped to " + from + ".." + cut);
        }
        return new ScanWindow(from, to, clamped);
    }

    private Pagination cap(Pagination page) {
        return page.limit() > maxLimit ? new Pagination(page.offset(), maxLimit) : page;
    }

    private static <T> Connection<T> slice(List<T> all, long total, boolean exact, Pagination p,
                                           Function<T, String> cursor) {
        int from = (int) Math.min(p.offset(), all.size());
        int to = (int) Math.min((long) p.offset() + p.limit(), all.size());
        return Connection.of(all.subList(from, to), total, exact, to < all.size(), p.offset() > 0, cursor);
    }

    static String logCursor(Log log) {
        return log.txHash().hex() + ":" + log.logIndex();
    }

    private static <T> T timed(String operation, Supplier<T> work) {
        var sample = QueryMetrics.start();
        String outcome = "error";
        try {
            T result = work.get();
            outcome = "ok";
            return result;
        } finally {
            QueryMetrics.stop(sample, operation, outcome);
        }
    }
}
