package io.indexer.core.storage;

import io.indexer.core.OperationContext;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.error.StorageUnavailableException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.BinaryReader;
import io.indexer.core.protocol.BinaryWriter;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.BlockCodec;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Log;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.ReceiptCodec;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TransactionCodec;
import io.indexer.core.protocol.TxLocation;

import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Chain Data Store on top of a {@link KeyValueDB}.
 *
 * Layout is described in {@link Keys}. Besides the public contract it exposes a staging API so the
 * index maintainer can put primary and secondary records into one batch.
 */
public final class KvChainStore implements ChainStore {
    private static final Logger LOG = Logger.getLogger(KvChainStore.class.getName());

    private final KeyValueDB db;
    private final ExecutorService lookupPool;
    private final ReentrantLock counterLock = new ReentrantLock();
    private final HeightWatermark rawWatermark;
    private final HeightWatermark fullWatermark;
    private volatile DerivedRecords derived = DerivedRecords.NONE;

    public KvChainStore(KeyValueDB db) {
        this(db, 4);
    }

    public KvChainStore(KeyValueDB db, int lookupThreads) {
        this.db = db;
        AtomicInteger seq = new AtomicInteger();
        this.lookupPool = Executors.newFixedThreadPool(Math.max(1, lookupThreads), r -> {
            Thread t = new Thread(r, "chain-indexer-lookup-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.rawWatermark = new HeightWatermark(db, Keys.RAW_WATERMARK, h -> db.get(Column.META, Keys.rawMarker(h)) != null);
        this.fullWatermark = new HeightWatermark(db, Keys.FULL_WATERMARK, h -> db.get(Column.META, Keys.fullMarker(h)) != null);
    }

    public KeyValueDB db() {
        return db;
    }

    /** Routes store-level deletes and replacements through the given secondary-record cleanup. */
    public void attachDerivedRecords(DerivedRecords derived) {
        this.derived = derived == null ? DerivedRecords.NONE : derived;
    }

    // -------------- reads ----------------

    @Override
    public long getLatestHeight(OperationContext ctx) {
        ctx.checkActive();
        long h = rawWatermark.get();
        if (h == HeightWatermark.EMPTY) {
            throw new NotFoundException("no blocks indexed");
        }
        return h;
    }

    /** Highest contiguous height whose secondary indexes are all written, or -1. */
    public long getFullyIndexedHeight(OperationContext ctx) {
        ctx.checkActive();
        return fullWatermark.get();
    }

    @Override
    public Block getBlock(OperationContext ctx, long height) {
        ctx.checkActive();
        checkHeight(height);
        return readBlock(height).orElseThrow(() -> new NotFoundException("block " + height + " not found"));
    }

    @Override
    public Block getBlockByHash(OperationContext ctx, Hash hash) {
        ctx.checkActive();
        byte[] h = db.get(Column.CHAIN, Keys.blockHash(hash));
        if (h == null) {
            throw new NotFoundException("block " + hash + " not found");
        }
        return getBlock(ctx, Keys.bytesToLong(h));
    }

    @Override
    public List<Block> getBlocks(OperationContext ctx, long startHeight, long endHeight) {
        checkRange(startHeight, endHeight);
        List<Block> out = new ArrayList<>();
        for (long h = startHeight; h <= endHeight; h++) {
            ctx.checkActive();
            readBlock(h).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public LocatedTransaction getTransaction(OperationContext ctx, Hash txHash) {
        ctx.checkActive();
        return readTransaction(txHash).orElseThrow(() -> new NotFoundException("transaction " + txHash + " not found"));
    }

    @Override
    public List<Optional<LocatedTransaction>> getTransactions(OperationContext ctx, List<Hash> txHashes) {
        ctx.checkActive();
        List<CompletableFuture<Optional<LocatedTransaction>>> futures = new ArrayList<>(txHashes.size());
        for (Hash hash : txHashes) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                ctx.checkActive();
                return readTransaction(hash);
            }, lookupPool));
        }
        List<Optional<LocatedTransaction>> out = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<Optional<LocatedTransaction>> f : futures) {
                out.add(f.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new StorageUnavailableException("batched transaction lookup failed", e.getCause());
        }
        return out;
    }

    @Override
    public List<Transaction> getTransactionsByBlock(OperationContext ctx, long height) {
        ctx.checkActive();
        checkHeight(height);
        if (!hasBlock(ctx, height)) {
            throw new NotFoundException("block " + height + " not found");
        }
        return readTransactions(height);
    }

    @Override
    public Receipt getReceipt(OperationContext ctx, Hash txHash) {
        ctx.checkActive();
        Receipt raw = readReceipt(txHash).orElseThrow(() -> new NotFoundException("receipt " + txHash + " not found"));
        Optional<LocatedTransaction> located = readTransaction(txHash);
        if (located.isEmpty()) {
            return raw;
        }
        TxLocation loc = located.get().location();
        long previousCumulative = -1L;
        if (loc.txIndex() > 0) {
            Optional<Receipt> prev = readTransactionAt(loc.blockHeight(), loc.txIndex() - 1)
                    .flatMap(tx -> readReceipt(tx.hash()));
            if (prev.isEmpty()) {
                // cannot derive without the predecessor; report what the source gave
                return raw;
            }
            previousCumulative = prev.get().cumulativeGasUsed();
        }
        BigInteger baseFee = readBlockHeader(loc.blockHeight()).flatMap(h -> h.headerOnly().baseFee()).orElse(null);
        return derive(raw, located.get().transaction(), previousCumulative, baseFee);
    }

    @Override
    public List<Receipt> getReceiptsByBlockNumber(OperationContext ctx, long height) {
        ctx.checkActive();
        Block block = getBlock(ctx, height);
        BigInteger baseFee = block.baseFee().orElse(null);
        List<Receipt> out = new ArrayList<>(block.transactions().size());
        long previousCumulative = -1L;
        boolean chainIntact = true;
        for (Transaction tx : block.transactions()) {
            ctx.checkActive();
            Optional<Receipt> raw = readReceipt(tx.hash());
            if (raw.isEmpty()) {
                chainIntact = false;
                continue;
            }
            Receipt r = raw.get();
            out.add(chainIntact ? derive(r, tx, previousCumulative, baseFee) : r);
            previousCumulative = r.cumulativeGasUsed();
            chainIntact = true;
        }
        return out;
    }

    @Override
    public boolean hasBlock(OperationContext ctx, long height) {
        ctx.checkActive();
        return height >= 0 && db.get(Column.CHAIN, Keys.block(height)) != null;
    }

    @Override
    public boolean hasTransaction(OperationContext ctx, Hash txHash) {
        ctx.checkActive();
        return db.get(Column.CHAIN, Keys.txLocation(txHash)) != null;
    }

    @Override
    public boolean hasReceipt(OperationContext ctx, Hash txHash) {
        ctx.checkActive();
        return db.get(Column.CHAIN, Keys.receipt(txHash)) != null;
    }

    @Override
    public long getBlockCount(OperationContext ctx) {
        ctx.checkActive();
        return readCounter(Keys.BLOCK_COUNT);
    }

    @Override
    public long getTransactionCount(OperationContext ctx) {
        ctx.checkActive();
        return readCounter(Keys.TX_COUNT);
    }

    /** Logs stored for a height, ordered by (tx index, log index). */
    public List<Log> getLogsByBlock(OperationContext ctx, long height) {
        ctx.checkActive();
        List<Log> out = new ArrayList<>();
        db.scanPrefix(Column.CHAIN, Keys.logPrefix(height), false, e -> {
            out.add(decode("log", () -> ReceiptCodec.logFromBytes(e.value())));
            return true;
        });
        return out;
    }

    /** Header fields of the block at a height, without its transactions. */
    public Optional<Block> getBlockHeader(OperationContext ctx, long height) {
        ctx.checkActive();
        checkHeight(height);
        return readBlockHeader(height).map(BlockCodec.Header::headerOnly);
    }

    public Optional<Log> getLog(OperationContext ctx, long height, int txIndex, int logIndex) {
        ctx.checkActive();
        byte[] raw = db.get(Column.CHAIN, Keys.log(height, txIndex, logIndex));
        return raw == null ? Optional.empty() : Optional.of(decode("log", () -> ReceiptCodec.logFromBytes(raw)));
    }

    /**
     * Visits stored logs with {@code fromHeight <= height <= toHeight} in (height, tx index, log index)
     * order until the visitor returns {@code false}.
     */
    public void scanLogs(OperationContext ctx, long fromHeight, long toHeight, Predicate<Log> visitor) {
        checkRange(fromHeight, toHeight);
        byte[] to = toHeight == Long.MAX_VALUE ? null : Keys.logsFrom(toHeight + 1);
        db.scan(Column.CHAIN, Keys.logsFrom(fromHeight), to, false, e -> {
            ctx.checkActive();
            return visitor.test(decode("log", () -> ReceiptCodec.logFromBytes(e.value())));
        });
    }

    /** The block and raw receipts at a height, as stored. */
    public Optional<StoredBlock> loadStored(OperationContext ctx, long height) {
        ctx.checkActive();
        Optional<Block> block = readBlock(height);
        if (block.isEmpty()) {
            return Optional.empty();
        }
        List<Receipt> receipts = new ArrayList<>();
        for (Transaction tx : block.get().transactions()) {
            readReceipt(tx.hash()).ifPresent(receipts::add);
        }
        return Optional.of(new StoredBlock(block.get(), receipts));
    }

    // -------------- writes ----------------

    @Override
    public void setBlock(OperationContext ctx, Block block) {
        setBlockWithReceipts(ctx, block, List.of());
    }

    @Override
    public void setBlocks(OperationContext ctx, List<Block> blocks) {
        for (Block b : blocks) {
            ctx.checkActive();
            setBlock(ctx, b);
        }
    }

    @Override
    public void setTransaction(OperationContext ctx, Transaction tx, TxLocation location) {
        ctx.checkActive();
        try (KeyValueDB.Batch batch = db.newBatch()) {
            stageTransaction(batch, tx, location);
            commit(batch, () -> {
                boolean known = db.get(Column.CHAIN, Keys.txLocation(tx.hash())) != null;
                return known ? CounterDelta.NONE : new CounterDelta(0, 1);
            });
        }
    }

    @Override
    public void setReceipt(OperationContext ctx, Receipt receipt) {
        setReceipts(ctx, List.of(receipt));
    }

    @Override
    public void setReceipts(OperationContext ctx, List<Receipt> receipts) {
        ctx.checkActive();
        try (KeyValueDB.Batch batch = db.newBatch()) {
            for (Receipt r : receipts) {
                stageReceipt(batch, r);
            }
            batch.commit();
        }
    }

    /**
     * Stores primary data only. Records derived from a replaced block are dropped and the height
     * stays out of both watermarks until the index maintainer indexes it. Stored receipts of
     * transactions that keep their position are carried over unless replaced.
     */
    @Override
    public void setBlockWithReceipts(OperationContext ctx, Block block, List<Receipt> receipts) {
        ctx.checkActive();
        Optional<StoredBlock> previous = loadStored(ctx, block.number());
        try (KeyValueDB.Batch batch = db.newBatch()) {
            Runnable beforeCommit = () -> {};
            if (previous.isPresent()) {
                beforeCommit = derived.unstage(ctx, batch, previous.get());
            }
            CounterDelta delta = stageBlock(batch, block, receipts, previous);
            previous.ifPresent(p -> restageKeptReceipts(batch, block, receipts, p));
            commit(batch, delta, beforeCommit);
        }
        if (previous.isPresent()) {
            rollbackWatermarks(block.number());
        }
    }

    @Override
    public void deleteBlock(OperationContext ctx, long height) {
        removeBlock(ctx, height);
    }

    /**
     * Removes a height, its primary data and every derived record in one batch. Returns false when
     * nothing is stored there.
     */
    public boolean removeBlock(OperationContext ctx, long height) {
        ctx.checkActive();
        checkHeight(height);
        Optional<StoredBlock> stored = loadStored(ctx, height);
        if (stored.isEmpty()) {
            return false;
        }
        try (KeyValueDB.Batch batch = db.newBatch()) {
            Runnable beforeCommit = derived.unstage(ctx, batch, stored.get());
            CounterDelta delta = stageDelete(batch, stored.get());
            commit(batch, delta, beforeCommit);
        }
        rollbackWatermarks(height);
        return true;
    }

    // -------------- staging API ----------------

    /** Aggregate counter adjustments produced by staged writes. */
    public record CounterDelta(long blocks, long transactions) {
        public static final CounterDelta NONE = new CounterDelta(0, 0);

        public CounterDelta plus(CounterDelta o) {
            return new CounterDelta(blocks + o.blocks, transactions + o.transactions);
        }
    }

    /**
     * Stages the block, its transactions and receipts, replacing whatever occupies the height.
     */
    public CounterDelta stageBlock(OperationContext ctx, KeyValueDB.Batch batch, Block block, List<Receipt> receipts) {
        return stageBlock(batch, block, receipts, loadStored(ctx, block.number()));
    }

    private CounterDelta stageBlock(KeyValueDB.Batch batch, Block block, List<Receipt> receipts, Optional<StoredBlock> previous) {
        for (Receipt r : receipts) {
            validateReceipt(r);
        }
        CounterDelta delta = CounterDelta.NONE;
        if (previous.isPresent()) {
            delta = stageDelete(batch, previous.get());
        }
        batch.put(Column.CHAIN, Keys.block(block.number()), BlockCodec.headerBytes(block));
        batch.put(Column.CHAIN, Keys.blockHash(block.hash()), Keys.longToBytes(block.number()));
        List<Transaction> txs = block.transactions();
        for (int i = 0; i < txs.size(); i++) {
            stageTransaction(batch, txs.get(i), new TxLocation(block.number(), block.hash(), i));
        }
        for (Receipt r : receipts) {
            stageReceipt(batch, r);
        }
        return delta.plus(new CounterDelta(1, txs.size()));
    }

    public CounterDelta stageDelete(KeyValueDB.Batch batch, StoredBlock stored) {
        Block block = stored.block();
        long height = block.number();
        batch.delete(Column.CHAIN, Keys.block(height));
        batch.delete(Column.CHAIN, Keys.blockHash(block.hash()));
        List<Transaction> txs = block.transactions();
        for (int i = 0; i < txs.size(); i++) {
            Hash hash = txs.get(i).hash();
            batch.delete(Column.CHAIN, Keys.transaction(height, i));
            batch.delete(Column.CHAIN, Keys.txLocation(hash));
            batch.delete(Column.CHAIN, Keys.receipt(hash));
        }
        db.scanPrefix(Column.CHAIN, Keys.logPrefix(height), false, e -> {
            batch.delete(Column.CHAIN, e.key());
            return true;
        });
        batch.delete(Column.META, Keys.rawMarker(height));
        batch.delete(Column.META, Keys.fullMarker(height));
        return new CounterDelta(-1, -txs.size());
    }

    private void restageKeptReceipts(KeyValueDB.Batch batch, Block block, List<Receipt> receipts, StoredBlock previous) {
        Set<Hash> supplied = new HashSet<>();
        for (Receipt r : receipts) {
            supplied.add(r.txHash());
        }
        List<Transaction> txs = block.transactions();
        for (Receipt r : previous.receipts()) {
            boolean samePosition = r.txIndex() < txs.size() && txs.get(r.txIndex()).hash().equals(r.txHash());
            if (samePosition && !supplied.contains(r.txHash())) {
                stageReceipt(batch, r);
            }
        }
    }

    /** Commits the batch and applies the counter adjustments atomically with it. */
    public void commit(KeyValueDB.Batch batch, CounterDelta delta) {
        commit(batch, delta, () -> {});
    }

    /**
     * Like {@link #commit(KeyValueDB.Batch, CounterDelta)}, running {@code beforeCommit} under the
     * commit lock so it can read committed state and stage dependent writes without racing
     * another height.
     */
    public void commit(KeyValueDB.Batch batch, CounterDelta delta, Runnable beforeCommit) {
        commit(batch, () -> {
            beforeCommit.run();
            return delta;
        });
    }

    /** Commits with counter adjustments computed under the commit lock from committed state. */
    private void commit(KeyValueDB.Batch batch, Supplier<CounterDelta> deltaUnderLock) {
        counterLock.lock();
        try {
            CounterDelta delta = deltaUnderLock.get();
            if (delta.blocks() != 0) {
                batch.put(Column.META, Keys.BLOCK_COUNT, Keys.longToBytes(Math.max(0, readCounter(Keys.BLOCK_COUNT) + delta.blocks())));
            }
            if (delta.transactions() != 0) {
                batch.put(Column.META, Keys.TX_COUNT, Keys.longToBytes(Math.max(0, readCounter(Keys.TX_COUNT) + delta.transactions())));
            }
            batch.commit();
        } finally {
            counterLock.unlock();
        }
    }

    /** Marks the primary phase of a height as complete within its batch. */
    public void stageRawMarker(KeyValueDB.Batch batch, long height) {
        batch.put(Column.META, Keys.rawMarker(height), new byte[] {1});
    }

    public void stageFullMarker(KeyValueDB.Batch batch, long height) {
        batch.put(Column.META, Keys.fullMarker(height), new byte[] {1});
    }

    public void markRawIndexed(long height) {
        rawWatermark.complete(height);
    }

    public void markFullyIndexed(long height) {
        fullWatermark.complete(height);
    }

    /** Drops only the fully-indexed watermark, used when a height is re-indexed in place. */
    public void rollbackFullWatermark(long height) {
        fullWatermark.rollbackBelow(height);
    }

    public void rollbackWatermarks(long height) {
        rawWatermark.rollbackBelow(height);
        fullWatermark.rollbackBelow(height);
    }

    @Override
    public void close() {
        lookupPool.shutdownNow();
        db.close();
        LOG.fine("Chain store closed");
    }

    // -------------- helpers ----------------

    static void validateReceipt(Receipt r) {
        if (r.status() != Receipt.STATUS_FAILED && r.status() != Receipt.STATUS_SUCCESS) {
            throw new InvalidInputException("receipt " + r.txHash() + " has invalid status " + r.status());
        }
        if (r.cumulativeGasUsed() < r.gasUsed()) {
            throw new InvalidInputException("receipt " + r.txHash() + " cumulative gas " + r.cumulativeGasUsed()
                    + " is below its gas used " + r.gasUsed());
        }
    }

    private void stageTransaction(KeyValueDB.Batch batch, Transaction tx, TxLocation loc) {
        batch.put(Column.CHAIN, Keys.transaction(loc.blockHeight(), loc.txIndex()), TransactionCodec.toBytes(tx));
        batch.put(Column.CHAIN, Keys.txLocation(tx.hash()), encodeLocation(loc));
    }

    private void stageReceipt(KeyValueDB.Batch batch, Receipt r) {
        validateReceipt(r);
        batch.put(Column.CHAIN, Keys.receipt(r.txHash()), ReceiptCodec.toBytes(r));
        for (Log log : r.logs()) {
            batch.put(Column.CHAIN, Keys.log(log.blockNumber(), log.txIndex(), log.logIndex()), ReceiptCodec.logBytes(log));
        }
    }

    private static Receipt derive(Receipt raw, Transaction tx, long previousCumulative, BigInteger baseFee) {
        long gasUsed;
        try {
            gasUsed = GasDerivation.gasUsed(previousCumulative, raw.cumulativeGasUsed());
        } catch (IllegalArgumentException e) {
            throw new StorageUnavailableException("inconsistent receipts around " + raw.txHash(), e);
        }
        BigInteger price = GasDerivation.effectiveGasPrice(tx, baseFee);
        Address contract = tx.isContractCreation() ? raw.contractAddress() : null;
        return raw.withDerived(gasUsed, price, contract);
    }

    private Optional<BlockCodec.Header> readBlockHeader(long height) {
        byte[] raw = db.get(Column.CHAIN, Keys.block(height));
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(decode("block", () -> BlockCodec.fromHeaderBytes(raw)));
    }

    private Optional<Block> readBlock(long height) {
        return readBlockHeader(height).map(h -> h.withTransactions(readTransactions(height)));
    }

    private List<Transaction> readTransactions(long height) {
        List<Transaction> txs = new ArrayList<>();
        db.scanPrefix(Column.CHAIN, Keys.transactionPrefix(height), false, e -> {
            txs.add(decode("transaction", () -> TransactionCodec.fromBytes(e.value())));
            return true;
        });
        return txs;
    }

    private Optional<Transaction> readTransactionAt(long height, int index) {
        byte[] raw = db.get(Column.CHAIN, Keys.transaction(height, index));
        return raw == null ? Optional.empty() : Optional.of(decode("transaction", () -> TransactionCodec.fromBytes(raw)));
    }

    private Optional<LocatedTransaction> readTransaction(Hash txHash) {
        byte[] locRaw = db.get(Column.CHAIN, Keys.txLocation(txHash));
        if (locRaw == null) {
            return Optional.empty();
        }
        TxLocation loc = decode("location", () -> decodeLocation(locRaw));
        return readTransactionAt(loc.blockHeight(), loc.txIndex()).map(tx -> new LocatedTransaction(tx, loc));
    }

    private Optional<Receipt> readReceipt(Hash txHash) {
        byte[] raw = db.get(Column.CHAIN, Keys.receipt(txHash));
        return raw == null ? Optional.empty() : Optional.of(decode("receipt", () -> ReceiptCodec.fromBytes(raw)));
    }

    private long readCounter(byte[] key) {
        byte[] raw = db.get(Column.META, key);
        return raw == null ? 0L : Keys.bytesToLong(raw);
    }

    private static byte[] encodeLocation(TxLocation loc) {
        return new BinaryWriter()
                .putLong(loc.blockHeight())
                .putHash(loc.blockHash())
                .putInt(loc.txIndex())
                .toByteArray();
    }

    private static TxLocation decodeLocation(byte[] raw) {
        BinaryReader r = new BinaryReader(raw);
        return new TxLocation(r.getLong(), r.getHash(), r.getInt());
    }

    static <T> T decode(String what, Supplier<T> decoder) {
        try {
            return decoder.get();
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new StorageUnavailableException("corrupt " + what + " record", e);
        }
    }

    private static void checkHeight(long height) {
        if (height < 0) {
            throw new InvalidInputException("height must be >= 0: " + height);
        }
    }

    private static void checkRange(long start, long end) {
        checkHeight(start);
        if (end < start) {
            throw new InvalidInputException("invalid range [" + start + ", " + end + "]");
        }
    }
}
