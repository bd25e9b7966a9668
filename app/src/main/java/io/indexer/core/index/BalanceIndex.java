package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.InvalidInputException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.GasDerivation;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Signed per-block balance deltas.
 *
 * <pre>
 * bd/{address}/{height}   net delta, two's complement
 * bdh/{height}/{address}  reverse entry used on rollback
 * bs/{address}/{height}   snapshot: absolute balance at the end of the block
 * </pre>
 *
 * Per transaction: the gas payer pays gasUsed * effectivePrice, the miner receives the part above the
 * base fee, and on success the value moves from sender to recipient (or the created contract), along
 * with the value of every successful internal call.
 */
public final class BalanceIndex implements IndexFamily, BalanceIndexReader, BalanceSnapshotWriter {
    private static final byte[] EMPTY = new byte[0];

    private final KeyValueDB db;

    public BalanceIndex(KeyValueDB db) {
        this.db = db;
    }

    @Override
    public String name() {
        return "balance";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        long height = bundle.height();
        for (Map.Entry<Address, BigInteger> e : deltas(bundle).entrySet()) {
            if (e.getValue().signum() == 0) {
                continue;
            }
            batch.put(deltaKey(e.getKey(), height), e.getValue().toByteArray());
            batch.put(Keys.key("bdh", Keys.num(height), Keys.addr(e.getKey())), EMPTY);
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        long height = stored.block().number();
        db.scanPrefix(Column.INDEX, Keys.key("bdh", Keys.num(height), ""), false, e -> {
            Address a = Address.fromHex(Keys.lastSegment(e.key()));
            batch.delete(deltaKey(a, height));
            batch.delete(e.key());
            return true;
        });
    }

    /** Net deltas of one block by address. */
    static Map<Address, BigInteger> deltas(BlockBundle bundle) {
        Block block = bundle.block();
        BigInteger baseFee = block.baseFee().orElse(null);
        Map<Hash, Receipt> receipts = bundle.receiptsByTx();
        Map<Address, BigInteger> out = new TreeMap<>();
        long previousCumulative = -1;
        for (Transaction tx : block.transactions()) {
            Receipt r = receipts.get(tx.hash());
            if (r == null) {
                previousCumulative = -1;
                continue;
            }
            long gasUsed = gasUsed(previousCumulative, r);
            previousCumulative = r.cumulativeGasUsed();

            BigInteger price = GasDerivation.effectiveGasPrice(tx, baseFee);
            BigInteger gas = BigInteger.valueOf(gasUsed);
            add(out, tx.gasPayer(), gas.multiply(price).negate());
            BigInteger minerPrice = baseFee == null ? price : price.subtract(baseFee).max(BigInteger.ZERO);
            add(out, block.miner(), gas.multiply(minerPrice));

            if (!r.succeeded()) {
                continue;
            }
            Address recipient = tx.to().orElse(r.contractAddress());
            if (recipient != null && tx.value().signum() != 0) {
                add(out, tx.from(), tx.value().negate());
                add(out, recipient, tx.value());
            }
            for (InternalCall call : bundle.trace(tx.hash())) {
                if (call.depth() == 0 || !call.succeeded() || call.to() == null || call.value().signum() == 0) {
                    continue;
                }
                add(out, call.from(), call.value().negate());
                add(out, call.to(), call.value());
            }
        }
        return out;
    }

    @Override
    public BigInteger getBalanceAt(OperationContext ctx, Address address, long height) {
        checkHeight(height);
        BigInteger[] balance = {BigInteger.ZERO};
        long[] start = {0};
        db.scan(Column.INDEX, snapshotPrefix(address), upperBound("bs", address, height), true, e -> {
            balance[0] = new BigInteger(e.value());
            start[0] = Long.parseLong(Keys.lastSegment(e.key())) + 1;
            return false;
        });
        if (start[0] > height) {
            return balance[0];
        }
        db.scan(Column.INDEX, deltaKey(address, start[0]), upperBound("bd", address, height), false, e -> {
            ctx.checkActive();
            balance[0] = balance[0].add(new BigInteger(e.value()));
            return true;
        });
        return balance[0];
    }

    @Override
    public List<BalanceChange> getBalanceHistory(OperationContext ctx, Address address, long fromBlock, long toBlock, PageRequest page) {
        checkHeight(fromBlock);
        if (toBlock < fromBlock) {
            throw new InvalidInputException("invalid range [" + fromBlock + ", " + toBlock + "]");
        }
        TreeMap<Long, BigInteger> snapshots = new TreeMap<>();
        db.scan(Column.INDEX, snapshotKey(address, fromBlock), upperBound("bs", address, toBlock), false, e -> {
            snapshots.put(Long.parseLong(Keys.lastSegment(e.key())), new BigInteger(e.value()));
            return true;
        });
        List<BalanceChange> changes = new ArrayList<>();
        BigInteger[] running = {fromBlock == 0 ? BigInteger.ZERO : getBalanceAt(ctx, address, fromBlock - 1)};
        db.scan(Column.INDEX, deltaKey(address, fromBlock), upperBound("bd", address, toBlock), false, e -> {
            ctx.checkActive();
            long h = Long.parseLong(Keys.lastSegment(e.key()));
            Map.Entry<Long, BigInteger> anchor = snapshots.floorEntry(h - 1);
            while (anchor != null) {
                running[0] = anchor.getValue();
                snapshots.headMap(anchor.getKey(), true).clear();
                anchor = snapshots.floorEntry(h - 1);
            }
            BigInteger delta = new BigInteger(e.value());
            running[0] = running[0].add(delta);
            BigInteger exact = snapshots.remove(h);
            if (exact != null) {
                running[0] = exact;
            }
            changes.add(new BalanceChange(address, h, delta, running[0]));
            return true;
        });
        if (page.newestFirst()) {
            Collections.reverse(changes);
        }
        int from = Math.min(page.offset(), changes.size());
        return List.copyOf(changes.subList(from, Math.min(from + page.limit(), changes.size())));
    }

    @Override
    public void setBalanceSnapshot(OperationContext ctx, Address address, long height, BigInteger balance) {
        ctx.checkActive();
        checkHeight(height);
        if (balance == null || balance.signum() < 0) {
            throw new InvalidInputException("snapshot balance must be >= 0");
        }
        db.put(Column.INDEX, snapshotKey(address, height), balance.toByteArray());
    }

    /** Derived from cumulative gas when the predecessor is known, the reported value otherwise. */
    private static long gasUsed(long previousCumulative, Receipt r) {
        if (previousCumulative < 0 && r.txIndex() > 0) {
            return r.gasUsed();
        }
        try {
            return GasDerivation.gasUsed(previousCumulative, r.cumulativeGasUsed());
        } catch (IllegalArgumentException e) {
            return r.gasUsed();
        }
    }

    private static void add(Map<Address, BigInteger> deltas, Address a, BigInteger amount) {
        if (amount.signum() != 0) {
            deltas.merge(a, amount, BigInteger::add);
        }
    }

    private static byte[] deltaKey(Address a, long height) {
        return Keys.key("bd", Keys.addr(a), Keys.num(height));
    }

    private static byte[] snapshotKey(Address a, long height) {
        return Keys.key("bs", Keys.addr(a), Keys.num(height));
    }

    private static byte[] snapshotPrefix(Address a) {
        return Keys.key("bs", Keys.addr(a), "");
    }

    private static byte[] upperBound(String bucket, Address a, long height) {
        return height == Long.MAX_VALUE
                ? Keys.prefixEnd(Keys.key(bucket, Keys.addr(a), ""))
                : Keys.key(bucket, Keys.addr(a), Keys.num(height + 1));
    }

    private static void checkHeight(long height) {
        if (height < 0) {
            throw new InvalidInputException("height must be >= 0: " + height);
        }
    }
}
