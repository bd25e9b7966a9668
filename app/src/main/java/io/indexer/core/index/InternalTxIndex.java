package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Internal calls from execution traces. Only frames below the top-level call are kept; the
 * top-level frame is the transaction itself.
 *
 * <pre>
 * it/{txHash}/{index}
 * itf/{from}/{height}/{txHash}/{index}
 * itt/{to}/{height}/{txHash}/{index}
 * </pre>
 */
public final class InternalTxIndex implements IndexFamily, InternalTxReader {
    private final KeyValueDB db;

    public InternalTxIndex(KeyValueDB db) {
        this.db = db;
    }

    @Override
    public String name() {
        return "internal";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        for (Transaction tx : bundle.block().transactions()) {
            int index = 0;
            for (InternalCall call : bundle.trace(tx.hash())) {
                if (call.depth() == 0) {
                    continue;
                }
                InternalTransaction it = new InternalTransaction(tx.hash(), bundle.height(), index++,
                        call.callType(), call.from(), call.to(), call.value(), call.gas(), call.gasUsed(),
                        call.depth(), call.error());
                byte[] key = recordKey(tx.hash(), it.index());
                batch.put(key, IndexJson.write(it));
                for (byte[] pointer : pointerKeys(it)) {
                    batch.put(pointer, key);
                }
            }
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        for (Transaction tx : stored.block().transactions()) {
            db.scanPrefix(Column.INDEX, Keys.key("it", tx.hash().hex(), ""), false, e -> {
                InternalTransaction it = IndexJson.read(e.value(), InternalTransaction.class);
                batch.delete(e.key());
                for (byte[] pointer : pointerKeys(it)) {
                    batch.delete(pointer);
                }
                return true;
            });
        }
    }

    @Override
    public List<InternalTransaction> getInternalTransactions(OperationContext ctx, Hash txHash) {
        List<InternalTransaction> out = new ArrayList<>();
        db.scanPrefix(Column.INDEX, Keys.key("it", txHash.hex(), ""), false, e -> {
            ctx.checkActive();
            out.add(IndexJson.read(e.value(), InternalTransaction.class));
            return true;
        });
        return out;
    }

    @Override
    public List<InternalTransaction> getInternalTransactionsByAddress(OperationContext ctx, Address address,
                                                                      boolean asSender, PageRequest page) {
        return IndexScan.page(db, ctx, bucket(address, asSender), page,
                e -> IndexScan.follow(db, e, InternalTransaction.class));
    }

    @Override
    public long countInternalTransactions(OperationContext ctx, Address address, boolean asSender) {
        return IndexScan.count(db, ctx, bucket(address, asSender));
    }

    private static byte[] bucket(Address address, boolean asSender) {
        return Keys.key(asSender ? "itf" : "itt", Keys.addr(address), "");
    }

    private static byte[] recordKey(Hash txHash, int index) {
        return Keys.key("it", txHash.hex(), Keys.idx(index));
    }

    private static List<byte[]> pointerKeys(InternalTransaction it) {
        List<byte[]> keys = new ArrayList<>(2);
        String h = Keys.num(it.blockNumber());
        String i = Keys.idx(it.index());
        keys.add(Keys.key("itf", Keys.addr(it.from()), h, it.txHash().hex(), i));
        if (it.to() != null) {
            keys.add(Keys.key("itt", Keys.addr(it.to()), h, it.txHash().hex(), i));
        }
        return keys;
    }
}
