package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * a/{address}/{height}/{txIndex} -> tx hash, written for the sender, the recipient and the
 * created contract of each transaction.
 */
public final class AddressIndex implements IndexFamily, AddressIndexReader {
    private final KeyValueDB db;

    public AddressIndex(KeyValueDB db) {
        this.db = db;
    }

    @Override
    public String name() {
        return "address";
    }

    @Override
    public boolean mandatory() {
        return true;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        Map<Hash, Receipt> receipts = bundle.receiptsByTx();
        List<Transaction> txs = bundle.block().transactions();
        for (int i = 0; i < txs.size(); i++) {
            Transaction tx = txs.get(i);
            byte[] value = tx.hash().bytes();
            for (Address a : participants(tx, receipts.get(tx.hash()))) {
                batch.put(key(a, bundle.height(), i), value);
            }
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        Map<Hash, Receipt> receipts = new BlockBundle(stored.block(), stored.receipts()).receiptsByTx();
        List<Transaction> txs = stored.block().transactions();
        for (int i = 0; i < txs.size(); i++) {
            Transaction tx = txs.get(i);
            for (Address a : participants(tx, receipts.get(tx.hash()))) {
                batch.delete(key(a, stored.block().number(), i));
            }
        }
    }

    @Override
    public List<Hash> getAddressTransactions(OperationContext ctx, Address address, PageRequest page) {
        return IndexScan.page(db, ctx, prefix(address), page, e -> new Hash(e.value()));
    }

    @Override
    public long getAddressTransactionCount(OperationContext ctx, Address address) {
        return IndexScan.count(db, ctx, prefix(address));
    }

    private static Set<Address> participants(Transaction tx, Receipt receipt) {
        Set<Address> out = new LinkedHashSet<>();
        out.add(tx.from());
        tx.to().ifPresent(out::add);
        if (tx.isContractCreation() && receipt != null && receipt.contractAddress() != null) {
            out.add(receipt.contractAddress());
        }
        tx.feePayer().ifPresent(out::add);
        return out;
    }

    private static byte[] key(Address a, long height, int txIndex) {
        return Keys.key("a", Keys.addr(a), Keys.num(height), Keys.idx(txIndex));
    }

    private static byte[] prefix(Address a) {
        return Keys.key("a", Keys.addr(a), "");
    }
}
