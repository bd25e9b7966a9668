package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.error.NotFoundException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.util.List;
import java.util.Map;

/**
 * cc/{contract} creation, ccr/{creator}/{height}/{txIndex} pointer, cv/{contract} verification.
 * Verification records are not tied to a height and survive block rollback.
 */
public final class ContractIndex implements IndexFamily, ContractIndexReader, ContractVerificationWriter {
    private final KeyValueDB db;

    public ContractIndex(KeyValueDB db) {
        this.db = db;
    }

    @Override
    public String name() {
        return "contract";
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
            Receipt r = receipts.get(tx.hash());
            if (!tx.isContractCreation() || r == null || !r.succeeded() || r.contractAddress() == null) {
                continue;
            }
            ContractCreation c = new ContractCreation(r.contractAddress(), tx.from(), tx.hash(),
                    bundle.height(), i, tx.input().length);
            byte[] key = creationKey(c.address());
            batch.put(key, IndexJson.write(c));
            batch.put(creatorKey(c.creator(), c.blockNumber(), i), key);
        }
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        List<Transaction> txs = stored.block().transactions();
        for (Receipt r : stored.receipts()) {
            if (r.contractAddress() == null || r.txIndex() < 0 || r.txIndex() >= txs.size()) {
                continue;
            }
            Transaction tx = txs.get(r.txIndex());
            if (!tx.isContractCreation()) {
                continue;
            }
            batch.delete(creationKey(r.contractAddress()));
            batch.delete(creatorKey(tx.from(), stored.block().number(), r.txIndex()));
        }
    }

    @Override
    public ContractCreation getContractCreation(OperationContext ctx, Address contract) {
        ctx.checkActive();
        byte[] raw = db.get(Column.INDEX, creationKey(contract));
        if (raw == null) {
            throw new NotFoundException("no creation indexed for " + contract);
        }
        return IndexJson.read(raw, ContractCreation.class);
    }

    @Override
    public List<ContractCreation> getContractsByCreator(OperationContext ctx, Address creator, PageRequest page) {
        return IndexScan.page(db, ctx, Keys.key("ccr", Keys.addr(creator), ""), page,
                e -> IndexScan.follow(db, e, ContractCreation.class));
    }

    @Override
    public ContractVerification getContractVerification(OperationContext ctx, Address contract) {
        ctx.checkActive();
        byte[] raw = db.get(Column.INDEX, verificationKey(contract));
        if (raw == null) {
            throw new NotFoundException("contract " + contract + " is not verified");
        }
        return IndexJson.read(raw, ContractVerification.class);
    }

    @Override
    public boolean isContractVerified(OperationContext ctx, Address contract) {
        ctx.checkActive();
        byte[] raw = db.get(Column.INDEX, verificationKey(contract));
        return raw != null && IndexJson.read(raw, ContractVerification.class).verified();
    }

    @Override
    public List<ContractVerification> listVerifiedContracts(OperationContext ctx, PageRequest page) {
        return IndexScan.page(db, ctx, Keys.key("cv", ""), page, e -> {
            ContractVerification v = IndexJson.read(e.value(), ContractVerification.class);
            return v.verified() ? v : null;
        });
    }

    @Override
    public void setContractVerification(OperationContext ctx, ContractVerification verification) {
        ctx.checkActive();
        db.put(Column.INDEX, verificationKey(verification.address()), IndexJson.write(verification));
    }

    @Override
    public void deleteContractVerification(OperationContext ctx, Address contract) {
        ctx.checkActive();
        db.delete(Column.INDEX, verificationKey(contract));
    }

    private static byte[] creationKey(Address contract) {
        return Keys.key("cc", Keys.addr(contract));
    }

    private static byte[] creatorKey(Address creator, long height, int txIndex) {
        return Keys.key("ccr", Keys.addr(creator), Keys.num(height), Keys.idx(txIndex));
    }

    private static byte[] verificationKey(Address contract) {
        return Keys.key("cv", Keys.addr(contract));
    }
}
