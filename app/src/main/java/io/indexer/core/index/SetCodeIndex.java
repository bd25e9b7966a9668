package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.SetCodeAuthorization;
import io.indexer.core.protocol.SignerRecovery;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxType;
import io.indexer.core.storage.Column;
import io.indexer.core.storage.KeyValueDB;
import io.indexer.core.storage.Keys;
import io.indexer.core.storage.StoredBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * EIP-7702 authorizations and the delegation state they leave behind.
 *
 * <pre>
 * sc/{txHash}/{authIndex}                          record
 * sct/{target}/{height}/{txIndex}/{authIndex}      by target
 * sca/{authority}/{height}/{txIndex}/{authIndex}   by authority
 * scd/{authority}                                  delegation in force
 * </pre>
 */
public final class SetCodeIndex implements IndexFamily, SetCodeIndexReader {
    private final KeyValueDB db;
    private final SignerRecovery recovery;

    public SetCodeIndex(KeyValueDB db, SignerRecovery recovery) {
        this.db = db;
        this.recovery = recovery;
    }

    @Override
    public String name() {
        return "setcode";
    }

    @Override
    public boolean mandatory() {
        return false;
    }

    @Override
    public void stage(IndexBatch batch, BlockBundle bundle) {
        long height = bundle.height();
        Map<Hash, Receipt> receipts = bundle.receiptsByTx();
        Map<Address, SetCodeAuthorizationRecord> latestApplied = new LinkedHashMap<>();
        List<Transaction> txs = bundle.block().transactions();
        for (int ti = 0; ti < txs.size(); ti++) {
            Transaction tx = txs.get(ti);
            if (tx.type() != TxType.SET_CODE) {
                continue;
            }
            Receipt receipt = receipts.get(tx.hash());
            boolean succeeded = receipt != null && receipt.succeeded();
            List<SetCodeAuthorization> auths = tx.authorizations();
            for (int ai = 0; ai < auths.size(); ai++) {
                SetCodeAuthorizationRecord rec = evaluate(tx.hash(), height, ti, ai, auths.get(ai), succeeded);
                byte[] key = recordKey(tx.hash(), ai);
                batch.put(key, IndexJson.write(rec));
                for (byte[] pointer : pointerKeys(rec)) {
                    batch.put(pointer, key);
                }
                if (rec.applied()) {
                    latestApplied.put(rec.authority(), rec);
                }
            }
        }
        if (latestApplied.isEmpty()) {
            return;
        }
        batch.onCommit(() -> {
            for (SetCodeAuthorizationRecord rec : latestApplied.values()) {
                Delegation current = readDelegation(rec.authority());
                if (current != null && current.blockNumber() > height) {
                    continue;
                }
                writeDelegation(batch, rec.authority(), rec);
            }
        });
    }

    @Override
    public void unstage(IndexBatch batch, StoredBlock stored) {
        long height = stored.block().number();
        Set<Address> authorities = new LinkedHashSet<>();
        for (Transaction tx : stored.block().transactions()) {
            if (tx.type() != TxType.SET_CODE) {
                continue;
            }
            db.scanPrefix(Column.INDEX, Keys.key("sc", tx.hash().hex(), ""), false, e -> {
                SetCodeAuthorizationRecord rec = IndexJson.read(e.value(), SetCodeAuthorizationRecord.class);
                batch.delete(e.key());
                for (byte[] pointer : pointerKeys(rec)) {
                    batch.delete(pointer);
                }
                if (rec.applied()) {
                    authorities.add(rec.authority());
                }
                return true;
            });
        }
        if (authorities.isEmpty()) {
            return;
        }
        batch.onCommit(() -> {
            for (Address authority : authorities) {
                Delegation current = readDelegation(authority);
                if (current != null && current.blockNumber() != height) {
                    continue;
                }
                // absent: cleared here, or by a later height that still governs
                if (current == null && hasAppliedAbove(authority, height)) {
                    continue;
                }
                writeDelegation(batch, authority, lastAppliedBelow(authority, height));
            }
        });
    }

    @Override
    public List<SetCodeAuthorizationRecord> getSetCodeAuthorizations(OperationContext ctx, Hash txHash) {
        List<SetCodeAuthorizationRecord> out = new ArrayList<>();
        db.scanPrefix(Column.INDEX, Keys.key("sc", txHash.hex(), ""), false, e -> {
            ctx.checkActive();
            out.add(IndexJson.read(e.value(), SetCodeAuthorizationRecord.class));
            return true;
        });
        return out;
    }

    @Override
    public List<SetCodeAuthorizationRecord> getSetCodeAuthorizationsByTarget(OperationContext ctx, Address target, PageRequest page) {
        return IndexScan.page(db, ctx, Keys.key("sct", Keys.addr(target), ""), page,
                e -> IndexScan.follow(db, e, SetCodeAuthorizationRecord.class));
    }

    @Override
    public List<SetCodeAuthorizationRecord> getSetCodeAuthorizationsByAuthority(OperationContext ctx, Address authority, PageRequest page) {
        return IndexScan.page(db, ctx, Keys.key("sca", Keys.addr(authority), ""), page,
                e -> IndexScan.follow(db, e, SetCodeAuthorizationRecord.class));
    }

    @Override
    public Optional<Delegation> getDelegation(OperationContext ctx, Address authority) {
        ctx.checkActive();
        return Optional.ofNullable(readDelegation(authority));
    }

    /**
     * Validation order: a zero r or s can never recover, then recovery itself, then the nonce
     * bound. A well-formed authorization is applied when its transaction succeeded.
     */
    SetCodeAuthorizationRecord evaluate(Hash txHash, long height, int txIndex, int authIndex,
                                        SetCodeAuthorization auth, boolean txSucceeded) {
        Address authority = null;
        String error;
        if (auth.r().signum() == 0 || auth.s().signum() == 0) {
            error = SetCodeAuthorizationRecord.INVALID_SIGNATURE;
        } else {
            authority = recovery.recover(auth).orElse(null);
            if (authority == null) {
                error = SetCodeAuthorizationRecord.RECOVERY_FAILED;
            } else if (auth.nonce() == -1L) {
                // 2^64 - 1 cannot be incremented
                error = SetCodeAuthorizationRecord.NONCE_OVERFLOW;
            } else {
                error = null;
            }
        }
        boolean applied = error == null && txSucceeded;
        return new SetCodeAuthorizationRecord(txHash, height, txIndex, authIndex, auth.address(), authority,
                auth.chainId(), auth.nonce(), auth.yParity(), applied, error);
    }

    private SetCodeAuthorizationRecord lastAppliedBelow(Address authority, long height) {
        SetCodeAuthorizationRecord[] found = new SetCodeAuthorizationRecord[1];
        byte[] prefix = Keys.key("sca", Keys.addr(authority), "");
        db.scan(Column.INDEX, prefix, Keys.key("sca", Keys.addr(authority), Keys.num(height)), true, e -> {
            SetCodeAuthorizationRecord rec = IndexScan.follow(db, e, SetCodeAuthorizationRecord.class);
            if (rec != null && rec.applied()) {
                found[0] = rec;
                return false;
            }
            return true;
        });
        return found[0];
    }

    private boolean hasAppliedAbove(Address authority, long height) {
        boolean[] found = new boolean[1];
        byte[] prefix = Keys.key("sca", Keys.addr(authority), "");
        db.scan(Column.INDEX, Keys.key("sca", Keys.addr(authority), Keys.num(height + 1)), Keys.prefixEnd(prefix), false, e -> {
            SetCodeAuthorizationRecord rec = IndexScan.follow(db, e, SetCodeAuthorizationRecord.class);
            found[0] = rec != null && rec.applied();
            return !found[0];
        });
        return found[0];
    }

    private Delegation readDelegation(Address authority) {
        byte[] raw = db.get(Column.INDEX, delegationKey(authority));
        return raw == null ? null : IndexJson.read(raw, Delegation.class);
    }

    /** A zero-address target clears the delegation, as does the absence of any applied record. */
    private static void writeDelegation(IndexBatch batch, Address authority, SetCodeAuthorizationRecord rec) {
        if (rec == null || Address.ZERO.equals(rec.target())) {
            batch.delete(delegationKey(authority));
            return;
        }
        batch.put(delegationKey(authority), IndexJson.write(
                new Delegation(authority, rec.target(), rec.blockNumber(), rec.txHash())));
    }

    private static byte[] recordKey(Hash txHash, int authIndex) {
        return Keys.key("sc", txHash.hex(), Keys.idx(authIndex));
    }

    private static byte[] delegationKey(Address authority) {
        return Keys.key("scd", Keys.addr(authority));
    }

    private static List<byte[]> pointerKeys(SetCodeAuthorizationRecord rec) {
        String h = Keys.num(rec.blockNumber());
        String ti = Keys.idx(rec.txIndex());
        String ai = Keys.idx(rec.authorizationIndex());
        List<byte[]> keys = new ArrayList<>(2);
        keys.add(Keys.key("sct", Keys.addr(rec.target()), h, ti, ai));
        if (rec.authority() != null) {
            keys.add(Keys.key("sca", Keys.addr(rec.authority()), h, ti, ai));
        }
        return keys;
    }
}
