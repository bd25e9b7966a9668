package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Block;
import io.indexer.core.protocol.Hash;
import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.SetCodeAuthorization;
import io.indexer.core.protocol.SignerRecovery;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxType;
import io.indexer.core.storage.InMemoryKeyValueDB;
import io.indexer.core.storage.KvChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static io.indexer.core.ChainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class SetCodeIndexTest {
    private static final Address AUTHORITY = addr(0xa0);
    private static final Address TARGET = addr(0x7a);
    private static final BigInteger GOOD_R = BigInteger.ONE;

    /** Recovers {@link #AUTHORITY} for r == 1 and fails for anything else. */
    private static final SignerRecovery STUB = (digest, recId, r, s) ->
            GOOD_R.equals(r) ? Optional.of(AUTHORITY) : Optional.empty();

    private final OperationContext ctx = OperationContext.background();
    private KvChainStore store;
    private SetCodeIndex index;
    private BlockIndexer indexer;

    @BeforeEach
    void setUp() {
        store = new KvChainStore(new InMemoryKeyValueDB());
        index = new SetCodeIndex(store.db(), STUB);
        indexer = new BlockIndexer(store, new IndexCatalog(List.of(new AddressIndex(store.db()), index)), null);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void zeroSignatureComponentsAreInvalidBeforeRecovery() {
        SetCodeAuthorizationRecord rec = index.evaluate(hash("tx"), 1, 0, 0, auth(TARGET, 0, BigInteger.ZERO, BigInteger.ONE), true);
        assertEquals(SetCodeAuthorizationRecord.INVALID_SIGNATURE, rec.error());
        assertNull(rec.authority());
        assertFalse(rec.applied());
    }

    @Test
    void failedRecoveryIsRecorded() {
        SetCodeAuthorizationRecord rec = index.evaluate(hash("tx"), 1, 0, 0, auth(TARGET, 0, BigInteger.TWO, BigInteger.ONE), true);
        assertEquals(SetCodeAuthorizationRecord.RECOVERY_FAILED, rec.error());
        assertNull(rec.authority());
        assertFalse(rec.applied());
    }

    @Test
    void maximalNonceOverflows() {
        SetCodeAuthorizationRecord rec = index.evaluate(hash("tx"), 1, 0, 0, auth(TARGET, -1L, GOOD_R, BigInteger.ONE), true);
        assertEquals(SetCodeAuthorizationRecord.NONCE_OVERFLOW, rec.error());
        assertEquals(AUTHORITY, rec.authority());
        assertFalse(rec.applied());
    }

    @Test
    void wellFormedAuthorizationAppliesOnlyWhenTheTransactionSucceeded() {
        SetCodeAuthorizationRecord ok = index.evaluate(hash("tx"), 1, 0, 0, auth(TARGET, 4, GOOD_R, BigInteger.ONE), true);
        assertNull(ok.error());
        assertTrue(ok.applied());

        SetCodeAuthorizationRecord reverted = index.evaluate(hash("tx"), 1, 0, 0, auth(TARGET, 4, GOOD_R, BigInteger.ONE), false);
        assertNull(reverted.error());
        assertFalse(reverted.applied());
    }

    @Test
    void indexedAuthorizationsAreReachableEveryWay() {
        Transaction tx = setCodeTx("sc-0", auth(TARGET, 0, GOOD_R, BigInteger.ONE), auth(TARGET, 1, BigInteger.TWO, BigInteger.ONE));
        indexer.index(ctx, bundle(block(0, List.of(tx))));

        List<SetCodeAuthorizationRecord> byTx = index.getSetCodeAuthorizations(ctx, tx.hash());
        assertEquals(2, byTx.size());
        assertEquals(2, index.getSetCodeAuthorizationsByTarget(ctx, TARGET, PageRequest.oldestFirst(0, 10)).size());
        // the unrecoverable one has no authority to be found under
        assertEquals(1, index.getSetCodeAuthorizationsByAuthority(ctx, AUTHORITY, PageRequest.oldestFirst(0, 10)).size());

        Delegation d = index.getDelegation(ctx, AUTHORITY).orElseThrow();
        assertEquals(TARGET, d.target());
        assertEquals(0L, d.blockNumber());
        assertEquals(0xef, d.designatorCode()[0] & 0xff);
    }

    @Test
    void revertedTransactionLeavesNoDelegation() {
        Transaction tx = setCodeTx("sc-0", auth(TARGET, 0, GOOD_R, BigInteger.ONE));
        Block b = block(0, List.of(tx));
        Receipt failed = receipt(b, 0, Receipt.STATUS_FAILED, 21_000, List.of());
        indexer.index(ctx, new BlockBundle(b, List.of(failed)));

        assertFalse(index.getSetCodeAuthorizations(ctx, tx.hash()).get(0).applied());
        assertTrue(index.getDelegation(ctx, AUTHORITY).isEmpty());
    }

    @Test
    void zeroTargetClearsAndRollbackRestores() {
        indexer.index(ctx, bundle(block(0, List.of(setCodeTx("sc-0", auth(TARGET, 0, GOOD_R, BigInteger.ONE))))));
        indexer.index(ctx, bundle(block(1, List.of(setCodeTx("sc-1", auth(Address.ZERO, 1, GOOD_R, BigInteger.ONE))))));
        assertTrue(index.getDelegation(ctx, AUTHORITY).isEmpty());

        assertTrue(indexer.rollback(ctx, 1));
        assertEquals(TARGET, index.getDelegation(ctx, AUTHORITY).orElseThrow().target());

        assertTrue(indexer.rollback(ctx, 0));
        assertTrue(index.getDelegation(ctx, AUTHORITY).isEmpty());
        assertTrue(index.getSetCodeAuthorizationsByTarget(ctx, TARGET, PageRequest.oldestFirst(0, 10)).isEmpty());
    }

    @Test
    void rollingBackAMiddleHeightKeepsALaterClear() {
        Address other = addr(0x7b);
        indexer.index(ctx, bundle(block(0, List.of(setCodeTx("sc-0", auth(TARGET, 0, GOOD_R, BigInteger.ONE))))));
        indexer.index(ctx, bundle(block(1, List.of(setCodeTx("sc-1", auth(other, 1, GOOD_R, BigInteger.ONE))))));
        indexer.index(ctx, bundle(block(2, List.of(setCodeTx("sc-2", auth(Address.ZERO, 2, GOOD_R, BigInteger.ONE))))));
        assertTrue(index.getDelegation(ctx, AUTHORITY).isEmpty());

        assertTrue(indexer.rollback(ctx, 1));

        assertTrue(index.getDelegation(ctx, AUTHORITY).isEmpty());
        assertEquals(2, index.getSetCodeAuthorizationsByAuthority(ctx, AUTHORITY, PageRequest.oldestFirst(0, 10)).size());
    }

    @Test
    void laterDelegationReplacesEarlierOne() {
        Address other = addr(0x7b);
        indexer.index(ctx, bundle(block(0, List.of(setCodeTx("sc-0", auth(TARGET, 0, GOOD_R, BigInteger.ONE))))));
        indexer.index(ctx, bundle(block(1, List.of(setCodeTx("sc-1", auth(other, 1, GOOD_R, BigInteger.ONE))))));

        Delegation d = index.getDelegation(ctx, AUTHORITY).orElseThrow();
        assertEquals(other, d.target());
        assertEquals(1L, d.blockNumber());
    }

    private static SetCodeAuthorization auth(Address target, long nonce, BigInteger r, BigInteger s) {
        return new SetCodeAuthorization(BigInteger.ONE, target, nonce, 0, r, s);
    }

    private static Transaction setCodeTx(String seed, SetCodeAuthorization... auths) {
        Hash h = hash(seed);
        return Transaction.builder()
                .hash(h)
                .type(TxType.SET_CODE)
                .from(addr(1))
                .to(addr(1))
                .gas(50_000)
                .gasTipCap(BigInteger.TEN)
                .gasFeeCap(BigInteger.valueOf(200))
                .authorizations(List.of(auths))
                .build();
    }
}
