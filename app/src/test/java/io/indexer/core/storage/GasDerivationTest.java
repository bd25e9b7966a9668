package io.indexer.core.storage;

import io.indexer.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static io.indexer.core.ChainFixtures.addr;
import static io.indexer.core.ChainFixtures.dynamicFeeTx;
import static io.indexer.core.ChainFixtures.legacyTx;
import static org.junit.jupiter.api.Assertions.*;

public class GasDerivationTest {

    @Test
    void firstTransactionUsesItsCumulativeGas() {
        assertEquals(21_000L, GasDerivation.gasUsed(-1, 21_000));
    }

    @Test
    void laterTransactionsSubtractThePredecessor() {
        assertEquals(30_000L, GasDerivation.gasUsed(21_000, 51_000));
        assertEquals(0L, GasDerivation.gasUsed(51_000, 51_000));
    }

    @Test
    void decreasingCumulativeGasIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> GasDerivation.gasUsed(50_000, 40_000));
    }

    @Test
    void feeCapBoundsTheEffectivePrice() {
        Transaction capped = dynamicFeeTx("capped", addr(1), addr(2), 20, 110);
        assertEquals(BigInteger.valueOf(110), GasDerivation.effectiveGasPrice(capped, BigInteger.valueOf(100)));

        Transaction roomy = dynamicFeeTx("roomy", addr(1), addr(2), 20, 200);
        assertEquals(BigInteger.valueOf(120), GasDerivation.effectiveGasPrice(roomy, BigInteger.valueOf(100)));
    }

    @Test
    void legacyTransactionsPayTheirGasPrice() {
        Transaction tx = legacyTx("legacy", addr(1), addr(2), 0);
        assertEquals(BigInteger.valueOf(150), GasDerivation.effectiveGasPrice(tx, BigInteger.valueOf(100)));
        assertEquals(BigInteger.valueOf(150), GasDerivation.effectiveGasPrice(tx, null));
    }

    @Test
    void feeMarketTransactionWithoutBaseFeeFallsBackToFeeCap() {
        Transaction tx = dynamicFeeTx("pre-london", addr(1), addr(2), 20, 200);
        assertEquals(BigInteger.valueOf(200), GasDerivation.effectiveGasPrice(tx, null));
    }
}
