package io.indexer.core.storage;

import io.indexer.core.protocol.Transaction;

import java.math.BigInteger;

/**
 * Fields recomputed at read time because upstream sources may omit them.
 */
public final class GasDerivation {
    private GasDerivation() {}

    /**
     * Gas consumed by transaction {@code i}: its cumulative gas minus the previous transaction's.
     * Pass {@code -1} as {@code previousCumulative} for the first transaction of a block.
     */
    public static long gasUsed(long previousCumulative, long cumulative) {
        if (previousCumulative < 0) {
            return cumulative;
        }
        if (cumulative < previousCumulative) {
            throw new IllegalArgumentException("cumulative gas decreased: " + previousCumulative + " -> " + cumulative);
        }
        return cumulative - previousCumulative;
    }

    /**
     * {@code min(baseFee + tipCap, feeCap)} for fee-market transactions in blocks with a base fee,
     * the fixed gas price otherwise.
     */
    public static BigInteger effectiveGasPrice(Transaction tx, BigInteger baseFee) {
        if (tx.type().usesFeeMarket() && baseFee != null) {
            return baseFee.add(tx.gasTipCap()).min(tx.gasFeeCap());
        }
        if (tx.gasPrice() != null) {
            return tx.gasPrice();
        }
        // fee-market transaction in a block without base fee
        return tx.gasFeeCap();
    }
}
