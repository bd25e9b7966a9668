package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;

import java.math.BigInteger;
import java.util.List;

public interface BalanceIndexReader {
    /** Balance at the end of block {@code height}. */
    BigInteger getBalanceAt(OperationContext ctx, Address address, long height);

    /** Heights in {@code [fromBlock, toBlock]} at which the balance moved, with running balances. */
    List<BalanceChange> getBalanceHistory(OperationContext ctx, Address address, long fromBlock, long toBlock, PageRequest page);
}
