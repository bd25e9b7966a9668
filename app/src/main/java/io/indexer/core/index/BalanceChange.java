package io.indexer.core.index;

import io.indexer.core.protocol.Address;

import java.math.BigInteger;

/**
 * Net balance movement of an address in one block and the balance it left.
 */
public record BalanceChange(Address address, long blockNumber, BigInteger delta, BigInteger balance) {
}
