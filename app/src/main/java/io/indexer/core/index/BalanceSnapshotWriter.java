package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;

import java.math.BigInteger;

/** Absolute balances taken from a node, used as anchors so reads need not sum from genesis. */
public interface BalanceSnapshotWriter {
    void setBalanceSnapshot(OperationContext ctx, Address address, long height, BigInteger balance);
}
