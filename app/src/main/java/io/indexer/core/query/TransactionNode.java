package io.indexer.core.query;

import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;

public record TransactionNode(Transaction transaction, TxLocation location, long blockTimestamp) {
}
