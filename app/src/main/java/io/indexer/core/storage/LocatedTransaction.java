package io.indexer.core.storage;

import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;

import java.util.Objects;

public record LocatedTransaction(Transaction transaction, TxLocation location) {
    public LocatedTransaction {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(location, "location");
    }
}
