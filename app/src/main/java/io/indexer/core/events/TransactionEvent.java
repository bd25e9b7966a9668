package io.indexer.core.events;

import io.indexer.core.protocol.Receipt;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxLocation;

import java.util.Objects;
import java.util.Optional;

/** A committed transaction; the receipt is absent when the source did not supply one. */
public record TransactionEvent(Transaction transaction, TxLocation location, Receipt receipt) implements ChainEvent {
    public TransactionEvent {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(location, "location");
    }

    @Override
    public EventType type() {
        return EventType.TRANSACTION;
    }

    @Override
    public long blockNumber() {
        return location.blockHeight();
    }

    public Optional<Receipt> receiptIfPresent() {
        return Optional.ofNullable(receipt);
    }
}
