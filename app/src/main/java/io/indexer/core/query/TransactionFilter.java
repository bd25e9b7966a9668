package io.indexer.core.query;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Transaction;
import io.indexer.core.protocol.TxType;

/** Transaction list filter; null fields match everything. A creation never matches a {@code to} filter. */
public record TransactionFilter(Long blockFrom, Long blockTo, Address from, Address to, TxType type) {

    public static final TransactionFilter NONE = new TransactionFilter(null, null, null, null, null);

    public boolean hasRange() {
        return blockFrom != null || blockTo != null;
    }

    public boolean hasAddressFilter() {
        return from != null || to != null;
    }

    public boolean matches(Transaction tx) {
        if (type != null && tx.type() != type) {
            return false;
        }
        if (from != null && !from.equals(tx.from())) {
            return false;
        }
        return to == null || tx.to().map(to::equals).orElse(false);
    }
}
