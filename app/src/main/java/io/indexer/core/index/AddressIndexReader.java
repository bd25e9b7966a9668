package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.util.List;

/** Per-address transaction history. */
public interface AddressIndexReader {
    /** Transaction hashes touching the address, ordered by (height, tx index). */
    List<Hash> getAddressTransactions(OperationContext ctx, Address address, PageRequest page);

    long getAddressTransactionCount(OperationContext ctx, Address address);
}
