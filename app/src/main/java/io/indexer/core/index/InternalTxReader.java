package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.util.List;

public interface InternalTxReader {
    List<InternalTransaction> getInternalTransactions(OperationContext ctx, Hash txHash);

    List<InternalTransaction> getInternalTransactionsByAddress(OperationContext ctx, Address address, boolean asSender, PageRequest page);

    /** Counted by scanning the address bucket on every call. */
    long countInternalTransactions(OperationContext ctx, Address address, boolean asSender);
}
