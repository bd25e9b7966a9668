package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.util.List;
import java.util.Optional;

public interface SetCodeIndexReader {
    List<SetCodeAuthorizationRecord> getSetCodeAuthorizations(OperationContext ctx, Hash txHash);

    List<SetCodeAuthorizationRecord> getSetCodeAuthorizationsByTarget(OperationContext ctx, Address target, PageRequest page);

    List<SetCodeAuthorizationRecord> getSetCodeAuthorizationsByAuthority(OperationContext ctx, Address authority, PageRequest page);

    /** Empty when the account has never delegated or its last delegation was cleared. */
    Optional<Delegation> getDelegation(OperationContext ctx, Address authority);
}
