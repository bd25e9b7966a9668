package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;

/** A governance proposal folded from its creation, vote and execution events. */
public record Proposal(Address contract,
                       BigInteger proposalId,
                       Address proposer,
                       long createdAt,
                       Hash createdTx,
                       String actionType,
                       long requiredApprovals,
                       long approved,
                       long rejected,
                       Status status,
                       Long executedAt) {

    public enum Status {
        VOTING,
        EXECUTED,
        FAILED
    }
}
