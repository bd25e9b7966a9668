package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

public interface SystemContractReader {
    /** Events of one kind with {@code fromBlock <= height <= toBlock}. */
    List<SystemContractEvent> getSystemEvents(OperationContext ctx, SystemEventKind kind, long fromBlock, long toBlock, PageRequest page);

    /** Events of the given kinds about one account, for example a minter's configuration history. */
    List<SystemContractEvent> getSystemEventsByAccount(OperationContext ctx, Address account, Set<SystemEventKind> kinds, PageRequest page);

    /** Addresses whose latest blacklist event put them on the list. */
    List<Address> getBlacklistedAddresses(OperationContext ctx);

    List<Proposal> getProposals(OperationContext ctx, Address contract, PageRequest page);

    /** @throws io.indexer.core.error.NotFoundException when the proposal was never created */
    Proposal getProposal(OperationContext ctx, Address contract, BigInteger proposalId);

    List<SystemContractEvent> getProposalVotes(OperationContext ctx, Address contract, BigInteger proposalId);
}
