package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.util.List;

/** WBFT round, seal, epoch and validator participation data. */
public interface ConsensusIndexReader {
    /** @throws io.indexer.core.error.NotFoundException when the block carries no indexed consensus data */
    WbftBlockExtra getWbftBlockExtra(OperationContext ctx, long height);

    WbftBlockExtra getWbftBlockExtraByHash(OperationContext ctx, Hash blockHash);

    /** @throws io.indexer.core.error.NotFoundException when no boundary block announced the epoch */
    EpochInfo getEpochInfo(OperationContext ctx, long epochNumber);

    EpochInfo getLatestEpochInfo(OperationContext ctx);

    ValidatorSigningStats getValidatorSigningStats(OperationContext ctx, Address validator, long fromBlock, long toBlock);

    /** Stats for every validator active in the range, ordered by address. */
    List<ValidatorSigningStats> getAllValidatorsSigningStats(OperationContext ctx, long fromBlock, long toBlock, PageRequest page);

    List<ValidatorSigningActivity> getValidatorSigningActivity(OperationContext ctx, Address validator,
                                                               long fromBlock, long toBlock, PageRequest page);

    BlockSigners getBlockSigners(OperationContext ctx, long height);

    record BlockSigners(List<Address> preparers, List<Address> committers) {
        public BlockSigners {
            preparers = List.copyOf(preparers);
            committers = List.copyOf(committers);
        }
    }
}
