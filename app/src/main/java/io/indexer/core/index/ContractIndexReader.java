package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;

import java.util.List;

public interface ContractIndexReader {
    /** @throws io.indexer.core.error.NotFoundException when no creation was indexed for the address */
    ContractCreation getContractCreation(OperationContext ctx, Address contract);

    List<ContractCreation> getContractsByCreator(OperationContext ctx, Address creator, PageRequest page);

    /** @throws io.indexer.core.error.NotFoundException when the contract is not verified */
    ContractVerification getContractVerification(OperationContext ctx, Address contract);

    boolean isContractVerified(OperationContext ctx, Address contract);

    /** Verified contracts in address order. */
    List<ContractVerification> listVerifiedContracts(OperationContext ctx, PageRequest page);
}
