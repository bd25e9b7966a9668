package io.indexer.core.index;

import io.indexer.core.OperationContext;
import io.indexer.core.protocol.Address;

/** Mutable verification records, last write wins. */
public interface ContractVerificationWriter {
    void setContractVerification(OperationContext ctx, ContractVerification verification);

    void deleteContractVerification(OperationContext ctx, Address contract);
}
