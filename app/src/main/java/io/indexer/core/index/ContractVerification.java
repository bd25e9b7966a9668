package io.indexer.core.index;

import io.indexer.core.error.InvalidInputException;
import io.indexer.core.protocol.Address;

/**
 * Verification result for a deployed contract, produced by an external verifier. Replaced as a
 * whole on every write.
 */
public record ContractVerification(Address address,
                                   boolean verified,
                                   String contractName,
                                   String compilerVersion,
                                   boolean optimizationEnabled,
                                   int optimizationRuns,
                                   String sourceCode,
                                   String abi,
                                   String constructorArguments,
                                   String licenseType,
                                   long verifiedAt) {
    public ContractVerification {
        if (address == null) {
            throw new InvalidInputException("verification requires an address");
        }
        if (optimizationRuns < 0) {
            throw new InvalidInputException("optimization runs must be >= 0");
        }
    }
}
