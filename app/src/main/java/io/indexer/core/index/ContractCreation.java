package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

/**
 * @param bytecodeSize length of the creation input in bytes
 */
public record ContractCreation(Address address,
                               Address creator,
                               Hash txHash,
                               long blockNumber,
                               int txIndex,
                               int bytecodeSize) {
}
