package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

/** Whether one validator signed the prepare and commit phases of one block. */
public record ValidatorSigningActivity(long blockNumber,
                                       Hash blockHash,
                                       Address validator,
                                       int validatorIndex,
                                       boolean signedPrepare,
                                       boolean signedCommit,
                                       long round,
                                       long timestamp) {
}
