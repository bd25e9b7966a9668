package io.indexer.core.index;

import io.indexer.core.protocol.Address;

/**
 * Signing counters for a validator over an inclusive block range.
 *
 * @param signingRateBps prepare signatures per block the validator was expected to sign, in
 *                       basis points (10000 = every block)
 */
public record ValidatorSigningStats(Address validator,
                                    int validatorIndex,
                                    long prepareSignCount,
                                    long prepareMissCount,
                                    long commitSignCount,
                                    long commitMissCount,
                                    long fromBlock,
                                    long toBlock,
                                    long signingRateBps) {
}
