package io.indexer.core.index;

import io.indexer.core.error.DecodeFailureException;
import io.indexer.core.protocol.Address;

import java.util.List;

/**
 * Validator set announced at an epoch boundary block for the epoch that follows it.
 *
 * @param validators candidate indexes, in validator-index order
 */
public record EpochInfo(long epochNumber,
                        long blockNumber,
                        List<Candidate> candidates,
                        List<Integer> validators,
                        List<byte[]> blsPublicKeys) {
    public EpochInfo {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        validators = validators == null ? List.of() : List.copyOf(validators);
        blsPublicKeys = blsPublicKeys == null ? List.of() : List.copyOf(blsPublicKeys);
    }

    /** Address of the validator at {@code validatorIndex}. */
    public Address validatorAddress(int validatorIndex) {
        if (validatorIndex < 0 || validatorIndex >= validators.size()) {
            throw new DecodeFailureException("validator index " + validatorIndex + " outside set of " + validators.size());
        }
        int candidate = validators.get(validatorIndex);
        if (candidate < 0 || candidate >= candidates.size()) {
            throw new DecodeFailureException("validator " + validatorIndex + " points at candidate " + candidate
                    + " of " + candidates.size());
        }
        return candidates.get(candidate).address();
    }
}
