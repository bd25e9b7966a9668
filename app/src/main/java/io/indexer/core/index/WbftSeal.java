package io.indexer.core.index;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated BLS seal. Bit {@code j} of byte {@code i} in {@code sealers} marks validator
 * index {@code i * 8 + j} as a signer.
 */
public record WbftSeal(byte[] sealers, byte[] signature) {
    public WbftSeal {
        sealers = sealers == null ? new byte[0] : sealers.clone();
        signature = signature == null ? new byte[0] : signature.clone();
    }

    public boolean signed(int validatorIndex) {
        int byteIndex = validatorIndex / 8;
        return byteIndex < sealers.length && (sealers[byteIndex] & (1 << (validatorIndex % 8))) != 0;
    }

    /** Indexes of signers below {@code validatorCount}. */
    public List<Integer> signerIndexes(int validatorCount) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < validatorCount && i / 8 < sealers.length; i++) {
            if (signed(i)) {
                out.add(i);
            }
        }
        return out;
    }
}
