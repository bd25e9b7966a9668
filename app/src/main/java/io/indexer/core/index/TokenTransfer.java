package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A decoded token Transfer event. ERC20 transfers carry {@code value}; ERC721 transfers carry
 * {@code tokenId}. The other amount is {@code null}.
 */
public record TokenTransfer(TokenStandard standard,
                            Address contract,
                            Address from,
                            Address to,
                            BigInteger value,
                            BigInteger tokenId,
                            Hash txHash,
                            long blockNumber,
                            int txIndex,
                            int logIndex) {
    public TokenTransfer {
        Objects.requireNonNull(standard, "standard");
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(txHash, "txHash");
    }

    public boolean mint() {
        return Address.ZERO.equals(from);
    }

    public boolean burn() {
        return Address.ZERO.equals(to);
    }
}
