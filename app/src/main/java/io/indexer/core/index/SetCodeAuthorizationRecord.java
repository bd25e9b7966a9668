package io.indexer.core.index;

import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.math.BigInteger;

/**
 * One indexed EIP-7702 authorization.
 *
 * @param authority recovered signer, {@code null} when recovery failed
 * @param error     {@code null} when the authorization is well formed, otherwise one of
 *                  {@link #RECOVERY_FAILED}, {@link #NONCE_OVERFLOW}, {@link #INVALID_SIGNATURE}
 */
public record SetCodeAuthorizationRecord(Hash txHash,
                                         long blockNumber,
                                         int txIndex,
                                         int authorizationIndex,
                                         Address target,
                                         Address authority,
                                         BigInteger chainId,
                                         long nonce,
                                         int yParity,
                                         boolean applied,
                                         String error) {
    public static final String RECOVERY_FAILED = "recovery_failed";
    public static final String NONCE_OVERFLOW = "nonce_overflow";
    public static final String INVALID_SIGNATURE = "invalid_signature";
}
