package io.indexer.core.protocol;

import java.math.BigInteger;
import java.util.Optional;

/** Recovers the address that produced a recoverable ECDSA signature over a 32-byte digest. */
public interface SignerRecovery {
    Optional<Address> recover(byte[] digest, int recoveryId, BigInteger r, BigInteger s);

    default Optional<Address> recover(SetCodeAuthorization auth) {
        return recover(auth.signingHash(), auth.yParity(), auth.r(), auth.s());
    }
}
