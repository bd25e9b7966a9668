package io.indexer.core.protocol;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One signed entry of an EIP-7702 authorization list.
 *
 * @param chainId  chain the authorization is valid on, zero for any chain
 * @param address  delegation target
 * @param nonce    authority nonce at signing time
 * @param yParity  recovery id, 0 or 1
 * @param r        signature r
 * @param s        signature s
 */
public record SetCodeAuthorization(BigInteger chainId, Address address, long nonce, int yParity, BigInteger r, BigInteger s) {
    public SetCodeAuthorization {
        Objects.requireNonNull(chainId, "chainId");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(r, "r");
        Objects.requireNonNull(s, "s");
    }

    /** keccak256(0x05 || rlp([chainId, address, nonce])), the digest the authority signed. */
    public byte[] signingHash() {
        byte[] payload = Rlp.encodeList(
                Rlp.encodeBigInteger(chainId),
                Rlp.encodeBytes(address.bytes()),
                Rlp.encodeLong(nonce));
        byte[] prefixed = new byte[payload.length + 1];
        prefixed[0] = 0x05;
        System.arraycopy(payload, 0, prefixed, 1, payload.length);
        return Hashes.keccak256(prefixed);
    }
}
