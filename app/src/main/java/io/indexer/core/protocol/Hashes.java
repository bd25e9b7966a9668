package io.indexer.core.protocol;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.charset.StandardCharsets;

public final class Hashes {
    private Hashes() {}

    public static byte[] keccak256(byte[] input) {
        Keccak.DigestKeccak kecc = new Keccak.Digest256();
        kecc.update(input, 0, input.length);
        return kecc.digest();
    }

    /** Topic hash of an event signature such as {@code Transfer(address,address,uint256)}. */
    public static Hash eventTopic(String signature) {
        return new Hash(keccak256(signature.getBytes(StandardCharsets.US_ASCII)));
    }
}
