package io.indexer.core.protocol;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class Secp256k1SignerRecoveryTest {
    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE =
            new ECDomainParameters(PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());
    private static final BigInteger PRIVATE_KEY = new BigInteger("4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", 16);

    private final SignerRecovery recovery = new Secp256k1SignerRecovery();

    @Test
    void recoversTheSigningAddress() {
        byte[] digest = Hashes.keccak256("hello".getBytes());
        Signature sig = sign(digest);

        Optional<Address> recovered = recovery.recover(digest, sig.recoveryId, sig.r, sig.s);
        assertEquals(Optional.of(expectedAddress()), recovered);
    }

    @Test
    void keyDerivesTheWellKnownAddress() {
        assertEquals(Address.fromHex("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23"), expectedAddress());
    }

    @Test
    void recoversTheAuthorityOfASetCodeAuthorization() {
        SetCodeAuthorization unsigned = new SetCodeAuthorization(BigInteger.ONE,
                Address.fromHex("0x00000000000000000000000000000000000000aa"), 3, 0, BigInteger.ONE, BigInteger.ONE);
        Signature sig = sign(unsigned.signingHash());
        SetCodeAuthorization signed = new SetCodeAuthorization(unsigned.chainId(), unsigned.address(),
                unsigned.nonce(), sig.recoveryId, sig.r, sig.s);

        assertEquals(Optional.of(expectedAddress()), recovery.recover(signed));
    }

    @Test
    void rejectsOutOfRangeSignatures() {
        byte[] digest = Hashes.keccak256("hello".getBytes());
        Signature sig = sign(digest);
        BigInteger highS = CURVE.getN().subtract(sig.s);

        assertTrue(recovery.recover(digest, sig.recoveryId, sig.r, highS).isEmpty());
        assertTrue(recovery.recover(digest, 2, sig.r, sig.s).isEmpty());
        assertTrue(recovery.recover(digest, 0, BigInteger.ZERO, sig.s).isEmpty());
        assertTrue(recovery.recover(new byte[31], 0, sig.r, sig.s).isEmpty());
    }

    private Signature sign(byte[] digest) {
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(PRIVATE_KEY, CURVE));
        BigInteger[] rs = signer.generateSignature(digest);
        BigInteger r = rs[0];
        BigInteger s = rs[1];
        if (s.compareTo(CURVE.getN().shiftRight(1)) > 0) {
            s = CURVE.getN().subtract(s);
        }
        Address expected = expectedAddress();
        for (int recId = 0; recId < 2; recId++) {
            if (recovery.recover(digest, recId, r, s).map(expected::equals).orElse(false)) {
                return new Signature(recId, r, s);
            }
        }
        throw new AssertionError("no recovery id reproduces the signer");
    }

    private static Address expectedAddress() {
        byte[] pub = CURVE.getG().multiply(PRIVATE_KEY).normalize().getEncoded(false);
        byte[] hash = Hashes.keccak256(Arrays.copyOfRange(pub, 1, pub.length));
        return new Address(Arrays.copyOfRange(hash, 12, 32));
    }

    private record Signature(int recoveryId, BigInteger r, BigInteger s) {
    }
}
