package io.indexer.core.protocol;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.custom.sec.SecP256K1Curve;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * Public-key recovery on secp256k1 (SEC 1 v2, section 4.1.6), returning the Ethereum
 * address of the recovered key.
 */
public final class Secp256k1SignerRecovery implements SignerRecovery {
    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE =
            new ECDomainParameters(PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());
    private static final BigInteger HALF_N = CURVE.getN().shiftRight(1);

    @Override
    public Optional<Address> recover(byte[] digest, int recoveryId, BigInteger r, BigInteger s) {
        if (digest == null || digest.length != 32 || recoveryId < 0 || recoveryId > 1) {
            return Optional.empty();
        }
        BigInteger n = CURVE.getN();
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(HALF_N) > 0) {
            return Optional.empty();
        }
        BigInteger prime = SecP256K1Curve.q;
        if (r.compareTo(prime) >= 0) {
            return Optional.empty();
        }
        ECPoint bigR = decompressKey(r, (recoveryId & 1) == 1);
        if (bigR == null || !bigR.multiply(n).isInfinity()) {
            return Optional.empty();
        }
        BigInteger e = new BigInteger(1, digest);
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, bigR, srInv).normalize();
        if (q.isInfinity()) {
            return Optional.empty();
        }
        byte[] encoded = q.getEncoded(false);
        byte[] hash = Hashes.keccak256(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Optional.of(new Address(Arrays.copyOfRange(hash, 12, 32)));
    }

    private static ECPoint decompressKey(BigInteger x, boolean yBit) {
        X9IntegerConverter x9 = new X9IntegerConverter();
        byte[] compEnc = x9.integerToBytes(x, 1 + x9.getByteLength(CURVE.getCurve()));
        compEnc[0] = (byte) (yBit ? 0x03 : 0x02);
        try {
            return CURVE.getCurve().decodePoint(compEnc);
        } catch (IllegalArgumentException notOnCurve) {
            return null;
        }
    }
}
