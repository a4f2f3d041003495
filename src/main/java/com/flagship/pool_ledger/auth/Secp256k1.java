package com.flagship.pool_ledger.auth;

import com.flagship.pool_ledger.pool.Address;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Public-key recovery on secp256k1 (SEC 1 v2, section 4.1.6).
 */
public final class Secp256k1 {

    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");

    public static final ECDomainParameters CURVE =
        new ECDomainParameters(PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());

    private static final BigInteger FIELD_PRIME = PARAMS.getCurve().getField().getCharacteristic();

    private Secp256k1() {
        // Utility class
    }

    /**
     * Recovers the signer of {@code messageHash}.
     *
     * @param recoveryId 0..3, selecting the candidate point R
     * @return the signer identity, or empty if the signature does not describe a valid key
     */
    public static Optional<Address> recoverAddress(int recoveryId, BigInteger r, BigInteger s, byte[] messageHash) {
        return recoverPublicKey(recoveryId, r, s, messageHash).map(Address::fromPublicKey);
    }

    /**
     * Recovers the uncompressed ({@code 0x04 || X || Y}) public key.
     */
    public static Optional<byte[]> recoverPublicKey(int recoveryId, BigInteger r, BigInteger s, byte[] messageHash) {
        BigInteger n = CURVE.getN();
        if (recoveryId < 0 || recoveryId > 3
                || r.signum() <= 0 || r.compareTo(n) >= 0
                || s.signum() <= 0 || s.compareTo(n) >= 0) {
            return Optional.empty();
        }

        BigInteger x = r.add(BigInteger.valueOf(recoveryId / 2).multiply(n));
        if (x.compareTo(FIELD_PRIME) >= 0) {
            return Optional.empty();
        }

        ECPoint candidate = decompress(x, (recoveryId & 1) == 1);
        if (candidate == null || !candidate.multiply(n).isInfinity()) {
            return Optional.empty();
        }

        BigInteger e = new BigInteger(1, messageHash);
        BigInteger rInverse = r.modInverse(n);
        BigInteger u1 = n.subtract(e).mod(n).multiply(rInverse).mod(n);
        BigInteger u2 = s.multiply(rInverse).mod(n);

        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), u1, candidate, u2).normalize();
        if (q.isInfinity()) {
            return Optional.empty();
        }
        return Optional.of(q.getEncoded(false));
    }

    private static ECPoint decompress(BigInteger x, boolean oddY) {
        X9IntegerConverter converter = new X9IntegerConverter();
        byte[] encoded = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
        encoded[0] = (byte) (oddY ? 0x03 : 0x02);
        try {
            return CURVE.getCurve().decodePoint(encoded);
        } catch (IllegalArgumentException notOnCurve) {
            return null;
        }
    }
}
