package com.flagship.pool_ledger.auth;

import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.PoolErrorCode;
import com.flagship.pool_ledger.pool.PoolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * Lets the pool authenticate as a key-holding principal: a signature over a challenge
 * hash counts as the pool's own when the operator produced it.
 *
 * Signatures are 65 bytes, {@code r (32) || s (32) || v (1)}. {@code v} may be given as
 * 0/1 or 27/28.
 */
@Component
@Slf4j
public class SignatureAuthenticator {

    public static final int SIGNATURE_LENGTH = 65;
    public static final int HASH_LENGTH = 32;

    /**
     * Checks that {@code signature} over {@code hash} recovers to {@code expectedSigner}.
     *
     * @return {@link SignatureVerdict#VALID} only for a non-zero recovered identity equal to
     *         the expected signer, {@link SignatureVerdict#INVALID} otherwise
     * @throws PoolException {@link PoolErrorCode#INVALID_SIGNATURE_LENGTH} if the signature is
     *         not 65 bytes; nothing is recovered in that case
     */
    public SignatureVerdict verify(byte[] hash, byte[] signature, Address expectedSigner) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new PoolException(PoolErrorCode.INVALID_SIGNATURE_LENGTH,
                "Signature must be " + SIGNATURE_LENGTH + " bytes, got " + (signature == null ? 0 : signature.length));
        }
        if (hash == null || hash.length != HASH_LENGTH) {
            log.debug("Rejecting challenge hash of unexpected length");
            return SignatureVerdict.INVALID;
        }

        Address recovered = recover(hash, signature).orElse(Address.ZERO);
        if (recovered.isZero() || expectedSigner == null || !recovered.equals(expectedSigner)) {
            return SignatureVerdict.INVALID;
        }
        return SignatureVerdict.VALID;
    }

    /**
     * Recovers the signing identity of a 65-byte signature.
     */
    public Optional<Address> recover(byte[] hash, byte[] signature) {
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        int v = signature[64] & 0xff;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            return Optional.empty();
        }
        return Secp256k1.recoverAddress(v - 27, r, s, hash);
    }
}
