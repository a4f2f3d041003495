package com.flagship.pool_ledger.pool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * A 20-byte account identity.
 *
 * Identities are compared case-insensitively and always rendered as lowercase
 * {@code 0x}-prefixed hex. The all-zero identity is the null sentinel and is never
 * a valid principal.
 */
@EqualsAndHashCode
public final class Address {

    public static final int LENGTH = 20;

    public static final Address ZERO = new Address(new byte[LENGTH]);

    private static final Pattern HEX_FORM = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private final byte[] value;

    private Address(byte[] value) {
        this.value = value;
    }

    /**
     * Parses a {@code 0x}-prefixed, 40 hex digit identity.
     *
     * @throws PoolException with {@link PoolErrorCode#INVALID_ADDRESS} if the text is malformed
     */
    @JsonCreator
    public static Address of(String hex) {
        if (hex == null || !HEX_FORM.matcher(hex.trim()).matches()) {
            throw new PoolException(PoolErrorCode.INVALID_ADDRESS, "Malformed address: " + hex);
        }
        return new Address(Hex.decode(hex.trim().substring(2)));
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new PoolException(PoolErrorCode.INVALID_ADDRESS, "Address must be 20 bytes");
        }
        return new Address(bytes.clone());
    }

    /**
     * Derives the identity of an uncompressed secp256k1 public key
     * ({@code 0x04 || X || Y}): the last 20 bytes of Keccak-256 over {@code X || Y}.
     */
    public static Address fromPublicKey(byte[] uncompressedKey) {
        if (uncompressedKey == null || uncompressedKey.length != 65 || uncompressedKey[0] != 0x04) {
            throw new IllegalArgumentException("Expected a 65-byte uncompressed public key");
        }
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(uncompressedKey, 1, 64);
        byte[] hash = digest.digest();
        return new Address(Arrays.copyOfRange(hash, hash.length - LENGTH, hash.length));
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public byte[] toBytes() {
        return value.clone();
    }

    @JsonValue
    @Override
    public String toString() {
        return "0x" + Hex.toHexString(value);
    }
}
