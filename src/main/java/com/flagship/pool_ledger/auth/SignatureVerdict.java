package com.flagship.pool_ledger.auth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Fixed 4-byte answers of the authentication boundary.
 * Callers treat the answer as data; a failed check is never an exception.
 */
@Getter
@RequiredArgsConstructor
public enum SignatureVerdict {
    VALID(0x1626ba7e),
    INVALID(0xffffffff);

    private final int magicValue;

    public byte[] toBytes() {
        return new byte[] {
            (byte) (magicValue >>> 24), (byte) (magicValue >>> 16), (byte) (magicValue >>> 8), (byte) magicValue
        };
    }

    public String toHex() {
        return String.format("0x%08x", magicValue);
    }
}
