package com.policysync.contract;

/**
 * Signing key generation reported by the server. {@code valid} is false when no
 * version is known, in which case {@code version} carries no meaning.
 */
public record PublicKeyVersion(int version, boolean valid) {

    private static final PublicKeyVersion INVALID = new PublicKeyVersion(0, false);

    public static PublicKeyVersion invalid() {
        return INVALID;
    }

    public static PublicKeyVersion of(int version) {
        return new PublicKeyVersion(version, true);
    }
}
