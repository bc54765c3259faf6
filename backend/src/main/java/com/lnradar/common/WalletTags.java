package com.lnradar.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives stable wallet tags for additional wallets: "w" + first 8 hex chars of SHA-256(credential).
 * Stable under reordering of the configured list and does not reveal the credential.
 */
public final class WalletTags {

    private static final int TAG_HEX_CHARS = 8;

    private WalletTags() {
    }

    public static String forCredential(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new IllegalArgumentException("credential is required");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(credential.strip().getBytes(StandardCharsets.UTF_8));
            return "w" + HexFormat.of().formatHex(digest).substring(0, TAG_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
