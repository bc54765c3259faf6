package com.lnradar.domain;

/**
 * Wallet-scoped identifier of one upstream payment. Persisted form is {@code {walletTag}_{paymentHash}}, so the
 * same hash seen by two wallets yields two distinct identifiers.
 */
public record EventIdentifier(String walletTag, String paymentHash) {

    public EventIdentifier {
        if (walletTag == null || walletTag.isBlank()) {
            throw new IllegalArgumentException("walletTag is required");
        }
        if (paymentHash == null || paymentHash.isBlank()) {
            throw new IllegalArgumentException("paymentHash is required");
        }
    }

    public String value() {
        return walletTag + "_" + paymentHash;
    }

    @Override
    public String toString() {
        return value();
    }
}
