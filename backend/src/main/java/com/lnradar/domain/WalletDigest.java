package com.lnradar.domain;

/**
 * Summary figures for the periodic digest. Totals are whole display units over non-pending recent payments.
 */
public record WalletDigest(
        WalletDescriptor wallet,
        long balance,
        int incomingCount,
        long incomingTotal,
        int outgoingCount,
        long outgoingTotal
) {
}
