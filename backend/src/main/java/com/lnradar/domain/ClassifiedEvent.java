package com.lnradar.domain;

/**
 * Committed incoming or outgoing payment, normalized for notification and donation accounting.
 * Transient: only its side effects (ledger entries, donations) are persisted.
 *
 * @param amount         whole display units, truncated toward zero
 * @param donationAmount whole display units; null unless {@code donation} is true
 */
public record ClassifiedEvent(
        EventIdentifier identifier,
        PaymentDirection direction,
        long amount,
        String memo,
        NormalizedTimestamp timestamp,
        boolean donation,
        Long donationAmount,
        String donationComment
) {

    public String walletTag() {
        return identifier.walletTag();
    }

    public boolean isIncoming() {
        return direction == PaymentDirection.INCOMING;
    }
}
