package com.lnradar.domain;

import java.util.Optional;

/**
 * Raw upstream payment as decoded from the recent-payments endpoint.
 * {@code paymentHash} and {@code amountMsat} are nullable: malformed records are still decoded so the
 * classifier can skip them with a warning instead of failing the whole batch.
 */
public record PaymentRecord(
        String paymentHash,
        Long amountMsat,
        String memo,
        PaymentStatus status,
        NormalizedTimestamp createdAt,
        Optional<DonationMetadata> donationMetadata
) {

    public PaymentRecord {
        status = status != null ? status : PaymentStatus.COMPLETED;
        donationMetadata = donationMetadata != null ? donationMetadata : Optional.empty();
    }

    public boolean hasIdentifier() {
        return paymentHash != null && !paymentHash.isBlank();
    }
}
