package com.lnradar.domain;

/**
 * Donation-related fields of the upstream metadata bag, decoded once at the API boundary.
 *
 * @param linkId     pay-link id the payment came through (compared against the configured donation link)
 * @param comment    payer comment, may be null
 * @param amountMsat donation-specific amount in milli-units, null when absent or not numeric
 */
public record DonationMetadata(String linkId, String comment, Long amountMsat) {
}
