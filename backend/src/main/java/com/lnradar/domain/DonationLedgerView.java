package com.lnradar.domain;

import java.time.Instant;
import java.util.List;

/**
 * Consistent read of the donation ledger: {@code total} always equals the sum of {@code donations} amounts.
 */
public record DonationLedgerView(long total, List<Donation> donations, Instant lastUpdate) {
}
