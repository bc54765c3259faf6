package com.lnradar.donation;

import com.lnradar.domain.Donation;

import java.time.Instant;
import java.util.List;

public record DonationSummary(
        long total,
        List<Donation> donations,
        String lightningAddress,
        String lnurl,
        Instant lastUpdate
) {
}
