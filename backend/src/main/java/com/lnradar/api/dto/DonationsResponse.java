package com.lnradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lnradar.domain.Donation;
import com.lnradar.donation.DonationSummary;

import java.util.List;

/**
 * GET /api/donations body. Field names kept compatible with the public donations page.
 */
public record DonationsResponse(
        @JsonProperty("total_donations") long totalDonations,
        List<Donation> donations,
        @JsonProperty("lightning_address") String lightningAddress,
        String lnurl
) {

    public static DonationsResponse from(DonationSummary summary) {
        return new DonationsResponse(summary.total(), summary.donations(), summary.lightningAddress(),
                summary.lnurl());
    }
}
