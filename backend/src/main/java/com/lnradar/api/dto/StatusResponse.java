package com.lnradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lnradar.domain.Donation;
import com.lnradar.ingestion.sync.progress.WalletStatusTracker.WalletStatus;

import java.util.List;

public record StatusResponse(
        List<WalletStatus> wallets,
        @JsonProperty("recent_identifiers") List<String> recentIdentifiers,
        @JsonProperty("total_donations") long totalDonations,
        List<Donation> donations,
        @JsonProperty("lightning_address") String lightningAddress,
        String lnurl
) {
}
