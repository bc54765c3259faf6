package com.lnradar.api.controller;

import com.lnradar.api.dto.StatusResponse;
import com.lnradar.donation.DonationSummary;
import com.lnradar.donation.DonationSummaryService;
import com.lnradar.ingestion.sync.progress.WalletStatusTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /status: last known balance per wallet, recently processed identifiers and the donation summary.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final WalletStatusTracker walletStatusTracker;
    private final DonationSummaryService donationSummaryService;

    @GetMapping("/status")
    public StatusResponse status() {
        DonationSummary summary = donationSummaryService.summary();
        return new StatusResponse(
                walletStatusTracker.statuses(),
                walletStatusTracker.recentIdentifiers(),
                summary.total(),
                summary.donations(),
                summary.lightningAddress(),
                summary.lnurl());
    }
}
