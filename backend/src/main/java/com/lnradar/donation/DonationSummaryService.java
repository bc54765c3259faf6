package com.lnradar.donation;

import com.lnradar.domain.DonationLedgerView;
import com.lnradar.domain.PayLink;
import com.lnradar.domain.VoteCounts;
import com.lnradar.domain.VoteType;
import com.lnradar.ingestion.config.DonationProperties;
import com.lnradar.ingestion.config.UpstreamProperties;
import com.lnradar.ingestion.store.DonationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Instant;
import java.util.Optional;

/**
 * Read side of the donation ledger, enriched with the payable address of the configured donation link.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DonationSummaryService {

    static final String UNAVAILABLE = "Unavailable";
    static final String UNKNOWN_USER = "Unknown";

    private final DonationLedger donationLedger;
    private final PayLinkResolver payLinkResolver;
    private final DonationProperties donationProperties;
    private final UpstreamProperties upstreamProperties;

    public DonationSummary summary() {
        DonationLedgerView view = donationLedger.view();
        String address = UNAVAILABLE;
        String lnurl = UNAVAILABLE;
        Optional<PayLink> link = donationProperties.isAttributionEnabled()
                ? payLinkResolver.resolve(donationProperties.getLinkId())
                : Optional.empty();
        if (link.isPresent()) {
            String username = link.get().username();
            if (username == null || username.isBlank()) {
                username = UNKNOWN_USER;
            }
            address = username + "@" + upstreamAuthority();
            if (link.get().lnurl() != null && !link.get().lnurl().isBlank()) {
                lnurl = link.get().lnurl();
            }
        }
        return new DonationSummary(view.total(), view.donations(), address, lnurl, view.lastUpdate());
    }

    public Instant lastUpdate() {
        return donationLedger.lastUpdate();
    }

    public Optional<VoteCounts> vote(String donationId, VoteType voteType) {
        Optional<VoteCounts> counts = donationLedger.vote(donationId, voteType);
        if (counts.isEmpty()) {
            log.debug("Vote for unknown donation {}", donationId);
        }
        return counts;
    }

    private String upstreamAuthority() {
        try {
            String authority = URI.create(upstreamProperties.getBaseUrl()).getAuthority();
            return authority != null ? authority : upstreamProperties.getBaseUrl();
        } catch (IllegalArgumentException e) {
            return upstreamProperties.getBaseUrl();
        }
    }
}
