package com.lnradar.donation;

import com.lnradar.ingestion.config.DonationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Checks once at startup that the configured donation link exists. Never aborts startup: the upstream may
 * simply be down.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DonationLinkStartupValidator {

    private final DonationProperties donationProperties;
    private final PayLinkResolver payLinkResolver;

    @EventListener(ApplicationReadyEvent.class)
    public void validate() {
        if (!donationProperties.isValidateOnStartup()) {
            return;
        }
        if (!donationProperties.isAttributionEnabled()) {
            log.info("No donation link configured; donation attribution disabled");
            return;
        }
        if (payLinkResolver.resolve(donationProperties.getLinkId()).isPresent()) {
            log.info("Donation link {} resolved", donationProperties.getLinkId());
        } else {
            log.warn("Donation link {} could not be resolved; donations will still be matched by id",
                    donationProperties.getLinkId());
        }
    }
}
