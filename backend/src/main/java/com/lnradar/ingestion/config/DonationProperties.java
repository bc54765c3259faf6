package com.lnradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Donation attribution. Payments whose metadata link equals {@link #linkId} are counted as donations.
 * Without a link id, donation attribution is off.
 */
@ConfigurationProperties(prefix = "lnradar.donations")
@NoArgsConstructor
@Getter
@Setter
public class DonationProperties {

    private String linkId;

    /** Public donations page, offered as a button in notifications. */
    private String pageUrl;

    private String informationUrl;

    /** Resolve the link once at startup and warn when it does not exist. */
    private boolean validateOnStartup = true;

    public boolean isAttributionEnabled() {
        return linkId != null && !linkId.isBlank();
    }
}
