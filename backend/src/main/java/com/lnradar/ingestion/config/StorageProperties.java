package com.lnradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * File locations of the three durable stores.
 */
@ConfigurationProperties(prefix = "lnradar.storage")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class StorageProperties {

    @NotBlank
    private String identifierLedgerFile = "data/processed_payments.txt";

    /** One {@code current-balance-{walletTag}.txt} per wallet. */
    @NotBlank
    private String balanceDir = "data";

    @NotBlank
    private String donationsFile = "data/donations.json";
}
