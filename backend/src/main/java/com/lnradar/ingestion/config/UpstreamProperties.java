package com.lnradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Read-only wallet API (LNbits-compatible) connection settings.
 */
@ConfigurationProperties(prefix = "lnradar.upstream")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class UpstreamProperties {

    /** Base URL of the wallet server, e.g. https://lnbits.example.org. */
    @NotBlank
    private String baseUrl;

    /** Upper bound for every upstream call; on timeout the tick for that wallet is abandoned. */
    @Positive
    private long timeoutMs = 10_000;

    /** Header carrying the per-wallet read-only key. */
    @NotBlank
    private String apiKeyHeader = "X-Api-Key";
}
