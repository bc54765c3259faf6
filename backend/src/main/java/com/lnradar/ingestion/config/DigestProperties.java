package com.lnradar.ingestion.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "lnradar.digest")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DigestProperties {

    private boolean enabled = true;

    @Positive
    private long intervalMs = 86_400_000;
}
