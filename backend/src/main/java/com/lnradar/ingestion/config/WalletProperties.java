package com.lnradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Monitored wallets. The main wallet is required; additional wallets are a comma-separated list whose entries are
 * either a bare key or {@code Display Name=key}.
 */
@ConfigurationProperties(prefix = "lnradar.wallets")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class WalletProperties {

    /** Shown in message headers. */
    private String instanceName = "LNbits Instance";

    @NotBlank
    private String mainKey;

    private String mainName = "Main Wallet";

    private String additionalKeys = "";
}
