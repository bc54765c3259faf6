package com.lnradar.api.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Administrative endpoints. Without a token they are open, which suits a single-operator deployment behind
 * a private network.
 */
@ConfigurationProperties(prefix = "lnradar.admin")
@NoArgsConstructor
@Getter
@Setter
public class AdminProperties {

    private String token;

    public boolean isTokenRequired() {
        return token != null && !token.isBlank();
    }
}
