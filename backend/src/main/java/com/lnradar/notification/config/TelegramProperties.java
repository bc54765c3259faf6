package com.lnradar.notification.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Telegram Bot API delivery. When disabled, notifications are only logged.
 */
@ConfigurationProperties(prefix = "lnradar.telegram")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TelegramProperties {

    private boolean enabled = false;
    private String botToken;
    private String chatId;
    private String apiBaseUrl = "https://api.telegram.org";

    @Positive
    private int maxMessagesPerMinute = 20;

    @Positive
    private long timeoutMs = 10_000;

    /** Optional "View Details" link target. */
    private String overwatchUrl;
}
