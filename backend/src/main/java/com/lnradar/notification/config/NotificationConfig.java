package com.lnradar.notification.config;

import com.lnradar.notification.LoggingNotificationChannel;
import com.lnradar.notification.NotificationChannel;
import com.lnradar.notification.TelegramNotificationChannel;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(TelegramProperties.class)
@Slf4j
public class NotificationConfig {

    @Bean(name = "telegramRateLimiter")
    public RateLimiter telegramRateLimiter(TelegramProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getMaxMessagesPerMinute()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("telegram", config);
    }

    @Bean
    public NotificationChannel notificationChannel(TelegramProperties properties, WebClient.Builder webClientBuilder,
                                                   RateLimiter telegramRateLimiter) {
        if (!properties.isEnabled()) {
            log.info("Telegram delivery disabled; notifications are logged only");
            return new LoggingNotificationChannel();
        }
        if (isBlank(properties.getBotToken()) || isBlank(properties.getChatId())) {
            throw new IllegalStateException("lnradar.telegram.bot-token and chat-id are required when telegram is enabled");
        }
        return new TelegramNotificationChannel(webClientBuilder, properties.getApiBaseUrl(), properties.getBotToken(),
                properties.getChatId(), telegramRateLimiter, Duration.ofMillis(properties.getTimeoutMs()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
