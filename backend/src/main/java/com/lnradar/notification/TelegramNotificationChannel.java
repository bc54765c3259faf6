package com.lnradar.notification;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telegram Bot API {@code sendMessage} with Markdown and an inline keyboard. Rate-limited per minute; a message
 * that cannot get a permit is dropped.
 */
@Slf4j
public class TelegramNotificationChannel implements NotificationChannel {

    private final WebClient webClient;
    private final String botToken;
    private final String chatId;
    private final RateLimiter rateLimiter;
    private final Duration timeout;

    public TelegramNotificationChannel(WebClient.Builder builder, String apiBaseUrl, String botToken, String chatId,
                                       RateLimiter rateLimiter, Duration timeout) {
        this.webClient = builder.baseUrl(apiBaseUrl).build();
        this.botToken = botToken;
        this.chatId = chatId;
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
    }

    @Override
    public boolean send(String text, List<List<InlineButton>> controls) {
        if (!rateLimiter.acquirePermission()) {
            log.error("Telegram rate limit reached; message dropped");
            return false;
        }
        try {
            webClient.post()
                    .uri("/bot{token}/sendMessage", botToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(text, controls))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            log.debug("Telegram message sent to chat {}", chatId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
            return false;
        }
    }

    Map<String, Object> payload(String text, List<List<InlineButton>> controls) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "Markdown");
        if (controls != null && !controls.isEmpty()) {
            body.put("reply_markup", Map.of("inline_keyboard", controls));
        }
        return body;
    }
}
