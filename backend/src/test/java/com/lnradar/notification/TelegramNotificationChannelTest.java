package com.lnradar.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramNotificationChannelTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private TelegramNotificationChannel channel(HttpStatus status, int perMinute) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status).build());
        });
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(perMinute)
                .timeoutDuration(Duration.ZERO)
                .build());
        return new TelegramNotificationChannel(builder, "https://api.telegram.org", "TOKEN", "42", limiter,
                Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("posts to sendMessage with markdown and inline keyboard")
    void sends() {
        TelegramNotificationChannel ch = channel(HttpStatus.OK, 5);
        List<List<InlineButton>> keyboard = List.of(List.of(InlineButton.callback("View", "view_transactions")));

        assertThat(ch.send("*hi*", keyboard)).isTrue();
        assertThat(requests.get(0).url().toString()).isEqualTo("https://api.telegram.org/botTOKEN/sendMessage");

        JsonNode payload = new ObjectMapper().valueToTree(ch.payload("*hi*", keyboard));
        assertThat(payload.get("chat_id").asText()).isEqualTo("42");
        assertThat(payload.get("parse_mode").asText()).isEqualTo("Markdown");
        JsonNode button = payload.get("reply_markup").get("inline_keyboard").get(0).get(0);
        assertThat(button.get("callback_data").asText()).isEqualTo("view_transactions");
        assertThat(button.has("url")).isFalse();
    }

    @Test
    @DisplayName("no keyboard means no reply_markup")
    void noKeyboard() {
        Map<String, Object> payload = channel(HttpStatus.OK, 5).payload("x", List.of());
        assertThat(payload).doesNotContainKey("reply_markup");
    }

    @Test
    @DisplayName("HTTP error is reported as not delivered")
    void httpError() {
        assertThat(channel(HttpStatus.BAD_REQUEST, 5).send("x", List.of())).isFalse();
    }

    @Test
    @DisplayName("messages beyond the per-minute limit are dropped")
    void rateLimited() {
        TelegramNotificationChannel ch = channel(HttpStatus.OK, 1);
        assertThat(ch.send("one", List.of())).isTrue();
        assertThat(ch.send("two", List.of())).isFalse();
        assertThat(requests).hasSize(1);
    }
}
