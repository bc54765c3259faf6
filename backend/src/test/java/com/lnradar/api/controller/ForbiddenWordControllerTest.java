package com.lnradar.api.controller;

import com.lnradar.api.config.AdminProperties;
import com.lnradar.ingestion.filter.ForbiddenWordService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Set;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ForbiddenWordControllerTest {

    @Mock
    private ForbiddenWordService forbiddenWordService;

    private WebTestClient client(String token) {
        AdminProperties props = new AdminProperties();
        props.setToken(token);
        return WebTestClient.bindToController(new ForbiddenWordController(forbiddenWordService, props))
                .controllerAdvice(new ValidationExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("adds a word and triggers re-sanitization when asked")
    void addWord() {
        when(forbiddenWordService.addWord("scam", true)).thenReturn(true);
        when(forbiddenWordService.words()).thenReturn(Set.of("scam"));

        client(null).post().uri("/api/admin/forbidden-words")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"word\": \"scam\", \"resanitize\": true}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.added").isEqualTo(true)
                .jsonPath("$.resanitizeTriggered").isEqualTo(true)
                .jsonPath("$.words[0]").isEqualTo("scam");
    }

    @Test
    @DisplayName("wrong or missing admin token is rejected when a token is configured")
    void tokenRequired() {
        client("s3cret").post().uri("/api/admin/forbidden-words")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"word\": \"scam\"}")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNAUTHORIZED");

        client("s3cret").get().uri("/api/admin/forbidden-words")
                .header("X-Admin-Token", "wrong")
                .exchange()
                .expectStatus().isUnauthorized();

        verify(forbiddenWordService, never()).addWord(anyString(), anyBoolean());
    }

    @Test
    @DisplayName("matching admin token lists words")
    void listWithToken() {
        when(forbiddenWordService.words()).thenReturn(Set.of("spam"));

        client("s3cret").get().uri("/api/admin/forbidden-words")
                .header("X-Admin-Token", "s3cret")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0]").isEqualTo("spam");
    }

    @Test
    @DisplayName("blank word is a validation error")
    void blankWord() {
        client(null).post().uri("/api/admin/forbidden-words")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"word\": \" \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("MISSING_WORD");
    }
}
