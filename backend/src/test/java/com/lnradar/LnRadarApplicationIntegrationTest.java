package com.lnradar;

import com.lnradar.ingestion.filter.MemoSanitizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "lnradar.upstream.base-url=http://localhost:1",
        "lnradar.wallets.main-key=test-read-key",
        "lnradar.polling.enabled=false",
        "lnradar.digest.enabled=false",
        "lnradar.donations.validate-on-startup=false",
        "lnradar.sanitizer.forbidden-words=spam",
        "lnradar.admin.token=s3cret"
})
@AutoConfigureWebTestClient
class LnRadarApplicationIntegrationTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("lnradar.storage.identifier-ledger-file", () -> dataDir.resolve("processed_payments.txt").toString());
        registry.add("lnradar.storage.balance-dir", () -> dataDir.toString());
        registry.add("lnradar.storage.donations-file", () -> dataDir.resolve("donations.json").toString());
    }

    @Autowired
    WebTestClient webTestClient;

    @Autowired
    MemoSanitizer memoSanitizer;

    @Test
    @DisplayName("context starts and serves an empty donation summary")
    void donationsEmpty() {
        webTestClient.get().uri("/api/donations")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_donations").isEqualTo(0)
                .jsonPath("$.lightning_address").isEqualTo("Unavailable");
    }

    @Test
    @DisplayName("status is available before the first tick")
    void status() {
        webTestClient.get().uri("/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.recent_identifiers").isArray();
    }

    @Test
    @DisplayName("vote on unknown donation is 404")
    void voteUnknown() {
        webTestClient.post().uri("/api/vote")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"donation_id\": \"missing\", \"vote_type\": \"like\"}")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("admin word added over HTTP applies to the sanitizer")
    void addForbiddenWord() {
        webTestClient.post().uri("/api/admin/forbidden-words")
                .header("X-Admin-Token", "s3cret")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"word\": \"rug\", \"resanitize\": false}")
                .exchange()
                .expectStatus().isOk();

        assertThat(memoSanitizer.sanitize("spam rug")).isEqualTo("**** ***");
    }
}
