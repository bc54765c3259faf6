package com.lnradar.ingestion.classifier;

import com.lnradar.domain.ClassifiedEvent;
import com.lnradar.domain.DonationMetadata;
import com.lnradar.domain.NormalizedTimestamp;
import com.lnradar.domain.PaymentDirection;
import com.lnradar.domain.PaymentRecord;
import com.lnradar.domain.PaymentStatus;
import com.lnradar.ingestion.config.SanitizerProperties;
import com.lnradar.ingestion.filter.ForbiddenWordRegistry;
import com.lnradar.ingestion.filter.MemoSanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentClassifierTest {

    private static final NormalizedTimestamp TS = NormalizedTimestamp.parsed(Instant.parse("2024-05-01T10:00:00Z"));

    private PaymentClassifier classifier;

    @BeforeEach
    void setUp() {
        SanitizerProperties props = new SanitizerProperties();
        props.setForbiddenWords(List.of("spam"));
        classifier = new PaymentClassifier(new MemoSanitizer(new ForbiddenWordRegistry(props), props));
    }

    private static PaymentRecord payment(String hash, Long amount, String memo, PaymentStatus status,
                                         DonationMetadata meta) {
        return new PaymentRecord(hash, amount, memo, status, TS, Optional.ofNullable(meta));
    }

    @Test
    @DisplayName("incoming payment: sign gives direction, magnitude is truncated")
    void incoming() {
        ClassifiedEvent e = classifier.classify(payment("h1", 21_999L, "hello", PaymentStatus.COMPLETED, null),
                "main", null).event();

        assertThat(e.direction()).isEqualTo(PaymentDirection.INCOMING);
        assertThat(e.amount()).isEqualTo(21);
        assertThat(e.memo()).isEqualTo("hello");
        assertThat(e.identifier().value()).isEqualTo("main_h1");
        assertThat(e.timestamp()).isEqualTo(TS);
        assertThat(e.donation()).isFalse();
        assertThat(e.donationAmount()).isNull();
    }

    @Test
    @DisplayName("outgoing payment of -1999 msat is 1 unit outgoing")
    void outgoingTruncation() {
        ClassifiedEvent e = classifier.classify(payment("h2", -1999L, null, PaymentStatus.COMPLETED, null),
                "main", null).event();

        assertThat(e.direction()).isEqualTo(PaymentDirection.OUTGOING);
        assertThat(e.amount()).isEqualTo(1);
        assertThat(e.memo()).isEqualTo("No memo");
    }

    @Test
    @DisplayName("pending, zero, malformed and unidentified records are skipped with a reason")
    void skips() {
        assertThat(classifier.classify(payment("h", 1000L, "m", PaymentStatus.PENDING, null), "main", null)
                .skipReason()).isEqualTo(SkipReason.PENDING);
        assertThat(classifier.classify(payment("h", 0L, "m", PaymentStatus.COMPLETED, null), "main", null)
                .skipReason()).isEqualTo(SkipReason.ZERO_AMOUNT);
        assertThat(classifier.classify(payment("h", null, "m", PaymentStatus.COMPLETED, null), "main", null)
                .skipReason()).isEqualTo(SkipReason.MALFORMED_AMOUNT);
        assertThat(classifier.classify(payment(null, 1000L, "m", PaymentStatus.COMPLETED, null), "main", null)
                .skipReason()).isEqualTo(SkipReason.MISSING_IDENTIFIER);
    }

    @Test
    @DisplayName("memo is sanitized")
    void memoSanitized() {
        ClassifiedEvent e = classifier.classify(payment("h", 5000L, "buy spam now", PaymentStatus.COMPLETED, null),
                "main", null).event();
        assertThat(e.memo()).isEqualTo("buy **** now");
    }

    @Test
    @DisplayName("matching donation link marks a donation with metadata amount and sanitized comment")
    void donationMatch() {
        DonationMetadata meta = new DonationMetadata("LINK1", "spam is fine", 10_500L);
        ClassifiedEvent e = classifier.classify(payment("h", 11_000L, "memo", PaymentStatus.COMPLETED, meta),
                "main", "LINK1").event();

        assertThat(e.donation()).isTrue();
        assertThat(e.donationAmount()).isEqualTo(10);
        assertThat(e.donationComment()).isEqualTo("**** is fine");
        assertThat(e.amount()).isEqualTo(11);
    }

    @Test
    @DisplayName("donation without metadata amount or comment falls back to payment amount and memo")
    void donationFallbacks() {
        DonationMetadata meta = new DonationMetadata("LINK1", null, null);
        ClassifiedEvent e = classifier.classify(payment("h", 7_000L, "thanks", PaymentStatus.COMPLETED, meta),
                "main", "LINK1").event();

        assertThat(e.donationAmount()).isEqualTo(7);
        assertThat(e.donationComment()).isEqualTo("thanks");
    }

    @Test
    @DisplayName("other link or no configured link is not a donation")
    void donationMismatch() {
        DonationMetadata meta = new DonationMetadata("OTHER", "c", 1000L);
        assertThat(classifier.classify(payment("h", 1000L, "m", PaymentStatus.COMPLETED, meta), "main", "LINK1")
                .event().donation()).isFalse();
        assertThat(classifier.classify(payment("h", 1000L, "m", PaymentStatus.COMPLETED, meta), "main", null)
                .event().donation()).isFalse();
    }
}
