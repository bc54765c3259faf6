package com.lnradar.ingestion.filter;

import com.lnradar.ingestion.config.SanitizerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MemoSanitizerTest {

    private ForbiddenWordRegistry registry;
    private MemoSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        SanitizerProperties props = new SanitizerProperties();
        props.setForbiddenWords(List.of("spam", "scam"));
        registry = new ForbiddenWordRegistry(props);
        sanitizer = new MemoSanitizer(registry, props);
    }

    @Test
    @DisplayName("masks whole-word matches with equal-length asterisks")
    void masksWholeWord() {
        assertThat(sanitizer.sanitize("no spam here")).isEqualTo("no **** here");
    }

    @Test
    @DisplayName("does not touch words that merely contain a forbidden word")
    void partialWordUntouched() {
        assertThat(sanitizer.sanitize("spammy content")).isEqualTo("spammy content");
    }

    @Test
    @DisplayName("matching is case-insensitive and keeps surrounding punctuation")
    void caseInsensitive() {
        assertThat(sanitizer.sanitize("SPAM, Scam!")).isEqualTo("****, ****!");
    }

    @Test
    @DisplayName("empty or absent memo becomes the placeholder")
    void placeholder() {
        assertThat(sanitizer.sanitize(null)).isEqualTo("No memo");
        assertThat(sanitizer.sanitize("   ")).isEqualTo("No memo");
    }

    @Test
    @DisplayName("sanitizing twice gives the same result")
    void idempotent() {
        String once = sanitizer.sanitize("spam and scam and more spam");
        assertThat(sanitizer.sanitize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("empty forbidden set leaves text as is")
    void emptySet() {
        assertThat(sanitizer.sanitize("spam", Set.of())).isEqualTo("spam");
    }

    @Test
    @DisplayName("words added at runtime apply to subsequent memos")
    void runtimeAddition() {
        assertThat(registry.add("Rug")).isTrue();
        assertThat(registry.add("rug")).isFalse();
        assertThat(sanitizer.sanitize("a rug pull")).isEqualTo("a *** pull");
    }
}
