package com.lnradar.ingestion.filter;

import com.lnradar.ingestion.config.SanitizerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ForbiddenWordServiceTest {

    @Mock
    private MemoResanitizer memoResanitizer;

    private ForbiddenWordService service;

    @BeforeEach
    void setUp() {
        SanitizerProperties props = new SanitizerProperties();
        props.setForbiddenWords(List.of("spam"));
        service = new ForbiddenWordService(new ForbiddenWordRegistry(props), memoResanitizer);
    }

    @Test
    @DisplayName("adding a word does not rewrite stored memos unless asked")
    void addWithoutResanitize() {
        assertThat(service.addWord("scam", false)).isTrue();
        assertThat(service.words()).containsExactlyInAnyOrder("spam", "scam");
        verify(memoResanitizer, never()).resanitizeAsync();
    }

    @Test
    @DisplayName("resanitize flag triggers the re-sanitization pass")
    void addWithResanitize() {
        service.addWord("scam", true);
        verify(memoResanitizer).resanitizeAsync();
    }

    @Test
    @DisplayName("known word reports not added")
    void duplicateWord() {
        assertThat(service.addWord("SPAM", false)).isFalse();
    }
}
