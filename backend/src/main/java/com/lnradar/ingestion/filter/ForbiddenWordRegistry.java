package com.lnradar.ingestion.filter;

import com.lnradar.ingestion.config.SanitizerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime-mutable set of forbidden memo words, seeded from configuration. Words are stored lowercase.
 * Growing the set does not touch memos already stored; see {@link com.lnradar.ingestion.filter.MemoResanitizer}.
 */
@Component
@Slf4j
public class ForbiddenWordRegistry {

    private final Set<String> words = ConcurrentHashMap.newKeySet();

    public ForbiddenWordRegistry(SanitizerProperties properties) {
        if (properties.getForbiddenWords() != null) {
            properties.getForbiddenWords().forEach(this::add);
        }
        log.info("Loaded {} forbidden words", words.size());
    }

    /**
     * @return true if the word was not known before
     */
    public boolean add(String word) {
        String normalized = normalize(word);
        if (normalized == null) {
            return false;
        }
        return words.add(normalized);
    }

    /**
     * Immutable copy, safe to hand to {@link MemoSanitizer#sanitize(String, Set)}.
     */
    public Set<String> snapshot() {
        return Set.copyOf(words);
    }

    static String normalize(String word) {
        if (word == null || word.isBlank()) {
            return null;
        }
        return word.strip().toLowerCase(Locale.ROOT);
    }
}
