package com.lnradar.ingestion.filter;

import com.lnradar.ingestion.config.SanitizerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Masks forbidden words in memos. Case-insensitive, whole-word matches only ("spam" does not touch "spammy");
 * each match is replaced by asterisks of the same length. Empty or absent input becomes the placeholder.
 * Idempotent: masked tokens contain no word characters and never match again.
 */
@Component
@RequiredArgsConstructor
public class MemoSanitizer {

    private static final char MASK = '*';

    private final ForbiddenWordRegistry registry;
    private final SanitizerProperties properties;

    /**
     * Sanitizes against the registry's current word set.
     */
    public String sanitize(String text) {
        return sanitize(text, registry.snapshot());
    }

    public String sanitize(String text, Set<String> forbiddenWords) {
        if (text == null || text.isBlank()) {
            return properties.getPlaceholder();
        }
        Pattern pattern = compile(forbiddenWords);
        if (pattern == null) {
            return text;
        }
        Matcher m = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            m.appendReplacement(out, String.valueOf(MASK).repeat(m.group().length()));
        }
        m.appendTail(out);
        return out.toString();
    }

    static Pattern compile(Set<String> forbiddenWords) {
        if (forbiddenWords == null || forbiddenWords.isEmpty()) {
            return null;
        }
        // longest first so "spam bot" wins over "spam" when both are listed
        String alternation = forbiddenWords.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(String::strip)
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        if (alternation.isEmpty()) {
            return null;
        }
        return Pattern.compile("(?<!\\w)(?:" + alternation + ")(?!\\w)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    }
}
