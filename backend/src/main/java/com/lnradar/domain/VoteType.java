package com.lnradar.domain;

import java.util.Locale;
import java.util.Optional;

public enum VoteType {
    LIKE,
    DISLIKE;

    public static Optional<VoteType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "like" -> Optional.of(LIKE);
            case "dislike" -> Optional.of(DISLIKE);
            default -> Optional.empty();
        };
    }
}
