package com.lnradar.domain;

import java.time.Instant;

/**
 * Creation time of an upstream record. {@link Source#FALLBACK} means the raw value could not be parsed
 * and {@link #instant()} is the observation time instead.
 */
public record NormalizedTimestamp(Instant instant, Source source) {

    public enum Source {
        PARSED,
        FALLBACK
    }

    public static NormalizedTimestamp parsed(Instant instant) {
        return new NormalizedTimestamp(instant, Source.PARSED);
    }

    public static NormalizedTimestamp fallback(Instant observedAt) {
        return new NormalizedTimestamp(observedAt, Source.FALLBACK);
    }

    public boolean isParsed() {
        return source == Source.PARSED;
    }
}
