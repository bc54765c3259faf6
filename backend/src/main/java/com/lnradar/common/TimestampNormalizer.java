package com.lnradar.common;

import com.lnradar.domain.NormalizedTimestamp;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Single place where upstream creation timestamps are parsed. Accepts epoch seconds or millis (number or numeric
 * string), ISO-8601 instants and offset date-times, and zone-less local date-times with 'T' or ' ' separator
 * (interpreted as UTC). Anything else yields a {@link NormalizedTimestamp.Source#FALLBACK} at the clock's now.
 */
public class TimestampNormalizer {

    /** Values above this are taken as epoch millis rather than seconds (~ year 33658 in seconds). */
    private static final long EPOCH_MILLIS_CUTOFF = 1_000_000_000_000L;

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ofPattern("HH:mm[:ss]"))
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .toFormatter();

    private final Clock clock;

    public TimestampNormalizer(Clock clock) {
        this.clock = clock;
    }

    public TimestampNormalizer() {
        this(Clock.systemUTC());
    }

    public NormalizedTimestamp normalize(Object raw) {
        if (raw instanceof Number n) {
            return fromEpoch(n.longValue());
        }
        if (raw instanceof String s && !s.isBlank()) {
            return parseText(s.strip());
        }
        return NormalizedTimestamp.fallback(clock.instant());
    }

    private NormalizedTimestamp parseText(String text) {
        try {
            return fromEpoch(new BigDecimal(text).longValue());
        } catch (NumberFormatException ignored) {
            // not numeric; try textual formats
        }
        try {
            return NormalizedTimestamp.parsed(Instant.parse(text));
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return NormalizedTimestamp.parsed(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return NormalizedTimestamp.parsed(LocalDateTime.parse(text, LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return NormalizedTimestamp.fallback(clock.instant());
        }
    }

    private static NormalizedTimestamp fromEpoch(long value) {
        if (Math.abs(value) >= EPOCH_MILLIS_CUTOFF) {
            return NormalizedTimestamp.parsed(Instant.ofEpochMilli(value));
        }
        return NormalizedTimestamp.parsed(Instant.ofEpochSecond(value));
    }
}
