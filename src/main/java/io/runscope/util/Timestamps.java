package io.runscope.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class Timestamps {
    private Timestamps() {
    }

    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // fall through to the plain instant form
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Whole seconds between two ISO timestamps, rounded, never negative; 0 when either does not parse. */
    public static long secondsBetween(String start, String end) {
        Optional<Instant> from = parse(start);
        Optional<Instant> to = parse(end);
        if (from.isEmpty() || to.isEmpty()) {
            return 0L;
        }
        long millis = to.get().toEpochMilli() - from.get().toEpochMilli();
        return Math.max(0L, Math.round(millis / 1000.0d));
    }
}
