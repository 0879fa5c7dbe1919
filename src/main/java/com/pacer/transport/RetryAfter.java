package com.pacer.transport;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the {@code Retry-After} response header.
 */
public final class RetryAfter {

    private RetryAfter() {
    }

    /**
     * Parse a header value given as delta-seconds or as an RFC 1123 HTTP-date.
     *
     * @param value raw header value
     * @param now   reference time for HTTP-date values
     * @return the suggested delay, or null when absent, unparseable or not in the future
     */
    public static Duration parse(String value, Instant now) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();

        try {
            long seconds = Long.parseLong(v);
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // not delta-seconds
        }

        try {
            Instant target = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delta = Duration.between(now, target);
            return delta.isNegative() || delta.isZero() ? null : delta;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
