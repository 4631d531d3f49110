package space.ketterling.liveview.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Timestamp parsing shared by the feed parsers.
 */
public final class Times {
    private Times() {
    }

    /**
     * Parses an ISO-8601 timestamp with either an offset or a 'Z' suffix.
     * Returns null for blank or unparseable input.
     */
    public static Instant parseInstant(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return OffsetDateTime.parse(s.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(s.trim());
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
