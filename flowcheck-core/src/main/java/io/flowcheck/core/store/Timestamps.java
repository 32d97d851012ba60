package io.flowcheck.core.store;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Optional;
import java.util.function.Supplier;

/// Parses the timestamp text stored in task-tracking tables.
///
/// Accepted shapes, tried in order:
/// - ISO offset date-time (`2026-10-18T14:15:00Z`, `2026-10-18T14:15:00+02:00`)
/// - ISO local date-time (`2026-10-18T14:15:00`), read as UTC
/// - SQL date-time (`2026-10-18 14:15:00`, optional fraction), read as UTC
/// - ISO date (`2026-10-18`), read as UTC midnight
public final class Timestamps {

    private static final DateTimeFormatter SQL_DATE_TIME =
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy-MM-dd HH:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                    .optionalEnd()
                    .toFormatter();

    private static final DateTimeFormatter ISO_LOCAL = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private static final ZoneOffset UTC = ZoneOffset.UTC;

    private Timestamps() {}

    /// Parses stored timestamp text.
    ///
    /// @param text the stored value, may be null or blank
    /// @return the instant, or empty if the text is absent or unparseable
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        return attempt(() -> OffsetDateTime.parse(value).toInstant())
                .or(() -> attempt(() -> LocalDateTime.parse(value, ISO_LOCAL).toInstant(UTC)))
                .or(() -> attempt(() -> LocalDateTime.parse(value, SQL_DATE_TIME).toInstant(UTC)))
                .or(() -> attempt(() -> LocalDate.parse(value).atStartOfDay(UTC).toInstant()));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /// Returns whether the text is present but cannot be parsed.
    ///
    /// @param text the stored value, may be null
    /// @return `true` for non-blank text that matches none of the accepted shapes
    public static boolean isMalformed(String text) {
        return text != null && !text.isBlank() && parse(text).isEmpty();
    }
}
