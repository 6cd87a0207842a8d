package uk.gegc.manuscript.features.scrivener.application;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Date handling for project XML. Parsing never fails: an unrecognized value is "no date".
 */
public final class ScrivenerDates {

    public static final DateTimeFormatter MANIFEST_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", Locale.ROOT);

    private static final DateTimeFormatter SPACE_NO_ZONE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter T_NO_ZONE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter T_COMPACT_ZONE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ", Locale.ROOT);

    // Tried in order; the first parser that succeeds wins.
    private static final List<Function<String, Instant>> PARSERS = List.of(
            value -> OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant(),
            value -> OffsetDateTime.parse(value, MANIFEST_FORMAT).toInstant(),
            value -> LocalDateTime.parse(value, SPACE_NO_ZONE).toInstant(ZoneOffset.UTC),
            value -> LocalDateTime.parse(value, T_NO_ZONE).toInstant(ZoneOffset.UTC),
            value -> OffsetDateTime.parse(value, T_COMPACT_ZONE).toInstant()
    );

    private ScrivenerDates() {
    }

    /**
     * @return the parsed instant, or {@code null} when no known format matches
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (Function<String, Instant> parser : PARSERS) {
            Instant parsed = tryParse(parser, trimmed);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String format(Instant instant, ZoneId zone) {
        return MANIFEST_FORMAT.format(instant.atZone(zone));
    }
}
