package cloud.aclinspector.auth;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Expiry parsing for the two token file formats.
 *
 * <p>
 * Owned tokens carry {@code expires_at} as {@code 2025-10-22T23:53:05Z}. Foreign (rclone) tokens carry {@code expiry}
 * with fractional seconds and a numeric offset, for example {@code 2025-10-31T01:22:03.598349702+10:00}. The field
 * present in the blob decides which parser applies.
 * </p>
 */
public final class TokenExpiry {

    public static final String OWNED_FIELD = "expires_at";
    public static final String FOREIGN_FIELD = "expiry";

    private static final DateTimeFormatter OWNED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
        .withZone(ZoneOffset.UTC);

    // offset is optional: files written without one are read as UTC
    private static final DateTimeFormatter FOREIGN_FORMAT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .toFormatter();

    private TokenExpiry() {
    }

    /**
     * @return expiry read from whichever field the blob carries, empty when none is present or parseable.
     */
    public static Optional<Instant> detect(JsonNode blob) {
        JsonNode owned = blob.path(OWNED_FIELD);
        if (owned.isTextual()) {
            return parseOwned(owned.asText());
        }
        JsonNode foreign = blob.path(FOREIGN_FIELD);
        if (foreign.isTextual()) {
            return parseForeign(foreign.asText());
        }
        return Optional.empty();
    }

    public static Optional<Instant> parseOwned(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value.trim()));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    public static Optional<Instant> parseForeign(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = FOREIGN_FORMAT.parse(value.trim());
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return Optional.of(OffsetDateTime.from(parsed).toInstant());
            }
            return Optional.of(LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    /**
     * Formats an instant the way owned token files store it, truncated to whole seconds.
     */
    public static String formatOwned(Instant instant) {
        return OWNED_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
