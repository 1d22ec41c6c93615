package space.ketterling.gridload.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the timestamp spellings seen in the feed and in history files.
 *
 * <p>
 * Values with an offset are converted to UTC. Values without one are read as
 * already being on the UTC clock and localized directly, with no offset
 * arithmetic. Historical partitions were written under that convention, so it
 * must not change.
 * </p>
 */
public final class TimestampParser {
    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHmm", "Z").optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private TimestampParser() {
    }

    /**
     * A parsed timestamp: the derived UTC instant plus the wall clock as
     * written.
     */
    public record Parsed(Instant utc, LocalDateTime local) {
    }

    /**
     * Parses a timestamp string; empty when blank or not a recognised form.
     */
    public static Optional<Parsed> parse(String s) {
        if (s == null || s.isBlank())
            return Optional.empty();
        String text = s.trim();
        try {
            TemporalAccessor t = FLEXIBLE.parseBest(text, OffsetDateTime::from, LocalDateTime::from,
                    LocalDate::from);
            if (t instanceof OffsetDateTime) {
                OffsetDateTime odt = (OffsetDateTime) t;
                return Optional.of(new Parsed(odt.toInstant(), odt.toLocalDateTime()));
            }
            LocalDateTime local = (t instanceof LocalDateTime) ? (LocalDateTime) t : ((LocalDate) t).atStartOfDay();
            return Optional.of(new Parsed(local.toInstant(ZoneOffset.UTC), local));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Formats a wall-clock value the way history files store it (seconds
     * always present).
     */
    public static String formatLocal(LocalDateTime local) {
        return local == null ? "" : DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(local);
    }
}
