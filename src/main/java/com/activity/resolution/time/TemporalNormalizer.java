package com.activity.resolution.time;

import com.activity.resolution.core.exception.ValueParseException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Turns the timestamp text found in source rows into a {@link NormalizedTimestamp}.
 *
 * <p>Candidate formats are tried in a fixed order and the first success wins:
 * <ol>
 *   <li>ISO with {@code T}: {@code 2024-03-10T07:15[:30]}</li>
 *   <li>ISO with a space: {@code 2024-03-10 7:15[:30][.123]}</li>
 *   <li>month/day/year with AM/PM: {@code 3/10/24 7:15 AM}, {@code 03/10/2024 07:15:30 pm}</li>
 *   <li>ISO date only, taken as midnight</li>
 *   <li>month/day/year date only, taken as midnight</li>
 * </ol>
 * Year-first dates written with slashes ({@code 2024/03/10}) are read as dashes.
 * Text ending in {@code Z} or carrying an explicit offset is an absolute instant.
 * Everything else is local wall-clock time in the declared zone; a wall clock
 * inside a DST gap is shifted forward and one inside an overlap takes the earlier offset.
 *
 * <p>Instances are stateless and thread-safe.
 */
public class TemporalNormalizer {

    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*\\d(Z|z|[+-]\\d{2}(:?\\d{2})?)$");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[ T].*");
    private static final Pattern YEAR_FIRST_SLASHES = Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})(?=$|[ T])");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .appendPattern("uuuu-M-d H:mm[:ss]")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                    .optionalEnd()
                    .toFormatter(Locale.ROOT),
            mdy("M/d/uuuu h:mm[:ss] a"),
            mdy("M/d/uu h:mm[:ss] a")
    );

    private static final List<DateTimeFormatter> DATE_ONLY_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("uuuu-M-d", Locale.ROOT),
            mdy("M/d/uuuu"),
            mdy("M/d/uu")
    );

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                    .appendOffset("+HHmm", "Z")
                    .toFormatter(Locale.ROOT),
            new DateTimeFormatterBuilder()
                    .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                    .appendOffset("+HH", "Z")
                    .toFormatter(Locale.ROOT)
    );

    private static DateTimeFormatter mdy(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US);
    }

    /**
     * Normalizes a single timestamp text in the declared zone.
     *
     * @throws ValueParseException if the text is blank or matches no candidate format
     */
    public NormalizedTimestamp normalize(String text, ZoneId declaredZone) {
        if (text == null || text.isBlank()) {
            throw new ValueParseException("Blank timestamp", text);
        }
        String trimmed = YEAR_FIRST_SLASHES.matcher(text.trim().replaceAll("\\s+", " "))
                .replaceFirst("$1-$2-$3");

        Optional<Instant> absolute = parseAbsolute(trimmed);
        if (absolute.isPresent()) {
            Instant instant = absolute.get();
            return new NormalizedTimestamp(instant.atZone(declaredZone).toLocalDateTime(), instant);
        }

        LocalDateTime local = parseLocal(trimmed)
                .orElseThrow(() -> new ValueParseException("Unrecognized timestamp", trimmed));
        return fromLocal(local, declaredZone);
    }

    /**
     * Normalizes a timestamp split into date and time fields. A blank time
     * means the date text is parsed on its own.
     */
    public NormalizedTimestamp normalize(String dateText, String timeText, ZoneId declaredZone) {
        String date = dateText == null ? "" : dateText.trim();
        String time = timeText == null ? "" : timeText.trim();
        String combined = !date.isEmpty() && !time.isEmpty() ? date + " " + time : date;
        return normalize(combined, declaredZone);
    }

    /**
     * Tags a local wall clock with the zone and converts it to UTC.
     */
    public NormalizedTimestamp fromLocal(LocalDateTime local, ZoneId zone) {
        // ofLocal shifts gap times forward by the gap length and picks the earlier offset in overlaps
        ZonedDateTime zoned = ZonedDateTime.ofLocal(local, zone, null);
        return new NormalizedTimestamp(zoned.toLocalDateTime(), zoned.toInstant());
    }

    /**
     * Parses an optional decimal field. Blank yields empty.
     *
     * @throws ValueParseException if the text is not a number
     */
    public Optional<Double> parseDecimal(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        try {
            double value = Double.parseDouble(trimmed);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ValueParseException("Not a finite number", trimmed);
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            throw new ValueParseException("Not a number", trimmed, e);
        }
    }

    /**
     * Parses an optional whole-second duration. Decimal input is truncated. Blank yields empty.
     *
     * @throws ValueParseException if the text is not a number
     */
    public Optional<Long> parseSeconds(String text) {
        return parseDecimal(text).map(Double::longValue);
    }

    private Optional<Instant> parseAbsolute(String text) {
        if (!OFFSET_SUFFIX.matcher(text).matches() || !ISO_DATE_PREFIX.matcher(text).matches()) {
            return Optional.empty();
        }
        String iso = text.charAt(10) == ' ' ? text.substring(0, 10) + 'T' + text.substring(11) : text;
        for (DateTimeFormatter format : OFFSET_FORMATS) {
            Optional<Instant> parsed = attempt(() -> OffsetDateTime.parse(iso, format).toInstant());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> parseLocal(String text) {
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            Optional<LocalDateTime> parsed = attempt(() -> LocalDateTime.parse(text, format));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        for (DateTimeFormatter format : DATE_ONLY_FORMATS) {
            Optional<LocalDateTime> parsed = attempt(() -> LocalDate.parse(text, format).atStartOfDay());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static <T> Optional<T> attempt(Supplier<T> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
