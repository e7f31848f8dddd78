package com.kreasipositif.ledgerimporter.batch;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lenient converters from raw sheet cells to typed values.
 *
 * <p>Source workbooks mix number and date formats, so none of these methods throws: anything
 * that cannot be understood comes back as {@code null}.
 */
public final class FieldParsers {

    /**
     * Day-first patterns come before ISO ones so that {@code 03/04/2024} reads as 3 April.
     */
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("dd.MM.uuuu"),
            strict("d.M.uuuu"),
            strict("dd/MM/uuuu"),
            strict("d/M/uuuu"),
            strict("dd-MM-uuuu"),
            strict("d-M-uuuu"),
            strict("dd.MM.uu"),
            strict("d.M.uu"),
            strict("dd/MM/uu"),
            strict("d/M/uu"),
            strict("uuuu-MM-dd"),
            strict("uuuu/MM/dd"),
            strict("d MMM uuuu"),
            strict("d MMMM uuuu"));

    private static final List<String> MISSING_DATE_TOKENS = List.of("nat", "nan");

    private FieldParsers() {
    }

    /**
     * Parses a locale-formatted decimal: {@code '} and spaces are thousands separators, a comma
     * is the decimal mark. {@code "1'234,50"} gives {@code 1234.50}.
     *
     * @return the value, or {@code null} when the input is blank or not a number
     */
    public static BigDecimal parseDecimal(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String normalised = trimmed
                .replace("'", "")
                .replace("\u2019", "")
                .replace(" ", "")
                .replace("\u00A0", "")
                .replace(",", ".");
        try {
            return new BigDecimal(normalised);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a date, reading ambiguous numeric forms day-first. A trailing time of day
     * ({@code 2024-04-03 00:00:00}, {@code 2024-04-03T10:15}) is ignored.
     *
     * @return the date, or {@code null} for blank, {@code NaT}, {@code nan} or unparsable input
     */
    public static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.replace("[$]", "").trim();
        if (trimmed.isEmpty() || MISSING_DATE_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        LocalDate parsed = tryFormats(trimmed);
        if (parsed == null) {
            String datePart = trimmed.split("[T ]", 2)[0];
            if (!datePart.equals(trimmed)) {
                parsed = tryFormats(datePart);
            }
        }
        return parsed;
    }

    /**
     * Returns the trimmed value, or an empty string for {@code null}.
     */
    public static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Joins the non-empty description fragments with {@code ", "}.
     */
    public static String collapseDescription(String... fragments) {
        return Arrays.stream(fragments)
                .map(FieldParsers::clean)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(", "));
    }

    /**
     * Returns {@code null} for a blank value, otherwise the trimmed value.
     */
    public static String emptyToNull(String value) {
        String cleaned = clean(value);
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static LocalDate tryFormats(String text) {
        return DATE_FORMATS.stream()
                .map(format -> parseOrNull(text, format))
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    private static LocalDate parseOrNull(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
