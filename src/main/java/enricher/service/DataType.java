package enricher.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detected type of a column. Detection is a display hint only; values stay text.
 */
public enum DataType {
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    BOOLEAN("boolean"),
    MIXED("mixed"),
    EMPTY("empty");

    /** Share of non-empty values a type needs to win. */
    static final double THRESHOLD = 0.8;

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(?i:inf|infinity|nan)");
    private static final Pattern ISO_DATE_PREFIX =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}:\\d{2})?.*");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            date("uuuu-MM-dd"),
            date("uuuu/MM/dd"),
            date("MM/dd/uuuu"),
            date("dd/MM/uuuu"),
            date("MMM d, uuuu"),
            date("d MMM uuuu"),
            date("MM-dd-uuuu"),
            date("dd-MM-uuuu"));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            date("uuuu-MM-dd HH:mm:ss"),
            date("uuuu/MM/dd HH:mm:ss"));

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Classify a column's values. Blank values are ignored; a type wins when it
     * covers at least 80% of the rest, checked in the order number, date,
     * boolean, string. Otherwise {@link #MIXED}.
     */
    public static DataType detect(List<String> values) {
        int strings = 0, numbers = 0, dates = 0, booleans = 0, empty = 0;

        for (String value : values) {
            String trimmed = value == null ? "" : value.trim();
            if (trimmed.isEmpty()) {
                empty++;
            } else if (isBoolean(trimmed)) {
                booleans++;
            } else if (isNumber(trimmed)) {
                numbers++;
            } else if (isDate(trimmed)) {
                dates++;
            } else {
                strings++;
            }
        }

        int total = values.size() - empty;
        if (total == 0)
            return EMPTY;

        double threshold = total * THRESHOLD;
        if (numbers >= threshold)
            return NUMBER;
        if (dates >= threshold)
            return DATE;
        if (booleans >= threshold)
            return BOOLEAN;
        if (strings >= threshold)
            return STRING;
        return MIXED;
    }

    static boolean isBoolean(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "false", "yes", "no", "1", "0" -> true;
            default -> false;
        };
    }

    static boolean isNumber(String value) {
        return NUMBER_PATTERN.matcher(value).matches();
    }

    static boolean isDate(String value) {
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                LocalDate.parse(value, f);
                return true;
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                LocalDateTime.parse(value, f);
                return true;
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return ISO_DATE_PREFIX.matcher(value).matches();
    }

    private static DateTimeFormatter date(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
