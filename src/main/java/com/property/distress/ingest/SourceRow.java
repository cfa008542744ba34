package com.property.distress.ingest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a public-record extract: column name to raw text, plus the source line.
 * The typed accessors treat blank cells and the literal {@code nan} as absent and throw
 * {@link RecordValidationException} for values that are present but unparsable.
 */
public final class SourceRow {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("M/d/yyyy"),
            formatter("yyyy-MM-dd"));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            formatter("M/d/yyyy h:mm:ss a"),
            formatter("yyyy-MM-dd HH:mm:ss"),
            formatter("M/d/yyyy h:mm a"),
            formatter("yyyy-MM-dd'T'HH:mm:ss"));

    private final long rowNumber;
    private final Map<String, String> values;

    private SourceRow(long rowNumber, Map<String, String> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Copies the map, stringifying non-null values and trimming column names.
     */
    public static SourceRow of(long rowNumber, Map<String, ?> values) {
        Objects.requireNonNull(values, "values are required");
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((column, value) -> {
            if (column != null) {
                copy.put(column.trim(), value != null ? value.toString() : null);
            }
        });
        return new SourceRow(rowNumber, copy);
    }

    /**
     * Same row with one column added or replaced.
     */
    public SourceRow with(String column, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new SourceRow(rowNumber, copy);
    }

    public long rowNumber() {
        return rowNumber;
    }

    public Map<String, String> values() {
        return values;
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * Trimmed text, or null when the cell is missing or blank.
     */
    public String text(String column) {
        String raw = values.get(column);
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan")) {
            return null;
        }
        return trimmed;
    }

    /**
     * First non-blank value among the columns, in the order given.
     */
    public String firstText(String... columns) {
        for (String column : columns) {
            String value = text(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Non-blank values of the columns joined by single spaces, or null if all are blank.
     */
    public String joinText(String... columns) {
        List<String> parts = new ArrayList<>();
        for (String column : columns) {
            String value = text(column);
            if (value != null) {
                parts.add(value);
            }
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    public String require(String column) {
        String value = text(column);
        if (value == null) {
            throw new RecordValidationException(rowNumber, column, "required value is missing");
        }
        return value;
    }

    /**
     * Parses the cell as a date. Accepted: {@code MM/dd/yyyy}, {@code yyyy-MM-dd}, and those
     * followed by a time of day, whose time part is discarded.
     */
    public LocalDate date(String column) {
        String value = text(column);
        if (value == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(value, format).toLocalDate();
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        throw new RecordValidationException(rowNumber, column, "unparsable date '" + value + "'");
    }

    /**
     * Parses a currency cell: {@code $} and thousands separators are dropped and a
     * parenthesized value is negative.
     */
    public BigDecimal amount(String column) {
        String value = text(column);
        if (value == null) {
            return null;
        }
        String cleaned = value.replace("$", "").replace(",", "").replace(" ", "");
        boolean negative = cleaned.startsWith("(") && cleaned.endsWith(")");
        if (negative) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            BigDecimal amount = new BigDecimal(cleaned);
            return negative ? amount.negate() : amount;
        } catch (NumberFormatException e) {
            throw new RecordValidationException(rowNumber, column, "unparsable amount '" + value + "'");
        }
    }

    /**
     * Parses a whole number; a trailing {@code .0} from spreadsheet exports is accepted.
     */
    public Integer integer(String column) {
        String value = text(column);
        if (value == null) {
            return null;
        }
        String cleaned = value.replace(",", "");
        if (cleaned.endsWith(".0")) {
            cleaned = cleaned.substring(0, cleaned.length() - 2);
        }
        try {
            return Integer.valueOf(cleaned);
        } catch (NumberFormatException e) {
            throw new RecordValidationException(rowNumber, column, "unparsable number '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return "SourceRow{row=" + rowNumber + ", values=" + values + '}';
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US);
    }
}
