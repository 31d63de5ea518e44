package com.execmetrics.io;

import com.execmetrics.domain.enums.Side;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Typed access to one CSV row read as a header-keyed map.
 *
 * <p>Blank cells read as null. Timestamps accept ISO local date-times with either 'T' or a space
 * between date and time and an optional fraction of a second, e.g. "2023-01-01 12:00:00.123456".
 */
final class CsvRow {

    // Two alternative sections, each with exactly one separator. Parse only.
    static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .optionalStart()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .optionalStart()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private final long lineNumber;
    private final Map<String, String> values;
    private final int cellCount;
    private final int headerCount;

    private CsvRow(long lineNumber, Map<String, String> values, int cellCount, int headerCount) {
        this.lineNumber = lineNumber;
        this.values = values;
        this.cellCount = cellCount;
        this.headerCount = headerCount;
    }

    /** Pairs cells with header names by position; cells beyond the header are dropped. */
    static CsvRow of(long lineNumber, String[] header, String[] cells) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < Math.min(header.length, cells.length); i++) {
            values.put(header[i].trim(), cells[i]);
        }
        return new CsvRow(lineNumber, values, cells.length, header.length);
    }

    void requireCompleteRow() {
        if (cellCount != headerCount) {
            throw new MalformedRowException(
                    String.format("line %d: expected %d cells, found %d", lineNumber, headerCount, cellCount));
        }
    }

    String text(String column) {
        String value = values.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    String requiredText(String column) {
        String value = text(column);
        if (value == null) {
            throw new MalformedRowException(String.format("line %d: missing %s", lineNumber, column));
        }
        return value;
    }

    BigDecimal decimal(String column) {
        String value = text(column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new MalformedRowException(
                    String.format("line %d: %s is not a number: '%s'", lineNumber, column, value), e);
        }
    }

    BigDecimal requiredDecimal(String column) {
        requiredText(column);
        return decimal(column);
    }

    LocalDateTime requiredTimestamp(String column) {
        String value = requiredText(column);
        try {
            return LocalDateTime.parse(value, TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new MalformedRowException(
                    String.format("line %d: %s is not a timestamp: '%s'", lineNumber, column, value), e);
        }
    }

    Side requiredSide(String column) {
        String value = requiredText(column);
        try {
            return Side.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedRowException(String.format("line %d: unknown side '%s'", lineNumber, value), e);
        }
    }
}
