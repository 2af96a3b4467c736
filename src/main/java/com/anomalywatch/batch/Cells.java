package com.anomalywatch.batch;

import com.anomalywatch.exception.InvalidDateException;
import com.anomalywatch.exception.NonNumericValueException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Cell coercion helpers shared by transformers and the comparison engine.
 */
public final class Cells {

    private Cells() {
    }

    /**
     * Reads a numeric cell. {@code null}, blank strings and {@code NaN} all mean "no value"
     * and come back as {@code null}.
     *
     * @throws NonNumericValueException if the cell holds something that is not a number
     */
    public static Double toDouble(String column, Object cell) {
        if (cell == null) {
            return null;
        }
        double value;
        if (cell instanceof Number number) {
            value = number.doubleValue();
        } else if (cell instanceof String text) {
            if (text.isBlank()) {
                return null;
            }
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                throw new NonNumericValueException(column, cell);
            }
        } else {
            throw new NonNumericValueException(column, cell);
        }
        return Double.isNaN(value) ? null : value;
    }

    public static boolean isMissing(Object cell) {
        if (cell == null) {
            return true;
        }
        if (cell instanceof Double d) {
            return d.isNaN();
        }
        if (cell instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Reads a date cell as a calendar date, dropping any time-of-day component.
     * Text may be a plain ISO date or an ISO date-time with a {@code T} or space separator,
     * optionally followed by an offset or zone; the calendar date is taken as written.
     * Returns {@code null} for a {@code null} or blank cell.
     *
     * @throws InvalidDateException if the cell holds something that is not a date
     */
    public static LocalDate toDate(String column, Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof LocalDate date) {
            return date;
        }
        if (cell instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (cell instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (cell instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (cell instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate();
        }
        if (cell instanceof Date date) {
            return new java.sql.Date(date.getTime()).toLocalDate();
        }
        String text = cell.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        // yyyy-MM-dd is exactly 10 characters; anything longer carries a time part
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            return text.length() <= 10
                ? LocalDate.parse(text)
                : DateTimeFormatter.ISO_DATE_TIME.parse(text, LocalDate::from);
        } catch (DateTimeParseException ex) {
            throw new InvalidDateException(column, cell);
        }
    }

    public static LocalDate toDate(Object cell) {
        return toDate("date", cell);
    }
}
