package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.db.QueryExecutionException;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Reads typed values out of executor rows. Drivers disagree on types
 * (PostgreSQL returns {@code BigDecimal} for {@code AVG} and
 * {@code java.sql.Date} for dates, SQLite returns {@code Double} and ISO
 * text), so every accessor accepts the plausible representations.
 *
 * <p>
 * SQL NULL comes back as {@code null}. A missing column or a value of an
 * unusable type is malformed data and raises {@link QueryExecutionException}.
 */
final class RowValues {

    private RowValues() {
    }

    static String text(Map<String, Object> row, String column) throws QueryExecutionException {
        Object value = require(row, column);
        return value == null ? null : value.toString();
    }

    static Integer integer(Map<String, Object> row, String column) throws QueryExecutionException {
        Object value = require(row, column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            try {
                return Math.toIntExact(number.longValue());
            } catch (ArithmeticException e) {
                throw malformed(column, value, e);
            }
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(column, value, e);
        }
    }

    static Long count(Map<String, Object> row, String column) throws QueryExecutionException {
        Object value = require(row, column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(column, value, e);
        }
    }

    static Double decimal(Map<String, Object> row, String column) throws QueryExecutionException {
        Object value = require(row, column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(column, value, e);
        }
    }

    static LocalDate date(Map<String, Object> row, String column) throws QueryExecutionException {
        Object value = require(row, column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate localDate) {
            return localDate;
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate();
        }
        String text = value.toString().trim();
        try {
            // SQLite may hand back "yyyy-MM-dd HH:mm:ss" for timestamp-ish text
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw malformed(column, value, e);
        }
    }

    private static Object require(Map<String, Object> row, String column) throws QueryExecutionException {
        if (!row.containsKey(column)) {
            throw new QueryExecutionException("Column '" + column + "' missing from result row " + row.keySet());
        }
        return row.get(column);
    }

    private static QueryExecutionException malformed(String column, Object value, Exception cause) {
        return new QueryExecutionException("Column '" + column + "' holds malformed value '" + value + "' ("
                + value.getClass().getSimpleName() + ")", cause);
    }
}
