package com.quill.util;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * Reads result-set cells as values Jackson can write without custom serializers: numbers,
 * booleans, strings and lists of those.
 *
 * <p>Result rows end up in SSE events, in the summary prompt and in value hints, so driver
 * types such as {@link java.sql.Date} or {@link java.sql.Clob} stop here.
 */
public final class JdbcJsonSafe {

    static final int MAX_TEXT_CHARS = 100_000;
    static final int MAX_BINARY_BYTES = 100_000;
    private static final int MAX_ARRAY_DEPTH = 3;

    private JdbcJsonSafe() {
    }

    /**
     * Read one cell.
     *
     * @param rs result set positioned on a row
     * @param column 1-based column index
     * @param sqlType {@link Types} constant reported by the result-set metadata
     * @return JSON-safe value, or null for SQL NULL
     * @throws SQLException if the driver cannot read the cell
     */
    public static Object read(ResultSet rs, int column, int sqlType) throws SQLException {
        Object value;
        switch (sqlType) {
            case Types.DATE:
                value = rs.getObject(column, LocalDate.class);
                return value == null ? null : value.toString();
            case Types.TIME:
                value = rs.getObject(column, LocalTime.class);
                return value == null ? null : value.toString();
            case Types.TIMESTAMP:
                value = rs.getObject(column, LocalDateTime.class);
                return value == null ? null : value.toString();
            case Types.TIMESTAMP_WITH_TIMEZONE:
                value = rs.getObject(column, OffsetDateTime.class);
                return value == null ? null : value.toString();
            case Types.CLOB:
            case Types.NCLOB:
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
                return clip(rs.getString(column));
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return encode(rs.getBytes(column));
            case Types.ARRAY:
                Array array = rs.getArray(column);
                if (array == null) {
                    return null;
                }
                try {
                    return toJsonSafe(array.getArray(), 1);
                } finally {
                    array.free();
                }
            default:
                return toJsonSafe(rs.getObject(column), 0);
        }
    }

    static Object toJsonSafe(Object value, int depth) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return simplify(decimal);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof String s) {
            return clip(s);
        }
        if (value instanceof byte[] bytes) {
            return encode(bytes);
        }
        if (value instanceof Object[] elements) {
            if (depth >= MAX_ARRAY_DEPTH) {
                return clip(Arrays.deepToString(elements));
            }
            List<Object> out = new ArrayList<>(elements.length);
            for (Object element : elements) {
                out.add(toJsonSafe(element, depth + 1));
            }
            return out;
        }
        return clip(value.toString());
    }

    // SUM and AVG over integer columns come back as DECIMAL; 42.00 should read as 42.
    static Number simplify(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException tooLarge) {
                return stripped.toBigInteger();
            }
        }
        return decimal.doubleValue();
    }

    private static String clip(String s) {
        if (s == null || s.length() <= MAX_TEXT_CHARS) {
            return s;
        }
        return s.substring(0, MAX_TEXT_CHARS);
    }

    private static String encode(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        int length = Math.min(bytes.length, MAX_BINARY_BYTES);
        return Base64.getEncoder().encodeToString(length == bytes.length ? bytes : Arrays.copyOf(bytes, length));
    }
}
