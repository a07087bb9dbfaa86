package com.quill.engine;

import com.quill.util.IdentifierSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Creates a table from a CSV file with a header row.
 *
 * <p>Column types are inferred from the non-empty values of each column, narrowest first:
 * BIGINT, DOUBLE PRECISION, BOOLEAN, DATE, TIMESTAMP, falling back to VARCHAR. Empty cells
 * become NULL.
 */
@Slf4j
final class CsvTableLoader {

    private static final int BATCH_SIZE = 1_000;
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

    enum ColumnType {
        BIGINT("BIGINT", Types.BIGINT),
        DOUBLE("DOUBLE PRECISION", Types.DOUBLE),
        BOOLEAN("BOOLEAN", Types.BOOLEAN),
        DATE("DATE", Types.DATE),
        TIMESTAMP("TIMESTAMP", Types.TIMESTAMP),
        VARCHAR("VARCHAR", Types.VARCHAR);

        private final String ddl;
        private final int sqlType;

        ColumnType(String ddl, int sqlType) {
            this.ddl = ddl;
            this.sqlType = sqlType;
        }
    }

    private CsvTableLoader() {
    }

    /**
     * Parse a CSV file and create {@code table} with its rows.
     *
     * @param conn connection; committed on success, rolled back on failure
     * @param table quoted-safe table name
     * @param csvFile source file
     * @param normalizeColumnNames lower-case header names and collapse non-alphanumerics to '_'
     * @return number of inserted rows
     */
    static long load(Connection conn, String table, Path csvFile, boolean normalizeColumnNames)
            throws IOException, SQLException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        List<String> header;
        List<CSVRecord> records;
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            header = columnNames(parser.getHeaderNames(), normalizeColumnNames);
            records = parser.getRecords();
        }
        if (header.isEmpty()) {
            throw new IOException("CSV file has no header row: " + csvFile.getFileName());
        }

        List<ColumnType> types = inferTypes(header.size(), records);

        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                st.execute(createTableSql(table, header, types));
            }
            long inserted = insertRows(conn, table, header, types, records);
            conn.commit();
            log.debug("Created table {} with {} columns and {} rows", table, header.size(), inserted);
            return inserted;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    static List<String> columnNames(List<String> rawHeader, boolean normalize) {
        List<String> out = new ArrayList<>(rawHeader.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rawHeader.size(); i++) {
            String name = rawHeader.get(i) != null ? rawHeader.get(i).replace("\uFEFF", "").trim() : "";
            if (normalize) {
                name = NON_WORD.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("_");
                name = name.replaceAll("^_+|_+$", "");
            }
            if (name.isEmpty()) {
                name = "column" + i;
            }
            String unique = name;
            int suffix = 2;
            // Identifiers are case-insensitive in the engine.
            while (!seen.add(unique.toLowerCase(Locale.ROOT))) {
                unique = name + "_" + suffix++;
            }
            out.add(unique);
        }
        return out;
    }

    static List<ColumnType> inferTypes(int columnCount, List<CSVRecord> records) {
        List<ColumnType> types = new ArrayList<>(columnCount);
        for (int col = 0; col < columnCount; col++) {
            ColumnType candidate = null;
            for (CSVRecord record : records) {
                String value = cell(record, col);
                if (value == null) {
                    continue;
                }
                candidate = widen(candidate, value);
                if (candidate == ColumnType.VARCHAR) {
                    break;
                }
            }
            types.add(candidate != null ? candidate : ColumnType.VARCHAR);
        }
        return types;
    }

    private static ColumnType widen(ColumnType current, String value) {
        for (ColumnType type : ColumnType.values()) {
            if (current != null && type.ordinal() < current.ordinal()) {
                continue;
            }
            if (compatible(type, current) && parses(type, value)) {
                return type;
            }
        }
        return ColumnType.VARCHAR;
    }

    // Only BIGINT -> DOUBLE and DATE -> TIMESTAMP widen; any other mix ends as VARCHAR.
    private static boolean compatible(ColumnType candidate, ColumnType current) {
        if (current == null || candidate == current || candidate == ColumnType.VARCHAR) {
            return true;
        }
        return (current == ColumnType.BIGINT && candidate == ColumnType.DOUBLE)
                || (current == ColumnType.DATE && candidate == ColumnType.TIMESTAMP);
    }

    private static boolean parses(ColumnType type, String value) {
        try {
            switch (type) {
                case BIGINT:
                    Long.parseLong(value);
                    return true;
                case DOUBLE:
                    Double.parseDouble(value);
                    return true;
                case BOOLEAN:
                    return "true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value);
                case DATE:
                    LocalDate.parse(value);
                    return true;
                case TIMESTAMP:
                    parseTimestamp(value);
                    return true;
                default:
                    return true;
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            return false;
        }
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay();
        }
        return LocalDateTime.parse(value.replace(' ', 'T'));
    }

    private static String createTableSql(String table, List<String> header, List<ColumnType> types) {
        StringBuilder sb = new StringBuilder("CREATE TABLE ").append(IdentifierSanitizer.quote(table)).append(" (");
        for (int i = 0; i < header.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(IdentifierSanitizer.quote(header.get(i))).append(' ').append(types.get(i).ddl);
        }
        return sb.append(')').toString();
    }

    private static long insertRows(Connection conn, String table, List<String> header, List<ColumnType> types,
                                   List<CSVRecord> records) throws SQLException {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(IdentifierSanitizer.quote(table)).append(" (");
        StringBuilder params = new StringBuilder();
        for (int i = 0; i < header.size(); i++) {
            if (i > 0) {
                sql.append(", ");
                params.append(", ");
            }
            sql.append(IdentifierSanitizer.quote(header.get(i)));
            params.append('?');
        }
        sql.append(") VALUES (").append(params).append(')');

        long inserted = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int pending = 0;
            for (CSVRecord record : records) {
                for (int col = 0; col < header.size(); col++) {
                    bind(ps, col + 1, types.get(col), cell(record, col));
                }
                ps.addBatch();
                pending++;
                inserted++;
                if (pending >= BATCH_SIZE) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
            }
        }
        return inserted;
    }

    private static void bind(PreparedStatement ps, int index, ColumnType type, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, type.sqlType);
            return;
        }
        switch (type) {
            case BIGINT:
                ps.setLong(index, Long.parseLong(value));
                break;
            case DOUBLE:
                ps.setDouble(index, Double.parseDouble(value));
                break;
            case BOOLEAN:
                ps.setBoolean(index, Boolean.parseBoolean(value));
                break;
            case DATE:
                ps.setDate(index, Date.valueOf(LocalDate.parse(value)));
                break;
            case TIMESTAMP:
                ps.setTimestamp(index, Timestamp.valueOf(parseTimestamp(value)));
                break;
            default:
                ps.setString(index, value);
        }
    }

    private static String cell(CSVRecord record, int col) {
        if (col >= record.size()) {
            return null;
        }
        String value = record.get(col);
        return value == null || value.isEmpty() ? null : value;
    }
}
