package com.quill.engine;

import com.quill.model.ColumnInfo;
import com.quill.model.Schema;
import com.quill.model.TableSchema;
import com.quill.model.TabularResult;
import com.quill.util.FuzzyScores;
import com.quill.util.IdentifierSanitizer;
import com.quill.util.JdbcJsonSafe;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link QueryEngine} over a pooled in-memory H2 database.
 *
 * <p>Tables are created with quoted lower-case names; the default URL turns on
 * {@code DATABASE_TO_LOWER} and {@code CASE_INSENSITIVE_IDENTIFIERS} so that generated SQL can
 * reference tables and camelCase columns with or without quotes.
 */
@Slf4j
@Component
public class JdbcQueryEngine implements QueryEngine {

    static final String DEFAULT_JDBC_URL =
            "jdbc:h2:mem:quill;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;CASE_INSENSITIVE_IDENTIFIERS=TRUE";

    private static final List<String> READ_ONLY_PREFIXES = List.of("SELECT", "WITH", "VALUES", "TABLE", "EXPLAIN", "SHOW");
    private static final Set<String> TEXT_TYPES = Set.of(
            "VARCHAR", "CHARACTER VARYING", "CHAR", "CHARACTER", "TEXT", "STRING", "VARCHAR_IGNORECASE");
    private static final String STAGING_SUFFIX = "__loading";

    private final HikariDataSource dataSource;
    private final int maxResultRows;
    private final int queryTimeoutMs;

    private final ReentrantLock writeLock = new ReentrantLock();
    // Guarded by writeLock.
    private final List<String> tables = new ArrayList<>();
    private volatile Schema schema = Schema.empty();

    /**
     * Create the engine and its connection pool.
     *
     * @param jdbcUrl JDBC URL of the backing database
     * @param maxPoolSize maximum pooled connections
     * @param maxResultRows rows kept per query result; 0 keeps all
     * @param queryTimeoutMs per-statement timeout; 0 disables it
     */
    public JdbcQueryEngine(
            @Value("${quill.engine.jdbc-url:" + DEFAULT_JDBC_URL + "}") String jdbcUrl,
            @Value("${quill.engine.max-pool-size:4}") int maxPoolSize,
            @Value("${quill.engine.max-result-rows:10000}") int maxResultRows,
            @Value("${quill.engine.query-timeout-ms:30000}") int queryTimeoutMs
    ) {
        this.dataSource = new HikariDataSource(buildHikariConfig(jdbcUrl, maxPoolSize));
        this.maxResultRows = maxResultRows;
        this.queryTimeoutMs = queryTimeoutMs;
    }

    private static HikariConfig buildHikariConfig(String jdbcUrl, int maxPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(EngineSqlExceptionOverride.class.getName());
        config.setJdbcUrl(jdbcUrl);
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(1);
        config.setPoolName("quill-engine");
        return config;
    }

    @Override
    public TabularResult execute(String sql) throws SqlExecutionException {
        if (sql == null || sql.isBlank()) {
            throw new SqlExecutionException("SQL execution failed: empty statement");
        }
        if (!isReadOnlyStatement(sql)) {
            throw new SqlExecutionException(
                    "SQL execution failed: only read-only queries (SELECT or WITH) are allowed");
        }
        if (hasStackedStatement(sql)) {
            throw new SqlExecutionException("SQL execution failed: multiple statements are not allowed");
        }

        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            if (queryTimeoutMs > 0) {
                stmt.setQueryTimeout(Math.max(1, queryTimeoutMs / 1000));
            }
            if (!stmt.execute(sql)) {
                throw new SqlExecutionException("SQL execution failed: statement returned no result set");
            }
            try (ResultSet rs = stmt.getResultSet()) {
                TabularResult result = readResult(rs, maxResultRows);
                log.debug("Query executed (rows={}, truncated={}, duration_ms={})",
                        result.rowCount(), result.truncated(), System.currentTimeMillis() - startTime);
                return result;
            }
        } catch (SQLException e) {
            throw new SqlExecutionException("SQL execution failed: " + e.getMessage(), e.getSQLState(), e);
        }
    }

    static boolean isReadOnlyStatement(String sql) {
        String head = stripLeadingComments(sql).toUpperCase(Locale.ROOT);
        while (head.startsWith("(")) {
            head = head.substring(1).trim();
        }
        for (String prefix : READ_ONLY_PREFIXES) {
            if (head.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when a second statement follows a {@code ;} outside literals, quoted identifiers and
     * comments. A single trailing {@code ;} is allowed.
     */
    static boolean hasStackedStatement(String sql) {
        boolean terminated = false;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int nl = sql.indexOf('\n', i);
                i = nl < 0 ? n : nl + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else if (terminated) {
                return true;
            } else if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
            } else if (c == ';') {
                terminated = true;
                i++;
            } else {
                i++;
            }
        }
        return false;
    }

    // Doubled quotes escape the quote character in both literals and identifiers.
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private static String stripLeadingComments(String sql) {
        String s = sql.trim();
        while (true) {
            if (s.startsWith("--")) {
                int nl = s.indexOf('\n');
                s = nl < 0 ? "" : s.substring(nl + 1).trim();
            } else if (s.startsWith("/*")) {
                int end = s.indexOf("*/");
                s = end < 0 ? "" : s.substring(end + 2).trim();
            } else {
                return s;
            }
        }
    }

    @Override
    public Schema getSchema() {
        return schema;
    }

    @Override
    public TabularResult getTableSample(String table, int n) throws SqlExecutionException {
        return query("SELECT * FROM " + IdentifierSanitizer.quote(table) + " LIMIT " + Math.max(0, n));
    }

    @Override
    public List<Object> sampleDistinctValues(String table, String column, int limit) throws SqlExecutionException {
        String col = IdentifierSanitizer.quote(column);
        String sql = "SELECT DISTINCT " + col + " FROM " + IdentifierSanitizer.quote(table)
                + " WHERE " + col + " IS NOT NULL LIMIT " + Math.max(0, limit);
        TabularResult result = query(sql);
        List<Object> values = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rows()) {
            values.add(row.values().iterator().next());
        }
        return values;
    }

    @Override
    public long countRows(String table) throws SqlExecutionException {
        TabularResult result = query("SELECT COUNT(*) AS row_count FROM " + IdentifierSanitizer.quote(table));
        Object count = result.rows().get(0).values().iterator().next();
        return ((Number) count).longValue();
    }

    @Override
    public List<String> detectRelationships(Schema schema, int threshold) {
        List<TableSchema> all = schema.tables();
        List<String> relationships = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            TableSchema t1 = all.get(i);
            for (int j = i + 1; j < all.size(); j++) {
                TableSchema t2 = all.get(j);
                for (ColumnInfo c1 : t1.columns()) {
                    String n1 = c1.name().toLowerCase(Locale.ROOT);
                    for (ColumnInfo c2 : t2.columns()) {
                        if (FuzzyScores.ratio(n1, c2.name().toLowerCase(Locale.ROOT)) >= threshold) {
                            relationships.add(t1.name() + "." + c1.name() + " <-> " + t2.name() + "." + c2.name());
                        }
                    }
                }
            }
        }
        return relationships;
    }

    @Override
    public Map<String, List<String>> getCategoricalValues(Schema schema, int maxDistinct) {
        Map<String, List<String>> categoricals = new LinkedHashMap<>();
        for (TableSchema table : schema.tables()) {
            for (ColumnInfo column : table.columns()) {
                if (!isTextType(column.type())) {
                    continue;
                }
                String key = table.name() + "." + column.name();
                try {
                    String col = IdentifierSanitizer.quote(column.name());
                    String from = " FROM " + IdentifierSanitizer.quote(table.name());
                    TabularResult count = query("SELECT COUNT(DISTINCT " + col + ") AS n" + from);
                    long distinct = ((Number) count.rows().get(0).values().iterator().next()).longValue();
                    if (distinct <= 0 || distinct > maxDistinct) {
                        continue;
                    }
                    TabularResult values = query("SELECT DISTINCT " + col + " AS v" + from
                            + " WHERE " + col + " IS NOT NULL ORDER BY v");
                    List<String> out = new ArrayList<>(values.rowCount());
                    for (Map<String, Object> row : values.rows()) {
                        out.add(String.valueOf(row.values().iterator().next()));
                    }
                    categoricals.put(key, out);
                } catch (SqlExecutionException | RuntimeException e) {
                    log.debug("Categorical lookup skipped (column={}, reason={})", key, e.getMessage());
                }
            }
        }
        return categoricals;
    }

    static boolean isTextType(String typeName) {
        if (typeName == null) {
            return false;
        }
        String upper = typeName.toUpperCase(Locale.ROOT);
        int paren = upper.indexOf('(');
        if (paren > 0) {
            upper = upper.substring(0, paren).trim();
        }
        return TEXT_TYPES.contains(upper);
    }

    @Override
    public Schema loadCsv(String table, Path csvFile, boolean normalizeColumnNames) {
        String staging = table + STAGING_SUFFIX;
        writeLock.lock();
        try (Connection conn = dataSource.getConnection()) {
            try (Statement st = conn.createStatement()) {
                st.execute("DROP TABLE IF EXISTS " + IdentifierSanitizer.quote(staging));
            }
            long rows = CsvTableLoader.load(conn, staging, csvFile, normalizeColumnNames);
            try (Statement st = conn.createStatement()) {
                st.execute("DROP TABLE IF EXISTS " + IdentifierSanitizer.quote(table));
                st.execute("ALTER TABLE " + IdentifierSanitizer.quote(staging)
                        + " RENAME TO " + IdentifierSanitizer.quote(table));
            }
            if (!tables.contains(table)) {
                tables.add(table);
            }
            schema = readSchema(conn);
            log.info("Loaded table: {} ({} rows)", table, rows);
            return schema;
        } catch (Exception e) {
            dropQuietly(staging);
            throw new DatasetException("Failed to load CSV into table " + table + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean dropTable(String table) {
        writeLock.lock();
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + IdentifierSanitizer.quote(table));
            boolean removed = tables.remove(table);
            schema = readSchema(conn);
            log.info("Dropped table: {} (registered={})", table, removed);
            return removed;
        } catch (SQLException e) {
            throw new DatasetException("Failed to drop table " + table + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void dropQuietly(String table) {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + IdentifierSanitizer.quote(table));
        } catch (SQLException e) {
            log.warn("Failed to clean up staging table {}: {}", table, e.getMessage());
        }
    }

    // Caller holds writeLock.
    private Schema readSchema(Connection conn) throws SQLException {
        List<TableSchema> out = new ArrayList<>(tables.size());
        for (String table : tables) {
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT * FROM " + IdentifierSanitizer.quote(table) + " WHERE 1 = 0")) {
                ResultSetMetaData md = rs.getMetaData();
                List<ColumnInfo> columns = new ArrayList<>(md.getColumnCount());
                for (int i = 1; i <= md.getColumnCount(); i++) {
                    columns.add(new ColumnInfo(md.getColumnLabel(i), md.getColumnTypeName(i)));
                }
                out.add(new TableSchema(table, columns));
            }
        }
        return new Schema(out);
    }

    private TabularResult query(String sql) throws SqlExecutionException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return readResult(rs, 0);
        } catch (SQLException e) {
            throw new SqlExecutionException("SQL execution failed: " + e.getMessage(), e.getSQLState(), e);
        }
    }

    private static TabularResult readResult(ResultSet rs, int limit) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();

        String[] labels = uniqueLabels(md);
        List<ColumnInfo> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new ColumnInfo(labels[i - 1], md.getColumnTypeName(i)));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (limit > 0 && rows.size() >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels[i - 1], JdbcJsonSafe.read(rs, i, md.getColumnType(i)));
            }
            rows.add(row);
        }
        return new TabularResult(columns, rows, truncated);
    }

    // A join can yield the same label twice; later ones become label_2, label_3 and so on.
    static String[] uniqueLabels(ResultSetMetaData md) throws SQLException {
        int columnCount = md.getColumnCount();
        String[] labels = new String[columnCount];
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= columnCount; i++) {
            String base = md.getColumnLabel(i);
            String label = base;
            int suffix = 2;
            while (!seen.add(label.toLowerCase(Locale.ROOT))) {
                label = base + "_" + suffix++;
            }
            labels[i - 1] = label;
        }
        return labels;
    }

    @PreDestroy
    public void close() {
        dataSource.close();
    }
}
