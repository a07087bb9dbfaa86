package com.quill.engine;

import com.quill.model.ColumnInfo;
import com.quill.model.Schema;
import com.quill.model.TableSchema;
import com.quill.model.TabularResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class JdbcQueryEngineTest {

    @TempDir
    Path tempDir;

    private JdbcQueryEngine engine;

    @BeforeEach
    void setUp() {
        engine = newEngine(10_000);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    static JdbcQueryEngine newEngine(int maxResultRows) {
        String url = "jdbc:h2:mem:test_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;CASE_INSENSITIVE_IDENTIFIERS=TRUE";
        return new JdbcQueryEngine(url, 2, maxResultRows, 30_000);
    }

    private Path csv(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private void loadNorthwindSubset() throws IOException {
        engine.loadCsv("orders", csv("orders.csv",
                "orderID,customerID,total\n"
                        + "1,ALFKI,100.5\n"
                        + "2,ANATR,20\n"
                        + "3,ALFKI,7.25\n"), false);
        engine.loadCsv("customers", csv("customers.csv",
                "customerID,companyName,country\n"
                        + "ALFKI,Alfreds Futterkiste,Germany\n"
                        + "ANATR,Ana Trujillo,Mexico\n"), false);
    }

    @Test
    void loadCsvInfersColumnTypes() throws IOException {
        Schema schema = engine.loadCsv("items", csv("items.csv",
                "id,name,price,active,created,updated_at\n"
                        + "1,Alpha,9.5,true,2024-01-02,2024-01-02 10:15:00\n"
                        + "2,Beta,10,false,2024-02-03,2024-02-03\n"
                        + "3,,,,,\n"), false);

        TableSchema items = schema.table("items").orElseThrow();
        assertThat(items.columns()).extracting(ColumnInfo::name)
                .containsExactly("id", "name", "price", "active", "created", "updated_at");
        assertThat(items.columns().get(0).type()).isEqualTo("BIGINT");
        assertThat(JdbcQueryEngine.isTextType(items.columns().get(1).type())).isTrue();
        assertThat(items.columns().get(2).type()).contains("DOUBLE");
        assertThat(items.columns().get(3).type()).isEqualTo("BOOLEAN");
        assertThat(items.columns().get(4).type()).isEqualTo("DATE");
        assertThat(items.columns().get(5).type()).startsWith("TIMESTAMP");
    }

    @Test
    void mixedNumericAndBooleanColumnStaysText() throws IOException {
        Schema schema = engine.loadCsv("flags", csv("flags.csv", "flag\n1\ntrue\n"), false);

        String type = schema.table("flags").orElseThrow().columns().get(0).type();
        assertThat(JdbcQueryEngine.isTextType(type)).isTrue();
    }

    @Test
    void executeReturnsRowsInColumnOrder() throws Exception {
        loadNorthwindSubset();

        TabularResult result = engine.execute(
                "SELECT \"customerID\", SUM(\"total\") AS revenue FROM \"orders\" GROUP BY \"customerID\" ORDER BY revenue DESC");

        assertThat(result.rowCount()).isEqualTo(2);
        assertThat(result.truncated()).isFalse();
        Map<String, Object> top = result.rows().get(0);
        assertThat(top.values()).first().isEqualTo("ALFKI");
        assertThat(((Number) top.get("revenue")).doubleValue()).isEqualTo(107.75);
    }

    @Test
    void executeTruncatesAtResultLimit() throws Exception {
        engine.close();
        engine = newEngine(1);
        loadNorthwindSubset();

        TabularResult result = engine.execute("SELECT * FROM \"orders\"");

        assertThat(result.rowCount()).isEqualTo(1);
        assertThat(result.truncated()).isTrue();
    }

    @Test
    void executeReportsUnknownColumn() throws IOException {
        loadNorthwindSubset();

        Throwable thrown = catchThrowable(
                () -> engine.execute("SELECT customerName, SUM(total) FROM orders GROUP BY customerName"));

        assertThat(thrown).isInstanceOf(SqlExecutionException.class)
                .hasMessageStartingWith("SQL execution failed: ");
        assertThat(thrown.getMessage()).containsIgnoringCase("customername");
    }

    @Test
    void executeRejectsSchemaChanges() throws IOException {
        loadNorthwindSubset();

        assertThatThrownBy(() -> engine.execute("DROP TABLE \"orders\""))
                .isInstanceOf(SqlExecutionException.class)
                .hasMessageContaining("read-only");
        assertThat(engine.getSchema().contains("orders")).isTrue();
    }

    @Test
    void executeRejectsStackedStatements() throws Exception {
        loadNorthwindSubset();

        assertThatThrownBy(() -> engine.execute("SELECT 1; DROP TABLE \"orders\""))
                .isInstanceOf(SqlExecutionException.class)
                .hasMessageContaining("multiple statements");
        assertThat(engine.getSchema().contains("orders")).isTrue();
        assertThat(engine.execute("SELECT COUNT(*) AS n FROM \"orders\"").rows().get(0).get("n")).isEqualTo(3L);
    }

    @Test
    void executeAcceptsTrailingSemicolonAndQuotedSemicolons() throws Exception {
        loadNorthwindSubset();

        assertThat(engine.execute("SELECT * FROM \"orders\";\n-- done\n").rowCount()).isEqualTo(3);
        assertThat(engine.execute("SELECT 'a;b' AS s").rows().get(0).get("s")).isEqualTo("a;b");
    }

    @Test
    void stackedStatementCheckIgnoresLiteralsAndComments() {
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 1;")).isFalse();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 1 ; /* end */ ")).isFalse();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 'it''s; fine'")).isFalse();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT \"a;b\" FROM t")).isFalse();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 1 -- x; DROP TABLE t")).isFalse();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 1; DROP TABLE t")).isTrue();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 1;/* x */CREATE TABLE t(a INT)")).isTrue();
        assertThat(JdbcQueryEngine.hasStackedStatement("SELECT 'x';;")).isTrue();
    }

    @Test
    void duplicateColumnLabelsKeepEveryValue() throws Exception {
        loadNorthwindSubset();

        TabularResult result = engine.execute("SELECT o.\"orderID\" AS id, c.\"customerID\" AS id"
                + " FROM \"orders\" o JOIN \"customers\" c ON o.\"customerID\" = c.\"customerID\""
                + " WHERE o.\"orderID\" = 2");

        assertThat(result.columns()).extracting(ColumnInfo::name).containsExactly("id", "id_2");
        assertThat(result.rows().get(0)).containsEntry("id", 2L).containsEntry("id_2", "ANATR");
    }

    @Test
    void readOnlyCheckSkipsCommentsAndParentheses() {
        assertThat(JdbcQueryEngine.isReadOnlyStatement("-- top customers\nSELECT 1")).isTrue();
        assertThat(JdbcQueryEngine.isReadOnlyStatement("/* cte */ with x as (select 1) select * from x")).isTrue();
        assertThat(JdbcQueryEngine.isReadOnlyStatement("(SELECT 1) UNION (SELECT 2)")).isTrue();
        assertThat(JdbcQueryEngine.isReadOnlyStatement("delete from orders")).isFalse();
        assertThat(JdbcQueryEngine.isReadOnlyStatement("INSERT INTO t VALUES (1)")).isFalse();
    }

    @Test
    void loadCsvReplacesExistingTable() throws Exception {
        loadNorthwindSubset();

        Schema schema = engine.loadCsv("orders", csv("orders2.csv", "orderID,amount\n10,1.5\n"), false);

        assertThat(schema.tableNames()).containsExactly("orders", "customers");
        assertThat(schema.table("orders").orElseThrow().columns()).extracting(ColumnInfo::name)
                .containsExactly("orderID", "amount");
        assertThat(engine.countRows("orders")).isEqualTo(1);
    }

    @Test
    void failedLoadKeepsPreviousSchema() throws IOException {
        loadNorthwindSubset();
        Schema before = engine.getSchema();

        assertThatThrownBy(() -> engine.loadCsv("orders", tempDir.resolve("missing.csv"), false))
                .isInstanceOf(DatasetException.class);
        assertThat(engine.getSchema()).isEqualTo(before);
    }

    @Test
    void loadCsvNormalizesHeadersWhenAsked() throws IOException {
        Schema schema = engine.loadCsv("people", csv("people.csv",
                "\uFEFFFull Name,Full-Name,Age (years)\nAda,Ada L,36\n"), true);

        assertThat(schema.table("people").orElseThrow().columns()).extracting(ColumnInfo::name)
                .containsExactly("full_name", "full_name_2", "age_years");
    }

    @Test
    void dropTableRemovesTableFromSchema() throws IOException {
        loadNorthwindSubset();

        assertThat(engine.dropTable("customers")).isTrue();
        assertThat(engine.getSchema().tableNames()).containsExactly("orders");
        assertThat(engine.dropTable("customers")).isFalse();
    }

    @Test
    void sampleDistinctValuesSkipsNulls() throws Exception {
        engine.loadCsv("t", csv("t.csv", "city\nParis\n\nParis\nLyon\n,\n"), false);

        List<Object> values = engine.sampleDistinctValues("t", "city", 5);

        assertThat(values).containsExactlyInAnyOrder("Paris", "Lyon");
    }

    @Test
    void detectRelationshipsPairsSimilarColumnsAcrossTables() throws IOException {
        loadNorthwindSubset();

        List<String> relationships = engine.detectRelationships(engine.getSchema(), 85);

        assertThat(relationships).containsExactly("orders.customerID <-> customers.customerID");
    }

    @Test
    void categoricalValuesListLowCardinalityTextColumns() throws IOException {
        loadNorthwindSubset();

        Map<String, List<String>> categoricals = engine.getCategoricalValues(engine.getSchema(), 50);

        assertThat(categoricals).containsEntry("customers.country", List.of("Germany", "Mexico"));
        assertThat(categoricals).containsEntry("orders.customerID", List.of("ALFKI", "ANATR"));
        assertThat(categoricals).doesNotContainKey("orders.total");
    }

    @Test
    void categoricalValuesRespectLimit() throws IOException {
        loadNorthwindSubset();

        Map<String, List<String>> categoricals = engine.getCategoricalValues(engine.getSchema(), 1);

        assertThat(categoricals).isEmpty();
    }

    @Test
    void tableSampleAndRowCount() throws Exception {
        loadNorthwindSubset();

        TabularResult sample = engine.getTableSample("orders", 2);

        assertThat(sample.rowCount()).isEqualTo(2);
        assertThat(sample.columns()).extracting(ColumnInfo::name).containsExactly("orderID", "customerID", "total");
        assertThat(engine.countRows("orders")).isEqualTo(3);
        assertThatThrownBy(() -> engine.countRows("missing")).isInstanceOf(SqlExecutionException.class);
    }
}
