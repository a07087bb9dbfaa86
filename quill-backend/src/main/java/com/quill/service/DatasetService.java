package com.quill.service;

import com.quill.engine.DatasetException;
import com.quill.engine.QueryEngine;
import com.quill.engine.SqlExecutionException;
import com.quill.model.Schema;
import com.quill.model.TableSchema;
import com.quill.model.TableSummary;
import com.quill.resolver.SchemaResolver;
import com.quill.util.IdentifierSanitizer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages the CSV-backed dataset: loads the data directory at startup, accepts uploads and
 * drops tables. Every change ends with a resolver refresh.
 *
 * <p>A mutation and its refresh run under one lock, so the resolver never ends up on a schema
 * older than the engine's.
 */
@Slf4j
@Service
public class DatasetService {

    private static final String CSV_EXTENSION = ".csv";

    private final QueryEngine engine;
    private final SchemaResolver resolver;
    private final Path dataDir;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public DatasetService(
            QueryEngine engine,
            SchemaResolver resolver,
            @Value("${quill.data.dir:data}") String dataDir
    ) {
        this.engine = engine;
        this.resolver = resolver;
        this.dataDir = Paths.get(dataDir);
    }

    /**
     * Load every {@code *.csv} of the data directory. A file that fails to load is logged and
     * skipped.
     */
    @PostConstruct
    public void loadDataDirectory() {
        if (!Files.isDirectory(dataDir)) {
            log.info("Data directory {} does not exist, starting with an empty dataset", dataDir.toAbsolutePath());
            return;
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, "*" + CSV_EXTENSION)) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            throw new DatasetException("Failed to list data directory " + dataDir + ": " + e.getMessage(), e);
        }
        files.sort(null);

        mutationLock.lock();
        try {
            for (Path file : files) {
                String table = IdentifierSanitizer.sanitize(stem(file.getFileName().toString()));
                try {
                    engine.loadCsv(table, file, false);
                } catch (DatasetException e) {
                    log.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
                }
            }
            resolver.refreshSchema(engine.getSchema());
        } finally {
            mutationLock.unlock();
        }
        log.info("Dataset ready (tables={})", engine.getSchema().tableNames());
    }

    /**
     * Store an uploaded CSV as {@code <table>.csv} and load it, replacing a table of the same name.
     *
     * @param filename client file name; the table name is its sanitized stem
     * @param content file content
     * @return the loaded table
     * @throws IllegalArgumentException if the file is not a CSV file
     */
    public TableSummary upload(String filename, InputStream content) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION)) {
            throw new IllegalArgumentException("Only CSV files are allowed.");
        }
        String table = IdentifierSanitizer.sanitize(stem(filename));
        Path target = dataDir.resolve(table + CSV_EXTENSION);

        Path temp = null;
        try {
            Files.createDirectories(dataDir);
            temp = Files.createTempFile(dataDir, table, ".upload");
            Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);

            Schema schema;
            mutationLock.lock();
            try {
                engine.loadCsv(table, temp, true);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                temp = null;
                schema = engine.getSchema();
                resolver.refreshSchema(schema);
            } finally {
                mutationLock.unlock();
            }

            TableSchema loaded = schema.table(table)
                    .orElseThrow(() -> new DatasetException("Table " + table + " missing after load"));
            log.info("Upload stored (table={}, file={})", table, target);
            return new TableSummary(table, rowCount(table), loaded.columns());
        } catch (IOException e) {
            throw new DatasetException("Failed to store upload " + filename + ": " + e.getMessage(), e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Drop a table and delete its CSV file.
     *
     * @param name table name as given by the client; sanitized before use
     * @return the sanitized name that was dropped
     */
    public String drop(String name) {
        String table = IdentifierSanitizer.sanitize(name);
        mutationLock.lock();
        try {
            engine.dropTable(table);
            Files.deleteIfExists(dataDir.resolve(table + CSV_EXTENSION));
        } catch (IOException e) {
            throw new DatasetException("Failed to delete data file for " + table + ": " + e.getMessage(), e);
        } finally {
            try {
                resolver.refreshSchema(engine.getSchema());
            } finally {
                mutationLock.unlock();
            }
        }
        return table;
    }

    /**
     * Every loaded table with its row count. A table whose count fails is left out.
     */
    public List<TableSummary> listTables() {
        List<TableSummary> out = new ArrayList<>();
        for (TableSchema table : engine.getSchema().tables()) {
            try {
                out.add(new TableSummary(table.name(), engine.countRows(table.name()), table.columns()));
            } catch (SqlExecutionException e) {
                log.warn("Could not count rows of {}: {}", table.name(), e.getMessage());
            }
        }
        return out;
    }

    public List<String> tableNames() {
        return engine.getSchema().tableNames();
    }

    private long rowCount(String table) {
        try {
            return engine.countRows(table);
        } catch (SqlExecutionException e) {
            throw new DatasetException("Failed to count rows of " + table + ": " + e.getMessage(), e);
        }
    }

    private static String stem(String filename) {
        String name = Paths.get(filename).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
