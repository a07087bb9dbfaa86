package com.quill.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the dataset structure: table name to ordered columns, in load order.
 *
 * <p>A new instance is built on every load, upload or drop; instances are never modified, so
 * they can be shared freely between concurrent pipeline runs.
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(List.of());

    private final Map<String, TableSchema> tables;

    public Schema(List<TableSchema> tables) {
        Map<String, TableSchema> byName = new LinkedHashMap<>();
        for (TableSchema table : tables) {
            if (byName.putIfAbsent(table.name(), table) != null) {
                throw new IllegalArgumentException("Duplicate table name: " + table.name());
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
    }

    public static Schema empty() {
        return EMPTY;
    }

    public List<String> tableNames() {
        return List.copyOf(tables.keySet());
    }

    public List<TableSchema> tables() {
        return List.copyOf(tables.values());
    }

    public Optional<TableSchema> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public boolean contains(String name) {
        return tables.containsKey(name);
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    /**
     * Restrict this schema to the given tables, keeping this schema's order.
     * Unknown names are ignored.
     *
     * @param names tables to keep
     * @return restricted schema
     */
    public Schema restrictTo(Collection<String> names) {
        Set<String> keep = new HashSet<>(names);
        List<TableSchema> kept = new ArrayList<>();
        for (TableSchema table : tables.values()) {
            if (keep.contains(table.name())) {
                kept.add(table);
            }
        }
        return new Schema(kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schema other)) {
            return false;
        }
        return List.copyOf(tables.values()).equals(List.copyOf(other.tables.values()));
    }

    @Override
    public int hashCode() {
        return List.copyOf(tables.values()).hashCode();
    }

    @Override
    public String toString() {
        return "Schema" + tables.keySet();
    }
}
