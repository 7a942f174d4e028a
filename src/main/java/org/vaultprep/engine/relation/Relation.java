package org.vaultprep.engine.relation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A fully materialized, immutable, rectangular relation: a header and its rows.
 *
 * Row order is significant and is preserved exactly as the compiler emitted it.
 *
 * @param name   File stem the relation is exported under (e.g. {@code standard_hub})
 * @param header Column names
 * @param rows   Rows, each as wide as the header
 */
public record Relation(
        String name,
        List<String> header,
        List<Row> rows) {

    public Relation {
        Objects.requireNonNull(name, "Relation name cannot be null");
        header = List.copyOf(header);
        rows = List.copyOf(rows);
        for (Row row : rows) {
            if (row.size() != header.size()) {
                throw new IllegalArgumentException("Row width " + row.size()
                        + " does not match header width " + header.size() + " in relation " + name);
            }
        }
    }

    public long rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return header.size();
    }

    /**
     * Gets a value at the specified row by column name.
     */
    public String getValue(int rowIndex, String columnName) {
        int columnIndex = header.indexOf(columnName);
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return rows.get(rowIndex).get(columnIndex);
    }

    /**
     * Returns all values of one column, in row order.
     */
    public List<String> columnValues(String columnName) {
        int columnIndex = header.indexOf(columnName);
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        List<String> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.get(columnIndex));
        }
        return values;
    }

    /**
     * Incrementally assembles a relation; used by the compilers.
     */
    public static Builder builder(String name, List<String> header) {
        return new Builder(name, header);
    }

    public static final class Builder {
        private final String name;
        private final List<String> header;
        private final List<Row> rows = new ArrayList<>();

        private Builder(String name, List<String> header) {
            this.name = name;
            this.header = header;
        }

        public Builder add(String... values) {
            rows.add(Row.of(values));
            return this;
        }

        public Relation build() {
            return new Relation(name, header, rows);
        }
    }
}
