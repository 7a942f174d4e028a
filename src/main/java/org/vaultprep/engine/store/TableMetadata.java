package org.vaultprep.engine.store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An annotated source table: the unit of compiler input.
 *
 * @param schema            The database schema (can be empty for default schema)
 * @param table             The table name
 * @param businessConcept   Optional business concept label
 * @param businessKeyGroups Business-key groups, hub and link, in declaration order
 * @param hashdiffGroups    Hashdiff groups in declaration order
 * @param columns           Physical columns in table order
 */
public record TableMetadata(
        String schema,
        String table,
        String businessConcept,
        List<BusinessKeyGroup> businessKeyGroups,
        List<HashdiffGroup> hashdiffGroups,
        List<ColumnMetadata> columns
) {
    public TableMetadata {
        Objects.requireNonNull(schema, "Schema cannot be null (use empty string for default)");
        Objects.requireNonNull(table, "Table name cannot be null");

        if (table.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }

        businessKeyGroups = businessKeyGroups == null ? List.of() : List.copyOf(businessKeyGroups);
        hashdiffGroups = hashdiffGroups == null ? List.of() : List.copyOf(hashdiffGroups);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    /**
     * Creates an un-annotated table, as produced by schema introspection.
     */
    public static TableMetadata unannotated(String schema, String table, List<ColumnMetadata> columns) {
        return new TableMetadata(schema, table, null, List.of(), List.of(), columns);
    }

    /**
     * @return The fully qualified table name (schema.table or just table)
     */
    public String qualifiedName() {
        return schema.isEmpty() ? table : schema + "." + table;
    }

    public boolean hasBusinessConcept() {
        return businessConcept != null && !businessConcept.isBlank();
    }

    /**
     * @return non-link groups in declaration order
     */
    public List<BusinessKeyGroup> hubGroups() {
        return businessKeyGroups.stream().filter(g -> !g.link()).toList();
    }

    /**
     * Finds the first column carrying the given role.
     */
    public Optional<ColumnMetadata> findColumnWithRole(ColumnRole role) {
        return columns.stream()
                .filter(c -> c.hasRole(role))
                .findFirst();
    }

    /**
     * @return the record-source column name, or empty string when none is flagged
     */
    public String recordSourceColumn() {
        return findColumnWithRole(ColumnRole.RECORD_SOURCE).map(ColumnMetadata::name).orElse("");
    }

    /**
     * @return the load-date column name, or empty string when none is flagged
     */
    public String loadDateColumn() {
        return findColumnWithRole(ColumnRole.LOAD_DATE).map(ColumnMetadata::name).orElse("");
    }

    /**
     * Finds a column by name.
     */
    public Optional<ColumnMetadata> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }
}
