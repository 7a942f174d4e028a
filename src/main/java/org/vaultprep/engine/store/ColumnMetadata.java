package org.vaultprep.engine.store;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Represents one physical column of one source table.
 *
 * @param schema          The database schema (can be empty for default schema)
 * @param table           The owning table name
 * @param name            The column name
 * @param ordinalPosition 1-based position reported by the source database
 * @param dataType        The declared SQL type as reported by the source (may be empty)
 * @param nullable        Whether the column allows NULL values
 * @param order           User-assigned sort order, or null when unset
 * @param roles           Role flags
 */
public record ColumnMetadata(
        String schema,
        String table,
        String name,
        int ordinalPosition,
        String dataType,
        boolean nullable,
        Integer order,
        Set<ColumnRole> roles
) {
    public ColumnMetadata {
        Objects.requireNonNull(schema, "Schema cannot be null (use empty string for default)");
        Objects.requireNonNull(table, "Table name cannot be null");
        Objects.requireNonNull(name, "Column name cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }

        dataType = dataType == null ? "" : dataType;
        roles = roles == null || roles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    /**
     * Factory for a plain column with no roles and no stored order.
     */
    public static ColumnMetadata of(String schema, String table, String name, int ordinalPosition) {
        return new ColumnMetadata(schema, table, name, ordinalPosition, "", true, null, Set.of());
    }

    public boolean hasRole(ColumnRole role) {
        return roles.contains(role);
    }

    /**
     * @return whether a positive stored order is set
     */
    public boolean hasStoredOrder() {
        return order != null && order > 0;
    }

    /**
     * Sort order used in emitted rows: the stored order when set,
     * otherwise the supplied 1-based fallback position.
     */
    public int sortOrderOr(int fallbackPosition) {
        return hasStoredOrder() ? order : fallbackPosition;
    }
}
