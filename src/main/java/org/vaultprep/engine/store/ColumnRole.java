package org.vaultprep.engine.store;

/**
 * Role flags a user can assign to a physical column.
 *
 * Flags are advisory: compilers derive hub and satellite membership from
 * the business-key and hashdiff groups, since flags and groups can drift
 * apart while a table is being edited.
 */
public enum ColumnRole {
    BUSINESS_KEY,
    HASHKEY,
    HASHDIFF,
    PAYLOAD,
    RECORD_SOURCE,
    LOAD_DATE
}
