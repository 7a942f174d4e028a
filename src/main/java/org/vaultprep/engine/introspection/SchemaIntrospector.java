package org.vaultprep.engine.introspection;

import org.vaultprep.engine.store.TableMetadata;

import java.sql.SQLException;
import java.util.List;

/**
 * Reads the column inventory of a source database.
 *
 * The returned tables carry no annotation: no concepts, groups or roles.
 */
public interface SchemaIntrospector {

    /**
     * @return one un-annotated table per (schema, table), columns in ordinal order
     */
    List<TableMetadata> introspect() throws SQLException;

    List<String> schemas() throws SQLException;

    List<String> tables(String schema) throws SQLException;
}
