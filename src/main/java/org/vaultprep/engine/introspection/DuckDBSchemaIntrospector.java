package org.vaultprep.engine.introspection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.TableMetadata;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code information_schema.columns} from a DuckDB database.
 *
 * Connections are opened per call and closed before returning, unless the
 * introspector was given a caller-owned connection.
 */
public class DuckDBSchemaIntrospector implements SchemaIntrospector {

    private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBSchemaIntrospector.class);

    // Force-load the JDBC driver at class initialization
    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            LOGGER.error("DuckDB driver not found in classpath", e);
        }
    }

    private static final String COLUMNS_QUERY = """
            SELECT table_schema, table_name, column_name, ordinal_position, data_type, is_nullable
            FROM information_schema.columns
            WHERE table_schema NOT IN ('information_schema', 'pg_catalog')
            ORDER BY table_schema, table_name, ordinal_position
            """;

    private static final String SCHEMAS_QUERY = """
            SELECT DISTINCT table_schema
            FROM information_schema.tables
            WHERE table_schema NOT IN ('information_schema', 'pg_catalog')
            ORDER BY table_schema
            """;

    private static final String TABLES_QUERY = """
            SELECT DISTINCT table_name
            FROM information_schema.tables
            WHERE table_schema NOT IN ('information_schema', 'pg_catalog')
              AND table_schema = ?
            ORDER BY table_name
            """;

    private final String jdbcUrl;
    private final Connection sharedConnection;

    private DuckDBSchemaIntrospector(String jdbcUrl, Connection sharedConnection) {
        this.jdbcUrl = jdbcUrl;
        this.sharedConnection = sharedConnection;
    }

    /**
     * Introspects a DuckDB database file.
     */
    public static DuckDBSchemaIntrospector forFile(String databasePath) {
        return new DuckDBSchemaIntrospector("jdbc:duckdb:" + databasePath, null);
    }

    /**
     * Introspects through a caller-owned connection, which is left open.
     */
    public static DuckDBSchemaIntrospector forConnection(Connection connection) {
        return new DuckDBSchemaIntrospector(null, connection);
    }

    @Override
    public List<TableMetadata> introspect() throws SQLException {
        Connection connection = open();
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery(COLUMNS_QUERY)) {
            Map<String, List<ColumnMetadata>> columnsByTable = new LinkedHashMap<>();
            Map<String, String[]> tableKeys = new LinkedHashMap<>();
            while (rs.next()) {
                String schema = rs.getString("table_schema");
                String table = rs.getString("table_name");
                String key = schema + "." + table;
                tableKeys.putIfAbsent(key, new String[] { schema, table });
                columnsByTable.computeIfAbsent(key, k -> new ArrayList<>()).add(new ColumnMetadata(
                        schema,
                        table,
                        rs.getString("column_name"),
                        rs.getInt("ordinal_position"),
                        rs.getString("data_type"),
                        "YES".equalsIgnoreCase(rs.getString("is_nullable")),
                        null,
                        Set.of()));
            }

            List<TableMetadata> tables = new ArrayList<>(tableKeys.size());
            for (Map.Entry<String, String[]> entry : tableKeys.entrySet()) {
                String[] key = entry.getValue();
                tables.add(TableMetadata.unannotated(key[0], key[1], columnsByTable.get(entry.getKey())));
            }
            LOGGER.info("Introspected {} tables", tables.size());
            return tables;
        } finally {
            release(connection);
        }
    }

    @Override
    public List<String> schemas() throws SQLException {
        Connection connection = open();
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery(SCHEMAS_QUERY)) {
            List<String> schemas = new ArrayList<>();
            while (rs.next()) {
                schemas.add(rs.getString(1));
            }
            return schemas;
        } finally {
            release(connection);
        }
    }

    @Override
    public List<String> tables(String schema) throws SQLException {
        Connection connection = open();
        try (PreparedStatement stmt = connection.prepareStatement(TABLES_QUERY)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                List<String> tables = new ArrayList<>();
                while (rs.next()) {
                    tables.add(rs.getString(1));
                }
                return tables;
            }
        } finally {
            release(connection);
        }
    }

    private Connection open() throws SQLException {
        return sharedConnection != null ? sharedConnection : DriverManager.getConnection(jdbcUrl);
    }

    private void release(Connection connection) throws SQLException {
        if (connection != sharedConnection) {
            connection.close();
        }
    }
}
