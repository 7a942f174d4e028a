package org.vaultprep.engine.introspection;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.TableMetadata;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Introspection against an in-memory DuckDB database.
 */
class DuckDBSchemaIntrospectorTest {

    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        try (Statement stmt = connection.createStatement()) {
            createTables(stmt);
        }
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null) {
            connection.close();
        }
    }

    private static void createTables(Statement stmt) throws SQLException {
        stmt.execute("CREATE SCHEMA crm");
        stmt.execute("CREATE TABLE crm.stg_customer (customer_id INTEGER NOT NULL, email VARCHAR, signup DATE)");
        stmt.execute("CREATE TABLE crm.stg_order (order_id BIGINT NOT NULL, customer_id INTEGER)");
    }

    @Test
    @DisplayName("Columns are read in ordinal order with type and nullability")
    void testIntrospectColumns() throws SQLException {
        List<TableMetadata> tables = DuckDBSchemaIntrospector.forConnection(connection).introspect();

        TableMetadata customer = tables.stream()
                .filter(t -> t.qualifiedName().equals("crm.stg_customer"))
                .findFirst()
                .orElseThrow();
        List<ColumnMetadata> columns = customer.columns();

        assertEquals(List.of("customer_id", "email", "signup"), columns.stream().map(ColumnMetadata::name).toList());
        assertAll(
                () -> assertEquals(1, columns.get(0).ordinalPosition()),
                () -> assertEquals("INTEGER", columns.get(0).dataType()),
                () -> assertFalse(columns.get(0).nullable()),
                () -> assertTrue(columns.get(1).nullable()),
                () -> assertEquals("DATE", columns.get(2).dataType()),
                () -> assertTrue(columns.get(0).roles().isEmpty()),
                () -> assertNull(columns.get(0).order()));
        assertTrue(customer.businessKeyGroups().isEmpty());
        assertNull(customer.businessConcept());
    }

    @Test
    void testTablesAreGroupedPerSchemaAndTable() throws SQLException {
        List<TableMetadata> tables = DuckDBSchemaIntrospector.forConnection(connection).introspect();

        assertEquals(List.of("crm.stg_customer", "crm.stg_order"),
                tables.stream()
                        .filter(t -> t.schema().equals("crm"))
                        .map(TableMetadata::qualifiedName)
                        .toList());
    }

    @Test
    void testSchemasAndTables() throws SQLException {
        SchemaIntrospector introspector = DuckDBSchemaIntrospector.forConnection(connection);

        assertTrue(introspector.schemas().contains("crm"));
        assertEquals(List.of("stg_customer", "stg_order"), introspector.tables("crm"));
        assertTrue(introspector.tables("missing").isEmpty());
    }

    @Test
    void testCallerOwnedConnectionStaysOpen() throws SQLException {
        DuckDBSchemaIntrospector.forConnection(connection).introspect();

        assertFalse(connection.isClosed());
    }

    @Test
    @DisplayName("Database files are opened and closed per call")
    void testIntrospectFile(@TempDir Path tempDir) throws SQLException {
        Path database = tempDir.resolve("warehouse.duckdb");
        try (Connection fileConnection = DriverManager.getConnection("jdbc:duckdb:" + database);
                Statement stmt = fileConnection.createStatement()) {
            createTables(stmt);
        }

        DuckDBSchemaIntrospector introspector = DuckDBSchemaIntrospector.forFile(database.toString());

        assertEquals(2, introspector.introspect().stream().filter(t -> t.schema().equals("crm")).count());
        assertEquals(List.of("stg_customer", "stg_order"), introspector.tables("crm"));
    }
}
