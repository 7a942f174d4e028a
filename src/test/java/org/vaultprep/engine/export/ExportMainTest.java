package org.vaultprep.engine.export;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vaultprep.engine.annotation.AnnotationStore;
import org.vaultprep.engine.compiler.CompilerOptions;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.TableFixtures;
import org.vaultprep.engine.store.TableMetadata;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExportMainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ExportMain main;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        main = new ExportMain(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return main.run(args, CompilerOptions.defaults());
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path saveFixtures(List<TableMetadata> tables) throws Exception {
        Path metadata = tempDir.resolve(AnnotationStore.DEFAULT_FILE_NAME);
        AnnotationStore.save(metadata, tables);
        return metadata;
    }

    @Test
    @DisplayName("Exports the four files from a saved annotation")
    void testExportFromMetadata() throws Exception {
        Path metadata = saveFixtures(TableFixtures.customerAndOrder());
        Path outputDirectory = tempDir.resolve("export");

        int status = run("--metadata", metadata.toString(), "--out", outputDirectory.toString());

        assertEquals(ExportMain.OK, status, stderr());
        assertTrue(stdout().contains("Successfully exported 4 CSV files to " + outputDirectory));
        assertTrue(Files.exists(outputDirectory.resolve("standard_link.csv")));
    }

    @Test
    void testDenormalizedFlag() throws Exception {
        Path metadata = saveFixtures(TableFixtures.customerAndOrder());
        Path outputDirectory = tempDir.resolve("export");

        int status = run("--metadata", metadata.toString(), "--out", outputDirectory.toString(), "--denormalized");

        assertEquals(ExportMain.OK, status);
        assertTrue(Files.exists(outputDirectory.resolve("denormalized_metadata.csv")));
        assertTrue(stdout().contains("Successfully exported 1 CSV files"));
    }

    @Test
    @DisplayName("Omissions are listed after the export summary")
    void testOmissionsArePrinted() throws Exception {
        TableMetadata dangling = TableFixtures.table("stg_order", null,
                List.of(BusinessKeyGroup.link("lk_order_customer", List.of("hk_customer_h"))),
                List.of(),
                TableFixtures.columns("stg_order", "customer_id"));
        Path metadata = saveFixtures(List.of(dangling));

        int status = run("--metadata", metadata.toString(), "--out", tempDir.resolve("export").toString(),
                "--link-policy", "skip");

        assertEquals(ExportMain.OK, status);
        assertTrue(stdout().contains("omitted: standard_link: crm.stg_order [lk_order_customer] UNRESOLVED_LINK_REFERENCE"));
        String link = Files.readString(tempDir.resolve("export").resolve("standard_link.csv"));
        assertFalse(link.contains("lk_order_customer"));
    }

    @Test
    void testSaveMetadataFromDuckDB() throws Exception {
        Path database = tempDir.resolve("warehouse.duckdb");
        try (Connection connection = DriverManager.getConnection("jdbc:duckdb:" + database);
                Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE stg_customer (customer_id INTEGER, email VARCHAR)");
        }
        Path saved = tempDir.resolve("saved.json");

        int status = run("--duckdb", database.toString(), "--save-metadata", saved.toString());

        assertEquals(ExportMain.OK, status, stderr());
        TableMetadata customer = AnnotationStore.load(saved).stream()
                .filter(t -> t.table().equals("stg_customer"))
                .findFirst()
                .orElseThrow();
        assertEquals("main", customer.schema());
        assertEquals(2, customer.columns().size());
    }

    @Test
    void testHelp() {
        assertEquals(ExportMain.OK, run("--help"));
        assertTrue(stdout().startsWith("Usage: vault-prep"));
    }

    @Test
    void testNoArguments() {
        assertEquals(ExportMain.USAGE_ERROR, run());
        assertTrue(stderr().contains("Either --metadata or --duckdb is required"));
    }

    @Test
    void testNothingToDo() {
        assertEquals(ExportMain.USAGE_ERROR, run("--metadata", "metadata.json"));
    }

    @Test
    void testUnknownArgument() {
        assertEquals(ExportMain.USAGE_ERROR, run("--verbose"));
        assertTrue(stderr().contains("Unknown argument: --verbose"));
    }

    @Test
    void testMissingFlagValue() {
        assertEquals(ExportMain.USAGE_ERROR, run("--out"));
        assertTrue(stderr().contains("Missing value for --out"));
    }

    @Test
    void testUnknownLinkPolicy() {
        assertEquals(ExportMain.USAGE_ERROR, run("--metadata", "m.json", "--out", "x", "--link-policy", "drop"));
    }

    @Test
    void testInvalidMetadata() throws Exception {
        Path metadata = tempDir.resolve("broken.json");
        Files.writeString(metadata, "{\"tables\": [");

        int status = run("--metadata", metadata.toString(), "--out", tempDir.resolve("export").toString());

        assertEquals(ExportMain.EXPORT_ERROR, status);
        assertTrue(stderr().startsWith("Invalid metadata: "));
    }

    @Test
    void testMissingMetadataFile() {
        int status = run("--metadata", tempDir.resolve("absent.json").toString(),
                "--out", tempDir.resolve("export").toString());

        assertEquals(ExportMain.EXPORT_ERROR, status);
        assertTrue(stderr().startsWith("Error exporting CSV: "));
    }

    @Test
    void testDuplicateHashkey() throws Exception {
        Path metadata = saveFixtures(List.of(TableFixtures.customer(), TableFixtures.customer()));

        int status = run("--metadata", metadata.toString(), "--out", tempDir.resolve("export").toString());

        assertEquals(ExportMain.EXPORT_ERROR, status);
        assertTrue(stderr().contains("hk_customer_h"));
    }
}
