package org.vaultprep.engine.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.serialization.CsvSerializer;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.TableMetadata;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.vaultprep.engine.store.TableFixtures.*;

class DataVaultCompilerTest {

    private final DataVaultCompiler compiler = new DataVaultCompiler();

    private static List<String> serializeAll(DataVaultCompiler.CompilationResult result) {
        List<String> csv = new ArrayList<>();
        for (Relation relation : result.relations()) {
            csv.add(CsvSerializer.INSTANCE.serialize(relation));
        }
        return csv;
    }

    @Test
    @DisplayName("Standard export produces the four relations in order")
    void testStandardRelations() {
        DataVaultCompiler.CompilationResult result = compiler.compileStandard(customerAndOrder());

        assertEquals(List.of("source_data", "standard_hub", "standard_satellite", "standard_link"),
                result.relations().stream().map(Relation::name).toList());
        assertEquals(2, result.relation(SourceRegistrar.RELATION_NAME).orElseThrow().rowCount());
        assertEquals(2, result.relation(HubCompiler.RELATION_NAME).orElseThrow().rowCount());
        assertEquals(2, result.relation(SatelliteCompiler.RELATION_NAME).orElseThrow().rowCount());
        assertEquals(2, result.relation(LinkCompiler.RELATION_NAME).orElseThrow().rowCount());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testCompilersNameTheirRelations() {
        List<RelationCompiler> compilers = List.of(new SourceRegistrar(), new HubCompiler(),
                new SatelliteCompiler(), new LinkCompiler(), new DenormalizedCompiler());

        for (RelationCompiler relationCompiler : compilers) {
            Relation relation = relationCompiler.compile(customerAndOrder());
            assertEquals(relationCompiler.relationName(), relation.name());
            assertEquals(relationCompiler.header(), relation.header());
        }
    }

    @Test
    void testDenormalizedRelation() {
        DataVaultCompiler.CompilationResult result = compiler.compileDenormalized(customerAndOrder());

        assertEquals(1, result.relations().size());
        assertTrue(result.relation(DenormalizedCompiler.RELATION_NAME).isPresent());
        assertTrue(result.relation(HubCompiler.RELATION_NAME).isEmpty());
    }

    @Test
    @DisplayName("Compiling twice yields byte-identical output")
    void testIdempotence() {
        List<TableMetadata> tables = customerAndOrder();

        assertEquals(serializeAll(compiler.compileStandard(tables)), serializeAll(compiler.compileStandard(tables)));
        assertEquals(serializeAll(compiler.compileDenormalized(tables)),
                serializeAll(compiler.compileDenormalized(tables)));
    }

    @Test
    @DisplayName("Empty input yields header-only CSV for every relation")
    void testEmptyInput() {
        List<String> standard = serializeAll(compiler.compileStandard(List.of()));
        List<String> denormalized = serializeAll(compiler.compileDenormalized(List.of()));

        assertAll(
                () -> assertEquals(String.join(",", SourceRegistrar.HEADER), standard.get(0)),
                () -> assertEquals(String.join(",", HubCompiler.HEADER), standard.get(1)),
                () -> assertEquals(String.join(",", SatelliteCompiler.HEADER), standard.get(2)),
                () -> assertEquals(String.join(",", LinkCompiler.HEADER), standard.get(3)),
                () -> assertEquals(String.join(",", DenormalizedCompiler.HEADER), denormalized.get(0)));
    }

    @Test
    void testDiagnosticsAreCollected() {
        List<TableMetadata> tables = List.of(
                TableMetadata.unannotated("crm", "stg_notes", columns("stg_notes", "note")),
                table("stg_order", null,
                        List.of(BusinessKeyGroup.link("lk_order_customer", List.of("hk_customer_h"))),
                        List.of(),
                        columns("stg_order", "customer_id")));

        DataVaultCompiler.CompilationResult result = compiler.compileStandard(tables);

        assertEquals(List.of(
                        CompilerDiagnostic.Reason.NO_BUSINESS_KEYS,
                        CompilerDiagnostic.Reason.NO_BUSINESS_KEYS,
                        CompilerDiagnostic.Reason.UNRESOLVED_LINK_REFERENCE),
                result.diagnostics().stream().map(CompilerDiagnostic::reason).toList());
    }

    @Test
    void testDuplicateHashkeyFailsTheExport() {
        List<TableMetadata> tables = List.of(customer(), customer());

        assertThrows(DuplicateHashkeyException.class, () -> compiler.compileStandard(tables));
        assertThrows(DuplicateHashkeyException.class, () -> compiler.compileDenormalized(tables));
    }
}
