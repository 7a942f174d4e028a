package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.TableMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Compiles an annotated table set into the Data Vault relations.
 *
 * The hashkey registry is built first, so a duplicate hashkey name fails
 * the whole export before any relation is produced.
 *
 * Example:
 *
 * <pre>
 * DataVaultCompiler compiler = new DataVaultCompiler(CompilerOptions.defaults());
 * CompilationResult result = compiler.compileStandard(tables);
 * Relation hubs = result.relation(HubCompiler.RELATION_NAME).orElseThrow();
 * </pre>
 */
public class DataVaultCompiler {

    /**
     * Relations of one export plus what was left out of them.
     */
    public record CompilationResult(List<Relation> relations, List<CompilerDiagnostic> diagnostics) {

        public CompilationResult {
            relations = List.copyOf(relations);
            diagnostics = List.copyOf(diagnostics);
        }

        public Optional<Relation> relation(String name) {
            return relations.stream().filter(r -> r.name().equals(name)).findFirst();
        }
    }

    private final SourceRegistrar sourceRegistrar = new SourceRegistrar();
    private final HubCompiler hubCompiler = new HubCompiler();
    private final SatelliteCompiler satelliteCompiler;
    private final LinkCompiler linkCompiler;
    private final DenormalizedCompiler denormalizedCompiler = new DenormalizedCompiler();

    public DataVaultCompiler() {
        this(CompilerOptions.defaults());
    }

    public DataVaultCompiler(CompilerOptions options) {
        this.satelliteCompiler = new SatelliteCompiler(options);
        this.linkCompiler = new LinkCompiler(options);
    }

    /**
     * Produces source_data, standard_hub, standard_satellite and standard_link, in that order.
     *
     * @throws DuplicateHashkeyException if two hub groups share a hashkey name
     */
    public CompilationResult compileStandard(List<TableMetadata> tables) {
        HashkeyRegistry registry = HashkeyRegistry.build(tables);
        Diagnostics diagnostics = new Diagnostics();
        List<Relation> relations = List.of(
                sourceRegistrar.compile(tables, diagnostics),
                hubCompiler.compile(tables, diagnostics),
                satelliteCompiler.compile(tables, diagnostics),
                linkCompiler.compile(tables, registry, diagnostics));
        return new CompilationResult(relations, diagnostics.entries());
    }

    /**
     * Produces the single denormalized relation.
     *
     * @throws DuplicateHashkeyException if two hub groups share a hashkey name
     */
    public CompilationResult compileDenormalized(List<TableMetadata> tables) {
        HashkeyRegistry registry = HashkeyRegistry.build(tables);
        Diagnostics diagnostics = new Diagnostics();
        Relation relation = denormalizedCompiler.compile(tables, registry, diagnostics);
        return new CompilationResult(List.of(relation), diagnostics.entries());
    }
}
