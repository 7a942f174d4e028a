package org.vaultprep.engine.export;

import org.vaultprep.engine.annotation.AnnotationStore;
import org.vaultprep.engine.compiler.CompilerDiagnostic;
import org.vaultprep.engine.compiler.CompilerOptions;
import org.vaultprep.engine.compiler.DataVaultCompiler;
import org.vaultprep.engine.introspection.SchemaIntrospector;
import org.vaultprep.engine.serialization.CsvSerializer;
import org.vaultprep.engine.store.TableMetadata;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

/**
 * Assembles a snapshot, compiles it and writes the CSV files.
 *
 * Example:
 *
 * <pre>
 * ExportService service = new ExportService(CompilerOptions.defaults());
 * ExportService.ExportReport report = service.export(tables, Path.of("out"), false);
 * </pre>
 */
public class ExportService {

    /**
     * Outcome of one export.
     *
     * @param writtenFiles Files written, in relation order
     * @param diagnostics  Omissions made by the compilers
     */
    public record ExportReport(List<Path> writtenFiles, List<CompilerDiagnostic> diagnostics) {

        public ExportReport {
            writtenFiles = List.copyOf(writtenFiles);
            diagnostics = List.copyOf(diagnostics);
        }

        public int exportedCount() {
            return writtenFiles.size();
        }
    }

    private final DataVaultCompiler compiler;

    public ExportService(CompilerOptions options) {
        this.compiler = new DataVaultCompiler(options);
    }

    /**
     * Compiles and writes the four standard files, or the single denormalized file.
     */
    public ExportReport export(List<TableMetadata> tables, Path outputDirectory, boolean denormalized)
            throws IOException {
        DataVaultCompiler.CompilationResult result = denormalized
                ? compiler.compileDenormalized(tables)
                : compiler.compileStandard(tables);
        ExportWriter writer = new ExportWriter(outputDirectory, CsvSerializer.INSTANCE);
        return new ExportReport(writer.write(result.relations()), result.diagnostics());
    }

    /**
     * Builds the snapshot from an optional schema and an optional saved annotation.
     * With both, the annotation is overlaid on the introspected schema.
     */
    public static List<TableMetadata> loadSnapshot(SchemaIntrospector introspector, Path annotationFile)
            throws IOException, SQLException {
        List<TableMetadata> annotated = annotationFile == null ? null : AnnotationStore.load(annotationFile);
        if (introspector == null) {
            if (annotated == null) {
                throw new IllegalArgumentException("Either a schema source or an annotation file is required");
            }
            return annotated;
        }
        List<TableMetadata> introspected = introspector.introspect();
        return annotated == null ? introspected : AnnotationStore.overlay(introspected, annotated);
    }
}
