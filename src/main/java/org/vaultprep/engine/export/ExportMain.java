package org.vaultprep.engine.export;

import org.vaultprep.engine.annotation.AnnotationParseException;
import org.vaultprep.engine.annotation.AnnotationStore;
import org.vaultprep.engine.compiler.CompilerDiagnostic;
import org.vaultprep.engine.compiler.CompilerOptions;
import org.vaultprep.engine.compiler.DuplicateHashkeyException;
import org.vaultprep.engine.compiler.LinkReferencePolicy;
import org.vaultprep.engine.introspection.DuckDBSchemaIntrospector;
import org.vaultprep.engine.store.TableMetadata;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

/**
 * Command-line export.
 *
 * <pre>
 * vault-prep --metadata metadata.json --out ./export
 * vault-prep --duckdb warehouse.duckdb --metadata metadata.json --out ./export --denormalized
 * vault-prep --duckdb warehouse.duckdb --save-metadata metadata.json
 * </pre>
 *
 * Flags override the VAULTPREP_* environment variables read by {@link CompilerOptions}.
 */
public final class ExportMain {

    static final int OK = 0;
    static final int USAGE_ERROR = 2;
    static final int EXPORT_ERROR = 1;

    private final PrintStream out;
    private final PrintStream err;

    ExportMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new ExportMain(System.out, System.err).run(args, CompilerOptions.fromEnvironment());
        if (status != OK) {
            System.exit(status);
        }
    }

    int run(String[] args, CompilerOptions baseOptions) {
        Path metadata = null;
        Path duckdb = null;
        Path outputDirectory = null;
        Path saveMetadata = null;
        boolean denormalized = false;
        CompilerOptions options = baseOptions;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--metadata" -> metadata = Path.of(requireValue(args, ++i));
                    case "--duckdb" -> duckdb = Path.of(requireValue(args, ++i));
                    case "--out" -> outputDirectory = Path.of(requireValue(args, ++i));
                    case "--save-metadata" -> saveMetadata = Path.of(requireValue(args, ++i));
                    case "--denormalized" -> denormalized = true;
                    case "--implicit-satellite" -> options = options.withImplicitSatellite(true);
                    case "--link-policy" -> options = options.withLinkReferencePolicy(
                            LinkReferencePolicy.fromString(requireValue(args, ++i)));
                    case "--help", "-h" -> {
                        printUsage(out);
                        return OK;
                    }
                    default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
                }
            }
            if (metadata == null && duckdb == null) {
                throw new IllegalArgumentException("Either --metadata or --duckdb is required");
            }
            if (outputDirectory == null && saveMetadata == null) {
                throw new IllegalArgumentException("Nothing to do: give --out and/or --save-metadata");
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return USAGE_ERROR;
        }

        try {
            DuckDBSchemaIntrospector introspector = duckdb == null
                    ? null
                    : DuckDBSchemaIntrospector.forFile(duckdb.toString());
            List<TableMetadata> tables = ExportService.loadSnapshot(introspector, metadata);

            if (saveMetadata != null) {
                AnnotationStore.save(saveMetadata, tables);
                out.println("Saved metadata for " + tables.size() + " tables to " + saveMetadata);
            }
            if (outputDirectory != null) {
                ExportService.ExportReport report = new ExportService(options)
                        .export(tables, outputDirectory, denormalized);
                out.println("Successfully exported " + report.exportedCount() + " CSV files to " + outputDirectory);
                for (CompilerDiagnostic diagnostic : report.diagnostics()) {
                    out.println("  omitted: " + diagnostic);
                }
            }
            return OK;
        } catch (IOException | SQLException e) {
            err.println("Error exporting CSV: " + e.getMessage());
            return EXPORT_ERROR;
        } catch (AnnotationParseException | DuplicateHashkeyException e) {
            err.println("Invalid metadata: " + e.getMessage());
            return EXPORT_ERROR;
        }
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: vault-prep [--duckdb <file>] [--metadata <file>] [--out <dir>]");
        stream.println("                  [--save-metadata <file>] [--denormalized]");
        stream.println("                  [--link-policy skip|placeholder] [--implicit-satellite]");
    }
}
