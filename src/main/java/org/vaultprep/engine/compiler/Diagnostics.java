package org.vaultprep.engine.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the omissions made while compiling one export.
 *
 * Every report is also logged, so that partial output is never silent.
 * Not thread-safe; use one instance per compile call.
 */
public final class Diagnostics {

    private static final Logger LOGGER = LoggerFactory.getLogger(Diagnostics.class);

    private final List<CompilerDiagnostic> entries = new ArrayList<>();

    /**
     * A sink that only logs. Used by the single-argument compile overloads.
     */
    public static Diagnostics loggingOnly() {
        return new Diagnostics();
    }

    public void report(CompilerDiagnostic diagnostic) {
        entries.add(diagnostic);
        LOGGER.warn("Omitted from {}: table={} group={} reason={} {}",
                diagnostic.relation(), diagnostic.table(), diagnostic.group(),
                diagnostic.reason(), diagnostic.detail());
    }

    public void report(String relation, String table, String group,
            CompilerDiagnostic.Reason reason, String detail) {
        report(new CompilerDiagnostic(relation, table, group, reason, detail));
    }

    public List<CompilerDiagnostic> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
