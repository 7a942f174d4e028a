package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.TableMetadata;

import java.util.List;

/**
 * Compiles the full annotated table set into one relation.
 *
 * Implementations are pure: they never mutate their input and return
 * identical relations for identical input.
 */
public interface RelationCompiler {

    /**
     * File stem of the produced relation (e.g. "standard_hub").
     */
    String relationName();

    List<String> header();

    Relation compile(List<TableMetadata> tables, Diagnostics diagnostics);

    default Relation compile(List<TableMetadata> tables) {
        return compile(tables, Diagnostics.loggingOnly());
    }
}
