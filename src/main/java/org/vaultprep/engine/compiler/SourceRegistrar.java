package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.TableMetadata;

import java.util.List;
import java.util.Locale;

/**
 * Emits one source registration row per table. Never filters.
 */
public final class SourceRegistrar implements RelationCompiler {

    public static final String RELATION_NAME = "source_data";

    public static final List<String> HEADER = List.of(
            "Source_System",
            "Source_Object",
            "Source_Schema_Physical_Name",
            "Source_Table_Physical_Name",
            "Source_Table_Identifier",
            "Record_Source_Column",
            "Load_Date_Column",
            "Group_Name",
            "Static_Part_of_Record_Source_Column");

    @Override
    public String relationName() {
        return RELATION_NAME;
    }

    @Override
    public List<String> header() {
        return HEADER;
    }

    @Override
    public Relation compile(List<TableMetadata> tables, Diagnostics diagnostics) {
        Relation.Builder relation = Relation.builder(RELATION_NAME, HEADER);
        for (TableMetadata table : tables) {
            String sourceSystem = NamingResolver.sourceSystem(table.schema());
            relation.add(
                    sourceSystem,
                    NamingResolver.sourceObject(table.table()),
                    table.schema(),
                    table.table(),
                    NamingResolver.sourceIdentifier(table.schema(), table.table()),
                    table.recordSourceColumn(),
                    table.loadDateColumn(),
                    NamingResolver.groupName(table.schema()),
                    sourceSystem.toUpperCase(Locale.ROOT));
        }
        return relation.build();
    }
}
