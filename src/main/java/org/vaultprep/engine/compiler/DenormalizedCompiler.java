package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.ColumnRole;
import org.vaultprep.engine.store.HashdiffGroup;
import org.vaultprep.engine.store.TableMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattens the annotation into one row per physical column.
 *
 * Hub, link and hashdiff membership are answered with the same rules the
 * relational compilers use ({@link HubCompiler}, {@link LinkCompiler},
 * {@link HashdiffMembership}).
 */
public final class DenormalizedCompiler implements RelationCompiler {

    public static final String RELATION_NAME = "denormalized_metadata";

    public static final String LIST_SEPARATOR = ";";

    public static final List<String> HEADER = List.of(
            "Source_Schema_Physical_Name",
            "Source_Table_Physical_Name",
            "Column_Physical_Name",
            "Ordinal_Position",
            "Data_Type",
            "Is_Nullable",
            "Business_Concept",
            "Hub_Hashkey",
            "Link_Hashkey",
            "Hashdiff_Groups",
            "Is_Record_Source",
            "Is_Load_Date",
            "Create_Satellite");

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
        return compile(tables, HashkeyRegistry.build(tables), diagnostics);
    }

    public Relation compile(List<TableMetadata> tables, HashkeyRegistry registry, Diagnostics diagnostics) {
        Relation.Builder relation = Relation.builder(RELATION_NAME, HEADER);
        for (TableMetadata table : tables) {
            for (ColumnMetadata column : table.columns()) {
                Optional<BusinessKeyGroup> hubGroup = owningHubGroup(table, column);
                List<String> hashdiffs = hashdiffGroupsOf(table, column);
                relation.add(
                        table.schema(),
                        table.table(),
                        column.name(),
                        String.valueOf(column.ordinalPosition()),
                        column.dataType(),
                        String.valueOf(column.nullable()),
                        businessConceptOf(table, hubGroup),
                        hubHashkeyOf(table, column, hubGroup),
                        linkHashkeyOf(table, column, registry),
                        String.join(LIST_SEPARATOR, hashdiffs),
                        String.valueOf(column.hasRole(ColumnRole.RECORD_SOURCE)),
                        String.valueOf(column.hasRole(ColumnRole.LOAD_DATE)),
                        String.valueOf(!hashdiffs.isEmpty()));
            }
        }
        return relation.build();
    }

    private static Optional<BusinessKeyGroup> owningHubGroup(TableMetadata table, ColumnMetadata column) {
        return table.hubGroups().stream()
                .filter(g -> g.columns().contains(column.name()))
                .findFirst();
    }

    private static String businessConceptOf(TableMetadata table, Optional<BusinessKeyGroup> hubGroup) {
        if (hubGroup.isPresent() && hubGroup.get().hasBusinessConcept()) {
            return hubGroup.get().businessConcept();
        }
        return table.hasBusinessConcept() ? table.businessConcept() : "";
    }

    private static String hubHashkeyOf(TableMetadata table, ColumnMetadata column, Optional<BusinessKeyGroup> hubGroup) {
        if (hubGroup.isPresent()) {
            return HubCompiler.hashkeyOf(table, hubGroup.get());
        }
        // Legacy flag path only applies when the table has no hub groups at all
        if (table.hubGroups().isEmpty() && column.hasRole(ColumnRole.BUSINESS_KEY)) {
            return NamingResolver.defaultHashkey(HubCompiler.hubNameOf(table));
        }
        return "";
    }

    /**
     * The first link of this table that carries the column through one of its
     * resolved hub references.
     */
    private static String linkHashkeyOf(TableMetadata table, ColumnMetadata column, HashkeyRegistry registry) {
        List<BusinessKeyGroup> groups = table.businessKeyGroups();
        for (int i = 0; i < groups.size(); i++) {
            BusinessKeyGroup group = groups.get(i);
            if (!group.link()) {
                continue;
            }
            for (String hashkey : group.referencedHashkeys()) {
                boolean carried = registry.resolve(hashkey)
                        .map(hub -> hub.columns().contains(column.name()))
                        .orElse(false);
                if (carried) {
                    return LinkCompiler.linkNameOf(table, i);
                }
            }
        }
        return "";
    }

    /**
     * Hashdiff groups the column belongs to, limited to groups the satellite
     * compiler would emit.
     */
    private static List<String> hashdiffGroupsOf(TableMetadata table, ColumnMetadata column) {
        List<String> names = new ArrayList<>();
        for (HashdiffGroup hashdiff : table.hashdiffGroups()) {
            if (HashdiffMembership.hasResolvableParent(table, hashdiff)
                    && HashdiffMembership.isMember(table, hashdiff, column)) {
                names.add(hashdiff.name());
            }
        }
        return names;
    }
}
