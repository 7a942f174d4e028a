package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.ColumnRole;
import org.vaultprep.engine.store.HashdiffGroup;
import org.vaultprep.engine.store.TableMetadata;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Expands hashdiff groups into ordered satellite rows.
 *
 * Each hashdiff group becomes one satellite attached to the hub named by its
 * (possibly concept-resolved) hashkey. With {@link CompilerOptions#implicitSatellite()}
 * set, a table without hashdiff groups gets a single satellite of its
 * unclassified columns, attached to the table's first hub.
 */
public final class SatelliteCompiler implements RelationCompiler {

    public static final String RELATION_NAME = "standard_satellite";

    public static final List<String> HEADER = List.of(
            "Satellite_Identifier",
            "Target_Satellite_Table_Physical_Name",
            "Source_Table_Identifier",
            "Source_Column_Physical_Name",
            "Parent_Identifier",
            "Parent_Primary_Key_Physical_Name",
            "Target_Column_Physical_Name",
            "Target_Column_Sort_Order",
            "Group_Name");

    private final CompilerOptions options;

    public SatelliteCompiler() {
        this(CompilerOptions.defaults());
    }

    public SatelliteCompiler(CompilerOptions options) {
        this.options = options;
    }

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
            if (table.hashdiffGroups().isEmpty()) {
                if (options.implicitSatellite()) {
                    compileImplicit(table, relation, diagnostics);
                }
                continue;
            }
            for (HashdiffGroup hashdiff : table.hashdiffGroups()) {
                compileHashdiff(table, hashdiff, relation, diagnostics);
            }
        }
        return relation.build();
    }

    private void compileHashdiff(TableMetadata table, HashdiffGroup hashdiff,
            Relation.Builder relation, Diagnostics diagnostics) {
        if (!hashdiff.hasBusinessConcept()) {
            diagnostics.report(RELATION_NAME, table.qualifiedName(), hashdiff.name(),
                    CompilerDiagnostic.Reason.NO_BUSINESS_CONCEPT, "hashdiff has no business concept");
            return;
        }

        Optional<String> hashkey = HashdiffMembership.resolveHashkey(table, hashdiff);
        if (hashkey.isEmpty()) {
            diagnostics.report(RELATION_NAME, table.qualifiedName(), hashdiff.name(),
                    CompilerDiagnostic.Reason.UNRESOLVED_HASHKEY,
                    "no hub group for concept '" + hashdiff.businessConcept() + "'");
            return;
        }

        List<ColumnMetadata> members = HashdiffMembership.members(table, hashdiff);
        if (members.isEmpty()) {
            diagnostics.report(RELATION_NAME, table.qualifiedName(), hashdiff.name(),
                    CompilerDiagnostic.Reason.EMPTY_COLUMN_SET, hashdiff.selection().mode() + " selects no columns");
            return;
        }

        String satelliteBase = NamingResolver.satelliteBaseOfHashdiff(hashdiff.name());
        String hubBase = NamingResolver.hubBaseOfHashkey(hashkey.get());
        emit(table, members,
                NamingResolver.satelliteIdentifier(satelliteBase),
                satelliteBase + "_sat",
                NamingResolver.hubIdentifier(hubBase),
                hashkey.get(),
                relation);
    }

    private void compileImplicit(TableMetadata table, Relation.Builder relation, Diagnostics diagnostics) {
        Optional<String> hubName = firstHubName(table);
        if (hubName.isEmpty()) {
            diagnostics.report(RELATION_NAME, table.qualifiedName(), "",
                    CompilerDiagnostic.Reason.NO_PARENT_HUB, "implicit satellite needs a hub");
            return;
        }

        List<ColumnMetadata> payload = payloadColumns(table);
        if (payload.isEmpty()) {
            diagnostics.report(RELATION_NAME, table.qualifiedName(), "",
                    CompilerDiagnostic.Reason.EMPTY_COLUMN_SET, "no unclassified columns");
            return;
        }

        String name = hubName.get();
        emit(table, payload,
                NamingResolver.satelliteIdentifier(name),
                name + "_sat",
                NamingResolver.hubIdentifier(name),
                firstHubHashkey(table, name),
                relation);
    }

    private void emit(TableMetadata table, List<ColumnMetadata> members, String satelliteIdentifier,
            String satelliteTable, String parentIdentifier, String parentHashkey, Relation.Builder relation) {
        String sourceIdentifier = NamingResolver.sourceIdentifier(table.schema(), table.table());
        String groupName = NamingResolver.groupName(table.schema());
        for (int i = 0; i < members.size(); i++) {
            ColumnMetadata column = members.get(i);
            relation.add(
                    satelliteIdentifier,
                    satelliteTable,
                    sourceIdentifier,
                    column.name(),
                    parentIdentifier,
                    parentHashkey,
                    column.name(),
                    String.valueOf(column.sortOrderOr(i + 1)),
                    groupName);
        }
    }

    private static Optional<String> firstHubName(TableMetadata table) {
        if (table.hubGroups().isEmpty() && HubCompiler.flaggedBusinessKeys(table).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(HubCompiler.hubNameOf(table));
    }

    private static String firstHubHashkey(TableMetadata table, String hubName) {
        List<BusinessKeyGroup> hubGroups = table.hubGroups();
        return hubGroups.isEmpty()
                ? NamingResolver.defaultHashkey(hubName)
                : HubCompiler.hashkeyOf(table, hubGroups.get(0));
    }

    /**
     * Columns not already classified as key or technical, in table order.
     */
    static List<ColumnMetadata> payloadColumns(TableMetadata table) {
        Set<String> technical = HashdiffMembership.technicalColumns(table);
        return table.columns().stream()
                .filter(c -> !technical.contains(c.name()))
                .filter(c -> c.hasRole(ColumnRole.PAYLOAD)
                        || !(c.hasRole(ColumnRole.BUSINESS_KEY)
                                || c.hasRole(ColumnRole.HASHKEY)
                                || c.hasRole(ColumnRole.HASHDIFF)
                                || c.hasRole(ColumnRole.RECORD_SOURCE)
                                || c.hasRole(ColumnRole.LOAD_DATE)))
                .toList();
    }
}
