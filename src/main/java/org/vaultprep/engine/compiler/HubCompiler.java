package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.ColumnRole;
import org.vaultprep.engine.store.TableMetadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Expands business-key groups into ordered hub rows.
 *
 * Rows follow group order, never table order: the sort order of a row is the
 * column's 1-based position within its group. Tables annotated only with the
 * older per-column business-key flag are compiled as one implicit group.
 */
public final class HubCompiler implements RelationCompiler {

    public static final String RELATION_NAME = "standard_hub";

    public static final List<String> HEADER = List.of(
            "Hub_Identifier",
            "Target_Hub_table_physical_name",
            "Source_Table_Identifier",
            "Source_Column_Physical_Name",
            "Business_Key_Physical_Name",
            "Target_Column_Sort_Order",
            "Target_Primary_Key_Physical_Name",
            "Record_Tracking_Satellite",
            "Is_Primary_Source",
            "Group_Name");

    /**
     * Hub name shared by every hub group of a table: the table's concept, else
     * derived from the table name. A group's own concept only drives hashdiff
     * resolution.
     */
    public static String hubNameOf(TableMetadata table) {
        return NamingResolver.hubName(table.table(), table.businessConcept());
    }

    /**
     * Hashkey emitted for a hub group: its own name, else {@code hk_{hubName}}.
     */
    public static String hashkeyOf(TableMetadata table, BusinessKeyGroup group) {
        return group.hasHashkeyName() ? group.hashkeyName() : NamingResolver.defaultHashkey(hubNameOf(table));
    }

    /**
     * Columns carrying the legacy business-key flag, in table order.
     */
    static List<ColumnMetadata> flaggedBusinessKeys(TableMetadata table) {
        return table.columns().stream()
                .filter(c -> c.hasRole(ColumnRole.BUSINESS_KEY))
                .toList();
    }

    /**
     * A flagged column paired with its effective sort order.
     */
    private record OrderedKey(ColumnMetadata column, int sortOrder) {
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
            List<BusinessKeyGroup> groups = table.hubGroups();
            if (!groups.isEmpty()) {
                compileGroups(table, groups, relation, diagnostics);
                continue;
            }
            List<ColumnMetadata> flagged = flaggedBusinessKeys(table);
            if (!flagged.isEmpty()) {
                compileFlaggedColumns(table, flagged, relation);
                continue;
            }
            diagnostics.report(RELATION_NAME, table.qualifiedName(), "",
                    CompilerDiagnostic.Reason.NO_BUSINESS_KEYS, "no hub groups and no flagged business keys");
        }
        return relation.build();
    }

    private void compileGroups(TableMetadata table, List<BusinessKeyGroup> groups,
            Relation.Builder relation, Diagnostics diagnostics) {
        String sourceIdentifier = NamingResolver.sourceIdentifier(table.schema(), table.table());
        String groupName = NamingResolver.groupName(table.schema());
        String hubName = hubNameOf(table);
        boolean primaryEmitted = false;

        for (BusinessKeyGroup group : groups) {
            String hashkey = hashkeyOf(table, group);
            if (group.columns().isEmpty()) {
                diagnostics.report(RELATION_NAME, table.qualifiedName(), hashkey,
                        CompilerDiagnostic.Reason.EMPTY_BUSINESS_KEY_GROUP, "group has no columns");
                continue;
            }
            List<String> columns = group.columns();
            for (int i = 0; i < columns.size(); i++) {
                String column = columns.get(i);
                relation.add(
                        NamingResolver.hubIdentifier(hubName),
                        hubName,
                        sourceIdentifier,
                        column,
                        column,
                        String.valueOf(i + 1),
                        hashkey,
                        "",
                        primaryEmitted ? "0" : "1",
                        groupName);
                primaryEmitted = true;
            }
        }
    }

    private void compileFlaggedColumns(TableMetadata table, List<ColumnMetadata> businessKeys,
            Relation.Builder relation) {
        String hubName = hubNameOf(table);
        String hashkey = NamingResolver.defaultHashkey(hubName);
        String sourceIdentifier = NamingResolver.sourceIdentifier(table.schema(), table.table());
        String groupName = NamingResolver.groupName(table.schema());

        // Stored orders first; unordered keys follow the highest stored order in filtered-list order.
        List<OrderedKey> ordered = new ArrayList<>(businessKeys.size());
        int highestStored = 0;
        for (ColumnMetadata key : businessKeys) {
            if (key.hasStoredOrder()) {
                ordered.add(new OrderedKey(key, key.order()));
                highestStored = Math.max(highestStored, key.order());
            }
        }
        ordered.sort(Comparator.comparingInt(OrderedKey::sortOrder));
        int next = highestStored;
        for (ColumnMetadata key : businessKeys) {
            if (!key.hasStoredOrder()) {
                ordered.add(new OrderedKey(key, ++next));
            }
        }

        for (int i = 0; i < ordered.size(); i++) {
            OrderedKey key = ordered.get(i);
            relation.add(
                    NamingResolver.hubIdentifier(hubName),
                    hubName,
                    sourceIdentifier,
                    key.column().name(),
                    key.column().name(),
                    String.valueOf(key.sortOrder()),
                    hashkey,
                    "",
                    i == 0 ? "1" : "0",
                    groupName);
        }
    }
}
