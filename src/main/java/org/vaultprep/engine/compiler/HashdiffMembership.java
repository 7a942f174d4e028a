package org.vaultprep.engine.compiler;

import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.HashdiffGroup;
import org.vaultprep.engine.store.HashdiffSelection;
import org.vaultprep.engine.store.TableMetadata;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Membership and parent resolution rules for hashdiff groups.
 * Shared by the satellite compiler and the denormalized export.
 */
public final class HashdiffMembership {

    private HashdiffMembership() {
    }

    /**
     * Resolves the parent hashkey of a hashdiff group: its own hashkey name,
     * else the hashkey of the first hub group of the same table whose
     * business concept matches.
     */
    public static Optional<String> resolveHashkey(TableMetadata table, HashdiffGroup hashdiff) {
        if (hashdiff.hasHashkeyName()) {
            return Optional.of(hashdiff.hashkeyName());
        }
        if (!hashdiff.hasBusinessConcept()) {
            return Optional.empty();
        }
        return table.hubGroups().stream()
                .filter(BusinessKeyGroup::hasBusinessConcept)
                .filter(g -> g.businessConcept().equalsIgnoreCase(hashdiff.businessConcept()))
                .filter(BusinessKeyGroup::hasHashkeyName)
                .map(BusinessKeyGroup::hashkeyName)
                .findFirst();
    }

    /**
     * Whether the satellite compiler accepts the group's concept and parent:
     * it carries a business concept and its hashkey resolves.
     */
    public static boolean hasResolvableParent(TableMetadata table, HashdiffGroup hashdiff) {
        return hashdiff.hasBusinessConcept() && resolveHashkey(table, hashdiff).isPresent();
    }

    /**
     * Columns a select-all hashdiff never picks up: business-key group members
     * and the record-source and load-date columns.
     */
    public static Set<String> technicalColumns(TableMetadata table) {
        Set<String> excluded = new HashSet<>();
        for (BusinessKeyGroup group : table.businessKeyGroups()) {
            excluded.addAll(group.columns());
        }
        String recordSource = table.recordSourceColumn();
        if (!recordSource.isEmpty()) {
            excluded.add(recordSource);
        }
        String loadDate = table.loadDateColumn();
        if (!loadDate.isEmpty()) {
            excluded.add(loadDate);
        }
        return excluded;
    }

    public static boolean isMember(TableMetadata table, HashdiffGroup hashdiff, ColumnMetadata column) {
        return isMember(hashdiff.selection(), technicalColumns(table), column.name());
    }

    /**
     * Member columns of a hashdiff group, in table column order.
     */
    public static List<ColumnMetadata> members(TableMetadata table, HashdiffGroup hashdiff) {
        Set<String> technical = technicalColumns(table);
        return table.columns().stream()
                .filter(c -> isMember(hashdiff.selection(), technical, c.name()))
                .toList();
    }

    private static boolean isMember(HashdiffSelection selection, Set<String> technical, String columnName) {
        if (selection instanceof HashdiffSelection.SelectAll selectAll) {
            return !selectAll.excludedColumns().contains(columnName) && !technical.contains(columnName);
        }
        if (selection instanceof HashdiffSelection.SelectExplicit selectExplicit) {
            return selectExplicit.includedColumns().contains(columnName);
        }
        throw new IllegalStateException("Unknown hashdiff selection: " + selection);
    }
}
