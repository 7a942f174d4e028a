package org.vaultprep.engine.store;

import java.util.List;

/**
 * An ordered business-key grouping declared on one table.
 *
 * A non-link group names the columns forming a hub's business key. Column
 * order is the order in which values are concatenated for hashing and is
 * never re-sorted.
 *
 * A link group has no columns of its own; it lists the hashkey names of
 * non-link groups (possibly on other tables) that the link connects.
 *
 * @param hashkeyName        The hashkey identifier, or null when unset
 * @param businessConcept    Optional business concept label
 * @param link               Whether this group declares a link
 * @param columns            Ordered business-key column names (non-link groups)
 * @param referencedHashkeys Ordered referenced hashkey names (link groups)
 */
public record BusinessKeyGroup(
        String hashkeyName,
        String businessConcept,
        boolean link,
        List<String> columns,
        List<String> referencedHashkeys
) {
    public BusinessKeyGroup {
        columns = columns == null ? List.of() : List.copyOf(columns);
        referencedHashkeys = referencedHashkeys == null ? List.of() : List.copyOf(referencedHashkeys);
    }

    /**
     * Factory for a hub (non-link) group.
     */
    public static BusinessKeyGroup hub(String hashkeyName, String businessConcept, List<String> columns) {
        return new BusinessKeyGroup(hashkeyName, businessConcept, false, columns, List.of());
    }

    /**
     * Factory for a link group.
     */
    public static BusinessKeyGroup link(String hashkeyName, List<String> referencedHashkeys) {
        return new BusinessKeyGroup(hashkeyName, null, true, List.of(), referencedHashkeys);
    }

    public boolean hasHashkeyName() {
        return hashkeyName != null && !hashkeyName.isBlank();
    }

    public boolean hasBusinessConcept() {
        return businessConcept != null && !businessConcept.isBlank();
    }
}
