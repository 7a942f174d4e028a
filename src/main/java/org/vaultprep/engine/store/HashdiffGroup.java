package org.vaultprep.engine.store;

import java.util.List;
import java.util.Objects;

/**
 * A change-tracking rule for one table. Each group becomes one satellite.
 *
 * @param name            The hashdiff name (e.g. {@code hd_customer_details_sat})
 * @param businessConcept The owning business concept
 * @param hashkeyName     The parent hashkey, or null to resolve it from the concept
 * @param selection       Which columns feed the hashdiff
 */
public record HashdiffGroup(
        String name,
        String businessConcept,
        String hashkeyName,
        HashdiffSelection selection
) {
    public HashdiffGroup {
        Objects.requireNonNull(name, "Hashdiff name cannot be null");
        Objects.requireNonNull(selection, "Hashdiff selection cannot be null");
    }

    public static HashdiffGroup selectAll(String name, String businessConcept, String hashkeyName,
            List<String> excludedColumns) {
        return new HashdiffGroup(name, businessConcept, hashkeyName,
                new HashdiffSelection.SelectAll(excludedColumns));
    }

    public static HashdiffGroup selectExplicit(String name, String businessConcept, String hashkeyName,
            List<String> includedColumns) {
        return new HashdiffGroup(name, businessConcept, hashkeyName,
                new HashdiffSelection.SelectExplicit(includedColumns));
    }

    public boolean hasBusinessConcept() {
        return businessConcept != null && !businessConcept.isBlank();
    }

    public boolean hasHashkeyName() {
        return hashkeyName != null && !hashkeyName.isBlank();
    }
}
