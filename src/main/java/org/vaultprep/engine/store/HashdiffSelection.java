package org.vaultprep.engine.store;

import java.util.List;

/**
 * Sealed interface for the column selection of a hashdiff group.
 */
public sealed interface HashdiffSelection
        permits HashdiffSelection.SelectAll,
        HashdiffSelection.SelectExplicit {

    /**
     * Wire name used in the annotation document.
     */
    String mode();

    /**
     * Every descriptive column of the table except the excluded ones.
     */
    record SelectAll(List<String> excludedColumns) implements HashdiffSelection {
        public SelectAll {
            excludedColumns = excludedColumns == null ? List.of() : List.copyOf(excludedColumns);
        }

        @Override
        public String mode() {
            return "select_all";
        }
    }

    /**
     * Exactly the included columns.
     */
    record SelectExplicit(List<String> includedColumns) implements HashdiffSelection {
        public SelectExplicit {
            includedColumns = includedColumns == null ? List.of() : List.copyOf(includedColumns);
        }

        @Override
        public String mode() {
            return "select_explicit";
        }
    }
}
