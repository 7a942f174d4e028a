package org.vaultprep.engine.compiler;

/**
 * Exception thrown when two hub groups declare the same hashkey name.
 * Link and hashdiff resolution need that name to be unique across all tables.
 */
public class DuplicateHashkeyException extends RuntimeException {

    private final String hashkeyName;

    public DuplicateHashkeyException(String hashkeyName, String firstTable, String secondTable) {
        super("Hashkey '" + hashkeyName + "' is declared by more than one hub group: "
                + firstTable + " and " + secondTable);
        this.hashkeyName = hashkeyName;
    }

    public String getHashkeyName() {
        return hashkeyName;
    }
}
