package org.vaultprep.engine.compiler;

import java.util.Locale;

/**
 * What the link compiler emits for a referenced hashkey it cannot expand
 * into columns (unknown name, or a hub group without columns).
 */
public enum LinkReferencePolicy {
    /**
     * Emit nothing for the reference.
     */
    SKIP,
    /**
     * Emit one row with blank source and target columns, so the
     * link-to-hub relationship is still recorded.
     */
    PLACEHOLDER;

    public static LinkReferencePolicy fromString(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "skip" -> SKIP;
            case "placeholder" -> PLACEHOLDER;
            default -> throw new IllegalArgumentException(
                    "Unknown link reference policy: " + value + ". Supported: skip, placeholder");
        };
    }
}
