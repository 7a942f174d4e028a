package org.vaultprep.engine.compiler;

import java.util.Objects;

/**
 * A structured record of something a compiler left out of its relation.
 *
 * @param relation The relation being compiled (e.g. {@code standard_hub})
 * @param table    Qualified name of the table involved
 * @param group    Group or hashdiff identifier involved, or empty
 * @param reason   Why it was omitted
 * @param detail   Free-form context
 */
public record CompilerDiagnostic(
        String relation,
        String table,
        String group,
        Reason reason,
        String detail) {

    public CompilerDiagnostic {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(reason, "reason");
        group = group == null ? "" : group;
        detail = detail == null ? "" : detail;
    }

    public enum Reason {
        NO_BUSINESS_KEYS,
        EMPTY_BUSINESS_KEY_GROUP,
        NO_BUSINESS_CONCEPT,
        UNRESOLVED_HASHKEY,
        EMPTY_COLUMN_SET,
        UNRESOLVED_LINK_REFERENCE,
        REFERENCED_HUB_WITHOUT_COLUMNS,
        NO_PARENT_HUB
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(relation).append(": ").append(table);
        if (!group.isEmpty()) {
            sb.append(" [").append(group).append(']');
        }
        sb.append(" ").append(reason);
        if (!detail.isEmpty()) {
            sb.append(" (").append(detail).append(')');
        }
        return sb.toString();
    }
}
