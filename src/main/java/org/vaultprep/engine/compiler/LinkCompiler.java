package org.vaultprep.engine.compiler;

import org.vaultprep.engine.relation.Relation;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.TableMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Expands link groups into ordered link rows.
 *
 * Each referenced hashkey is resolved through a {@link HashkeyRegistry} built
 * over all tables, and the referenced hub's business-key columns are emitted
 * in group order. References that cannot be expanded are handled according
 * to {@link CompilerOptions#linkReferencePolicy()}.
 */
public final class LinkCompiler implements RelationCompiler {

    public static final String RELATION_NAME = "standard_link";

    public static final List<String> HEADER = List.of(
            "Link_Identifier",
            "Target_link_table_physical_name",
            "Source_Table_Identifier",
            "Source_Column_Physical_Name",
            "Hub_Identifier",
            "Hub_primary_key_physical_name",
            "Target_column_physical_name",
            "Target_Primary_Key_Physical_Name",
            "Group_Name");

    private final CompilerOptions options;

    public LinkCompiler() {
        this(CompilerOptions.defaults());
    }

    public LinkCompiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Link name: the group's hashkey, else {@code lk_{table}_{n}} where n is the
     * 1-based position of the group within the table's business-key groups.
     */
    public static String linkNameOf(TableMetadata table, int groupIndex) {
        BusinessKeyGroup group = table.businessKeyGroups().get(groupIndex);
        if (group.hasHashkeyName()) {
            return group.hashkeyName();
        }
        return "lk_" + table.table() + "_" + (groupIndex + 1);
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
        return compile(tables, HashkeyRegistry.build(tables), diagnostics);
    }

    /**
     * Compiles against an already built registry.
     */
    public Relation compile(List<TableMetadata> tables, HashkeyRegistry registry, Diagnostics diagnostics) {
        Relation.Builder relation = Relation.builder(RELATION_NAME, HEADER);
        for (TableMetadata table : tables) {
            List<BusinessKeyGroup> groups = table.businessKeyGroups();
            for (int i = 0; i < groups.size(); i++) {
                if (groups.get(i).link()) {
                    compileLink(table, i, registry, relation, diagnostics);
                }
            }
        }
        return relation.build();
    }

    private void compileLink(TableMetadata table, int groupIndex, HashkeyRegistry registry,
            Relation.Builder relation, Diagnostics diagnostics) {
        BusinessKeyGroup group = table.businessKeyGroups().get(groupIndex);
        String linkName = linkNameOf(table, groupIndex);
        String linkIdentifier = NamingResolver.linkIdentifier(linkName);
        String sourceIdentifier = NamingResolver.sourceIdentifier(table.schema(), table.table());
        String groupName = NamingResolver.groupName(table.schema());

        for (String hashkey : group.referencedHashkeys()) {
            Optional<HashkeyRegistry.HubDefinition> hub = registry.resolve(hashkey);

            if (hub.isPresent() && !hub.get().columns().isEmpty()) {
                for (String column : hub.get().columns()) {
                    relation.add(
                            linkIdentifier,
                            linkName,
                            sourceIdentifier,
                            column,
                            hub.get().hubIdentifier(),
                            hashkey,
                            column,
                            linkName,
                            groupName);
                }
                continue;
            }

            CompilerDiagnostic.Reason reason = hub.isPresent()
                    ? CompilerDiagnostic.Reason.REFERENCED_HUB_WITHOUT_COLUMNS
                    : CompilerDiagnostic.Reason.UNRESOLVED_LINK_REFERENCE;
            diagnostics.report(RELATION_NAME, table.qualifiedName(), linkName, reason,
                    "hashkey '" + hashkey + "', policy " + options.linkReferencePolicy());

            if (options.linkReferencePolicy() == LinkReferencePolicy.PLACEHOLDER) {
                String hubIdentifier = hub.map(HashkeyRegistry.HubDefinition::hubIdentifier)
                        .orElseGet(() -> NamingResolver.hubIdentifier(NamingResolver.stripPrefix(hashkey, "hk_")));
                relation.add(
                        linkIdentifier,
                        linkName,
                        sourceIdentifier,
                        "",
                        hubIdentifier,
                        hashkey,
                        "",
                        linkName,
                        groupName);
            }
        }
    }
}
