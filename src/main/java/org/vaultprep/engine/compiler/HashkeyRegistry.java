package org.vaultprep.engine.compiler;

import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.TableMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup from hashkey name to the hub group that owns it, across all tables.
 *
 * Built once per compile call. Only hub groups with an explicit hashkey name
 * are registered; a name declared twice is rejected when the registry is built.
 */
public final class HashkeyRegistry {

    /**
     * The hub a hashkey name resolves to.
     *
     * @param table   The table declaring the hub group
     * @param group   The hub group
     * @param hubName The hub name derived for the owning table
     */
    public record HubDefinition(TableMetadata table, BusinessKeyGroup group, String hubName) {

        public String hubIdentifier() {
            return NamingResolver.hubIdentifier(hubName);
        }

        public List<String> columns() {
            return group.columns();
        }
    }

    private final Map<String, HubDefinition> definitionsByHashkey;

    private HashkeyRegistry(Map<String, HubDefinition> definitionsByHashkey) {
        this.definitionsByHashkey = Collections.unmodifiableMap(definitionsByHashkey);
    }

    /**
     * Builds the registry over the full table set.
     *
     * @throws DuplicateHashkeyException if two hub groups share a hashkey name
     */
    public static HashkeyRegistry build(List<TableMetadata> tables) {
        Map<String, HubDefinition> definitions = new LinkedHashMap<>();
        for (TableMetadata table : tables) {
            for (BusinessKeyGroup group : table.hubGroups()) {
                if (!group.hasHashkeyName()) {
                    continue;
                }
                HubDefinition definition = new HubDefinition(table, group, HubCompiler.hubNameOf(table));
                HubDefinition existing = definitions.putIfAbsent(group.hashkeyName(), definition);
                if (existing != null) {
                    throw new DuplicateHashkeyException(group.hashkeyName(),
                            existing.table().qualifiedName(), table.qualifiedName());
                }
            }
        }
        return new HashkeyRegistry(definitions);
    }

    public Optional<HubDefinition> resolve(String hashkeyName) {
        if (hashkeyName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitionsByHashkey.get(hashkeyName));
    }

    public boolean contains(String hashkeyName) {
        return definitionsByHashkey.containsKey(hashkeyName);
    }

    public int size() {
        return definitionsByHashkey.size();
    }
}
