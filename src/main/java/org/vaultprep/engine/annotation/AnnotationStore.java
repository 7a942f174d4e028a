package org.vaultprep.engine.annotation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vaultprep.engine.store.BusinessKeyGroup;
import org.vaultprep.engine.store.ColumnMetadata;
import org.vaultprep.engine.store.ColumnRole;
import org.vaultprep.engine.store.HashdiffGroup;
import org.vaultprep.engine.store.HashdiffSelection;
import org.vaultprep.engine.store.TableMetadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads and saves the annotated snapshot as a JSON document.
 *
 * Document shape:
 *
 * <pre>
 * { "tables": [ { "schema", "table", "businessConcept",
 *                 "businessKeyGroups": [ { "hashkeyName", "businessConcept", "isLink",
 *                                          "columns": [], "linkedHashkeys": [] } ],
 *                 "hashdiffGroups": [ { "name", "businessConcept", "hashkeyName", "mode",
 *                                       "excludedColumns": [], "includedColumns": [] } ],
 *                 "columns": [ { "column", "order", "ordinalPosition", "type", "nullable",
 *                                "businessKeyGroup", "isBusinessKey", "isRecordSource",
 *                                "isLoadDate", "isHashkey", "isHashdiff", "isPayload" } ] } ] }
 * </pre>
 */
public final class AnnotationStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationStore.class);

    public static final String DEFAULT_FILE_NAME = "metadata.json";

    private static final String MODE_SELECT_ALL = "select_all";
    private static final String MODE_SELECT_EXPLICIT = "select_explicit";

    private AnnotationStore() {
    }

    public static List<TableMetadata> load(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        List<TableMetadata> tables = fromJson(json);
        LOGGER.info("Loaded {} annotated tables from {}", tables.size(), file);
        return tables;
    }

    public static void save(Path file, List<TableMetadata> tables) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(tables), StandardCharsets.UTF_8);
        LOGGER.info("Saved {} annotated tables to {}", tables.size(), file);
    }

    public static List<TableMetadata> fromJson(String json) {
        return fromDocument(AnnotationJson.parseObject(json));
    }

    public static String toJson(List<TableMetadata> tables) {
        return AnnotationJson.toJson(toDocument(tables));
    }

    // ========== READING ==========

    public static List<TableMetadata> fromDocument(Map<String, Object> document) {
        List<TableMetadata> tables = new ArrayList<>();
        for (Map<String, Object> table : AnnotationJson.getObjectList(document, "tables")) {
            tables.add(readTable(table));
        }
        return tables;
    }

    private static TableMetadata readTable(Map<String, Object> node) {
        String schema = orEmpty(AnnotationJson.getString(node, "schema"));
        String table = AnnotationJson.getString(node, "table");
        if (table == null || table.isBlank()) {
            throw new AnnotationParseException("Table entry without a 'table' name");
        }

        List<BusinessKeyGroup> groups = new ArrayList<>();
        for (Map<String, Object> group : AnnotationJson.getObjectList(node, "businessKeyGroups")) {
            groups.add(readBusinessKeyGroup(group));
        }

        List<HashdiffGroup> hashdiffs = new ArrayList<>();
        for (Map<String, Object> hashdiff : AnnotationJson.getObjectList(node, "hashdiffGroups")) {
            hashdiffs.add(readHashdiffGroup(table, hashdiff));
        }

        List<Map<String, Object>> columnNodes = AnnotationJson.getObjectList(node, "columns");
        List<ColumnMetadata> columns = new ArrayList<>(columnNodes.size());
        for (int i = 0; i < columnNodes.size(); i++) {
            columns.add(readColumn(schema, table, i + 1, columnNodes.get(i)));
        }

        return new TableMetadata(schema, table, AnnotationJson.getString(node, "businessConcept"),
                groups, hashdiffs, columns);
    }

    private static BusinessKeyGroup readBusinessKeyGroup(Map<String, Object> node) {
        return new BusinessKeyGroup(
                AnnotationJson.getString(node, "hashkeyName"),
                AnnotationJson.getString(node, "businessConcept"),
                AnnotationJson.getBoolean(node, "isLink"),
                AnnotationJson.getStringList(node, "columns"),
                AnnotationJson.getStringList(node, "linkedHashkeys"));
    }

    private static HashdiffGroup readHashdiffGroup(String table, Map<String, Object> node) {
        String name = AnnotationJson.getString(node, "name");
        if (name == null) {
            throw new AnnotationParseException("Hashdiff group without a name on table " + table);
        }
        String mode = Optional.ofNullable(AnnotationJson.getString(node, "mode")).orElse(MODE_SELECT_ALL);
        HashdiffSelection selection = switch (mode) {
            case MODE_SELECT_ALL -> new HashdiffSelection.SelectAll(
                    AnnotationJson.getStringList(node, "excludedColumns"));
            case MODE_SELECT_EXPLICIT -> new HashdiffSelection.SelectExplicit(
                    AnnotationJson.getStringList(node, "includedColumns"));
            default -> throw new AnnotationParseException(
                    "Unknown hashdiff mode '" + mode + "' on " + table + "." + name);
        };
        return new HashdiffGroup(name,
                AnnotationJson.getString(node, "businessConcept"),
                AnnotationJson.getString(node, "hashkeyName"),
                selection);
    }

    private static ColumnMetadata readColumn(String schema, String table, int position, Map<String, Object> node) {
        String name = AnnotationJson.getString(node, "column");
        if (name == null || name.isBlank()) {
            throw new AnnotationParseException("Column entry without a 'column' name on table " + table);
        }

        String businessKeyGroup = AnnotationJson.getString(node, "businessKeyGroup");
        boolean inGroup = businessKeyGroup != null && !businessKeyGroup.isEmpty();
        boolean recordSource = AnnotationJson.getBoolean(node, "isRecordSource");
        boolean loadDate = AnnotationJson.getBoolean(node, "isLoadDate");

        Set<ColumnRole> roles = EnumSet.noneOf(ColumnRole.class);
        if (inGroup || AnnotationJson.getBoolean(node, "isBusinessKey")) {
            roles.add(ColumnRole.BUSINESS_KEY);
        }
        if (AnnotationJson.getBoolean(node, "isHashkey")) {
            roles.add(ColumnRole.HASHKEY);
        }
        if (AnnotationJson.getBoolean(node, "isHashdiff")) {
            roles.add(ColumnRole.HASHDIFF);
        }
        if (recordSource) {
            roles.add(ColumnRole.RECORD_SOURCE);
        }
        if (loadDate) {
            roles.add(ColumnRole.LOAD_DATE);
        }
        // Payload is implied when the editor did not say otherwise
        boolean payload = node.containsKey("isPayload")
                ? AnnotationJson.getBoolean(node, "isPayload")
                : !inGroup && !recordSource && !loadDate;
        if (payload) {
            roles.add(ColumnRole.PAYLOAD);
        }

        Integer ordinal = AnnotationJson.getInt(node, "ordinalPosition");
        Object nullable = node.get("nullable");
        return new ColumnMetadata(
                schema,
                table,
                name,
                ordinal != null ? ordinal : position,
                AnnotationJson.getString(node, "type"),
                !(nullable instanceof Boolean b) || b,
                AnnotationJson.getInt(node, "order"),
                roles);
    }

    // ========== WRITING ==========

    public static Map<String, Object> toDocument(List<TableMetadata> tables) {
        List<Object> tableNodes = new ArrayList<>(tables.size());
        for (TableMetadata table : tables) {
            tableNodes.add(writeTable(table));
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("tables", tableNodes);
        return document;
    }

    private static Map<String, Object> writeTable(TableMetadata table) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("schema", table.schema());
        node.put("table", table.table());
        node.put("businessConcept", table.businessConcept());

        List<Object> groups = new ArrayList<>();
        for (BusinessKeyGroup group : table.businessKeyGroups()) {
            Map<String, Object> groupNode = new LinkedHashMap<>();
            groupNode.put("hashkeyName", group.hashkeyName());
            groupNode.put("businessConcept", group.businessConcept());
            groupNode.put("isLink", group.link());
            groupNode.put("columns", new ArrayList<Object>(group.columns()));
            groupNode.put("linkedHashkeys", new ArrayList<Object>(group.referencedHashkeys()));
            groups.add(groupNode);
        }
        node.put("businessKeyGroups", groups);

        List<Object> hashdiffs = new ArrayList<>();
        for (HashdiffGroup hashdiff : table.hashdiffGroups()) {
            Map<String, Object> hashdiffNode = new LinkedHashMap<>();
            hashdiffNode.put("name", hashdiff.name());
            hashdiffNode.put("businessConcept", hashdiff.businessConcept());
            hashdiffNode.put("hashkeyName", hashdiff.hashkeyName());
            hashdiffNode.put("mode", hashdiff.selection().mode());
            if (hashdiff.selection() instanceof HashdiffSelection.SelectAll selectAll) {
                hashdiffNode.put("excludedColumns", new ArrayList<Object>(selectAll.excludedColumns()));
            } else if (hashdiff.selection() instanceof HashdiffSelection.SelectExplicit selectExplicit) {
                hashdiffNode.put("includedColumns", new ArrayList<Object>(selectExplicit.includedColumns()));
            }
            hashdiffs.add(hashdiffNode);
        }
        node.put("hashdiffGroups", hashdiffs);

        List<Object> columns = new ArrayList<>();
        for (ColumnMetadata column : table.columns()) {
            Map<String, Object> columnNode = new LinkedHashMap<>();
            columnNode.put("column", column.name());
            columnNode.put("order", column.order());
            columnNode.put("ordinalPosition", column.ordinalPosition());
            columnNode.put("type", column.dataType());
            columnNode.put("nullable", column.nullable());
            columnNode.put("businessKeyGroup", owningGroupName(table, column).orElse(null));
            columnNode.put("isBusinessKey", column.hasRole(ColumnRole.BUSINESS_KEY));
            columnNode.put("isRecordSource", column.hasRole(ColumnRole.RECORD_SOURCE));
            columnNode.put("isLoadDate", column.hasRole(ColumnRole.LOAD_DATE));
            columnNode.put("isHashkey", column.hasRole(ColumnRole.HASHKEY));
            columnNode.put("isHashdiff", column.hasRole(ColumnRole.HASHDIFF));
            columnNode.put("isPayload", column.hasRole(ColumnRole.PAYLOAD));
            columns.add(columnNode);
        }
        node.put("columns", columns);
        return node;
    }

    private static Optional<String> owningGroupName(TableMetadata table, ColumnMetadata column) {
        return table.hubGroups().stream()
                .filter(BusinessKeyGroup::hasHashkeyName)
                .filter(g -> g.columns().contains(column.name()))
                .map(BusinessKeyGroup::hashkeyName)
                .findFirst();
    }

    // ========== MERGING ==========

    /**
     * Overlays a saved annotation on a freshly introspected schema.
     *
     * Physical facts (ordinal position, type, nullability) come from the
     * introspected columns; concepts, groups, roles and stored order come from
     * the annotation. Annotated tables no longer present in the schema are kept
     * after the introspected ones.
     */
    public static List<TableMetadata> overlay(List<TableMetadata> introspected, List<TableMetadata> annotated) {
        Map<String, TableMetadata> annotatedByName = new LinkedHashMap<>();
        for (TableMetadata table : annotated) {
            annotatedByName.put(table.qualifiedName(), table);
        }

        List<TableMetadata> merged = new ArrayList<>(introspected.size());
        for (TableMetadata schemaTable : introspected) {
            TableMetadata annotation = annotatedByName.remove(schemaTable.qualifiedName());
            if (annotation == null) {
                merged.add(schemaTable);
                continue;
            }
            List<ColumnMetadata> columns = new ArrayList<>(schemaTable.columns().size());
            for (ColumnMetadata column : schemaTable.columns()) {
                columns.add(annotation.findColumn(column.name())
                        .map(a -> new ColumnMetadata(column.schema(), column.table(), column.name(),
                                column.ordinalPosition(), column.dataType(), column.nullable(),
                                a.order(), a.roles()))
                        .orElse(column));
            }
            merged.add(new TableMetadata(schemaTable.schema(), schemaTable.table(), annotation.businessConcept(),
                    annotation.businessKeyGroups(), annotation.hashdiffGroups(), columns));
        }
        if (!annotatedByName.isEmpty()) {
            LOGGER.warn("Annotated tables not found in schema: {}", annotatedByName.keySet());
            merged.addAll(annotatedByName.values());
        }
        return merged;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
