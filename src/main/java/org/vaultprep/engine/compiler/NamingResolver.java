package org.vaultprep.engine.compiler;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives canonical Data Vault identifiers from raw schema and table names.
 *
 * Convention:
 * - Hub: {@code {concept}_h}, or first token of the prefix-stripped table name + {@code _h}
 * - Hub identifier: {@code H_} + hub name
 * - Source identifier: {@code {SYSTEM}_{OBJECT}_{table}}
 */
public final class NamingResolver {

    private static final Pattern STAGING_PREFIX = Pattern.compile("^(stg_|rv_|hub_)", Pattern.CASE_INSENSITIVE);
    private static final String DEFAULT = "DEFAULT";

    private NamingResolver() {
    }

    /**
     * stg_product_master -> product_h; (anything, Customer) -> customer_h
     */
    public static String hubName(String tableName, String businessConcept) {
        if (businessConcept != null && !businessConcept.isBlank()) {
            return businessConcept.toLowerCase(Locale.ROOT) + "_h";
        }
        String cleaned = STAGING_PREFIX.matcher(tableName).replaceFirst("");
        String base = firstToken(cleaned);
        return (base.isEmpty() ? cleaned : base) + "_h";
    }

    public static String hubIdentifier(String hubName) {
        return "H_" + hubName;
    }

    public static String defaultHashkey(String hubName) {
        return "hk_" + hubName;
    }

    public static String linkIdentifier(String linkName) {
        return "L_" + linkName;
    }

    public static String satelliteIdentifier(String satelliteBase) {
        return "S_" + satelliteBase;
    }

    public static String sourceSystem(String schema) {
        return upperOrDefault(schema);
    }

    public static String sourceObject(String tableName) {
        return upperOrDefault(firstToken(tableName));
    }

    public static String groupName(String schema) {
        return upperOrDefault(schema);
    }

    /**
     * Foreign key tying every emitted row back to its originating table.
     */
    public static String sourceIdentifier(String schema, String tableName) {
        return sourceSystem(schema) + "_" + sourceObject(tableName) + "_" + tableName;
    }

    /**
     * hk_customer_h -> customer
     */
    public static String hubBaseOfHashkey(String hashkey) {
        return stripSuffix(stripPrefix(hashkey, "hk_"), "_h");
    }

    /**
     * hd_customer_details_sat -> customer_details
     */
    public static String satelliteBaseOfHashdiff(String hashdiffName) {
        return stripSuffix(stripPrefix(hashdiffName, "hd_"), "_sat");
    }

    static String stripPrefix(String value, String prefix) {
        return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
    }

    static String stripSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }

    private static String firstToken(String value) {
        int underscore = value.indexOf('_');
        return underscore < 0 ? value : value.substring(0, underscore);
    }

    private static String upperOrDefault(String value) {
        if (value == null || value.isEmpty()) {
            return DEFAULT;
        }
        return value.toUpperCase(Locale.ROOT);
    }
}
