package org.vaultprep.engine.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Annotated tables shared by the compiler and export tests.
 *
 * <pre>
 * crm.stg_customer  hub hk_customer_h [customer_id], hashdiff hd_customer_details_sat (select_all)
 * crm.stg_order     hub hk_order_h [order_id], link lk_customer_order -> [hk_customer_h, hk_order_h]
 * </pre>
 */
public final class TableFixtures {

    public static final String SCHEMA = "crm";

    private TableFixtures() {
    }

    public static ColumnMetadata column(String table, String name, int ordinal, ColumnRole... roles) {
        return new ColumnMetadata(SCHEMA, table, name, ordinal, "VARCHAR", true, null, Set.of(roles));
    }

    public static ColumnMetadata orderedColumn(String table, String name, int ordinal, int order,
            ColumnRole... roles) {
        return new ColumnMetadata(SCHEMA, table, name, ordinal, "VARCHAR", true, order, Set.of(roles));
    }

    /**
     * Plain columns named in table order, ordinals starting at 1.
     */
    public static List<ColumnMetadata> columns(String table, String... names) {
        List<ColumnMetadata> columns = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            columns.add(column(table, names[i], i + 1));
        }
        return columns;
    }

    public static TableMetadata table(String table, String concept, List<BusinessKeyGroup> groups,
            List<HashdiffGroup> hashdiffs, List<ColumnMetadata> columns) {
        return new TableMetadata(SCHEMA, table, concept, groups, hashdiffs, columns);
    }

    public static TableMetadata customer() {
        return table("stg_customer", "Customer",
                List.of(BusinessKeyGroup.hub("hk_customer_h", "Customer", List.of("customer_id"))),
                List.of(HashdiffGroup.selectAll("hd_customer_details_sat", "Customer", null, List.of("country"))),
                List.of(
                        column("stg_customer", "customer_id", 1, ColumnRole.BUSINESS_KEY),
                        column("stg_customer", "email", 2, ColumnRole.PAYLOAD),
                        column("stg_customer", "name", 3, ColumnRole.PAYLOAD),
                        column("stg_customer", "country", 4, ColumnRole.PAYLOAD),
                        column("stg_customer", "rsrc", 5, ColumnRole.RECORD_SOURCE),
                        column("stg_customer", "load_dts", 6, ColumnRole.LOAD_DATE)));
    }

    public static TableMetadata order() {
        return table("stg_order", "Order",
                List.of(
                        BusinessKeyGroup.hub("hk_order_h", "Order", List.of("order_id")),
                        BusinessKeyGroup.link("lk_customer_order", List.of("hk_customer_h", "hk_order_h"))),
                List.of(),
                List.of(
                        column("stg_order", "order_id", 1, ColumnRole.BUSINESS_KEY),
                        column("stg_order", "customer_id", 2),
                        column("stg_order", "amount", 3, ColumnRole.PAYLOAD)));
    }

    public static List<TableMetadata> customerAndOrder() {
        return Arrays.asList(customer(), order());
    }
}
