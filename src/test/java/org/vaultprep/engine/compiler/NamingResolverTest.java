package org.vaultprep.engine.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NamingResolverTest {

    @Nested
    @DisplayName("Hub names")
    class HubNames {

        @Test
        @DisplayName("Staging prefix is stripped and the first token kept")
        void testHubNameFromStagingTable() {
            assertEquals("product_h", NamingResolver.hubName("stg_product_master", null));
        }

        @Test
        @DisplayName("Business concept wins over the table name")
        void testHubNameFromConcept() {
            assertEquals("customer_h", NamingResolver.hubName("anything", "Customer"));
        }

        @Test
        void testPrefixesAreCaseInsensitive() {
            assertAll(
                    () -> assertEquals("account_h", NamingResolver.hubName("RV_account_detail", null)),
                    () -> assertEquals("store_h", NamingResolver.hubName("Hub_store", null)),
                    () -> assertEquals("orders_h", NamingResolver.hubName("orders", null)));
        }

        @Test
        void testOnlyOnePrefixIsStripped() {
            assertEquals("hub_h", NamingResolver.hubName("stg_hub_customer", null));
        }

        @Test
        void testBlankConceptFallsBackToTable() {
            assertEquals("product_h", NamingResolver.hubName("stg_product", "  "));
        }

        @Test
        void testLeadingUnderscoreKeepsWholeName() {
            assertEquals("_tmp_h", NamingResolver.hubName("_tmp", null));
        }
    }

    @Nested
    @DisplayName("Source identity")
    class SourceIdentity {

        @Test
        void testSourceIdentifier() {
            assertEquals("CRM_STG_stg_customer", NamingResolver.sourceIdentifier("crm", "stg_customer"));
        }

        @Test
        void testEmptySchemaUsesDefault() {
            assertAll(
                    () -> assertEquals("DEFAULT", NamingResolver.sourceSystem("")),
                    () -> assertEquals("DEFAULT", NamingResolver.groupName("")),
                    () -> assertEquals("DEFAULT_ORDERS_orders", NamingResolver.sourceIdentifier("", "orders")));
        }

        @Test
        void testSourceObjectIsFirstToken() {
            assertEquals("SALES", NamingResolver.sourceObject("sales_order_line"));
        }
    }

    @Test
    @DisplayName("Hashkey and hashdiff names strip to their base")
    void testBaseNames() {
        assertAll(
                () -> assertEquals("customer", NamingResolver.hubBaseOfHashkey("hk_customer_h")),
                () -> assertEquals("customer", NamingResolver.hubBaseOfHashkey("customer")),
                () -> assertEquals("customer_details", NamingResolver.satelliteBaseOfHashdiff("hd_customer_details_sat")),
                () -> assertEquals("details", NamingResolver.satelliteBaseOfHashdiff("details")));
    }

    @Test
    void testIdentifiers() {
        assertAll(
                () -> assertEquals("H_customer_h", NamingResolver.hubIdentifier("customer_h")),
                () -> assertEquals("hk_customer_h", NamingResolver.defaultHashkey("customer_h")),
                () -> assertEquals("L_lk_order", NamingResolver.linkIdentifier("lk_order")),
                () -> assertEquals("S_details", NamingResolver.satelliteIdentifier("details")));
    }
}
