package com.di.bqsampler.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableReference Tests")
class TableReferenceTest {

    @Test
    @DisplayName("Should parse a fully-qualified id with location")
    void testParse_WithLocation() {
        TableReference table = TableReference.parse("my-project.sales.orders@europe-west3");
        assertEquals("my-project", table.getProjectId());
        assertEquals("sales", table.getDatasetId());
        assertEquals("orders", table.getTableId());
        assertEquals("europe-west3", table.getLocation());
        assertEquals("my-project.sales.orders", table.fqnId(false));
        assertEquals("my-project.sales.orders@europe-west3", table.toString());
    }

    @Test
    @DisplayName("Should reject ids without three parts")
    void testParse_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> TableReference.parse("sales.orders"));
        assertThrows(IllegalArgumentException.class, () -> TableReference.of("p", " ", "t"));
    }

    @Test
    @DisplayName("Should match tables when either location is unknown")
    void testRefersToSameTable() {
        TableReference located = TableReference.parse("p.d.t@EU");
        assertTrue(located.refersToSameTable(TableReference.of("p", "d", "t")));
        assertFalse(located.refersToSameTable(TableReference.parse("p.d.t@US")));
        assertFalse(located.refersToSameTable(TableReference.parse("p.d.other@EU")));
    }

    @Test
    @DisplayName("Should derive the sample target with the with-methods")
    void testWith_Target() {
        TableReference target = TableReference.parse("src.d.t@US").withProjectId("tgt").withLocation("EU");
        assertEquals("tgt.d.t@EU", target.toString());
    }

    @Test
    @DisplayName("Should use snake_case keys in JSON")
    void testToJson() {
        TableReference table = TableReference.parse("p.d.t@EU");
        assertEquals("{\"project_id\":\"p\",\"dataset_id\":\"d\",\"table_id\":\"t\",\"location\":\"EU\"}",
                table.toJson().toString());
        assertEquals(table, TableReference.fromJson(table.toJson()));
    }

    @Test
    @DisplayName("Should reject a compliance check across different tables")
    void testTablePolicy_Mismatch() {
        TablePolicy policy = new TablePolicy(TableReference.of("p", "d", "a"), Policy.FALLBACK_GENERIC_POLICY);
        TableSample other = new TableSample(TableReference.of("p", "d", "b"), Sample.EMPTY);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> policy.compliantSample(other, 10));
        assertTrue(ex.getMessage().contains("Policy only applicable to table p.d.a"));
    }
}
