package com.di.bqsampler.util;

import com.di.bqsampler.entity.TableReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator utility class.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Column Name Validation Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"id", "user_name", "created_at", "_private", "order_date", "Col9"})
    @DisplayName("Should validate correct column names")
    void testValidateColumnName_ValidNames(String column) {
        assertEquals(column, InputValidator.validateColumnName(column));
    }

    @Test
    @DisplayName("Should trim column names")
    void testValidateColumnName_Trimmed() {
        assertEquals("id", InputValidator.validateColumnName("  id "));
    }

    @Test
    @DisplayName("Should reject null and empty column names")
    void testValidateColumnName_NullOrEmpty() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateColumnName(null));
        assertTrue(ex.getMessage().contains("cannot be null"));

        ex = assertThrows(IllegalArgumentException.class, () -> InputValidator.validateColumnName("   "));
        assertTrue(ex.getMessage().contains("cannot be empty"));
    }

    @Test
    @DisplayName("Should reject column names with SQL injection patterns")
    void testValidateColumnName_SqlInjection() {
        String[] sqlInjectionPatterns = {
            "id; DROP TABLE users--",
            "id' OR '1'='1",
            "id UNION SELECT",
            "id/*comment*/",
            "id`",
            "id DESC"
        };

        for (String pattern : sqlInjectionPatterns) {
            assertThrows(IllegalArgumentException.class, () -> InputValidator.validateColumnName(pattern),
                    pattern);
        }
    }

    @Test
    @DisplayName("Should reject column names starting with a digit")
    void testValidateColumnName_LeadingDigit() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateColumnName("1st"));
        assertTrue(ex.getMessage().contains("Invalid Column name format"));
    }

    // ============================================================================
    // Table Reference Validation Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {
            "my-project.sales.orders",
            "my-project.sales_2024.order items",
            "my-project.sales.bestellungen-ä"
    })
    @DisplayName("Should accept valid BigQuery table ids")
    void testValidateTableReference_Valid(String fqn) {
        assertDoesNotThrow(() -> InputValidator.validateTableReference(TableReference.parse(fqn)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "data-and-analytics.sales.orders",
            "sales-or-returns.sales.orders",
            "create-prod.sales.orders",
            "my-project.sales.drop-list",
            "my-project.sales.select and insert"
    })
    @DisplayName("Should accept ids containing SQL keywords between hyphens or spaces")
    void testValidateTableReference_KeywordsInIds(String fqn) {
        TableReference table = TableReference.parse(fqn);
        assertSame(table, InputValidator.validateTableReference(table));
    }

    @Test
    @DisplayName("Should reject invalid BigQuery table ids")
    void testValidateTableReference_Invalid() {
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableReference(TableReference.of("My_Project", "sales", "orders")));
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableReference(TableReference.of("my-project", "sales-eu", "orders")));
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableReference(TableReference.of("my-project", "sales", "orders`x")));
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateTableReference(null));
    }

    // ============================================================================
    // Numeric Input Validation Tests
    // ============================================================================

    @Test
    @DisplayName("Should validate amounts")
    void testValidateAmount() {
        assertEquals(0L, InputValidator.validateAmount(0L));
        assertEquals(1000L, InputValidator.validateAmount(1000L));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateAmount(null));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateAmount(-1L));
        assertTrue(ex.getMessage().contains("greater or equal 0"));
    }

    // ============================================================================
    // Name Normalisation Tests
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "trips_europe-west3_temp, trips_europe_west3_temp",
            "sales_US_temp, sales_US_temp",
            "a.b c, a_b_c"
    })
    @DisplayName("Should replace non-word characters in generated names")
    void testBigQueryValidName(String raw, String expected) {
        assertEquals(expected, InputValidator.bigQueryValidName(raw));
    }

    @Test
    @DisplayName("Should truncate generated names")
    void testBigQueryValidName_Truncated() {
        assertEquals(InputValidator.MAX_RESOURCE_NAME_LENGTH,
                InputValidator.bigQueryValidName("x".repeat(2000)).length());
    }

    @Test
    @DisplayName("Should normalise label values")
    void testLabelValue() {
        assertEquals("europe-west3", InputValidator.labelValue("europe-west3"));
        assertEquals("example_com_my-project", InputValidator.labelValue("example.com:My-Project"));
        assertEquals("", InputValidator.labelValue(null));
        assertEquals(InputValidator.MAX_LABEL_LENGTH, InputValidator.labelValue("a".repeat(100)).length());
    }
}
