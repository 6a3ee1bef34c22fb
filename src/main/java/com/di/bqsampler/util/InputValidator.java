package com.di.bqsampler.util;

import com.di.bqsampler.entity.TableReference;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input validation utility for everything interpolated into BigQuery statements.
 * Prevents SQL injection and normalises generated resource names.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // BigQuery Identifier Validation Patterns
    // ============================================================================

    /**
     * Valid BigQuery column name:
     * - Starts with letter or underscore
     * - Followed by letters, digits or underscores
     * - Max length: 300 characters
     */
    private static final Pattern VALID_COLUMN_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_]{0,299}$"
    );

    /**
     * Project ids, including domain-scoped ones ({@code example.com:my-project}).
     */
    private static final Pattern VALID_PROJECT_PATTERN = Pattern.compile(
            "^[a-z0-9][a-z0-9.:-]{1,127}$"
    );

    private static final Pattern VALID_DATASET_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9_]{1,1024}$"
    );

    /**
     * Table names: letters, marks, numbers, connectors, dashes and spaces.
     */
    private static final Pattern VALID_TABLE_PATTERN = Pattern.compile(
            "^[\\p{L}\\p{M}\\p{N}\\p{Pc}\\p{Pd} ]{1,1024}$"
    );

    /**
     * Pattern to detect potentially dangerous SQL injection attempts:
     * - SQL keywords as whole words (SELECT, INSERT, UNION, etc.)
     * - SQL comments (--, /*)
     * - Semicolons, quotes and backticks
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|MERGE|EXEC|EXECUTE|UNION|OR|AND)\\b"
                    + "|--|/\\*|\\*/|;|'|\"|`)"
    );

    private static final Pattern NON_WORD_PATTERN = Pattern.compile("\\W");
    private static final Pattern INVALID_LABEL_CHARS_PATTERN = Pattern.compile("[^a-z0-9_-]");

    /**
     * Maximum length for dataset ids and table ids.
     */
    public static final int MAX_RESOURCE_NAME_LENGTH = 1024;

    /**
     * Maximum length for label keys and values.
     */
    public static final int MAX_LABEL_LENGTH = 63;

    // ============================================================================
    // Identifier Validation
    // ============================================================================

    /**
     * Validates a column name used in an ORDER BY clause.
     *
     * @param columnName The column name to validate
     * @return The validated column name (trimmed)
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateColumnName(String columnName) {
        String trimmed = requireText(columnName, "Column name");
        rejectSqlPatterns(trimmed, "Column name");
        if (!VALID_COLUMN_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid Column name format: '%s'. " +
                            "Must start with a letter or underscore, followed by letters, digits or underscores, " +
                            "at most 300 characters.", trimmed));
        }
        return trimmed;
    }

    /**
     * Validates every id of a table reference before it is interpolated as {@code `p.d.t`}.
     * Ids are checked against their BigQuery naming rules only; none of the patterns admits
     * a backtick, and keywords such as {@code and} are legal inside hyphenated ids.
     *
     * @param table The table to validate
     * @return The same table
     * @throws IllegalArgumentException if validation fails
     */
    public static TableReference validateTableReference(TableReference table) {
        if (table == null) {
            throw new IllegalArgumentException("Table reference cannot be null");
        }
        validateAgainst(table.getProjectId(), VALID_PROJECT_PATTERN, "Project id");
        validateAgainst(table.getDatasetId(), VALID_DATASET_PATTERN, "Dataset id");
        validateAgainst(table.getTableId(), VALID_TABLE_PATTERN, "Table id");
        return table;
    }

    /**
     * Validates a row amount used in a LIMIT clause.
     *
     * @param amount The amount to validate
     * @return The validated amount
     * @throws IllegalArgumentException if validation fails
     */
    public static long validateAmount(Long amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (amount < 0) {
            throw new IllegalArgumentException(
                    String.format("Amount must be greater or equal 0, got: %d", amount));
        }
        return amount;
    }

    // ============================================================================
    // Name Normalisation
    // ============================================================================

    /**
     * Replaces every non-word character with {@code _} and truncates to
     * {@link #MAX_RESOURCE_NAME_LENGTH}, e.g. {@code trips_europe-west3} becomes
     * {@code trips_europe_west3}.
     *
     * @param value The raw name
     * @return A valid dataset/table name
     */
    public static String bigQueryValidName(String value) {
        String result = NON_WORD_PATTERN.matcher(requireText(value, "Name")).replaceAll("_");
        return result.length() > MAX_RESOURCE_NAME_LENGTH ? result.substring(0, MAX_RESOURCE_NAME_LENGTH) : result;
    }

    /**
     * Lower-cases and replaces characters not allowed in label values.
     *
     * @param value The raw value (null yields an empty label value)
     * @return A valid label value
     */
    public static String labelValue(String value) {
        if (value == null) {
            return "";
        }
        String result = INVALID_LABEL_CHARS_PATTERN.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        return result.length() > MAX_LABEL_LENGTH ? result.substring(0, MAX_LABEL_LENGTH) : result;
    }

    // ============================================================================
    // Utility Methods
    // ============================================================================

    private static String requireText(String value, String identifierType) {
        if (value == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        return trimmed;
    }

    private static void validateAgainst(String value, Pattern pattern, String identifierType) {
        String trimmed = requireText(value, identifierType);
        if (!pattern.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'", identifierType, trimmed));
        }
    }

    private static void rejectSqlPatterns(String value, String identifierType) {
        if (SQL_INJECTION_PATTERN.matcher(value).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, value);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns.", identifierType));
        }
    }
}
