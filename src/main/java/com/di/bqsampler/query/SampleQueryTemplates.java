package com.di.bqsampler.query;

import com.di.bqsampler.entity.SortDirection;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.util.InputValidator;

/**
 * Renders the sampling statements. Every interpolated value is validated first.
 */
public final class SampleQueryTemplates {

    private static final String INSERT_RANDOM_SAMPLE =
            "INSERT INTO `%s`\nSELECT * FROM `%s`\nTABLESAMPLE SYSTEM (%d PERCENT)\nLIMIT %d";

    private static final String INSERT_SORTED_SAMPLE =
            "INSERT INTO `%s`\nSELECT * FROM `%s`\nORDER BY %s %s\nLIMIT %d";

    // TABLESAMPLE is not supported on views
    private static final String INSERT_VIEW_RANDOM_SAMPLE =
            "INSERT INTO `%s`\nSELECT * FROM `%s`\nORDER BY RAND()\nLIMIT %d";

    private SampleQueryTemplates() {}

    public static String insertRandomSample(TableReference source, TableReference target, int percent, long amount) {
        if (percent < 1 || percent > 100) {
            throw new IllegalArgumentException("TABLESAMPLE percent must be in [1, 100], got: " + percent);
        }
        return String.format(INSERT_RANDOM_SAMPLE, fqn(target), fqn(source), percent,
                InputValidator.validateAmount(amount));
    }

    public static String insertSortedSample(TableReference source, TableReference target,
                                            String column, SortDirection direction, long amount) {
        if (direction == null) {
            throw new IllegalArgumentException("Sort direction cannot be null");
        }
        return String.format(INSERT_SORTED_SAMPLE, fqn(target), fqn(source),
                InputValidator.validateColumnName(column), direction.name(),
                InputValidator.validateAmount(amount));
    }

    public static String insertViewRandomSample(TableReference source, TableReference target, long amount) {
        return String.format(INSERT_VIEW_RANDOM_SAMPLE, fqn(target), fqn(source),
                InputValidator.validateAmount(amount));
    }

    /**
     * {@code ceil(amount / rows * 100)} clamped to {@code [1, 100]}.
     */
    public static int tableSamplePercent(long amount, long numRows) {
        if (numRows <= 0) {
            throw new IllegalArgumentException("Table row count must be greater than 0, got: " + numRows);
        }
        long percent = (long) Math.ceil(amount / (double) numRows * 100.0);
        return (int) Math.min(100L, Math.max(1L, percent));
    }

    private static String fqn(TableReference table) {
        return InputValidator.validateTableReference(table).fqnId(false);
    }
}
