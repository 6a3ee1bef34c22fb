package com.di.bqsampler.entity;

import lombok.Value;

/**
 * A resolved {@link Policy} scoped to one table.
 */
@Value
public class TablePolicy {

    TableReference tableReference;
    Policy policy;

    public TablePolicy(TableReference tableReference, Policy policy) {
        if (tableReference == null) {
            throw new IllegalArgumentException("Table policy requires a table reference");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Table policy requires a policy");
        }
        this.tableReference = tableReference;
        this.policy = policy;
    }

    /**
     * @throws IllegalArgumentException if the sample targets another table
     */
    public TableSample compliantSample(TableSample tableSample, long rowCount) {
        if (tableSample == null) {
            throw new IllegalArgumentException("Table sample cannot be null");
        }
        if (!tableReference.refersToSameTable(tableSample.getTableReference())) {
            throw new IllegalArgumentException(String.format(
                    "Policy only applicable to table %s and sample is for table %s",
                    tableReference, tableSample.getTableReference()));
        }
        return new TableSample(
                tableSample.getTableReference(),
                policy.compliantSample(tableSample.getSample(), rowCount));
    }
}
