package com.di.bqsampler.query;

import com.di.bqsampler.entity.TableReference;
import lombok.Builder;
import lombok.Value;

/**
 * Physical facts about a table needed to choose a sampling statement.
 */
@Value
@Builder
public class TableMetadata {

    TableReference table;

    /** Row count from table metadata; zero for views. */
    long numRows;

    /** True when the table is a (materialised or logical) view. */
    boolean view;
}
