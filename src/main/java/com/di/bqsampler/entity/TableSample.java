package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * A {@link Sample} bound to a table.
 */
@Value
public class TableSample implements Patchable<TableSample> {

    TableReference tableReference;
    Sample sample;

    public TableSample(TableReference tableReference, Sample sample) {
        if (tableReference == null) {
            throw new IllegalArgumentException("Table sample requires a table reference");
        }
        if (sample == null) {
            throw new IllegalArgumentException("Table sample requires a sample");
        }
        this.tableReference = tableReference;
        this.sample = sample;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public TableSample patchWith(TableSample fallback) {
        return Patchable.substitute(this, fallback);
    }

    public static TableSample fromJson(JsonNode node) {
        JsonFields.requireObject(node, TableSample.class);
        return new TableSample(
                JsonFields.required(node, "table_reference", TableReference::fromJson, TableSample.class),
                JsonFields.required(node, "sample", Sample::fromJson, TableSample.class));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("table_reference", tableReference.toJson());
        node.set("sample", sample.toJson());
        return node;
    }
}
