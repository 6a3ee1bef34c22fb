package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;
import lombok.With;

import java.util.Objects;

/**
 * Identifies a physical table. The fully-qualified id is {@code project.dataset.table[@location]}.
 * Derived references (e.g. the sample target) are made with the {@code with*} methods.
 */
@Value
@With
public class TableReference implements Patchable<TableReference> {

    String projectId;
    String datasetId;
    String tableId;
    String location;

    public TableReference(String projectId, String datasetId, String tableId, String location) {
        this.projectId = requireNonBlank(projectId, "project_id");
        this.datasetId = requireNonBlank(datasetId, "dataset_id");
        this.tableId = requireNonBlank(tableId, "table_id");
        this.location = location == null || location.isBlank() ? null : location.trim();
    }

    public static TableReference of(String projectId, String datasetId, String tableId) {
        return new TableReference(projectId, datasetId, tableId, null);
    }

    /**
     * Parses {@code project.dataset.table} with an optional {@code @location} suffix.
     */
    public static TableReference parse(String fqnId) {
        if (fqnId == null) {
            throw new IllegalArgumentException("Table id cannot be null");
        }
        String location = null;
        String ids = fqnId.trim();
        int at = ids.indexOf('@');
        if (at >= 0) {
            location = ids.substring(at + 1);
            ids = ids.substring(0, at);
        }
        String[] parts = ids.split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                    "Table id must have the form project.dataset.table[@location], got: " + fqnId);
        }
        return new TableReference(parts[0], parts[1], parts[2], location);
    }

    public String fqnId(boolean withLocation) {
        String id = projectId + "." + datasetId + "." + tableId;
        return withLocation && location != null ? id + "@" + location : id;
    }

    public String datasetFqnId() {
        return projectId + "." + datasetId;
    }

    /**
     * Same table, where an absent location on either side matches any location.
     */
    public boolean refersToSameTable(TableReference other) {
        if (other == null) {
            return false;
        }
        boolean sameIds = projectId.equals(other.projectId)
                && datasetId.equals(other.datasetId)
                && tableId.equals(other.tableId);
        return sameIds && (location == null || other.location == null
                || Objects.equals(location, other.location));
    }

    /**
     * Never empty: all ids are mandatory.
     */
    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public TableReference patchWith(TableReference fallback) {
        return Patchable.substitute(this, fallback);
    }

    public static TableReference fromJson(JsonNode node) {
        JsonFields.requireObject(node, TableReference.class);
        return new TableReference(
                JsonFields.text(node, "project_id"),
                JsonFields.text(node, "dataset_id"),
                JsonFields.text(node, "table_id"),
                JsonFields.text(node, "location"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("project_id", projectId);
        node.put("dataset_id", datasetId);
        node.put("table_id", tableId);
        JsonFields.putIfPresent(node, "location", location);
        return node;
    }

    @Override
    public String toString() {
        return fqnId(true);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Table reference field '" + field + "' must be a non-empty string");
        }
        return value.trim();
    }
}
