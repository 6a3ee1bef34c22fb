package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Column and direction for a sorted sample, e.g. {@code {"by": "created_at", "direction": "DESC"}}.
 */
@Value
public class SortProperties {

    String by;
    SortDirection direction;

    public SortProperties(String by, SortDirection direction) {
        if (by == null || by.trim().isEmpty()) {
            throw new IllegalArgumentException("Sort column 'by' must be a non-empty string");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Sort direction is required");
        }
        this.by = by.trim();
        this.direction = direction;
    }

    public static SortProperties fromJson(JsonNode node) {
        JsonFields.requireObject(node, SortProperties.class);
        return new SortProperties(
                JsonFields.text(node, "by"),
                SortDirection.from(JsonFields.text(node, "direction")));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("by", by);
        node.put("direction", direction.name());
        return node;
    }
}
