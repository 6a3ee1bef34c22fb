package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Sampling method. {@code properties} is required for {@link SortType#SORTED} and is
 * dropped for {@link SortType#RANDOM}. When only properties are given the type
 * defaults to {@link SortType#defaultType()}.
 */
@Value
public class SampleSpec implements Patchable<SampleSpec> {

    public static final SampleSpec EMPTY = new SampleSpec(null, null);

    SortType type;
    SortProperties properties;

    public SampleSpec(SortType type, SortProperties properties) {
        if (type == null && properties == null) {
            this.type = null;
            this.properties = null;
            return;
        }
        SortType resolved = type != null ? type : SortType.defaultType();
        if (resolved == SortType.SORTED && properties == null) {
            throw new IllegalArgumentException("Sample spec of type 'sorted' requires properties");
        }
        this.type = resolved;
        this.properties = resolved == SortType.SORTED ? properties : null;
    }

    public static SampleSpec random() {
        return new SampleSpec(SortType.RANDOM, null);
    }

    public static SampleSpec sorted(String by, SortDirection direction) {
        return new SampleSpec(SortType.SORTED, new SortProperties(by, direction));
    }

    /**
     * @return the declared type, or the default type for an empty spec
     */
    public SortType effectiveType() {
        return type != null ? type : SortType.defaultType();
    }

    @Override
    public boolean isEmpty() {
        return type == null && properties == null;
    }

    @Override
    public SampleSpec patchWith(SampleSpec fallback) {
        return Patchable.substitute(this, fallback);
    }

    public static SampleSpec fromJson(JsonNode node) {
        JsonFields.requireObject(node, SampleSpec.class);
        String type = JsonFields.text(node, "type");
        return new SampleSpec(
                type != null ? SortType.from(type) : null,
                JsonFields.nested(node, "properties", SortProperties::fromJson, SampleSpec.class));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        if (type != null) {
            node.put("type", type.getValue());
        }
        if (properties != null) {
            node.set("properties", properties.toJson());
        }
        return node;
    }
}
