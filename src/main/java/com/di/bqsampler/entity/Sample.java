package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * A sampling intent, independent of any table.
 *
 * <pre>
 * {"size": {"count": 123, "percentage": 19.2},
 *  "spec": {"type": "sorted", "properties": {"by": "my_column", "direction": "DESC"}}}
 * </pre>
 *
 * A sample request either replaces the default sample of its policy entirely or defers to
 * it entirely, so {@link #patchWith} substitutes. {@link #fillFrom} is the field-level
 * variant used only while one policy is merged into another.
 */
@Value
public class Sample implements Patchable<Sample> {

    public static final Sample EMPTY = new Sample(null, null);

    SizeSpec size;
    SampleSpec spec;

    public Sample(SizeSpec size, SampleSpec spec) {
        this.size = size;
        this.spec = spec;
    }

    @Override
    public boolean isEmpty() {
        return size == null && spec == null;
    }

    @Override
    public Sample patchWith(Sample fallback) {
        return Patchable.substitute(this, fallback);
    }

    /**
     * Field-level fill: absent fields come from {@code fallback}, present ones are
     * patched with the fallback's counterpart.
     */
    public Sample fillFrom(Sample fallback) {
        if (fallback == null) {
            return this;
        }
        SizeSpec mergedSize = size == null ? fallback.size : size.patchWith(fallback.size);
        SampleSpec mergedSpec = spec == null ? fallback.spec : spec.patchWith(fallback.spec);
        return new Sample(mergedSize, mergedSpec);
    }

    public static Sample fromJson(JsonNode node) {
        JsonFields.requireObject(node, Sample.class);
        return new Sample(
                JsonFields.nested(node, "size", SizeSpec::fromJson, Sample.class),
                JsonFields.nested(node, "spec", SampleSpec::fromJson, Sample.class));
    }

    /**
     * Lenient parse of a stored sample request; unparsable content yields {@link #EMPTY}.
     */
    public static Sample fromJson(String json, String context) {
        JsonNode node = JsonFields.parseOrEmpty(json, context);
        return node.isObject() ? fromJson(node) : EMPTY;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        if (size != null) {
            node.set("size", size.toJson());
        }
        if (spec != null) {
            node.set("spec", spec.toJson());
        }
        return node;
    }
}
