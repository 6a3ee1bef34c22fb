package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Amount of rows expressed as an absolute count, a percentage of the table, or both.
 *
 * <pre>
 * {"count": 123, "percentage": 19.2}
 * </pre>
 *
 * A count of zero is accepted: it is what a compliant sample of an empty table carries.
 */
@Value
public class SizeSpec implements Patchable<SizeSpec> {

    public static final SizeSpec EMPTY = new SizeSpec(null, null);

    Long count;
    Double percentage;

    public SizeSpec(Long count, Double percentage) {
        if (count != null && count < 0) {
            throw new IllegalArgumentException("Size count must not be negative, got: " + count);
        }
        if (percentage != null && (percentage.isNaN() || percentage <= 0.0 || percentage > 100.0)) {
            throw new IllegalArgumentException(
                    "Size percentage must be in (0, 100], got: " + percentage);
        }
        this.count = count;
        this.percentage = percentage;
    }

    public static SizeSpec ofCount(long count) {
        return new SizeSpec(count, null);
    }

    public static SizeSpec ofPercentage(double percentage) {
        return new SizeSpec(null, percentage);
    }

    @Override
    public boolean isEmpty() {
        return count == null && percentage == null;
    }

    @Override
    public SizeSpec patchWith(SizeSpec fallback) {
        return Patchable.substitute(this, fallback);
    }

    public static SizeSpec fromJson(JsonNode node) {
        JsonFields.requireObject(node, SizeSpec.class);
        return new SizeSpec(JsonFields.longValue(node, "count"), JsonFields.decimal(node, "percentage"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "count", count);
        JsonFields.putIfPresent(node, "percentage", percentage);
        return node;
    }
}
