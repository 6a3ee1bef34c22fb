package com.di.bqsampler.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Sampling policy of a table: the largest sample allowed ({@code limit}) and the sample
 * taken when no specific request exists ({@code default_sample}).
 *
 * <pre>
 * {"limit": {"count": 1000, "percentage": 20.0},
 *  "default_sample": {"size": {"count": 123, "percentage": 19.2},
 *                     "spec": {"type": "sorted", "properties": {"by": "my_column", "direction": "DESC"}}}}
 * </pre>
 *
 * <p>Unlike the other value types a policy <em>merges</em> with its fallback: a table
 * policy that only sets {@code default_sample.size} keeps {@code limit} and
 * {@code default_sample.spec} from the default policy.
 */
@Value
public class Policy implements Patchable<Policy> {

    public static final Policy EMPTY = new Policy(null, null);

    /**
     * Absolute minimum policy, used when no usable default policy object exists.
     */
    public static final Policy FALLBACK_GENERIC_POLICY = new Policy(
            SizeSpec.ofCount(1),
            new Sample(SizeSpec.ofCount(1), new SampleSpec(SortType.defaultType(), null)));

    SizeSpec limit;
    Sample defaultSample;

    public Policy(SizeSpec limit, Sample defaultSample) {
        this.limit = limit;
        this.defaultSample = defaultSample;
    }

    @Override
    public boolean isEmpty() {
        return limit == null && defaultSample == null;
    }

    @Override
    public Policy patchWith(Policy fallback) {
        if (fallback == null) {
            return this;
        }
        SizeSpec mergedLimit = limit == null ? fallback.limit : limit.patchWith(fallback.limit);
        Sample mergedSample = defaultSample == null
                ? fallback.defaultSample
                : defaultSample.fillFrom(fallback.defaultSample);
        return new Policy(mergedLimit, mergedSample);
    }

    /**
     * Returns the request reduced to what this policy allows for a table of
     * {@code rowCount} rows. The result always carries an absolute count and the
     * request's spec.
     *
     * <p>The limit is the tightest of {@code limit.count} and {@code limit.percentage};
     * the requested amount is the widest of {@code size.count} and {@code size.percentage}.
     * An empty table always yields a count of zero.
     *
     * @throws IllegalArgumentException if {@code sample} is null or {@code rowCount} is negative
     */
    public Sample compliantSample(Sample sample, long rowCount) {
        if (sample == null) {
            throw new IllegalArgumentException("Sample cannot be null");
        }
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count must not be negative, got: " + rowCount);
        }
        long compliantCount = rowCount == 0
                ? 0
                : Math.min(policyCountLimit(rowCount), sampleCount(sample, rowCount));
        return new Sample(SizeSpec.ofCount(compliantCount), sample.getSpec());
    }

    private long policyCountLimit(long rowCount) {
        SizeSpec size = limit != null ? limit : SizeSpec.EMPTY;
        long result = rowCount;
        if (size.getCount() != null) {
            result = size.getCount();
        }
        if (size.getPercentage() != null) {
            long byPercentage = (long) Math.floor(rowCount * size.getPercentage() / 100.0);
            result = Math.min(byPercentage, result);
        }
        return result;
    }

    private static long sampleCount(Sample sample, long rowCount) {
        SizeSpec size = sample.getSize() != null ? sample.getSize() : SizeSpec.EMPTY;
        long result = 0;
        if (size.getCount() != null) {
            result = size.getCount();
        }
        if (size.getPercentage() != null) {
            long byPercentage = (long) Math.ceil(rowCount * size.getPercentage() / 100.0);
            result = Math.max(byPercentage, result);
        }
        return result;
    }

    public static Policy fromJson(JsonNode node) {
        JsonFields.requireObject(node, Policy.class);
        return new Policy(
                JsonFields.nested(node, "limit", SizeSpec::fromJson, Policy.class),
                JsonFields.nested(node, "default_sample", Sample::fromJson, Policy.class));
    }

    /**
     * Lenient parse of a stored policy; unparsable content yields {@link #EMPTY}.
     */
    public static Policy fromJson(String json, String context) {
        JsonNode node = JsonFields.parseOrEmpty(json, context);
        return node.isObject() ? fromJson(node) : EMPTY;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        if (limit != null) {
            node.set("limit", limit.toJson());
        }
        if (defaultSample != null) {
            node.set("default_sample", defaultSample.toJson());
        }
        return node;
    }
}
