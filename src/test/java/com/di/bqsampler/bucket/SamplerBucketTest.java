package com.di.bqsampler.bucket;

import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.entity.Policy;
import com.di.bqsampler.entity.Sample;
import com.di.bqsampler.entity.SampleSpec;
import com.di.bqsampler.entity.SizeSpec;
import com.di.bqsampler.entity.SortDirection;
import com.di.bqsampler.entity.TablePolicy;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.entity.TableSample;
import com.di.bqsampler.query.FakeBigQueryGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for SamplerBucket against an in-memory store.
 */
@DisplayName("SamplerBucket Tests")
class SamplerBucketTest {

    private static final String POLICY_BUCKET = "policies";
    private static final String REQUEST_BUCKET = "requests";

    private static final String DEFAULT_POLICY = "{"
            + "\"limit\": {\"count\": 1000, \"percentage\": 20.0},"
            + "\"default_sample\": {\"size\": {\"count\": 10, \"percentage\": 10.0},"
            + "  \"spec\": {\"type\": \"sorted\", \"properties\": {\"by\": \"col\", \"direction\": \"DESC\"}}}}";

    private InMemoryObjectStore store;
    private FakeBigQueryGateway gateway;
    private SamplerBucket bucket;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        gateway = new FakeBigQueryGateway();
        gateway.datasetLocations.put("proj.sales", "EU");
        SamplerProperties properties = new SamplerProperties();
        properties.setPolicyBucket(POLICY_BUCKET);
        properties.setRequestBucket(REQUEST_BUCKET);
        bucket = new SamplerBucket(store, new DatasetLocationResolver(gateway, properties), properties);
    }

    // ============================================================================
    // Sampling lock
    // ============================================================================

    @Test
    @DisplayName("Should detect the sampling lock, even when empty")
    void testIsSamplingLockPresent() {
        assertFalse(bucket.isSamplingLockPresent());
        store.put(REQUEST_BUCKET, "block-sampling", "");
        assertTrue(bucket.isSamplingLockPresent());
        assertEquals("gs://requests/block-sampling", bucket.samplingLockUri());
    }

    // ============================================================================
    // Discovery
    // ============================================================================

    @Test
    @DisplayName("Should list project/dataset prefixes only")
    void testPolicyPrefixes() {
        store.put(POLICY_BUCKET, "default_policy.json", DEFAULT_POLICY)
                .put(POLICY_BUCKET, "proj/sales/orders.json", "{}")
                .put(POLICY_BUCKET, "proj/sales/customers.json", "{}")
                .put(POLICY_BUCKET, "proj/hr/people.json", "{}")
                .put(POLICY_BUCKET, "other/logs/events.json", "{}");

        List<String> prefixes = bucket.policyPrefixes().sorted().collect(Collectors.toList());

        assertEquals(List.of("other/logs/", "proj/hr/", "proj/sales/"), prefixes);
    }

    @Test
    @DisplayName("Should only list table policy objects under a prefix")
    void testPolicyObjectPaths() {
        store.put(POLICY_BUCKET, "proj/sales/orders.json", "{}")
                .put(POLICY_BUCKET, "proj/sales/README.md", "docs")
                .put(POLICY_BUCKET, "proj/sales/archive/old.json", "{}")
                .put(POLICY_BUCKET, "proj/hr/people.json", "{}");

        List<String> paths = bucket.policyObjectPaths("proj/sales/").collect(Collectors.toList());

        assertEquals(List.of("proj/sales/orders.json"), paths);
    }

    @Test
    @DisplayName("Should recognise table object paths")
    void testIsTableObjectPath() {
        assertTrue(SamplerBucket.isTableObjectPath("p/d/t.json"));
        assertFalse(SamplerBucket.isTableObjectPath("default_policy.json"));
        assertFalse(SamplerBucket.isTableObjectPath("p/d/t.yaml"));
        assertFalse(SamplerBucket.isTableObjectPath("p/d/x/t.json"));
    }

    // ============================================================================
    // Policy resolution
    // ============================================================================

    @Test
    @DisplayName("Should merge a table policy with the default policy")
    void testTablePolicy_FullResolution() {
        store.put(POLICY_BUCKET, "default_policy.json", DEFAULT_POLICY)
                .put(POLICY_BUCKET, "proj/sales/orders.json",
                        "{\"default_sample\": {\"size\": {\"count\": 123, \"percentage\": 19.2}}}");

        TablePolicy tablePolicy = bucket.tablePolicy("proj/sales/orders.json", bucket.defaultPolicy());

        assertEquals(TableReference.parse("proj.sales.orders@EU"), tablePolicy.getTableReference());
        Policy policy = tablePolicy.getPolicy();
        assertEquals(new SizeSpec(1000L, 20.0), policy.getLimit());
        assertEquals(new SizeSpec(123L, 19.2), policy.getDefaultSample().getSize());
        assertEquals(SampleSpec.sorted("col", SortDirection.DESC), policy.getDefaultSample().getSpec());
    }

    @Test
    @DisplayName("Should fall back to the generic policy without a default policy object")
    void testDefaultPolicy_Missing() {
        assertEquals(Policy.FALLBACK_GENERIC_POLICY, bucket.defaultPolicy());
    }

    @Test
    @DisplayName("Should fall back to the generic policy for a malformed default policy")
    void testDefaultPolicy_Malformed() {
        store.put(POLICY_BUCKET, "default_policy.json", "{\"limit\": ");
        assertEquals(Policy.FALLBACK_GENERIC_POLICY, bucket.defaultPolicy());
    }

    @Test
    @DisplayName("Should resolve every policy under a prefix")
    void testAllPolicies() {
        store.put(POLICY_BUCKET, "proj/sales/orders.json", "{}")
                .put(POLICY_BUCKET, "proj/sales/customers.json", "{\"limit\": {\"count\": 5}}");

        List<TablePolicy> policies = bucket.allPolicies("proj/sales/").collect(Collectors.toList());

        assertEquals(2, policies.size());
        assertEquals(SizeSpec.ofCount(5), policies.get(0).getPolicy().getLimit());
        assertEquals(Policy.FALLBACK_GENERIC_POLICY, policies.get(1).getPolicy());
    }

    // ============================================================================
    // Sample requests
    // ============================================================================

    @Test
    @DisplayName("Should use the policy default sample when no request exists")
    void testSampleRequestFromPolicy_NoRequest() {
        Sample defaultSample = new Sample(SizeSpec.ofCount(7), SampleSpec.random());
        TablePolicy tablePolicy = new TablePolicy(TableReference.parse("proj.sales.orders@EU"),
                new Policy(SizeSpec.ofCount(100), defaultSample));

        TableSample request = bucket.sampleRequestFromPolicy(tablePolicy);

        assertEquals(defaultSample, request.getSample());
    }

    @Test
    @DisplayName("Should use a stored request as is")
    void testSampleRequestFromPolicy_StoredRequest() {
        store.put(REQUEST_BUCKET, "proj/sales/orders.json", "{\"size\": {\"percentage\": 50.0}}");
        TablePolicy tablePolicy = new TablePolicy(TableReference.parse("proj.sales.orders@EU"),
                Policy.FALLBACK_GENERIC_POLICY);

        TableSample request = bucket.sampleRequestFromPolicy(tablePolicy);

        assertEquals(new Sample(SizeSpec.ofPercentage(50.0), null), request.getSample());
    }

    @Test
    @DisplayName("Should list stored requests without applying policies")
    void testAllSampleRequests() {
        store.put(REQUEST_BUCKET, "proj/sales/orders.json", "{\"size\": {\"count\": 3}}")
                .put(REQUEST_BUCKET, "block-sampling", "");

        List<TableSample> requests = bucket.allSampleRequests(null).collect(Collectors.toList());

        assertEquals(1, requests.size());
        assertEquals(TableReference.parse("proj.sales.orders@EU"), requests.get(0).getTableReference());
        assertEquals(SizeSpec.ofCount(3), requests.get(0).getSample().getSize());
    }
}
