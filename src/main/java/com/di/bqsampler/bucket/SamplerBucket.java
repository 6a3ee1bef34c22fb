package com.di.bqsampler.bucket;

import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.entity.Policy;
import com.di.bqsampler.entity.Sample;
import com.di.bqsampler.entity.TablePolicy;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.entity.TableSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads policies and sample requests from their buckets. Both buckets share one layout:
 * <pre>
 * default_policy.json                     (policy bucket only)
 * &lt;project&gt;/&lt;dataset&gt;/&lt;table&gt;.json
 * block-sampling                          (request bucket only, presence blocks sampling)
 * </pre>
 *
 * <p>Absent or malformed policy and request objects read as empty and are completed
 * from their fallbacks. Storage errors propagate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SamplerBucket {

    static final String JSON_EXT = ".json";
    private static final String DELIMITER = "/";

    private final ObjectStore objectStore;
    private final DatasetLocationResolver locationResolver;
    private final SamplerProperties properties;

    // ------------------------------------------------------------------ //
    // Sampling lock                                                       //
    // ------------------------------------------------------------------ //

    public boolean isSamplingLockPresent() {
        log.info("[BUCKET] Verifying sampling lock {}", samplingLockUri());
        return objectStore.readObject(properties.getRequestBucket(), properties.getSamplingLockObjectPath())
                .isPresent();
    }

    public String samplingLockUri() {
        return "gs://" + properties.getRequestBucket() + "/" + properties.getSamplingLockObjectPath();
    }

    // ------------------------------------------------------------------ //
    // Policies                                                            //
    // ------------------------------------------------------------------ //

    /**
     * Lazily lists the {@code project/dataset/} prefixes of the policy bucket.
     */
    public Stream<String> policyPrefixes() {
        String bucket = properties.getPolicyBucket();
        return objectStore.listPrefixes(bucket, null)
                .flatMap(projectPrefix -> objectStore.listPrefixes(bucket, projectPrefix))
                .filter(prefix -> segments(prefix) == 2);
    }

    /**
     * The bucket default policy completed with {@link Policy#FALLBACK_GENERIC_POLICY}.
     */
    public Policy defaultPolicy() {
        String path = properties.getDefaultPolicyObjectPath();
        Policy result = readPolicy(path).patchWith(Policy.FALLBACK_GENERIC_POLICY);
        log.info("[BUCKET] Default policy read from gs://{}/{}: {}", properties.getPolicyBucket(), path, result);
        return result;
    }

    /**
     * Lazily lists {@code project/dataset/table.json} policy objects under {@code prefix}.
     */
    public Stream<String> policyObjectPaths(String prefix) {
        return objectStore.listObjects(properties.getPolicyBucket(), prefix, SamplerBucket::isTableObjectPath);
    }

    /**
     * Resolves the policy stored at {@code objectPath} merged with {@code defaultPolicy}.
     */
    public TablePolicy tablePolicy(String objectPath, Policy defaultPolicy) {
        TableReference table = tableReference(objectPath);
        Policy policy = readPolicy(objectPath).patchWith(defaultPolicy);
        return new TablePolicy(table, policy);
    }

    /**
     * All resolved table policies under {@code prefix} (whole bucket when null).
     */
    public Stream<TablePolicy> allPolicies(String prefix) {
        Policy defaultPolicy = defaultPolicy();
        return policyObjectPaths(prefix).map(path -> tablePolicy(path, defaultPolicy));
    }

    // ------------------------------------------------------------------ //
    // Sample requests                                                     //
    // ------------------------------------------------------------------ //

    /**
     * The table's request, or the policy default sample when there is no usable request.
     */
    public TableSample sampleRequestFromPolicy(TablePolicy tablePolicy) {
        TableReference table = tablePolicy.getTableReference();
        Sample request = readSample(objectPath(table));
        return new TableSample(table, request.patchWith(tablePolicy.getPolicy().getDefaultSample()));
    }

    /**
     * Requests as stored, without any policy applied.
     */
    public Stream<TableSample> allSampleRequests(String prefix) {
        log.info("[BUCKET] Retrieving sample requests from gs://{}/{}",
                properties.getRequestBucket(), prefix != null ? prefix : "");
        return objectStore.listObjects(properties.getRequestBucket(), prefix, SamplerBucket::isTableObjectPath)
                .map(path -> new TableSample(tableReference(path), readSample(path)));
    }

    // ------------------------------------------------------------------ //
    // Internal helpers                                                    //
    // ------------------------------------------------------------------ //

    static boolean isTableObjectPath(String path) {
        return path.endsWith(JSON_EXT) && path.split(DELIMITER, -1).length == 3;
    }

    static String objectPath(TableReference table) {
        return String.join(DELIMITER, table.getProjectId(), table.getDatasetId(), table.getTableId()) + JSON_EXT;
    }

    private TableReference tableReference(String objectPath) {
        String[] parts = objectPath.split(DELIMITER, -1);
        String tableId = parts[2].substring(0, parts[2].length() - JSON_EXT.length());
        String location = locationResolver.resolve(parts[0], parts[1]);
        return new TableReference(parts[0], parts[1], tableId, location);
    }

    private Policy readPolicy(String path) {
        String bucket = properties.getPolicyBucket();
        return readString(bucket, path)
                .map(json -> Policy.fromJson(json, "gs://" + bucket + "/" + path))
                .orElseGet(() -> {
                    log.warn("[BUCKET] No policy at gs://{}/{}", bucket, path);
                    return Policy.EMPTY;
                });
    }

    private Sample readSample(String path) {
        String bucket = properties.getRequestBucket();
        return readString(bucket, path)
                .map(json -> Sample.fromJson(json, "gs://" + bucket + "/" + path))
                .orElseGet(() -> {
                    log.info("[BUCKET] No sample request at gs://{}/{}", bucket, path);
                    return Sample.EMPTY;
                });
    }

    private Optional<String> readString(String bucket, String path) {
        return objectStore.readObject(bucket, path).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    private static int segments(String prefix) {
        String trimmed = prefix;
        while (trimmed.startsWith(DELIMITER)) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(DELIMITER)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? 0 : trimmed.split(DELIMITER).length;
    }
}
