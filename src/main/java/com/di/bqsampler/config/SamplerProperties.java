package com.di.bqsampler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Single binding for the sampler deployment settings.
 *
 * <pre>
 * bqsampler:
 *   target-project-id: ${TARGET_PROJECT_ID}
 *   target-location: ${TARGET_LOCATION}
 *   policy-bucket: ${POLICY_BUCKET_NAME}
 *   default-policy-object-path: default_policy.json
 *   request-bucket: ${REQUEST_BUCKET_NAME}
 *   sampling-lock-object-path: block-sampling
 *   command-topic: projects/my-project/topics/sampler-commands
 *   error-topic: projects/my-project/topics/sampler-errors
 *   transfer-notification-topic: projects/my-project/topics/bq-transfer-notifications
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bqsampler")
public class SamplerProperties {

    // ------------------------------------------------------------------ //
    // Target                                                              //
    // ------------------------------------------------------------------ //

    /** Project that receives every sample table. */
    @NotBlank
    private String targetProjectId;

    /** BigQuery location of the sample tables, e.g. {@code europe-west3}. */
    @NotBlank
    private String targetLocation;

    // ------------------------------------------------------------------ //
    // Buckets                                                             //
    // ------------------------------------------------------------------ //

    /** Bucket with {@code <project>/<dataset>/<table>.json} policies and the default policy. */
    @NotBlank
    private String policyBucket;

    /** Path of the default policy inside the policy bucket. */
    @NotBlank
    private String defaultPolicyObjectPath = "default_policy.json";

    /** Bucket with {@code <project>/<dataset>/<table>.json} sample requests. */
    @NotBlank
    private String requestBucket;

    /** Path, inside the request bucket, of the object whose presence blocks sampling. */
    @NotBlank
    private String samplingLockObjectPath = "block-sampling";

    // ------------------------------------------------------------------ //
    // Pub/Sub topics (full resource names)                                //
    // ------------------------------------------------------------------ //

    /** Topic carrying the workflow commands. */
    @NotBlank
    private String commandTopic;

    /** Topic receiving {@code {"command": ..., "error": ...}} records. */
    @NotBlank
    private String errorTopic;

    /** Topic the Data Transfer Service notifies on run completion. Null = no notification. */
    private String transferNotificationTopic;

    /** Service account the cross-location transfers run as. Null = caller credentials. */
    private String transferServiceAccount;

    // ------------------------------------------------------------------ //
    // Caching                                                             //
    // ------------------------------------------------------------------ //

    /** Maximum number of cached dataset locations. */
    @Min(1)
    private int locationCacheSize = 1000;
}
