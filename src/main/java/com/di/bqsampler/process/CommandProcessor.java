package com.di.bqsampler.process;

import com.di.bqsampler.bucket.SamplerBucket;
import com.di.bqsampler.command.Command;
import com.di.bqsampler.command.CommandRemoveDataset;
import com.di.bqsampler.command.CommandSampleDone;
import com.di.bqsampler.command.CommandSamplePolicyPrefix;
import com.di.bqsampler.command.CommandSampleStart;
import com.di.bqsampler.command.CommandTransferRunDone;
import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.entity.JsonFields;
import com.di.bqsampler.entity.Policy;
import com.di.bqsampler.entity.Sample;
import com.di.bqsampler.entity.SampleSpec;
import com.di.bqsampler.entity.SortProperties;
import com.di.bqsampler.entity.SortType;
import com.di.bqsampler.entity.TablePolicy;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.entity.TableSample;
import com.di.bqsampler.pubsub.CommandPublisher;
import com.di.bqsampler.query.SampleQueryService;
import com.di.bqsampler.util.SamplerMetrics;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs one command of the sampling workflow:
 * <pre>
 * START ──► SAMPLE_POLICY_PREFIX (per project/dataset) ──► SAMPLE_START (per table) ──► SAMPLE_DONE
 *                                                               │ different locations
 *                                                               ▼
 *                                            TRANSFER_RUN_DONE ──► REMOVE_DATASET (staging)
 * </pre>
 * Fan-out happens by publishing follow-up commands; nothing is retried here. Any failure
 * is published to the error topic as {@code {"command": ..., "error": ...}} and rethrown
 * so the transport can redeliver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandProcessor {

    private final SamplerBucket bucket;
    private final SampleQueryService queryService;
    private final CommandPublisher publisher;
    private final SamplerProperties properties;
    private final SamplerMetrics metrics;
    private final Clock clock;

    public void process(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        long started = clock.millis();
        log.info("[PROCESS] Processing {} (timestamp={})", command.getType(), command.getTimestamp());
        try {
            switch (command.getType()) {
                case START:
                    processStart(command);
                    break;
                case SAMPLE_POLICY_PREFIX:
                    processSamplePolicyPrefix((CommandSamplePolicyPrefix) command);
                    break;
                case SAMPLE_START:
                    processSampleStart((CommandSampleStart) command);
                    break;
                case SAMPLE_DONE:
                    processSampleDone((CommandSampleDone) command);
                    break;
                case TRANSFER_RUN_DONE:
                    processTransferRunDone((CommandTransferRunDone) command);
                    break;
                case REMOVE_DATASET:
                    processRemoveDataset((CommandRemoveDataset) command);
                    break;
                default:
                    throw new IllegalArgumentException("Command type " + command.getType() + " is not supported");
            }
            metrics.recordProcessed(command.getType(), clock.millis() - started);
        } catch (RuntimeException e) {
            metrics.recordFailed(command.getType(), clock.millis() - started);
            log.error("[PROCESS] {} failed: {}", command.getType(), e.getMessage(), e);
            publishError(command, e);
            throw e;
        }
    }

    // ------------------------------------------------------------------ //
    // START                                                               //
    // ------------------------------------------------------------------ //

    private void processStart(Command command) {
        if (bucket.isSamplingLockPresent()) {
            throw new SamplingInterruptedException(bucket.samplingLockUri());
        }
        String targetProject = properties.getTargetProjectId();
        log.info("[START] Removing samples of the previous run in {}", targetProject);
        queryService.dropAllSampleTables(targetProject);
        queryService.removeEmptySampleDatasets(targetProject);
        queryService.removeAllTransferConfigs(targetProject, properties.getTargetLocation());

        int published = 0;
        try (Stream<String> prefixes = bucket.policyPrefixes()) {
            Iterator<String> it = prefixes.iterator();
            while (it.hasNext()) {
                publish(new CommandSamplePolicyPrefix(command.getTimestamp(), it.next()));
                published++;
            }
        }
        log.info("[START] Published {} SAMPLE_POLICY_PREFIX commands", published);
    }

    // ------------------------------------------------------------------ //
    // SAMPLE_POLICY_PREFIX                                                //
    // ------------------------------------------------------------------ //

    private void processSamplePolicyPrefix(CommandSamplePolicyPrefix command) {
        String prefix = command.getPrefix();
        Policy defaultPolicy = bucket.defaultPolicy();
        List<String> failures = new ArrayList<>();
        int published = 0;

        try (Stream<String> paths = bucket.policyObjectPaths(prefix)) {
            Iterator<String> it = paths.iterator();
            while (it.hasNext()) {
                String path = it.next();
                try {
                    publish(sampleStart(command.getTimestamp(), path, defaultPolicy));
                    published++;
                } catch (RuntimeException e) {
                    log.warn("[PREFIX] Could not process policy {}: {}", path, e.getMessage());
                    failures.add(path + ": " + e.getMessage());
                }
            }
        }

        log.info("[PREFIX] {}: published {} SAMPLE_START commands, {} failed", prefix, published, failures.size());
        if (!failures.isEmpty()) {
            throw new PolicyPrefixFailedException(prefix, failures);
        }
    }

    private CommandSampleStart sampleStart(long timestamp, String policyPath, Policy defaultPolicy) {
        TablePolicy tablePolicy = bucket.tablePolicy(policyPath, defaultPolicy);
        TableSample request = bucket.sampleRequestFromPolicy(tablePolicy);
        long rowCount = queryService.rowCount(tablePolicy.getTableReference());
        TableSample compliant = tablePolicy.compliantSample(request, rowCount);
        log.info("[PREFIX] {} has {} rows; requested {}, compliant {}",
                tablePolicy.getTableReference(), rowCount, request.getSample(), compliant.getSample());
        return new CommandSampleStart(timestamp, compliant, targetTable(tablePolicy.getTableReference()));
    }

    TableReference targetTable(TableReference source) {
        return source.withProjectId(properties.getTargetProjectId())
                .withLocation(properties.getTargetLocation());
    }

    // ------------------------------------------------------------------ //
    // SAMPLE_START / SAMPLE_DONE                                          //
    // ------------------------------------------------------------------ //

    private void processSampleStart(CommandSampleStart command) {
        TableSample request = command.getSampleRequest();
        TableReference source = request.getTableReference();
        TableReference target = command.getTargetTable();
        Sample sample = request.getSample();
        if (sample.getSize() == null || sample.getSize().getCount() == null) {
            throw new IllegalArgumentException("Sample request for " + source + " carries no row count: " + sample);
        }
        long amount = sample.getSize().getCount();
        SampleSpec spec = sample.getSpec() != null ? sample.getSpec() : SampleSpec.EMPTY;
        String notificationTopic = properties.getTransferNotificationTopic();

        long startTimestamp = clock.instant().getEpochSecond();
        long inserted;
        if (spec.effectiveType() == SortType.SORTED) {
            SortProperties sort = spec.getProperties();
            inserted = queryService.createTableWithSortedSample(source, target, amount,
                    sort.getBy(), sort.getDirection(), true, notificationTopic);
        } else {
            inserted = queryService.createTableWithRandomSample(source, target, amount, true, notificationTopic);
        }
        long endTimestamp = clock.instant().getEpochSecond();
        metrics.recordRowsInserted(inserted);

        publish(new CommandSampleDone(command.getTimestamp(), request, target,
                startTimestamp, endTimestamp, "", inserted));
    }

    private void processSampleDone(CommandSampleDone command) {
        if (command.hasError()) {
            log.warn("[DONE] Sampling {} into {} failed: {}", command.getSampleRequest().getTableReference(),
                    command.getTargetTable(), command.getErrorMessage());
            return;
        }
        log.info("[DONE] Sampled {} rows of {} into {} in {}s", command.getAmountInserted(),
                command.getSampleRequest().getTableReference(), command.getTargetTable(),
                command.getEndTimestamp() - command.getStartTimestamp());
    }

    // ------------------------------------------------------------------ //
    // Transfer cleanup                                                    //
    // ------------------------------------------------------------------ //

    private void processTransferRunDone(CommandTransferRunDone command) {
        if (!CommandTransferRunDone.STATE_SUCCEEDED.equals(command.getState())) {
            throw new IllegalStateException(String.format("Transfer run of %s ended in state %s: %s",
                    command.getName(), command.getState(), command.getPayload().path("errorStatus")));
        }
        String projectId = command.getParam("source_project_id");
        String datasetId = command.getParam("source_dataset_id");
        if (projectId == null || datasetId == null) {
            throw new IllegalArgumentException("Transfer run of " + command.getName()
                    + " names no source_project_id/source_dataset_id");
        }
        queryService.removeTransferConfig(command.getName());
        publish(new CommandRemoveDataset(command.getTimestamp(), projectId, datasetId));
        log.info("[TRANSFER] {} succeeded; removal of staging dataset {}.{} requested",
                command.getName(), projectId, datasetId);
    }

    private void processRemoveDataset(CommandRemoveDataset command) {
        queryService.removeDataset(command.getProjectId(), command.getDatasetId());
    }

    // ------------------------------------------------------------------ //
    // Publishing                                                          //
    // ------------------------------------------------------------------ //

    private void publish(Command command) {
        publisher.publish(command.toJson(), properties.getCommandTopic());
    }

    private void publishError(Command command, RuntimeException error) {
        ObjectNode record = JsonFields.newObject();
        record.set("command", command.toJson());
        record.put("error", String.valueOf(error.getMessage()));
        try {
            publisher.publish(record, properties.getErrorTopic());
        } catch (RuntimeException publishError) {
            log.error("[PROCESS] Could not publish error record to {}: {}",
                    properties.getErrorTopic(), publishError.getMessage());
            error.addSuppressed(publishError);
        }
    }
}
