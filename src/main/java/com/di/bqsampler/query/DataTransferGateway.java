package com.di.bqsampler.query;

import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.entity.TableReference;
import com.google.cloud.bigquery.datatransfer.v1.CreateTransferConfigRequest;
import com.google.cloud.bigquery.datatransfer.v1.DataTransferServiceClient;
import com.google.cloud.bigquery.datatransfer.v1.ListTransferConfigsRequest;
import com.google.cloud.bigquery.datatransfer.v1.LocationName;
import com.google.cloud.bigquery.datatransfer.v1.ScheduleOptions;
import com.google.cloud.bigquery.datatransfer.v1.StartManualTransferRunsRequest;
import com.google.cloud.bigquery.datatransfer.v1.TransferConfig;
import com.google.protobuf.Struct;
import com.google.protobuf.Timestamp;
import com.google.protobuf.Value;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * {@link TransferGateway} backed by the BigQuery Data Transfer Service.
 *
 * <p>Each copy gets its own config with auto scheduling disabled and a single manual run.
 * The run result is published to the notification topic, which is how the staging
 * dataset and the config get cleaned up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataTransferGateway implements TransferGateway {

    static final Pattern TRANSFER_CONFIG_NAME =
            Pattern.compile("^projects/([^/\\s]+)/locations/([^/\\s]+)/transferConfigs/([^/\\s]+)$");

    private final DataTransferServiceClient client;
    private final SamplerProperties properties;
    private final Clock clock;

    @Override
    public String startCrossLocationCopy(String sourceProjectId, String sourceDatasetId,
                                         TableReference target, String notificationTopic) {
        TransferConfig.Builder config = TransferConfig.newBuilder()
                .setDestinationDatasetId(target.getDatasetId())
                .setDisplayName("Cross-region transfer " + target.datasetFqnId())
                .setDataSourceId(CROSS_REGION_COPY_DATA_SOURCE)
                .setParams(Struct.newBuilder()
                        .putFields("source_project_id", stringValue(sourceProjectId))
                        .putFields("source_dataset_id", stringValue(sourceDatasetId))
                        .putFields("overwrite_destination_table", Value.newBuilder().setBoolValue(true).build())
                        .build())
                .setScheduleOptions(ScheduleOptions.newBuilder().setDisableAutoScheduling(true).build())
                .setDataRefreshWindowDays(0);
        if (notificationTopic != null && !notificationTopic.isBlank()) {
            config.setNotificationPubsubTopic(notificationTopic);
        }

        CreateTransferConfigRequest.Builder request = CreateTransferConfigRequest.newBuilder()
                .setParent(parent(target.getProjectId(), target.getLocation()))
                .setTransferConfig(config.build());
        String serviceAccount = properties.getTransferServiceAccount();
        if (serviceAccount != null && !serviceAccount.isBlank()) {
            request.setServiceAccountName(serviceAccount);
        }

        TransferConfig created = client.createTransferConfig(request.build());
        log.info("[TRANSFER] Created config {} for {}.{} -> {}",
                created.getName(), sourceProjectId, sourceDatasetId, target.datasetFqnId());

        Instant now = clock.instant();
        client.startManualTransferRuns(StartManualTransferRunsRequest.newBuilder()
                .setParent(created.getName())
                .setRequestedRunTime(Timestamp.newBuilder()
                        .setSeconds(now.getEpochSecond())
                        .setNanos(now.getNano())
                        .build())
                .build());
        return created.getName();
    }

    @Override
    public void removeTransferConfig(String name) {
        if (name == null || !TRANSFER_CONFIG_NAME.matcher(name.trim()).matches()) {
            throw new IllegalArgumentException("Invalid transfer config name: '" + name + "'");
        }
        client.deleteTransferConfig(name.trim());
        log.info("[TRANSFER] Removed config {}", name);
    }

    @Override
    public int removeAllTransferConfigs(String projectId, String location) {
        ListTransferConfigsRequest request = ListTransferConfigsRequest.newBuilder()
                .setParent(parent(projectId, location))
                .addDataSourceIds(CROSS_REGION_COPY_DATA_SOURCE)
                .build();
        int removed = 0;
        for (TransferConfig config : client.listTransferConfigs(request).iterateAll()) {
            if (CROSS_REGION_COPY_DATA_SOURCE.equals(config.getDataSourceId())) {
                client.deleteTransferConfig(config.getName());
                log.debug("[TRANSFER] Removed config {}", config.getName());
                removed++;
            }
        }
        return removed;
    }

    private static String parent(String projectId, String location) {
        if (location == null) {
            throw new IllegalArgumentException("A location is required for transfer configs of project " + projectId);
        }
        return LocationName.of(projectId, location).toString();
    }

    private static Value stringValue(String value) {
        return Value.newBuilder().setStringValue(value).build();
    }
}
