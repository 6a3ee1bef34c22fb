package com.di.bqsampler.query;

import com.di.bqsampler.entity.TableReference;

/**
 * Port for cross-location dataset copies (BigQuery Data Transfer Service,
 * data source {@code cross_region_copy}).
 */
public interface TransferGateway {

    String CROSS_REGION_COPY_DATA_SOURCE = "cross_region_copy";

    /**
     * Creates a one-off transfer config copying {@code sourceProjectId.sourceDatasetId}
     * into the dataset of {@code target} and starts a manual run.
     *
     * @param notificationTopic topic notified when the run ends; may be null
     * @return the transfer config name
     */
    String startCrossLocationCopy(String sourceProjectId, String sourceDatasetId,
                                  TableReference target, String notificationTopic);

    /**
     * Deletes the transfer config {@code projects/p/locations/l/transferConfigs/id}.
     */
    void removeTransferConfig(String name);

    /**
     * Deletes every {@value #CROSS_REGION_COPY_DATA_SOURCE} config in the project and location.
     *
     * @return number of configs removed
     */
    int removeAllTransferConfigs(String projectId, String location);
}
