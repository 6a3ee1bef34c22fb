package com.di.bqsampler.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.datatransfer.v1.DataTransferServiceClient;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * Registers the Google Cloud clients, backed by Application Default Credentials.
 * Pub/Sub publishers are created per topic by the publisher itself.
 */
@Configuration
public class GcpClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient() {
        return BigQueryOptions.getDefaultInstance().getService();
    }

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(DataTransferServiceClient.class)
    public DataTransferServiceClient dataTransferServiceClient() {
        try {
            return DataTransferServiceClient.create();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create BigQuery Data Transfer client", e);
        }
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
