package com.di.bqsampler.bucket;

import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.query.BigQueryGateway;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Cache-in-front of {@link BigQueryGateway#datasetLocation}. One invocation only touches a
 * handful of datasets and locations do not change while it runs, so entries are never
 * invalidated.
 */
@Slf4j
@Component
public class DatasetLocationResolver {

    private final BigQueryGateway bigQueryGateway;
    private final Cache<String, Optional<String>> locations;

    public DatasetLocationResolver(BigQueryGateway bigQueryGateway, SamplerProperties properties) {
        this.bigQueryGateway = bigQueryGateway;
        this.locations = Caffeine.newBuilder()
                .maximumSize(properties.getLocationCacheSize())
                .build();
    }

    /**
     * @return the dataset location, or null when the dataset does not exist
     */
    public String resolve(String projectId, String datasetId) {
        return locations.get(projectId + "." + datasetId, key -> {
            Optional<String> location = bigQueryGateway.datasetLocation(projectId, datasetId);
            if (location.isEmpty()) {
                log.warn("[BUCKET] Dataset {}.{} not found; location unknown", projectId, datasetId);
            }
            return location;
        }).orElse(null);
    }
}
