package com.di.bqsampler;

import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.process.CommandProcessor;
import com.di.bqsampler.pubsub.CommandPublisher;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.datatransfer.v1.DataTransferServiceClient;
import com.google.cloud.storage.Storage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context smoke test with the Google Cloud clients mocked out.
 */
@SpringBootTest
@DisplayName("BqSamplerApplication Tests")
class BqSamplerApplicationTests {

    @MockBean
    private BigQuery bigQuery;

    @MockBean
    private Storage storage;

    @MockBean
    private DataTransferServiceClient dataTransferServiceClient;

    @MockBean
    private CommandPublisher commandPublisher;

    @Autowired
    private CommandProcessor commandProcessor;

    @Autowired
    private SamplerProperties properties;

    @Test
    @DisplayName("Should start the context and bind the sampler properties")
    void testContextLoads() {
        assertNotNull(commandProcessor);
        assertEquals("target-project", properties.getTargetProjectId());
        assertEquals("europe-west3", properties.getTargetLocation());
        assertEquals("block-sampling", properties.getSamplingLockObjectPath());
        assertEquals(100, properties.getLocationCacheSize());
    }
}
