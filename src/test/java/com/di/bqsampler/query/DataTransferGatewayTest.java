package com.di.bqsampler.query;

import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.entity.TableReference;
import com.google.cloud.bigquery.datatransfer.v1.CreateTransferConfigRequest;
import com.google.cloud.bigquery.datatransfer.v1.DataTransferServiceClient;
import com.google.cloud.bigquery.datatransfer.v1.ListTransferConfigsRequest;
import com.google.cloud.bigquery.datatransfer.v1.StartManualTransferRunsRequest;
import com.google.cloud.bigquery.datatransfer.v1.TransferConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Test cases for DataTransferGateway against a mocked transfer client.
 */
@DisplayName("DataTransferGateway Tests")
class DataTransferGatewayTest {

    private static final long NOW = 1_700_000_000L;
    private static final String CONFIG_NAME = "projects/123/locations/europe-west3/transferConfigs/abc";
    private static final TableReference TARGET = TableReference.parse("tgt-project.sales.orders@europe-west3");

    private DataTransferServiceClient client;
    private SamplerProperties properties;
    private DataTransferGateway gateway;

    @BeforeEach
    void setUp() {
        client = mock(DataTransferServiceClient.class);
        properties = new SamplerProperties();
        gateway = new DataTransferGateway(client, properties,
                Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should create an unscheduled cross-region copy and start one run")
    void testStartCrossLocationCopy() {
        properties.setTransferServiceAccount("sampler@tgt-project.iam.gserviceaccount.com");
        when(client.createTransferConfig(any(CreateTransferConfigRequest.class)))
                .thenReturn(TransferConfig.newBuilder().setName(CONFIG_NAME).build());

        String name = gateway.startCrossLocationCopy("tgt-project", "sales_US_temp", TARGET,
                "projects/tgt-project/topics/transfers");

        assertEquals(CONFIG_NAME, name);
        ArgumentCaptor<CreateTransferConfigRequest> created = ArgumentCaptor.forClass(CreateTransferConfigRequest.class);
        verify(client).createTransferConfig(created.capture());
        CreateTransferConfigRequest request = created.getValue();
        assertEquals("projects/tgt-project/locations/europe-west3", request.getParent());
        assertEquals("sampler@tgt-project.iam.gserviceaccount.com", request.getServiceAccountName());

        TransferConfig config = request.getTransferConfig();
        assertEquals("cross_region_copy", config.getDataSourceId());
        assertEquals("sales", config.getDestinationDatasetId());
        assertEquals("projects/tgt-project/topics/transfers", config.getNotificationPubsubTopic());
        assertTrue(config.getScheduleOptions().getDisableAutoScheduling());
        assertEquals("sales_US_temp", config.getParams().getFieldsOrThrow("source_dataset_id").getStringValue());
        assertEquals("tgt-project", config.getParams().getFieldsOrThrow("source_project_id").getStringValue());
        assertTrue(config.getParams().getFieldsOrThrow("overwrite_destination_table").getBoolValue());

        ArgumentCaptor<StartManualTransferRunsRequest> runs =
                ArgumentCaptor.forClass(StartManualTransferRunsRequest.class);
        verify(client).startManualTransferRuns(runs.capture());
        assertEquals(CONFIG_NAME, runs.getValue().getParent());
        assertEquals(NOW, runs.getValue().getRequestedRunTime().getSeconds());
    }

    @Test
    @DisplayName("Should require a target location")
    void testStartCrossLocationCopy_NoLocation() {
        assertThrows(IllegalArgumentException.class, () -> gateway.startCrossLocationCopy(
                "tgt-project", "sales_US_temp", TARGET.withLocation(null), null));
        verify(client, never()).createTransferConfig(any(CreateTransferConfigRequest.class));
    }

    @Test
    @DisplayName("Should reject malformed config names without calling the service")
    void testRemoveTransferConfig_InvalidName() {
        assertThrows(IllegalArgumentException.class, () -> gateway.removeTransferConfig("transferConfigs/abc"));
        assertThrows(IllegalArgumentException.class, () -> gateway.removeTransferConfig(CONFIG_NAME + "/runs/r1"));
        assertThrows(IllegalArgumentException.class, () -> gateway.removeTransferConfig(null));
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("Should delete a well-formed config name")
    void testRemoveTransferConfig() {
        gateway.removeTransferConfig(CONFIG_NAME);

        verify(client).deleteTransferConfig(CONFIG_NAME);
    }

    @Test
    @DisplayName("Should delete only cross-region copy configs")
    void testRemoveAllTransferConfigs() {
        DataTransferServiceClient.ListTransferConfigsPagedResponse response =
                mock(DataTransferServiceClient.ListTransferConfigsPagedResponse.class);
        TransferConfig copy = TransferConfig.newBuilder()
                .setName(CONFIG_NAME).setDataSourceId("cross_region_copy").build();
        TransferConfig scheduled = TransferConfig.newBuilder()
                .setName("projects/123/locations/europe-west3/transferConfigs/other")
                .setDataSourceId("scheduled_query").build();
        when(response.iterateAll()).thenReturn(List.of(copy, scheduled));
        when(client.listTransferConfigs(any(ListTransferConfigsRequest.class))).thenReturn(response);

        assertEquals(1, gateway.removeAllTransferConfigs("tgt-project", "europe-west3"));
        verify(client).deleteTransferConfig(CONFIG_NAME);
        verify(client, never()).deleteTransferConfig("projects/123/locations/europe-west3/transferConfigs/other");
    }
}
