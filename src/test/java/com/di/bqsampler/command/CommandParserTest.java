package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.di.bqsampler.entity.Sample;
import com.di.bqsampler.entity.SampleSpec;
import com.di.bqsampler.entity.SizeSpec;
import com.di.bqsampler.entity.SortDirection;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.entity.TableSample;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for CommandParser.
 */
@DisplayName("CommandParser Tests")
class CommandParserTest {

    private static final long TS = 1_700_000_000L;

    private static final String TRANSFER_NOTIFICATION = "{"
            + "\"name\": \"projects/123/locations/europe-west3/transferConfigs/abc-1/runs/run-9\","
            + "\"dataSourceId\": \"cross_region_copy\","
            + "\"state\": \"SUCCEEDED\","
            + "\"params\": {\"source_project_id\": \"tgt-bq\", \"source_dataset_id\": \"trips_us_temp\"}}";

    private static JsonNode json(String text) throws Exception {
        return JsonFields.MAPPER.readTree(text);
    }

    // ============================================================================
    // Typed commands
    // ============================================================================

    @Test
    @DisplayName("Should parse START case-insensitively")
    void testToCommand_Start() throws Exception {
        Command command = CommandParser.toCommand(json("{\"type\": \"start\"}"), TS);
        assertEquals(new CommandStart(TS), command);
    }

    @Test
    @DisplayName("Should override the message timestamp with the given one")
    void testToCommand_TimestampOverride() throws Exception {
        Command command = CommandParser.toCommand(
                json("{\"type\": \"SAMPLE_POLICY_PREFIX\", \"timestamp\": 5, \"prefix\": \"p/d/\"}"), TS);
        assertEquals(new CommandSamplePolicyPrefix(TS, "p/d/"), command);
    }

    @Test
    @DisplayName("Should parse what SAMPLE_DONE serializes to")
    void testToCommand_SampleDone() {
        TableSample request = new TableSample(TableReference.parse("src.d.t@US"),
                new Sample(SizeSpec.ofCount(42), SampleSpec.sorted("id", SortDirection.ASC)));
        CommandSampleDone done = new CommandSampleDone(TS, request, TableReference.parse("tgt.d.t@EU"),
                TS + 1, TS + 30, "", 40L);

        Command parsed = CommandParser.toCommand(done.toJson().toString().getBytes(StandardCharsets.UTF_8), TS);

        assertEquals(done, parsed);
        assertFalse(((CommandSampleDone) parsed).hasError());
    }

    @Test
    @DisplayName("Should parse REMOVE_DATASET")
    void testToCommand_RemoveDataset() throws Exception {
        Command command = CommandParser.toCommand(
                json("{\"type\": \"REMOVE_DATASET\", \"project_id\": \"p\", \"dataset_id\": \"d_temp\"}"), TS);
        assertEquals(new CommandRemoveDataset(TS, "p", "d_temp"), command);
    }

    @Test
    @DisplayName("Should parse what SAMPLE_START serializes to")
    void testToCommand_SampleStartRoundTrip() {
        TableSample request = new TableSample(TableReference.parse("src-project.sales.orders@US"),
                new Sample(SizeSpec.ofCount(100), SampleSpec.sorted("order_id", SortDirection.DESC)));
        CommandSampleStart start = new CommandSampleStart(TS, request,
                TableReference.parse("tgt-project.sales.orders@europe-west3"));

        assertEquals(start, CommandParser.toCommand(start.toJson(), TS));
    }

    @Test
    @DisplayName("Should parse what TRANSFER_RUN_DONE serializes to")
    void testToCommand_TransferRunDoneRoundTrip() throws Exception {
        CommandTransferRunDone done = new CommandTransferRunDone(TS,
                "projects/123/locations/europe-west3/transferConfigs/abc-1", json(TRANSFER_NOTIFICATION));

        Command parsed = CommandParser.toCommand(done.toJson(), TS);

        assertEquals(done, parsed);
        assertEquals("tgt-bq", ((CommandTransferRunDone) parsed).getParam("source_project_id"));
    }

    @Test
    @DisplayName("Should reject SAMPLE_START without a target table")
    void testToCommand_SampleStartMissingTarget() throws Exception {
        String request = new TableSample(TableReference.of("p", "d", "t"), Sample.EMPTY).toJson().toString();
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> CommandParser.toCommand(
                json("{\"type\": \"SAMPLE_START\", \"sample_request\": " + request + "}"), TS));
        assertTrue(ex.getMessage().contains("target_table"));
    }

    // ============================================================================
    // Transfer run notifications
    // ============================================================================

    @Test
    @DisplayName("Should turn a transfer run notification into TRANSFER_RUN_DONE")
    void testToCommand_TransferRunNotification() throws Exception {
        Command command = CommandParser.toCommand(json(TRANSFER_NOTIFICATION), TS);

        CommandTransferRunDone done = assertInstanceOf(CommandTransferRunDone.class, command);
        assertEquals("projects/123/locations/europe-west3/transferConfigs/abc-1", done.getName());
        assertEquals(CommandTransferRunDone.STATE_SUCCEEDED, done.getState());
        assertEquals("trips_us_temp", done.getParam("source_dataset_id"));
        assertNull(done.getParam("missing"));
    }

    @Test
    @DisplayName("Should reject an untyped message that is not a transfer notification")
    void testToCommand_UntypedNotNotification() {
        assertThrows(IllegalArgumentException.class,
                () -> CommandParser.toCommand(json("{\"name\": \"projects/1/runs\"}"), TS));
    }

    // ============================================================================
    // Invalid input
    // ============================================================================

    @Test
    @DisplayName("Should reject unknown command types")
    void testToCommand_UnknownType() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> CommandParser.toCommand(json("{\"type\": \"SAMPLE_EVERYTHING\"}"), TS));
        assertTrue(ex.getMessage().contains("is not supported"));
    }

    @Test
    @DisplayName("Should reject invalid JSON, non-objects and non-positive timestamps")
    void testToCommand_InvalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> CommandParser.toCommand("{oops".getBytes(StandardCharsets.UTF_8), TS));
        assertThrows(IllegalArgumentException.class, () -> CommandParser.toCommand(json("[]"), TS));
        assertThrows(IllegalArgumentException.class, () -> CommandParser.toCommand(json("{\"type\": \"START\"}"), 0));
    }

    @Test
    @DisplayName("Should serialize type and timestamp first")
    void testToJson_Envelope() {
        assertEquals("{\"type\":\"START\",\"timestamp\":1700000000}", new CommandStart(TS).toJson().toString());
    }
}
