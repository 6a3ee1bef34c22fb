package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a received message into a {@link Command}.
 *
 * <p>Messages without a {@code type} are tried as BigQuery Data Transfer run
 * notifications, which the transfer service publishes on the notification topic:
 * <pre>
 * {"name": "projects/123/locations/europe-west4/transferConfigs/abc/runs/def",
 *  "dataSourceId": "cross_region_copy",
 *  "params": {"source_project_id": "tgt-bq", "source_dataset_id": "trips_europe_west3_temp", ...},
 *  "state": "SUCCEEDED", ...}
 * </pre>
 */
@Slf4j
public final class CommandParser {

    static final Pattern TRANSFER_CONFIG_FROM_RUN_NAME = Pattern.compile(
            "^(projects/[^/\\s]+/locations/[^/\\s]+/transferConfigs/[^/\\s]+)/runs/\\S+$");

    private CommandParser() {}

    /**
     * @param data      raw message body (UTF-8 JSON)
     * @param timestamp positive epoch seconds, overrides any timestamp in the message
     */
    public static Command toCommand(byte[] data, long timestamp) {
        JsonNode value;
        try {
            value = JsonFields.MAPPER.readTree(data);
        } catch (IOException e) {
            throw new IllegalArgumentException("Command message is not valid JSON: " + e.getMessage(), e);
        }
        return toCommand(value, timestamp);
    }

    /**
     * @param value     message as a JSON object
     * @param timestamp positive epoch seconds, overrides any timestamp in the message
     * @throws IllegalArgumentException for unknown types, missing fields or a non-positive timestamp
     */
    public static Command toCommand(JsonNode value, long timestamp) {
        if (value == null || !value.isObject()) {
            throw new IllegalArgumentException("Expecting a JSON object as command, got: " + value);
        }
        if (timestamp <= 0) {
            throw new IllegalArgumentException("Timestamp must be positive, got: " + timestamp);
        }
        JsonNode typeNode = value.get("type");
        Optional<CommandType> type = CommandType.find(typeNode != null && typeNode.isTextual() ? typeNode.asText() : null);
        if (type.isEmpty()) {
            if (typeNode != null && !typeNode.isNull()) {
                throw new IllegalArgumentException(String.format(
                        "Command type <%s> is not supported. Argument: <%s>", typeNode, value));
            }
            return fromTransferRunNotification(value, timestamp)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Cannot create command without a type from argument <" + value + ">"));
        }
        switch (type.get()) {
            case START:
                return new CommandStart(timestamp);
            case SAMPLE_POLICY_PREFIX:
                return CommandSamplePolicyPrefix.fromJson(value, timestamp);
            case SAMPLE_START:
                return CommandSampleStart.fromJson(value, timestamp);
            case SAMPLE_DONE:
                return CommandSampleDone.fromJson(value, timestamp);
            case TRANSFER_RUN_DONE:
                return CommandTransferRunDone.fromJson(value, timestamp);
            case REMOVE_DATASET:
                return CommandRemoveDataset.fromJson(value, timestamp);
            default:
                throw new IllegalArgumentException("Command type <" + type.get() + "> is not supported");
        }
    }

    private static Optional<CommandTransferRunDone> fromTransferRunNotification(JsonNode value, long timestamp) {
        JsonNode runName = value.get("name");
        JsonNode dataSourceId = value.get("dataSourceId");
        JsonNode params = value.get("params");
        if (runName == null || !runName.isTextual()
                || dataSourceId == null || !dataSourceId.isTextual()
                || params == null || !params.isObject()) {
            return Optional.empty();
        }
        Matcher matcher = TRANSFER_CONFIG_FROM_RUN_NAME.matcher(runName.asText());
        if (!matcher.matches()) {
            log.warn("[PARSER] Transfer run name <{}> does not match {}", runName.asText(), TRANSFER_CONFIG_FROM_RUN_NAME);
            return Optional.empty();
        }
        ObjectNode payload = value.deepCopy();
        return Optional.of(new CommandTransferRunDone(timestamp, matcher.group(1), payload));
    }
}
