package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A BigQuery Data Transfer run finished. {@code name} is the transfer config name and
 * {@code payload} is the run notification as published by the transfer service.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommandTransferRunDone extends Command {

    public static final String STATE_SUCCEEDED = "SUCCEEDED";

    private final String name;
    private final JsonNode payload;

    public CommandTransferRunDone(long timestamp, String name, JsonNode payload) {
        super(CommandType.TRANSFER_RUN_DONE, timestamp);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Transfer config name must be a non-empty string");
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Transfer run payload must be a JSON object");
        }
        this.name = name;
        this.payload = payload.deepCopy();
    }

    public String getState() {
        return JsonFields.isAbsent(payload, "state") ? null : payload.get("state").asText();
    }

    /**
     * @return {@code params.<field>} of the run payload, or null
     */
    public String getParam(String field) {
        JsonNode params = payload.get("params");
        return params == null || JsonFields.isAbsent(params, field) ? null : params.get(field).asText();
    }

    static CommandTransferRunDone fromJson(JsonNode node, long timestamp) {
        return new CommandTransferRunDone(
                timestamp,
                JsonFields.text(node, "name"),
                node.get("payload"));
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.put("name", name);
        node.set("payload", payload.deepCopy());
    }
}
