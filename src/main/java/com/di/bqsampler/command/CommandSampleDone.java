package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.entity.TableSample;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a {@link CommandSampleStart}. {@code amountInserted} is the row count of the
 * table written by the sampling statement, which may be below the requested amount.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommandSampleDone extends CommandSampleStart {

    private final long startTimestamp;
    private final long endTimestamp;
    private final String errorMessage;
    private final Long amountInserted;

    public CommandSampleDone(long timestamp, TableSample sampleRequest, TableReference targetTable,
                             long startTimestamp, long endTimestamp,
                             String errorMessage, Long amountInserted) {
        super(CommandType.SAMPLE_DONE, timestamp, sampleRequest, targetTable);
        if (startTimestamp <= 0 || endTimestamp <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Start and end timestamps must be positive, got: %d and %d", startTimestamp, endTimestamp));
        }
        if (amountInserted != null && amountInserted < 0) {
            throw new IllegalArgumentException("Amount inserted must not be negative, got: " + amountInserted);
        }
        this.startTimestamp = startTimestamp;
        this.endTimestamp = endTimestamp;
        this.errorMessage = errorMessage != null ? errorMessage : "";
        this.amountInserted = amountInserted;
    }

    public boolean hasError() {
        return !errorMessage.isEmpty();
    }

    static CommandSampleDone fromJson(JsonNode node, long timestamp) {
        Long start = JsonFields.longValue(node, "start_timestamp");
        Long end = JsonFields.longValue(node, "end_timestamp");
        if (start == null || end == null) {
            throw new IllegalArgumentException("SAMPLE_DONE requires start_timestamp and end_timestamp");
        }
        return new CommandSampleDone(
                timestamp,
                JsonFields.required(node, "sample_request", TableSample::fromJson, CommandSampleDone.class),
                JsonFields.required(node, "target_table", TableReference::fromJson, CommandSampleDone.class),
                start,
                end,
                JsonFields.text(node, "error_message"),
                JsonFields.longValue(node, "amount_inserted"));
    }

    @Override
    protected void writeFields(ObjectNode node) {
        super.writeFields(node);
        node.put("start_timestamp", startTimestamp);
        node.put("end_timestamp", endTimestamp);
        node.put("error_message", errorMessage);
        JsonFields.putIfPresent(node, "amount_inserted", amountInserted);
    }
}
