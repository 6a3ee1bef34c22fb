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
 * Samples one table: {@code sample_request} is already policy compliant and carries an
 * absolute count; {@code target_table} is where the rows go.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommandSampleStart extends Command {

    private final TableSample sampleRequest;
    private final TableReference targetTable;

    public CommandSampleStart(long timestamp, TableSample sampleRequest, TableReference targetTable) {
        this(CommandType.SAMPLE_START, timestamp, sampleRequest, targetTable);
    }

    protected CommandSampleStart(CommandType type, long timestamp,
                                 TableSample sampleRequest, TableReference targetTable) {
        super(type, timestamp);
        if (sampleRequest == null) {
            throw new IllegalArgumentException("Sample request is required");
        }
        if (targetTable == null) {
            throw new IllegalArgumentException("Target table is required");
        }
        this.sampleRequest = sampleRequest;
        this.targetTable = targetTable;
    }

    static CommandSampleStart fromJson(JsonNode node, long timestamp) {
        return new CommandSampleStart(
                timestamp,
                JsonFields.required(node, "sample_request", TableSample::fromJson, CommandSampleStart.class),
                JsonFields.required(node, "target_table", TableReference::fromJson, CommandSampleStart.class));
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.set("sample_request", sampleRequest.toJson());
        node.set("target_table", targetTable.toJson());
    }
}
