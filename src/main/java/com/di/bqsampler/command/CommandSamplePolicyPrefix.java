package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Processes every table policy under one {@code project/dataset/} prefix of the policy bucket.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommandSamplePolicyPrefix extends Command {

    private final String prefix;

    public CommandSamplePolicyPrefix(long timestamp, String prefix) {
        super(CommandType.SAMPLE_POLICY_PREFIX, timestamp);
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Policy prefix must be a non-empty string");
        }
        this.prefix = prefix;
    }

    static CommandSamplePolicyPrefix fromJson(JsonNode node, long timestamp) {
        return new CommandSamplePolicyPrefix(timestamp, JsonFields.text(node, "prefix"));
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.put("prefix", prefix);
    }
}
