package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Message exchanged between the stages of the sampling workflow.
 *
 * <p>Commands are immutable. Each stage builds a fresh successor that carries the
 * {@code timestamp} of the triggering START.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class Command {

    private final CommandType type;
    private final long timestamp;

    protected Command(CommandType type, long timestamp) {
        if (type == null) {
            throw new IllegalArgumentException("Command type is required");
        }
        if (timestamp <= 0) {
            throw new IllegalArgumentException("Command timestamp must be positive, got: " + timestamp);
        }
        this.type = type;
        this.timestamp = timestamp;
    }

    /**
     * Wire form: {@code {"type": ..., "timestamp": ..., <type-specific fields>}}.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("type", type.name());
        node.put("timestamp", timestamp);
        writeFields(node);
        return node;
    }

    protected abstract void writeFields(ObjectNode node);
}
