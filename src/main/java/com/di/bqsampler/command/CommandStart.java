package com.di.bqsampler.command;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Trigger of a sampling run.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommandStart extends Command {

    public CommandStart(long timestamp) {
        super(CommandType.START, timestamp);
    }

    @Override
    protected void writeFields(ObjectNode node) {
        // no payload
    }
}
