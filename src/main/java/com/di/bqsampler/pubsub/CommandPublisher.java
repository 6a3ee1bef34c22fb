package com.di.bqsampler.pubsub;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Port for publishing JSON messages to a topic.
 */
public interface CommandPublisher {

    /**
     * Publishes {@code message} and blocks until the broker acknowledged it.
     *
     * @param topic full topic name, {@code projects/<project>/topics/<topic>}
     * @return the broker message id
     */
    String publish(JsonNode message, String topic);
}
