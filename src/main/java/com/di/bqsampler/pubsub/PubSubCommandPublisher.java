package com.di.bqsampler.pubsub;

import com.di.bqsampler.entity.JsonFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandPublisher} on Google Cloud Pub/Sub. One {@link Publisher} is created
 * per topic on first use and shut down with the application context.
 */
@Slf4j
@Component
public class PubSubCommandPublisher implements CommandPublisher {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Map<String, Publisher> publishers = new ConcurrentHashMap<>();

    @Override
    public String publish(JsonNode message, String topic) {
        byte[] data;
        try {
            data = JsonFields.MAPPER.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message cannot be serialized: " + e.getMessage(), e);
        }
        PubsubMessage pubsubMessage = PubsubMessage.newBuilder().setData(ByteString.copyFrom(data)).build();
        try {
            String messageId = publisher(topic).publish(pubsubMessage).get();
            log.debug("[PUBSUB] Published {} to {}", messageId, topic);
            return messageId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Publishing to " + topic + " failed: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }

    private Publisher publisher(String topic) {
        return publishers.computeIfAbsent(topic, name -> {
            try {
                log.info("[PUBSUB] Creating publisher for {}", name);
                return Publisher.newBuilder(TopicName.parse(name)).build();
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create publisher for " + name, e);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        publishers.forEach((topic, publisher) -> {
            publisher.shutdown();
            try {
                publisher.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[PUBSUB] Interrupted shutting down publisher for {}", topic);
            }
        });
        publishers.clear();
    }
}
