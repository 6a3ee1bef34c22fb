package com.di.bqsampler.pubsub;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Body of a Pub/Sub push delivery:
 * <pre>
 * {"message": {"data": "&lt;base64&gt;", "messageId": "123", "publishTime": "2024-05-01T10:15:30.123Z"},
 *  "subscription": "projects/p/subscriptions/s"}
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PubSubPushEnvelope {

    private Message message;
    private String subscription;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String data;
        private String messageId;
        private String publishTime;
    }

    /**
     * @throws IllegalArgumentException when the envelope has no message data or the data is not base64
     */
    public byte[] decodedData() {
        if (message == null || message.getData() == null || message.getData().isEmpty()) {
            throw new IllegalArgumentException("Push envelope carries no message data");
        }
        return Base64.getDecoder().decode(message.getData());
    }

    /**
     * @return publish time in epoch seconds, or {@code fallback} when absent
     * @throws IllegalArgumentException when the publish time is not RFC 3339
     */
    public long publishEpochSeconds(long fallback) {
        if (message == null || message.getPublishTime() == null || message.getPublishTime().isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(message.getPublishTime()).getEpochSecond();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid publishTime: " + message.getPublishTime(), e);
        }
    }

    public String messageId() {
        return message != null ? message.getMessageId() : null;
    }
}
