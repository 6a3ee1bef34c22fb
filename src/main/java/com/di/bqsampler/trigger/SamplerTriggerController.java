package com.di.bqsampler.trigger;

import com.di.bqsampler.command.CommandStart;
import com.di.bqsampler.config.SamplerProperties;
import com.di.bqsampler.pubsub.CommandPublisher;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Starts a sampling run by publishing START to the command topic. Meant for schedulers
 * (e.g. Cloud Scheduler HTTP targets) and operators.
 */
@Slf4j
@RestController
@RequestMapping("/api/sampler")
@RequiredArgsConstructor
public class SamplerTriggerController {

    private final CommandPublisher publisher;
    private final SamplerProperties properties;
    private final Clock clock;

    @PostMapping(path = "/trigger", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JsonNode> trigger() {
        CommandStart start = new CommandStart(clock.instant().getEpochSecond());
        JsonNode message = start.toJson();
        String messageId = publisher.publish(message, properties.getCommandTopic());
        log.info("[TRIGGER] Published START {} to {}", messageId, properties.getCommandTopic());
        return ResponseEntity.accepted().body(message);
    }
}
