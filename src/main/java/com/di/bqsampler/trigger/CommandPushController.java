package com.di.bqsampler.trigger;

import com.di.bqsampler.command.Command;
import com.di.bqsampler.command.CommandParser;
import com.di.bqsampler.process.CommandProcessor;
import com.di.bqsampler.pubsub.PubSubPushEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Pub/Sub push endpoint of the command subscription. A 2xx response acknowledges the
 * message; any error response makes Pub/Sub redeliver it.
 */
@Slf4j
@RestController
@RequestMapping("/api/sampler")
@RequiredArgsConstructor
public class CommandPushController {

    private static final String MESSAGE_ID = "messageId";
    private static final String COMMAND_TYPE = "commandType";

    private final CommandProcessor processor;
    private final Clock clock;

    @PostMapping(path = "/commands", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> receive(@RequestBody PubSubPushEnvelope envelope) {
        String messageId = envelope.messageId();
        if (messageId != null) {
            MDC.put(MESSAGE_ID, messageId);
        }
        try {
            long timestamp = envelope.publishEpochSeconds(clock.instant().getEpochSecond());
            Command command = CommandParser.toCommand(envelope.decodedData(), timestamp);
            MDC.put(COMMAND_TYPE, command.getType().name());
            log.info("[PUSH] Received {} from {}", command.getType(), envelope.getSubscription());
            processor.process(command);
            return ResponseEntity.ok("OK");
        } finally {
            MDC.remove(MESSAGE_ID);
            MDC.remove(COMMAND_TYPE);
        }
    }
}
