package com.di.bqsampler.util;

import com.di.bqsampler.command.CommandType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for command processing and sample materialisation.
 */
@Slf4j
@Component
public class SamplerMetrics {

    private final Map<CommandType, Counter> processedCounters = new EnumMap<>(CommandType.class);
    private final Map<CommandType, Counter> failedCounters = new EnumMap<>(CommandType.class);
    private final Map<CommandType, Timer> durationTimers = new EnumMap<>(CommandType.class);
    private final DistributionSummary rowsInserted;

    public SamplerMetrics(MeterRegistry meterRegistry) {
        for (CommandType type : CommandType.values()) {
            String tag = type.name();
            processedCounters.put(type, Counter.builder("bqsampler.commands.processed")
                    .description("Commands processed successfully")
                    .tag("type", tag)
                    .register(meterRegistry));
            failedCounters.put(type, Counter.builder("bqsampler.commands.failed")
                    .description("Commands whose handler raised an error")
                    .tag("type", tag)
                    .register(meterRegistry));
            durationTimers.put(type, Timer.builder("bqsampler.command.duration")
                    .description("Time spent handling a command")
                    .tag("type", tag)
                    .register(meterRegistry));
        }

        this.rowsInserted = DistributionSummary.builder("bqsampler.samples.rows.inserted")
                .description("Rows written per sample table")
                .baseUnit("rows")
                .register(meterRegistry);
    }

    // ============================================================================
    // Commands
    // ============================================================================

    public void recordProcessed(CommandType type, long durationMs) {
        processedCounters.get(type).increment();
        durationTimers.get(type).record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded {} processed: durationMs={}", type, durationMs);
    }

    public void recordFailed(CommandType type, long durationMs) {
        failedCounters.get(type).increment();
        durationTimers.get(type).record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded {} failed: durationMs={}", type, durationMs);
    }

    // ============================================================================
    // Samples
    // ============================================================================

    public void recordRowsInserted(long rows) {
        rowsInserted.record(rows);
    }
}
