package com.di.bqsampler.command;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stages of the sampling workflow. START fans out into one SAMPLE_POLICY_PREFIX per
 * {@code project/dataset/} prefix, which fans out into one SAMPLE_START per table,
 * which ends in SAMPLE_DONE. TRANSFER_RUN_DONE and REMOVE_DATASET clean up after a
 * cross-location copy.
 */
public enum CommandType {
    START,
    SAMPLE_POLICY_PREFIX,
    SAMPLE_START,
    SAMPLE_DONE,
    TRANSFER_RUN_DONE,
    REMOVE_DATASET;

    private static final Map<String, CommandType> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(
                    t -> t.name().toLowerCase(Locale.ROOT), Function.identity())));

    /**
     * Case-insensitive lookup; empty for null or unknown names.
     */
    public static Optional<CommandType> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
