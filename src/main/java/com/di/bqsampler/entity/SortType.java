package com.di.bqsampler.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * How rows are picked from the source table.
 */
public enum SortType {

    /** Probabilistic block sampling. */
    RANDOM("random"),
    /** Full scan ordered by a column. */
    SORTED("sorted");

    private static final Map<String, SortType> BY_VALUE = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(t -> t.value, Function.identity())));

    private final String value;

    SortType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SortType defaultType() {
        return RANDOM;
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static SortType from(String value) {
        SortType type = value == null ? null : BY_VALUE.get(value.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new IllegalArgumentException(
                    String.format("Unknown sort type '%s'. Valid values: %s", value, BY_VALUE.keySet()));
        }
        return type;
    }
}
