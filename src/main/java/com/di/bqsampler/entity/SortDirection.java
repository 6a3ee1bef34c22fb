package com.di.bqsampler.entity;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for anything other than ASC or DESC
     */
    public static SortDirection from(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (SortDirection direction : values()) {
                if (direction.name().equals(normalized)) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException(
                String.format("Sort direction must be ASC or DESC, got: '%s'", value));
    }
}
