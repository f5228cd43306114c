package com.myinfra.gateway.accessgateway.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the pattern string of a route mapping is interpreted.
 */
public enum PatternKind {
    REGEX,
    GLOB,
    EXACT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when reading configuration. Missing or unknown kinds fall back to {@link #REGEX}.
     */
    @JsonCreator
    public static PatternKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return REGEX;
        }
        for (PatternKind kind : values()) {
            if (kind.value().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return REGEX;
    }
}
