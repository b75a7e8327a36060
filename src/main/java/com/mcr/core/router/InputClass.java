package com.mcr.core.router;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Request class as decided by {@link InputClassifier}. The lowercase value is the
 * {@code inputType} stored with strategies and performance records.
 */
public enum InputClass {
    ASSERT("assert"),
    QUERY("query");

    private final String value;

    InputClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static InputClass fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Input class must not be null");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (InputClass c : values()) {
            if (c.value.equals(v)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown input class: " + value);
    }
}
