package com.treeds.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Layout of node records written by {@link TreeJsonCodec}. Both layouts are accepted when reading.
 */
public enum SerializationMode {
    /** {@code node_id}, {@code value}, {@code children}, {@code parent}. */
    FULL,
    /** {@code node_id}, {@code value}, {@code parent}; children are rebuilt from parent ids on read. */
    COMPACT;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static SerializationMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Serialization mode must not be blank");
        }
        for (SerializationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown serialization mode: " + value);
    }
}
