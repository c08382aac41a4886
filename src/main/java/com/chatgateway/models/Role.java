package com.chatgateway.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    SYSTEM,
    USER,
    ASSISTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Role parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("role is required");
        }
        String normalized = value.trim().toLowerCase();
        if ("model".equals(normalized)) {
            return ASSISTANT;
        }
        return Role.valueOf(normalized.toUpperCase());
    }
}
