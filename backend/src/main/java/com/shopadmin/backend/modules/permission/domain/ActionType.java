package com.shopadmin.backend.modules.permission.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {
    READ,
    WRITE,
    DELETE,
    MANAGE,
    ADMIN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action type must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown action type: " + value);
    }
}
