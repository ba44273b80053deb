package com.shopadmin.backend.modules.permission.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which grant, if any, produced a verdict.
 */
public enum DecisionSource {
    USER_OVERRIDE("user-override"),
    ROLE("role"),
    NONE("none");

    private final String code;

    DecisionSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
