package com.shopadmin.backend.modules.permission.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of resource kinds a capability can target.
 */
public enum ResourceType {
    USER,
    BRAND,
    CATEGORY,
    PRODUCT,
    INVENTORY,
    UPLOAD,
    ORDER,
    ADDRESS,
    REVIEW,
    COUPON,
    POINT,
    BANNER,
    SLIDER,
    WISHLIST,
    SEARCH,
    NOTIFICATION,
    CUSTOMER,
    REPORT,
    SYSTEM,
    AUDIT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResourceType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("resource type must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ResourceType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown resource type: " + value);
    }
}
