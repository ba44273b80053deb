package com.shopadmin.backend.modules.permission.domain;

import java.util.Objects;

/**
 * Outcome of one permission check.
 * <p>
 * A decision is allowed only when a grant produced it, so {@code allowed} always implies a
 * source other than {@link DecisionSource#NONE}. {@code infrastructureFailure} marks the
 * fail-closed denial emitted when a store could not be read.
 */
public record PermissionDecision(boolean allowed, DecisionSource source, String reason, boolean infrastructureFailure) {

    public static final String REASON_UNKNOWN_CAPABILITY = "unknown or inactive capability";
    public static final String REASON_NO_GRANT = "no role or user grant";
    public static final String REASON_CHECK_UNAVAILABLE = "permission check unavailable";

    public PermissionDecision {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reason, "reason");
        if (allowed && source == DecisionSource.NONE) {
            throw new IllegalArgumentException("an allowed decision needs a grant source");
        }
        if (allowed && infrastructureFailure) {
            throw new IllegalArgumentException("an infrastructure failure cannot allow");
        }
    }

    public static PermissionDecision unknownCapability() {
        return new PermissionDecision(false, DecisionSource.NONE, REASON_UNKNOWN_CAPABILITY, false);
    }

    public static PermissionDecision noGrant() {
        return new PermissionDecision(false, DecisionSource.NONE, REASON_NO_GRANT, false);
    }

    public static PermissionDecision checkUnavailable() {
        return new PermissionDecision(false, DecisionSource.NONE, REASON_CHECK_UNAVAILABLE, true);
    }

    public static PermissionDecision overrideAllowed(String overrideReason) {
        return new PermissionDecision(true, DecisionSource.USER_OVERRIDE,
                withDetail("granted by user override", overrideReason), false);
    }

    public static PermissionDecision overrideDenied(String overrideReason) {
        return new PermissionDecision(false, DecisionSource.USER_OVERRIDE,
                withDetail("denied by user override", overrideReason), false);
    }

    public static PermissionDecision roleAllowed(String roleCode) {
        return new PermissionDecision(true, DecisionSource.ROLE, "granted by role " + roleCode, false);
    }

    private static String withDetail(String base, String detail) {
        if (detail == null || detail.isBlank()) {
            return base;
        }
        return base + ": " + detail.trim();
    }
}
