package com.shopadmin.backend.modules.audit.domain;

public enum DecisionOutcome {
    ALLOW,
    DENY;

    public static DecisionOutcome of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }
}
