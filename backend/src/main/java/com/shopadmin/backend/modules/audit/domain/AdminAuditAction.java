package com.shopadmin.backend.modules.audit.domain;

public enum AdminAuditAction {
    CREATE,
    UPDATE,
    DELETE,
    GRANT,
    REVOKE,
    ASSIGN
}
