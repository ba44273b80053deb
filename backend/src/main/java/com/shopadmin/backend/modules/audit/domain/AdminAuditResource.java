package com.shopadmin.backend.modules.audit.domain;

public enum AdminAuditResource {
    PERMISSION,
    ROLE,
    ROLE_PERMISSION,
    USER_PERMISSION,
    USER_ROLE
}
