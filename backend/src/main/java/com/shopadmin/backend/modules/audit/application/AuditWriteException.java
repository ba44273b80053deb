package com.shopadmin.backend.modules.audit.application;

import com.shopadmin.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * An audit entry could not be persisted. Aborts the administrative change it belongs to.
 */
public class AuditWriteException extends ProblemException {

    public static final String CODE = "audit.write_failed";

    public AuditWriteException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, message, cause);
    }
}
