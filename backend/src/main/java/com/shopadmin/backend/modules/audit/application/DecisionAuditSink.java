package com.shopadmin.backend.modules.audit.application;

/**
 * Destination for permission decision audit entries.
 * <p>
 * Implementations must not throw: a failure to audit is reported through logs and metrics and
 * never changes the verdict returned to the caller.
 */
public interface DecisionAuditSink {

    void record(DecisionAuditEntry entry);
}
