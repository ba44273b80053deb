package com.shopadmin.backend.modules.audit.application;

import java.util.List;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes each decision entry before the check returns. Latency of the audit store is added to
 * every permission check; the JDBC query timeout bounds it.
 */
@Component
@ConditionalOnProperty(name = "app.authorization.audit.mode", havingValue = "sync")
public class SynchronousDecisionAuditSink implements DecisionAuditSink {

    private static final Logger log = LoggerFactory.getLogger(SynchronousDecisionAuditSink.class);

    private final DecisionAuditWriter writer;
    private final Counter written;
    private final Counter writeFailures;

    public SynchronousDecisionAuditSink(DecisionAuditWriter writer, MeterRegistry meterRegistry) {
        this.writer = writer;
        this.written = Counter.builder("authz.audit.written")
                .description("Decision audit entries persisted")
                .register(meterRegistry);
        this.writeFailures = Counter.builder("authz.audit.write_failures")
                .description("Failed attempts to persist decision audit entries")
                .register(meterRegistry);
    }

    @Override
    public void record(DecisionAuditEntry entry) {
        try {
            writer.write(List.of(entry));
            written.increment();
        } catch (RuntimeException ex) {
            writeFailures.increment();
            log.error("[ALERT][Audit] decision audit write failed actor={} capability={}.{} allowed={}",
                    entry.actorId(), entry.resourceType().code(), entry.actionType().code(), entry.allowed(), ex);
        }
    }
}
