package com.shopadmin.backend.modules.audit.application;

import java.util.List;

import com.shopadmin.backend.modules.audit.domain.DecisionOutcome;
import com.shopadmin.backend.modules.audit.domain.PermissionDecisionLog;
import com.shopadmin.backend.modules.audit.infrastructure.persistence.PermissionDecisionLogRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
public class DecisionAuditWriter {

    private static final int MAX_REASON_LENGTH = 500;
    private static final int MAX_RESOURCE_ID_LENGTH = 128;

    private final PermissionDecisionLogRepository repository;

    public DecisionAuditWriter(PermissionDecisionLogRepository repository) {
        this.repository = repository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void write(List<DecisionAuditEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<PermissionDecisionLog> rows = entries.stream()
                .map(DecisionAuditWriter::toRow)
                .toList();
        repository.saveAll(rows);
    }

    private static PermissionDecisionLog toRow(DecisionAuditEntry entry) {
        PermissionDecisionLog row = new PermissionDecisionLog(
                entry.actorId(),
                entry.resourceType(),
                entry.actionType(),
                truncate(entry.resourceId(), MAX_RESOURCE_ID_LENGTH),
                DecisionOutcome.of(entry.allowed()),
                entry.source(),
                truncate(entry.reason(), MAX_REASON_LENGTH),
                entry.infrastructureFailure(),
                entry.decidedAt()
        );
        row.attachRequest(entry.request().clientIp(), entry.request().userAgent(), entry.request().requestId());
        return row;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
