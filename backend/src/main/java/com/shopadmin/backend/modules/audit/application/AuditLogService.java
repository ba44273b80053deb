package com.shopadmin.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.shopadmin.backend.global.web.ClientRequestContext;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.audit.domain.AuditLog;
import com.shopadmin.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes administrative audit entries inside the caller's transaction, so a change and its
 * entry commit or roll back together.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        ClientRequestContext context = ClientRequestContext.current();

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setTargetUserId(command.targetUserId());
        auditLog.setClientIp(context.clientIp());
        auditLog.setUserAgent(context.userAgent());
        auditLog.setRequestId(context.requestId());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new LinkedHashMap<>(command.detail()));
        }

        try {
            auditLogRepository.saveAndFlush(auditLog);
        } catch (DataAccessException ex) {
            log.error("[ALERT][Audit] admin audit write failed action={} resource={} key={}",
                    command.actionType(), command.resourceType(), command.resourceKey(), ex);
            throw new AuditWriteException("Failed to write audit entry for "
                    + command.resourceType() + " " + command.resourceKey(), ex);
        }
    }

    public record AuditLogCommand(
            AdminAuditAction actionType,
            AdminAuditResource resourceType,
            String resourceKey,
            UUID actorUserId,
            UUID targetUserId,
            Map<String, Object> detail
    ) {
    }
}
