package com.shopadmin.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.global.web.PageResponse;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.audit.domain.AuditLog;
import com.shopadmin.backend.modules.audit.domain.DecisionOutcome;
import com.shopadmin.backend.modules.audit.domain.PermissionDecisionLog;
import com.shopadmin.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.shopadmin.backend.modules.audit.infrastructure.persistence.PermissionDecisionLogRepository;
import com.shopadmin.backend.modules.audit.presentation.dto.AdminAuditEntryResponse;
import com.shopadmin.backend.modules.audit.presentation.dto.DecisionAuditEntryResponse;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Paginated, newest-first reads over the decision log and the administrative change log.
 */
@Service
@Transactional(readOnly = true)
public class AuditQueryService {

    static final int MAX_PAGE_SIZE = 200;

    private final PermissionDecisionLogRepository decisionLogRepository;
    private final AuditLogRepository auditLogRepository;

    public AuditQueryService(PermissionDecisionLogRepository decisionLogRepository,
                             AuditLogRepository auditLogRepository) {
        this.decisionLogRepository = decisionLogRepository;
        this.auditLogRepository = auditLogRepository;
    }

    public PageResponse<DecisionAuditEntryResponse> queryDecisions(DecisionAuditQuery query, int page, int size) {
        validateRange(query.from(), query.to());
        PageRequest pageable = PageRequest.of(normalizePage(page), normalizeSize(size),
                Sort.by(Sort.Direction.DESC, "decidedAt").and(Sort.by("id")));
        Page<PermissionDecisionLog> result = decisionLogRepository.findAll(AuditSpecifications.decisions(query), pageable);
        return PageResponse.from(result.map(DecisionAuditEntryResponse::from));
    }

    public PageResponse<AdminAuditEntryResponse> queryAdminChanges(AdminAuditQuery query, int page, int size) {
        validateRange(query.from(), query.to());
        PageRequest pageable = PageRequest.of(normalizePage(page), normalizeSize(size),
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by("id")));
        Page<AuditLog> result = auditLogRepository.findAll(AuditSpecifications.adminChanges(query), pageable);
        return PageResponse.from(result.map(AdminAuditEntryResponse::from));
    }

    private static void validateRange(OffsetDateTime from, OffsetDateTime to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "invalid_range", "from must not be after to");
        }
    }

    private static int normalizePage(int page) {
        return Math.max(page, 0);
    }

    private static int normalizeSize(int size) {
        if (size < 1) {
            return 20;
        }
        return Math.min(size, MAX_PAGE_SIZE);
    }

    public record DecisionAuditQuery(
            UUID actorId,
            ResourceType resourceType,
            ActionType actionType,
            DecisionOutcome outcome,
            OffsetDateTime from,
            OffsetDateTime to
    ) {
    }

    public record AdminAuditQuery(
            UUID actorId,
            UUID targetUserId,
            AdminAuditResource resourceType,
            AdminAuditAction actionType,
            OffsetDateTime from,
            OffsetDateTime to
    ) {
    }
}
