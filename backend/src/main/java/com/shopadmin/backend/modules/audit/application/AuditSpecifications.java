package com.shopadmin.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.audit.domain.AuditLog;
import com.shopadmin.backend.modules.audit.domain.DecisionOutcome;
import com.shopadmin.backend.modules.audit.domain.PermissionDecisionLog;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import org.springframework.data.jpa.domain.Specification;

final class AuditSpecifications {

    private AuditSpecifications() {
    }

    static Specification<PermissionDecisionLog> decisions(AuditQueryService.DecisionAuditQuery query) {
        return Specification.where(decisionActor(query.actorId()))
                .and(decisionResource(query.resourceType()))
                .and(decisionAction(query.actionType()))
                .and(decisionOutcome(query.outcome()))
                .and(decidedBetween(query.from(), query.to()));
    }

    static Specification<AuditLog> adminChanges(AuditQueryService.AdminAuditQuery query) {
        return Specification.where(changeActor(query.actorId()))
                .and(changeTarget(query.targetUserId()))
                .and(changeResource(query.resourceType()))
                .and(changeAction(query.actionType()))
                .and(createdBetween(query.from(), query.to()));
    }

    private static Specification<PermissionDecisionLog> decisionActor(UUID actorId) {
        return (root, q, cb) -> actorId == null ? null : cb.equal(root.get("actorUserId"), actorId);
    }

    private static Specification<PermissionDecisionLog> decisionResource(ResourceType resourceType) {
        return (root, q, cb) -> resourceType == null ? null : cb.equal(root.get("resourceType"), resourceType);
    }

    private static Specification<PermissionDecisionLog> decisionAction(ActionType actionType) {
        return (root, q, cb) -> actionType == null ? null : cb.equal(root.get("actionType"), actionType);
    }

    private static Specification<PermissionDecisionLog> decisionOutcome(DecisionOutcome outcome) {
        return (root, q, cb) -> outcome == null ? null : cb.equal(root.get("outcome"), outcome);
    }

    private static Specification<PermissionDecisionLog> decidedBetween(OffsetDateTime from, OffsetDateTime to) {
        return (root, q, cb) -> {
            if (from != null && to != null) {
                return cb.between(root.get("decidedAt"), from, to);
            }
            if (from != null) {
                return cb.greaterThanOrEqualTo(root.get("decidedAt"), from);
            }
            if (to != null) {
                return cb.lessThanOrEqualTo(root.get("decidedAt"), to);
            }
            return null;
        };
    }

    private static Specification<AuditLog> changeActor(UUID actorId) {
        return (root, q, cb) -> actorId == null ? null : cb.equal(root.get("actorUserId"), actorId);
    }

    private static Specification<AuditLog> changeTarget(UUID targetUserId) {
        return (root, q, cb) -> targetUserId == null ? null : cb.equal(root.get("targetUserId"), targetUserId);
    }

    private static Specification<AuditLog> changeResource(AdminAuditResource resourceType) {
        return (root, q, cb) -> resourceType == null ? null : cb.equal(root.get("resourceType"), resourceType);
    }

    private static Specification<AuditLog> changeAction(AdminAuditAction actionType) {
        return (root, q, cb) -> actionType == null ? null : cb.equal(root.get("actionType"), actionType);
    }

    private static Specification<AuditLog> createdBetween(OffsetDateTime from, OffsetDateTime to) {
        return (root, q, cb) -> {
            if (from != null && to != null) {
                return cb.between(root.get("createdAt"), from, to);
            }
            if (from != null) {
                return cb.greaterThanOrEqualTo(root.get("createdAt"), from);
            }
            if (to != null) {
                return cb.lessThanOrEqualTo(root.get("createdAt"), to);
            }
            return null;
        };
    }
}
