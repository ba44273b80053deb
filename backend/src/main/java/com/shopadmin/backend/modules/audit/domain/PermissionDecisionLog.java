package com.shopadmin.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.DecisionSource;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * One row per permission check, allow or deny. Rows are never updated.
 */
@Entity
@Immutable
@Table(name = "permission_decision_log")
public class PermissionDecisionLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "actor_user_id", nullable = false, columnDefinition = "uuid")
    private UUID actorUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_type", nullable = false, length = 32)
    private ResourceType resourceType;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 16)
    private ActionType actionType;

    @Column(name = "resource_id", length = 128)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 8)
    private DecisionOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision_source", nullable = false, length = 16)
    private DecisionSource source;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "infrastructure_failure", nullable = false)
    private boolean infrastructureFailure;

    @Column(name = "client_ip", length = 64)
    private String clientIp;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "request_id", length = 128)
    private String requestId;

    @Column(name = "decided_at", nullable = false)
    private OffsetDateTime decidedAt;

    protected PermissionDecisionLog() {
    }

    public PermissionDecisionLog(UUID actorUserId, ResourceType resourceType, ActionType actionType,
                                 String resourceId, DecisionOutcome outcome, DecisionSource source, String reason,
                                 boolean infrastructureFailure, OffsetDateTime decidedAt) {
        this.actorUserId = actorUserId;
        this.resourceType = resourceType;
        this.actionType = actionType;
        this.resourceId = resourceId;
        this.outcome = outcome;
        this.source = source;
        this.reason = reason;
        this.infrastructureFailure = infrastructureFailure;
        this.decidedAt = decidedAt;
    }

    public void attachRequest(String clientIp, String userAgent, String requestId) {
        this.clientIp = clientIp;
        this.userAgent = userAgent;
        this.requestId = requestId;
    }

    public UUID getId() {
        return id;
    }

    public UUID getActorUserId() {
        return actorUserId;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public DecisionOutcome getOutcome() {
        return outcome;
    }

    public DecisionSource getSource() {
        return source;
    }

    public String getReason() {
        return reason;
    }

    public boolean isInfrastructureFailure() {
        return infrastructureFailure;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getRequestId() {
        return requestId;
    }

    public OffsetDateTime getDecidedAt() {
        return decidedAt;
    }
}
