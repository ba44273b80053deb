package com.shopadmin.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.global.web.ClientRequestContext;
import com.shopadmin.backend.modules.audit.application.DecisionAuditEntry;
import com.shopadmin.backend.modules.audit.application.DecisionAuditSink;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.PermissionDecision;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether an actor may perform an action on a resource type.
 * <p>
 * Evaluation order:
 * <ol>
 *     <li>Unknown or inactive capability: deny, source none.</li>
 *     <li>Non-expired user override: allow or deny, source user-override. Role grants are not consulted.</li>
 *     <li>Actor's active role grants the permission: allow, source role.</li>
 *     <li>Otherwise deny, source none.</li>
 * </ol>
 * Any failure while reading the stores yields a deny flagged as an infrastructure failure.
 * Every call hands exactly one entry to the {@link DecisionAuditSink} before returning.
 * The {@code resourceId} is recorded for audit and does not influence the verdict.
 */
@Service
public class PermissionDecisionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionDecisionService.class);

    private final PermissionCatalog catalog;
    private final GrantLookupService grantLookupService;
    private final DecisionAuditSink auditSink;
    private final MeterRegistry meterRegistry;
    private final Counter infrastructureFailures;
    private final Clock clock;

    public PermissionDecisionService(PermissionCatalog catalog,
                                     GrantLookupService grantLookupService,
                                     DecisionAuditSink auditSink,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.catalog = catalog;
        this.grantLookupService = grantLookupService;
        this.auditSink = auditSink;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.infrastructureFailures = Counter.builder("authz.decisions.infrastructure_failures")
                .description("Permission checks denied because a store could not be read")
                .register(meterRegistry);
    }

    public PermissionDecision checkPermission(UUID actorId, ResourceType resourceType, ActionType actionType,
                                              String resourceId) {
        return checkPermission(actorId, resourceType, actionType, resourceId, ClientRequestContext.current());
    }

    public PermissionDecision checkPermission(UUID actorId, ResourceType resourceType, ActionType actionType,
                                              String resourceId, ClientRequestContext context) {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(actionType, "actionType");

        PermissionDecision decision;
        try {
            decision = decide(actorId, resourceType, actionType);
        } catch (RuntimeException ex) {
            infrastructureFailures.increment();
            log.error("[ALERT][Authz] permission check failed closed actor={} capability={}.{}",
                    actorId, resourceType.code(), actionType.code(), ex);
            decision = PermissionDecision.checkUnavailable();
        }

        meterRegistry.counter("authz.decisions",
                "outcome", decision.allowed() ? "allow" : "deny",
                "source", decision.source().code()).increment();
        if (log.isDebugEnabled()) {
            log.debug("Permission decision actor={} capability={}.{} resourceId={} allowed={} source={} reason={}",
                    actorId, resourceType.code(), actionType.code(), resourceId, decision.allowed(),
                    decision.source().code(), decision.reason());
        }

        publish(DecisionAuditEntry.of(actorId, resourceType, actionType, resourceId, decision,
                context, OffsetDateTime.now(clock)));
        return decision;
    }

    private PermissionDecision decide(UUID actorId, ResourceType resourceType, ActionType actionType) {
        Optional<Capability> capability = catalog.resolve(resourceType, actionType);
        if (capability.isEmpty() || !capability.get().active()) {
            return PermissionDecision.unknownCapability();
        }
        UUID permissionId = capability.get().permissionId();

        Optional<OverrideSnapshot> override = grantLookupService.overrideOf(actorId, permissionId);
        if (override.isPresent()) {
            return override.get().granted()
                    ? PermissionDecision.overrideAllowed(override.get().reason())
                    : PermissionDecision.overrideDenied(override.get().reason());
        }

        Optional<String> roleCode = grantLookupService.roleOf(actorId);
        if (roleCode.isPresent() && grantLookupService.roleGrants(roleCode.get(), permissionId)) {
            return PermissionDecision.roleAllowed(roleCode.get());
        }
        return PermissionDecision.noGrant();
    }

    private void publish(DecisionAuditEntry entry) {
        try {
            auditSink.record(entry);
        } catch (RuntimeException ex) {
            log.error("[ALERT][Audit] decision audit sink threw actor={} capability={}.{}",
                    entry.actorId(), entry.resourceType().code(), entry.actionType().code(), ex);
        }
    }
}
