package com.shopadmin.backend.global.security.permission;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.global.security.SecurityUtils;
import com.shopadmin.backend.global.web.ClientRequestContext;
import com.shopadmin.backend.modules.permission.application.PermissionDecisionService;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.PermissionDecision;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Turns decision engine verdicts into request outcomes: 401 without an authenticated actor,
 * 403 carrying the engine's reason on deny. On allow the decision is exposed as request
 * attributes for downstream handlers.
 */
@Component
public class PermissionGuard {

    public static final String SOURCE_ATTRIBUTE = "permission.source";
    public static final String RESOURCE_ATTRIBUTE = "permission.resource";
    public static final String ACTION_ATTRIBUTE = "permission.action";

    static final String CODE_DENIED = "permission.denied";
    static final String CODE_CHECK_UNAVAILABLE = "permission.check_unavailable";

    private final PermissionDecisionService decisionService;

    public PermissionGuard(PermissionDecisionService decisionService) {
        this.decisionService = decisionService;
    }

    public PermissionDecision require(HttpServletRequest request, ResourceType resource, ActionType action,
                                      String resourceId) {
        return require(request, new PermissionRequirement(resource, action, resourceId));
    }

    public PermissionDecision require(HttpServletRequest request, PermissionRequirement requirement) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        PermissionDecision decision = check(request, actorId, requirement);
        if (!decision.allowed()) {
            throw rejection(decision);
        }
        expose(request, decision, requirement);
        return decision;
    }

    /**
     * Allows when any alternative is allowed, checking in order and stopping at the first allow.
     */
    public PermissionDecision requireAny(HttpServletRequest request, List<PermissionRequirement> alternatives) {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("at least one permission alternative is required");
        }
        UUID actorId = SecurityUtils.getCurrentUserId();

        boolean everyCheckFailed = true;
        for (PermissionRequirement requirement : alternatives) {
            PermissionDecision decision = check(request, actorId, requirement);
            if (decision.allowed()) {
                expose(request, decision, requirement);
                return decision;
            }
            everyCheckFailed &= decision.infrastructureFailure();
        }

        if (everyCheckFailed) {
            throw rejection(PermissionDecision.checkUnavailable());
        }
        String names = alternatives.stream().map(PermissionRequirement::name).collect(Collectors.joining(", "));
        throw new ProblemException(HttpStatus.FORBIDDEN, CODE_DENIED, "none of the required permissions is granted: " + names);
    }

    private PermissionDecision check(HttpServletRequest request, UUID actorId, PermissionRequirement requirement) {
        return decisionService.checkPermission(actorId, requirement.resource(), requirement.action(),
                requirement.resourceId(), ClientRequestContext.from(request));
    }

    private static void expose(HttpServletRequest request, PermissionDecision decision, PermissionRequirement requirement) {
        if (request == null) {
            return;
        }
        request.setAttribute(SOURCE_ATTRIBUTE, decision.source().code());
        request.setAttribute(RESOURCE_ATTRIBUTE, requirement.resource().code());
        request.setAttribute(ACTION_ATTRIBUTE, requirement.action().code());
    }

    private static ProblemException rejection(PermissionDecision decision) {
        String code = decision.infrastructureFailure() ? CODE_CHECK_UNAVAILABLE : CODE_DENIED;
        return new ProblemException(HttpStatus.FORBIDDEN, code, decision.reason());
    }
}
