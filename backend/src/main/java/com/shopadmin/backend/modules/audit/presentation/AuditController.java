package com.shopadmin.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.global.security.permission.RequiresPermission;
import com.shopadmin.backend.global.web.PageResponse;
import com.shopadmin.backend.modules.audit.application.AuditQueryService;
import com.shopadmin.backend.modules.audit.application.AuditQueryService.AdminAuditQuery;
import com.shopadmin.backend.modules.audit.application.AuditQueryService.DecisionAuditQuery;
import com.shopadmin.backend.modules.audit.domain.AdminAuditAction;
import com.shopadmin.backend.modules.audit.domain.AdminAuditResource;
import com.shopadmin.backend.modules.audit.domain.DecisionOutcome;
import com.shopadmin.backend.modules.audit.presentation.dto.AdminAuditEntryResponse;
import com.shopadmin.backend.modules.audit.presentation.dto.DecisionAuditEntryResponse;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/audit")
@RequiresPermission(resource = ResourceType.AUDIT, action = ActionType.READ)
public class AuditController {

    private final AuditQueryService auditQueryService;

    public AuditController(AuditQueryService auditQueryService) {
        this.auditQueryService = auditQueryService;
    }

    @Operation(summary = "Permission decision log", description = "Newest first. Filters combine with AND.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of decisions"),
            @ApiResponse(responseCode = "400", description = "Unknown filter value or from after to"),
            @ApiResponse(responseCode = "403", description = "audit:read required")
    })
    @GetMapping("/decisions")
    public ResponseEntity<PageResponse<DecisionAuditEntryResponse>> decisions(
            @RequestParam(name = "actorId", required = false) UUID actorId,
            @RequestParam(name = "resource", required = false) String resource,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "outcome", required = false) String outcome,
            @RequestParam(name = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        DecisionAuditQuery query = new DecisionAuditQuery(
                actorId,
                parse("resource", resource, ResourceType::fromCode),
                parse("action", action, ActionType::fromCode),
                parse("outcome", outcome, value -> DecisionOutcome.valueOf(value.toUpperCase(Locale.ROOT))),
                from,
                to
        );
        return ResponseEntity.ok(auditQueryService.queryDecisions(query, page, size));
    }

    @Operation(summary = "Administrative change log", description = "Role, permission and override changes, newest first.")
    @GetMapping("/grants")
    public ResponseEntity<PageResponse<AdminAuditEntryResponse>> adminChanges(
            @RequestParam(name = "actorId", required = false) UUID actorId,
            @RequestParam(name = "targetUserId", required = false) UUID targetUserId,
            @RequestParam(name = "resource", required = false) String resource,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        AdminAuditQuery query = new AdminAuditQuery(
                actorId,
                targetUserId,
                parse("resource", resource, value -> AdminAuditResource.valueOf(value.toUpperCase(Locale.ROOT))),
                parse("action", action, value -> AdminAuditAction.valueOf(value.toUpperCase(Locale.ROOT))),
                from,
                to
        );
        return ResponseEntity.ok(auditQueryService.queryAdminChanges(query, page, size));
    }

    private static <T> T parse(String name, String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "invalid_filter",
                    "unknown " + name + " filter: " + value);
        }
    }
}
