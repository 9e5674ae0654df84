package com.example.auditledger.http;

import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.requests.AuditEventHttpRequest;
import com.example.auditledger.requests.AuditEventRequest;
import com.example.auditledger.requests.AuditRecordQuery;
import com.example.auditledger.service.AuditLogService;
import com.example.auditledger.service.AuditQueryService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for emitting and reading audit records. Emission goes through the same
 * critical/non-critical policy as in-process callers; reads are strictly read-only and filter
 * by workspace, action, resource, actor and creation date.
 */
@RestController
public class AuditRecordController {

    private final AuditLogService auditLogService;
    private final AuditQueryService queryService;

    public AuditRecordController(AuditLogService auditLogService, AuditQueryService queryService) {
        this.auditLogService = auditLogService;
        this.queryService = queryService;
    }

    @PostMapping("/audit-records")
    public ResponseEntity<AuditRecordResponse> emit(@Valid @RequestBody AuditEventHttpRequest request,
                                                    HttpServletRequest servletRequest) {
        AuditEventRequest event = new AuditEventRequest(
                request.actorUserId(),
                request.workspaceId(),
                request.action(),
                request.resourceType(),
                request.resourceId(),
                request.details(),
                request.ipAddress() != null ? request.ipAddress() : servletRequest.getRemoteAddr(),
                request.userAgent() != null ? request.userAgent() : servletRequest.getHeader(HttpHeaders.USER_AGENT),
                request.critical()
        );

        Optional<AuditRecord> record = auditLogService.emit(event);
        // a non-critical event that could not be recorded is accepted without a record
        return record
                .map(r -> ResponseEntity.status(HttpStatus.CREATED).body(map(r)))
                .orElseGet(() -> ResponseEntity.accepted().build());
    }

    @GetMapping("/audit-records")
    public ResponseEntity<List<AuditRecordResponse>> list(
            @RequestParam(name = "workspace_id", required = false) String workspaceId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "resource_type", required = false) String resourceType,
            @RequestParam(name = "resource_id", required = false) String resourceId,
            @RequestParam(name = "actor_user_id", required = false) String actorUserId,
            @RequestParam(name = "start_date", required = false) Instant startDate,
            @RequestParam(name = "end_date", required = false) Instant endDate,
            @RequestParam(name = "limit", defaultValue = "" + AuditRecordQuery.DEFAULT_LIMIT) int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset
    ) {
        AuditRecordQuery query = new AuditRecordQuery(workspaceId, action, resourceType, resourceId,
                actorUserId, startDate, endDate, limit, offset);
        List<AuditRecord> records = queryService.search(query);
        return ResponseEntity.ok(records.stream().map(AuditRecordController::map).toList());
    }

    static AuditRecordResponse map(AuditRecord record) {
        return new AuditRecordResponse(
                record.getId(),
                record.getCreatedAt(),
                record.getActorUserId(),
                record.getWorkspaceId(),
                record.getAction(),
                record.getResourceType(),
                record.getResourceId(),
                record.getDetails(),
                record.getIpAddress(),
                record.getUserAgent(),
                record.getPreviousHash(),
                record.getRecordHash()
        );
    }
}
