package com.example.auditledger.requests;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Service-layer command describing one security-relevant event to append to the audit chain.
 * Built by route handlers (or from {@link AuditEventHttpRequest}) with request provenance
 * already resolved.
 *
 * <p>{@code critical} overrides the action-based classification when non-null.
 */
public record AuditEventRequest(
        String actorUserId,
        String workspaceId,
        String action,
        String resourceType,
        String resourceId,
        Map<String, Object> details,
        String ipAddress,
        String userAgent,
        Boolean critical
) {

    private static final Pattern ACTION = Pattern.compile("[a-z][a-z0-9_]*(\\.[a-z][a-z0-9_]*)+");

    public AuditEventRequest(String actorUserId,
                             String workspaceId,
                             String action,
                             String resourceType,
                             String resourceId) {
        this(actorUserId, workspaceId, action, resourceType, resourceId, null, null, null, null);
    }

    public AuditEventRequest {
        Objects.requireNonNull(action, "action");
        if (!ACTION.matcher(action).matches()) {
            throw new IllegalArgumentException("action must be a namespaced verb like document.create: " + action);
        }
        // '|' separates the hashed fields
        requireNoSeparator("actorUserId", actorUserId);
        requireNoSeparator("workspaceId", workspaceId);
        requireNoSeparator("resourceType", resourceType);
        requireNoSeparator("resourceId", resourceId);

        actorUserId = blankToNull(actorUserId);
        workspaceId = blankToNull(workspaceId);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    private static void requireNoSeparator(String field, String value) {
        if (value != null && value.indexOf('|') >= 0) {
            throw new IllegalArgumentException(field + " must not contain '|'");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
