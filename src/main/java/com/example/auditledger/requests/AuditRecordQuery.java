package com.example.auditledger.requests;

import com.example.auditledger.models.AuditRecord;
import java.time.Instant;
import java.util.Objects;

/**
 * Read-only filter over committed records. Null fields do not constrain; {@code startDate} and
 * {@code endDate} are both inclusive. Without a workspace every chain scope is searched.
 */
public record AuditRecordQuery(
        String workspaceId,
        String action,
        String resourceType,
        String resourceId,
        String actorUserId,
        Instant startDate,
        Instant endDate,
        int limit,
        int offset
) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;
    public static final int MAX_OFFSET = 100_000;

    public AuditRecordQuery {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("offset must be between 0 and " + MAX_OFFSET);
        }
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date must not be after end_date");
        }
        workspaceId = blankToNull(workspaceId);
        action = blankToNull(action);
        resourceType = blankToNull(resourceType);
        resourceId = blankToNull(resourceId);
        actorUserId = blankToNull(actorUserId);
    }

    /** Newest {@code limit} records of one workspace, or of every scope when null. */
    public static AuditRecordQuery latest(String workspaceId, int limit) {
        return new AuditRecordQuery(workspaceId, null, null, null, null, null, null, limit, 0);
    }

    /**
     * Field filters only; the date range is applied by the store.
     */
    public boolean matches(AuditRecord record) {
        return matches(action, record.getAction())
                && matches(resourceType, record.getResourceType())
                && matches(resourceId, record.getResourceId())
                && matches(actorUserId, record.getActorUserId());
    }

    private static boolean matches(String wanted, String actual) {
        return wanted == null || Objects.equals(wanted, actual);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
