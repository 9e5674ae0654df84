package com.example.auditledger.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Body of POST /audit-records/archive. A missing workspace archives the global chain. The cutoff
 * is either {@code older_than} or {@code older_than_months} before now (UTC calendar months);
 * {@code dry_run} only reports what would be archived.
 */
public record ArchiveChainHttpRequest(
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("older_than") Instant olderThan,
        @JsonProperty("older_than_months") @Positive Integer olderThanMonths,
        @JsonProperty("archived_by") String archivedBy,
        @JsonProperty("dry_run") Boolean dryRun
) {

    public Instant cutoff(Clock clock) {
        if ((olderThan == null) == (olderThanMonths == null)) {
            throw new IllegalArgumentException("exactly one of older_than and older_than_months is required");
        }
        if (olderThan != null) {
            return olderThan;
        }
        return clock.instant().atZone(ZoneOffset.UTC).minusMonths(olderThanMonths).toInstant();
    }

    public boolean isDryRun() {
        return Boolean.TRUE.equals(dryRun);
    }
}
