package com.example.auditledger.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointResponse(
        @JsonProperty("id") String id,
        @JsonProperty("chain_scope") String chainScope,
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("last_record_id") String lastRecordId,
        @JsonProperty("last_record_created_at") Instant lastRecordCreatedAt,
        @JsonProperty("last_record_hash") String lastRecordHash,
        @JsonProperty("records_archived") Integer recordsArchived,
        @JsonProperty("archived_at") Instant archivedAt,
        @JsonProperty("archived_by") String archivedBy,
        @JsonProperty("archive_location") String archiveLocation,
        @JsonProperty("archive_checksum") String archiveChecksum
) { }
