package com.example.auditledger.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record ArchivePreviewResponse(
        @JsonProperty("dry_run") boolean dryRun,
        @JsonProperty("chain_scope") String chainScope,
        @JsonProperty("cutoff") Instant cutoff,
        @JsonProperty("records_to_archive") int recordsToArchive,
        @JsonProperty("more") boolean more,
        @JsonProperty("oldest_record") Instant oldestRecord,
        @JsonProperty("newest_record") Instant newestRecord,
        @JsonProperty("batches") int batches
) { }
