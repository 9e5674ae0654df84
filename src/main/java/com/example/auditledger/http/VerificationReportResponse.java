package com.example.auditledger.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record VerificationReportResponse(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("records_checked") int recordsChecked,
        @JsonProperty("chain_scopes") List<String> chainScopes,
        @JsonProperty("findings") List<Finding> findings
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Finding(
            @JsonProperty("record_id") String recordId,
            @JsonProperty("chain_scope") String chainScope,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("is_valid") boolean valid,
            @JsonProperty("error_message") String errorMessage,
            @JsonProperty("expected_hash") String expectedHash,
            @JsonProperty("actual_hash") String actualHash
    ) { }
}
