package com.example.auditledger.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;

/**
 * Body of POST /audit-records/verify. Without a workspace every chain is verified.
 */
public record VerifyChainHttpRequest(
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("limit") @Positive Integer limit
) {}
