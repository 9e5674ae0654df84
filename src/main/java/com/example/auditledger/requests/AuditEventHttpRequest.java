package com.example.auditledger.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * HTTP-layer payload for POST /audit-records. Request provenance (ip, user agent) falls back to
 * the calling connection when the emitting service does not forward its own client's values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEventHttpRequest(
        @JsonProperty("actor_user_id") String actorUserId,
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("action") @NotBlank String action,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("user_agent") String userAgent,
        @JsonProperty("critical") Boolean critical
) {}
