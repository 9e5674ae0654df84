package com.example.auditledger.shipping;

import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Snake_case JSON form of a committed record as it leaves the ledger, with {@code created_at}
 * in the hashed timestamp format so exported records can be re-verified.
 */
@Component
public class AuditRecordJson {

    private final ObjectMapper mapper;

    public AuditRecordJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(AuditRecord record) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("id", record.getId());
        event.put("created_at", ChainHash.formatTimestamp(record.getCreatedAt()));
        event.put("chain_scope", record.getChainScope());
        event.put("actor_user_id", record.getActorUserId());
        event.put("workspace_id", record.getWorkspaceId());
        event.put("action", record.getAction());
        event.put("resource_type", record.getResourceType());
        event.put("resource_id", record.getResourceId());
        event.put("details", record.getDetails());
        event.put("ip_address", record.getIpAddress());
        event.put("user_agent", record.getUserAgent());
        event.put("previous_hash", record.getPreviousHash());
        event.put("record_hash", record.getRecordHash());
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit record " + record.getId(), e);
        }
    }

    /**
     * One record per line in chain order, UTF-8, no trailing newline.
     */
    public byte[] writeLines(List<AuditRecord> records) {
        StringBuilder out = new StringBuilder();
        for (AuditRecord record : records) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(write(record));
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
