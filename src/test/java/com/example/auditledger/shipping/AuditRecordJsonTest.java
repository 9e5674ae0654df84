package com.example.auditledger.shipping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AuditRecordJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final AuditRecordJson json = new AuditRecordJson(MAPPER);

    private static AuditRecord record(String id, String previousHash) {
        return AuditRecord.builder()
                .id(id)
                .createdAt(Instant.parse("2024-10-01T12:34:56.789Z"))
                .actorUserId("u1")
                .workspaceId("w1")
                .action("document.create")
                .resourceType("document")
                .resourceId("d1")
                .details(Map.of("title", "Plan"))
                .previousHash(previousHash)
                .build();
    }

    @Test
    @DisplayName("records are rendered as one snake_case JSON object")
    void write() throws Exception {
        AuditRecord record = record("rec-1", ChainHash.GENESIS);

        JsonNode node = MAPPER.readTree(json.write(record));

        assertEquals("rec-1", node.get("id").asText());
        assertEquals("2024-10-01T12:34:56.789Z", node.get("created_at").asText());
        assertEquals("ws:w1", node.get("chain_scope").asText());
        assertEquals(record.getRecordHash(), node.get("record_hash").asText());
        assertEquals("Plan", node.get("details").get("title").asText());
        assertNull(node.get("ip_address").textValue());
    }

    @Test
    @DisplayName("batches are written one record per line in order")
    void writeLines() throws Exception {
        AuditRecord first = record("rec-1", ChainHash.GENESIS);
        AuditRecord second = record("rec-2", first.getRecordHash());

        String[] lines = new String(json.writeLines(List.of(first, second)), StandardCharsets.UTF_8).split("\n");

        assertEquals(2, lines.length);
        assertEquals("rec-1", MAPPER.readTree(lines[0]).get("id").asText());
        assertEquals(first.getRecordHash(), MAPPER.readTree(lines[1]).get("previous_hash").asText());
    }
}
