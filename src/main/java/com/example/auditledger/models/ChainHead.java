package com.example.auditledger.models;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Per-scope row in {@code audit_chain_heads}. Every append and every archive batch rewrites
 * the head conditioned on {@link #getVersion()}, which serializes writers of a scope across
 * processes. The tip survives archival, so the next append still links to the last archived
 * record's hash when the live set is empty.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Getter @Setter
public class ChainHead {

    private String chainScope;
    private String tipRecordId;
    private String tipRecordHash;
    private Instant tipCreatedAt;
    private Long recordCount;
    private String latestCheckpointId;
    private Long version;
    private Instant updatedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("chain_scope")
    public String getChainScope() { return chainScope; }

    @DynamoDbAttribute("tip_record_id")
    public String getTipRecordId() { return tipRecordId; }

    @DynamoDbAttribute("tip_record_hash")
    public String getTipRecordHash() { return tipRecordHash; }

    @DynamoDbAttribute("tip_created_at")
    public Instant getTipCreatedAt() { return tipCreatedAt; }

    @DynamoDbAttribute("record_count")
    public Long getRecordCount() { return recordCount; }

    @DynamoDbAttribute("latest_checkpoint_id")
    public String getLatestCheckpointId() { return latestCheckpointId; }

    @DynamoDbAttribute("version")
    public Long getVersion() { return version; }

    @DynamoDbAttribute("updated_at")
    public Instant getUpdatedAt() { return updatedAt; }

    public static ChainHead start(AuditRecord first) {
        return ChainHead.builder()
                .chainScope(first.getChainScope())
                .tipRecordId(first.getId())
                .tipRecordHash(first.getRecordHash())
                .tipCreatedAt(first.getCreatedAt())
                .recordCount(1L)
                .version(1L)
                .updatedAt(first.getCreatedAt())
                .build();
    }

    public ChainHead advance(AuditRecord next) {
        return toBuilder()
                .tipRecordId(next.getId())
                .tipRecordHash(next.getRecordHash())
                .tipCreatedAt(next.getCreatedAt())
                .recordCount(count() + 1)
                .version(version + 1)
                .updatedAt(next.getCreatedAt())
                .build();
    }

    public ChainHead withCheckpoint(ArchiveCheckpoint checkpoint) {
        return toBuilder()
                .latestCheckpointId(checkpoint.getId())
                .recordCount(Math.max(0L, count() - checkpoint.getRecordsArchived()))
                .version(version + 1)
                .updatedAt(checkpoint.getArchivedAt())
                .build();
    }

    private long count() {
        return recordCount == null ? 0L : recordCount;
    }
}
