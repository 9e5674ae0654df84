package com.example.auditledger.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * One committed, immutable fact in the {@code audit_records} table.
 *
 * <p>Records are partitioned by chain scope and sorted by {@code <created_at>#<id>}, so a
 * forward query over a partition walks the chain in order.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditRecord {

    // chainScope, sortKey and recordHash are derived in build()
    private String chainScope;           // PK
    private String sortKey;              // SK "{created_at}#{id}"

    @NonNull private String id;
    @NonNull private Instant createdAt;
    private String actorUserId;
    private String workspaceId;
    @NonNull private String action;
    private String resourceType;
    private String resourceId;
    private Map<String, Object> details;
    private String ipAddress;
    private String userAgent;
    @NonNull private String previousHash;
    private String recordHash;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("chain_scope")
    public String getChainScope() { return chainScope; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sort_key")
    public String getSortKey() { return sortKey; }

    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("created_at")
    public Instant getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("actor_user_id")
    public String getActorUserId() { return actorUserId; }

    @DynamoDbAttribute("workspace_id")
    public String getWorkspaceId() { return workspaceId; }

    @DynamoDbAttribute("action")
    public String getAction() { return action; }

    @DynamoDbAttribute("resource_type")
    public String getResourceType() { return resourceType; }

    @DynamoDbAttribute("resource_id")
    public String getResourceId() { return resourceId; }

    @DynamoDbConvertedBy(DetailsAttributeConverter.class)
    @DynamoDbAttribute("details")
    public Map<String, Object> getDetails() { return details; }

    @DynamoDbAttribute("ip_address")
    public String getIpAddress() { return ipAddress; }

    @DynamoDbAttribute("user_agent")
    public String getUserAgent() { return userAgent; }

    @DynamoDbAttribute("previous_hash")
    public String getPreviousHash() { return previousHash; }

    @DynamoDbAttribute("record_hash")
    public String getRecordHash() { return recordHash; }

    public static String sortKeyOf(Instant createdAt, String id) {
        return ChainHash.formatTimestamp(createdAt) + "#" + id;
    }

    public static class AuditRecordBuilder {
        public AuditRecord build() {
            AuditRecord r = new AuditRecord(
                    ChainScope.of(workspaceId), null, id,
                    createdAt == null ? null : ChainHash.truncate(createdAt),
                    actorUserId, workspaceId, action, resourceType, resourceId,
                    details, ipAddress, userAgent, previousHash, null
            );
            r.sortKey = sortKeyOf(r.createdAt, r.id);
            r.recordHash = ChainHash.compute(r);
            return r;
        }
    }
}
