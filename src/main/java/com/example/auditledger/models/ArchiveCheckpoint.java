package com.example.auditledger.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Anchor left behind when archival removes the oldest records of a chain scope. The first
 * surviving record links to {@link #getLastRecordHash()} instead of to its deleted predecessor.
 *
 * <p>Checkpoints are sorted by {@code <last_record_created_at>#<id>} so the newest anchor of a
 * scope is the last item of its partition. When archived records were exported, the export's
 * location and SHA-256 are kept with the anchor.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class ArchiveCheckpoint {

    // chainScope and sortKey are derived in build()
    private String chainScope;           // PK
    private String sortKey;              // SK "{last_record_created_at}#{id}"

    @NonNull private String id;
    @NonNull private String lastRecordId;
    @NonNull private Instant lastRecordCreatedAt;
    @NonNull private String lastRecordHash;
    @NonNull private Integer recordsArchived;
    private String workspaceId;
    private Instant archivedAt;
    private String archivedBy;
    private String archiveLocation;
    private String archiveChecksum;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("chain_scope")
    public String getChainScope() { return chainScope; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sort_key")
    public String getSortKey() { return sortKey; }

    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @DynamoDbAttribute("last_record_id")
    public String getLastRecordId() { return lastRecordId; }

    @DynamoDbAttribute("last_record_created_at")
    public Instant getLastRecordCreatedAt() { return lastRecordCreatedAt; }

    @DynamoDbAttribute("last_record_hash")
    public String getLastRecordHash() { return lastRecordHash; }

    @DynamoDbAttribute("records_archived")
    public Integer getRecordsArchived() { return recordsArchived; }

    @DynamoDbAttribute("workspace_id")
    public String getWorkspaceId() { return workspaceId; }

    @DynamoDbAttribute("archived_at")
    public Instant getArchivedAt() { return archivedAt; }

    @DynamoDbAttribute("archived_by")
    public String getArchivedBy() { return archivedBy; }

    @DynamoDbAttribute("archive_location")
    public String getArchiveLocation() { return archiveLocation; }

    @DynamoDbAttribute("archive_checksum")
    public String getArchiveChecksum() { return archiveChecksum; }

    public static class ArchiveCheckpointBuilder {
        public ArchiveCheckpoint build() {
            ArchiveCheckpoint c = new ArchiveCheckpoint(
                    ChainScope.of(workspaceId), null, id, lastRecordId, lastRecordCreatedAt,
                    lastRecordHash, recordsArchived, workspaceId, archivedAt, archivedBy,
                    archiveLocation, archiveChecksum
            );
            c.sortKey = AuditRecord.sortKeyOf(c.lastRecordCreatedAt, c.id);
            return c;
        }
    }
}
