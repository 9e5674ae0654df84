package com.example.auditledger.service;

import com.example.auditledger.access.ArchiveBatch;
import com.example.auditledger.access.AuditLedgerAccess;
import com.example.auditledger.access.DynamoAuditLedgerAccess;
import com.example.auditledger.access.ImmutabilityGuard;
import com.example.auditledger.access.MaintenanceWindow;
import com.example.auditledger.config.AuditArchivalProperties;
import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHead;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.requests.AuditEventRequest;
import com.example.auditledger.shipping.ArchiveExport;
import com.example.auditledger.shipping.AuditArchiveSink;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes the oldest records of a chain scope while keeping the chain verifiable.
 *
 * <p>Work happens inside a maintenance window and in batches. When an {@link AuditArchiveSink} is
 * configured each batch is exported first and a failed export stops the run with the batch still
 * live. The batch is then one store transaction that writes a checkpoint anchored on the newest
 * record of the batch (with the export's location and checksum), deletes the batch and rewrites
 * the chain head, so after every committed batch the surviving chain starts at a known anchor. A
 * head conflict (a concurrent append or archive on the same scope) re-reads the candidates and
 * retries; the retried batch is exported again under its new checkpoint id.
 */
@Service
@Slf4j
public class ChainArchiveService {

    public static final String SCHEDULED_JOB = "scheduled_job";

    private final AuditLedgerAccess access;
    private final ImmutabilityGuard guard;
    private final ChainAppender appender;
    private final AuditArchivalProperties properties;
    private final Clock clock;
    private final Optional<AuditArchiveSink> sink;

    public ChainArchiveService(AuditLedgerAccess access,
                               ImmutabilityGuard guard,
                               ChainAppender appender,
                               AuditArchivalProperties properties,
                               Clock clock,
                               Optional<AuditArchiveSink> sink) {
        this.access = access;
        this.guard = guard;
        this.appender = appender;
        this.properties = properties;
        this.clock = clock;
        this.sink = sink;
    }

    /**
     * Archives every record of {@code chainScope} created before {@code olderThan}.
     *
     * @return the newest checkpoint written, or empty when nothing qualified
     */
    public Optional<ArchiveCheckpoint> archive(String chainScope, Instant olderThan, String archivedBy) {
        Objects.requireNonNull(chainScope, "chainScope");
        Objects.requireNonNull(olderThan, "olderThan");
        String operator = archivedBy == null || archivedBy.isBlank() ? SCHEDULED_JOB : archivedBy;

        return guard.withMaintenance(chainScope, "archive records older than " + olderThan, operator,
                window -> archiveWithin(window, olderThan, operator));
    }

    /**
     * Reports what {@link #archive} would remove, without opening a maintenance window or
     * writing anything.
     */
    public ArchivePreview preview(String chainScope, Instant olderThan) {
        Objects.requireNonNull(chainScope, "chainScope");
        Objects.requireNonNull(olderThan, "olderThan");
        Instant now = clock.instant();
        Instant cutoff = olderThan.isBefore(now) ? olderThan : now;
        int limit = Math.max(1, properties.getPreviewLimit());

        List<AuditRecord> candidates = access.findOldest(chainScope, cutoff, limit + 1);
        boolean more = candidates.size() > limit;
        List<AuditRecord> counted = more ? candidates.subList(0, limit) : candidates;
        int batchSize = effectiveBatchSize();

        ArchivePreview preview = new ArchivePreview(
                chainScope,
                cutoff,
                counted.size(),
                more,
                counted.isEmpty() ? null : counted.get(0).getCreatedAt(),
                counted.isEmpty() ? null : counted.get(counted.size() - 1).getCreatedAt(),
                (counted.size() + batchSize - 1) / batchSize);
        log.info("Archive dry run for chain {}: {}{} records older than {}",
                chainScope, preview.recordsToArchive(), more ? "+" : "", cutoff);
        return preview;
    }

    private Optional<ArchiveCheckpoint> archiveWithin(MaintenanceWindow window, Instant olderThan, String archivedBy) {
        String chainScope = window.getChainScope();
        // never archive the maintenance record itself or anything appended after it
        Instant cutoff = olderThan.isBefore(window.getOpenedAt()) ? olderThan : window.getOpenedAt();
        int batchSize = effectiveBatchSize();

        List<String> locations = new ArrayList<>();
        ArchiveCheckpoint latest = null;
        Instant oldestArchived = null;
        int archived = 0;
        int conflicts = 0;

        while (true) {
            List<AuditRecord> batch = access.findOldest(chainScope, cutoff, batchSize);
            if (batch.isEmpty()) {
                break;
            }
            try {
                ArchiveCheckpoint checkpoint = commitBatch(window, batch, archivedBy);
                if (oldestArchived == null) {
                    oldestArchived = batch.get(0).getCreatedAt();
                }
                archived += batch.size();
                latest = checkpoint;
                if (checkpoint.getArchiveLocation() != null) {
                    locations.add(checkpoint.getArchiveLocation());
                }
                conflicts = 0;
            } catch (AuditLedgerException ex) {
                if (!ex.isRetryable() || ++conflicts >= Math.max(1, properties.getMaxConflictRetries())) {
                    log.error("Archival of chain {} stopped after {} records: {}",
                            chainScope, archived, ex.getMessage());
                    throw ex;
                }
                log.debug("Archive batch on chain {} conflicted, re-reading candidates (conflict {})",
                        chainScope, conflicts);
            }
        }

        if (latest == null) {
            log.info("No records older than {} in chain {}", cutoff, chainScope);
            return Optional.empty();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("records_archived", archived);
        details.put("oldest_record", oldestArchived.toString());
        details.put("newest_record", latest.getLastRecordCreatedAt().toString());
        details.put("cutoff", cutoff.toString());
        details.put("checkpoint_id", latest.getId());
        details.put("archived_by", archivedBy);
        if (!locations.isEmpty()) {
            details.put("archive_locations", locations);
        }
        appender.append(new AuditEventRequest(null, ChainScope.workspaceIdOf(chainScope),
                AuditActions.RECORDS_ARCHIVED, AuditActions.LEDGER_RESOURCE_TYPE, latest.getId(),
                details, null, null, Boolean.TRUE));

        log.info("Archived {} records from chain {} (cutoff {}, checkpoint {})",
                archived, chainScope, cutoff, latest.getId());
        return Optional.of(latest);
    }

    private ArchiveCheckpoint commitBatch(MaintenanceWindow window, List<AuditRecord> batch, String archivedBy) {
        String chainScope = window.getChainScope();
        ChainHead head = access.findHead(chainScope)
                .orElseThrow(() -> AuditLedgerException.archivalInconsistency(chainScope,
                        "records exist without a chain head", null));

        String checkpointId = UUID.randomUUID().toString();
        // exported before the delete; a sink failure leaves the batch live
        Optional<ArchiveExport> export = sink.map(s -> s.export(chainScope, checkpointId, batch));

        AuditRecord newest = batch.get(batch.size() - 1);
        ArchiveCheckpoint checkpoint = ArchiveCheckpoint.builder()
                .id(checkpointId)
                .lastRecordId(newest.getId())
                .lastRecordCreatedAt(newest.getCreatedAt())
                .lastRecordHash(newest.getRecordHash())
                .recordsArchived(batch.size())
                .workspaceId(ChainScope.workspaceIdOf(chainScope))
                .archivedAt(clock.instant())
                .archivedBy(archivedBy)
                .archiveLocation(export.map(ArchiveExport::location).orElse(null))
                .archiveChecksum(export.map(ArchiveExport::checksum).orElse(null))
                .build();

        access.archive(window, new ArchiveBatch(chainScope, head, head.withCheckpoint(checkpoint), checkpoint, batch));
        return checkpoint;
    }

    private int effectiveBatchSize() {
        return Math.max(1, Math.min(properties.getBatchSize(), DynamoAuditLedgerAccess.MAX_ARCHIVE_BATCH));
    }
}
