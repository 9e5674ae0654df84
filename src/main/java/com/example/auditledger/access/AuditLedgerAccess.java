package com.example.auditledger.access;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHead;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Storage capability for the audit ledger tables. Deliberately narrow: records can be appended
 * and read, and removed only through {@link #archive} inside a maintenance window. There is no
 * way to update a committed record.
 *
 * <p>Failures surface as {@link com.example.auditledger.service.AuditLedgerException}:
 * {@code WRITE_CONFLICT} when the head condition fails, {@code STORAGE_ERROR} for store faults.
 */
public interface AuditLedgerAccess {

    /**
     * Strongly consistent read of a scope's head.
     */
    Optional<ChainHead> findHead(String chainScope);

    List<ChainHead> findAllHeads();

    /**
     * Atomically writes {@code record} and replaces the head. {@code expectedHead} is the head
     * the record was chained onto, or {@code null} for the first record of a scope; the write
     * fails with {@code WRITE_CONFLICT} if the stored head has moved since.
     */
    void append(AuditRecord record, ChainHead expectedHead, ChainHead nextHead);

    /**
     * Returns the newest {@code limit} records of a scope in chain order (oldest first).
     */
    List<AuditRecord> findLatest(String chainScope, int limit);

    /**
     * Walks a scope newest first over records created in {@code [from, to]} (either bound may be
     * null) and returns the first {@code max} that satisfy {@code filter}.
     */
    List<AuditRecord> search(String chainScope, Instant from, Instant to, Predicate<AuditRecord> filter, int max);

    /**
     * Returns up to {@code limit} of the oldest records of a scope created strictly before
     * {@code createdBefore}, in chain order.
     */
    List<AuditRecord> findOldest(String chainScope, Instant createdBefore, int limit);

    /**
     * All checkpoints of a scope ordered by their anchor's timestamp.
     */
    List<ArchiveCheckpoint> findCheckpoints(String chainScope);

    /**
     * Writes the checkpoint, deletes the batch's records and replaces the head in a single
     * transaction. Requires an open maintenance window for the batch's scope.
     */
    void archive(MaintenanceWindow window, ArchiveBatch batch);
}
