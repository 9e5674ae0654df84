package com.example.auditledger.access;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHead;
import java.util.List;
import java.util.Objects;

/**
 * One atomic unit of archival: the checkpoint, the records it replaces and the head rewrite
 * that serializes it against appends on the same scope.
 */
public record ArchiveBatch(
        String chainScope,
        ChainHead expectedHead,
        ChainHead nextHead,
        ArchiveCheckpoint checkpoint,
        List<AuditRecord> records
) {

    public ArchiveBatch {
        Objects.requireNonNull(chainScope, "chainScope");
        Objects.requireNonNull(expectedHead, "expectedHead");
        Objects.requireNonNull(nextHead, "nextHead");
        Objects.requireNonNull(checkpoint, "checkpoint");
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            throw new IllegalArgumentException("records must not be empty");
        }
        records = List.copyOf(records);
    }
}
