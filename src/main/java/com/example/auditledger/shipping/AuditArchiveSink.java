package com.example.auditledger.shipping;

import com.example.auditledger.models.AuditRecord;
import java.util.List;

/**
 * Durable destination for records leaving the live ledger. An export must be complete before
 * the batch is deleted; implementations throw instead of returning partial results.
 */
public interface AuditArchiveSink {

    /**
     * Writes {@code records} (one archive batch, in chain order) and returns where they went.
     */
    ArchiveExport export(String chainScope, String checkpointId, List<AuditRecord> records);

    String name();
}
