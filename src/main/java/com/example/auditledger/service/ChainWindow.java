package com.example.auditledger.service;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import java.util.List;
import java.util.Objects;

/**
 * The slice of one chain scope handed to {@link ChainVerifier}.
 *
 * @param records     the records to examine, in any order
 * @param checkpoints every checkpoint of the scope
 * @param truncated   whether older live records exist before {@code records}
 */
public record ChainWindow(
        String chainScope,
        List<AuditRecord> records,
        List<ArchiveCheckpoint> checkpoints,
        boolean truncated
) {

    public ChainWindow {
        Objects.requireNonNull(chainScope, "chainScope");
        records = records == null ? List.of() : List.copyOf(records);
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
    }
}
