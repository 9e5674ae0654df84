package com.example.auditledger.shipping;

import com.example.auditledger.models.AuditRecord;

/**
 * Read-only downstream consumer of committed audit records, e.g. an external log pipeline.
 * Called after the record is durable; failures are logged by the caller and never roll back
 * or block the append.
 */
public interface AuditRecordShipper {

    void ship(AuditRecord record);

    default String name() {
        return getClass().getSimpleName();
    }
}
