package com.example.auditledger.service;

import com.example.auditledger.config.AuditChainProperties;
import com.example.auditledger.requests.AuditEventRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Action names written by the ledger itself, and the critical/non-critical classification of
 * every action.
 */
@Component
@RequiredArgsConstructor
public class AuditActions {

    public static final String MAINTENANCE_STARTED = "audit.maintenance_started";
    public static final String MAINTENANCE_ENDED = "audit.maintenance_ended";
    public static final String IMMUTABILITY_VIOLATION = "audit.immutability_violation";
    public static final String RECORDS_ARCHIVED = "audit.records_archived";

    public static final String LEDGER_RESOURCE_TYPE = "audit_records";

    private final AuditChainProperties properties;

    /**
     * Critical actions must be durably recorded or the enclosing operation fails.
     */
    public boolean isCritical(AuditEventRequest request) {
        if (request.critical() != null) {
            return request.critical();
        }
        return isCritical(request.action());
    }

    public boolean isCritical(String action) {
        for (String prefix : properties.getCriticalActionPrefixes()) {
            if (action.startsWith(prefix)) {
                return true;
            }
        }
        for (String suffix : properties.getCriticalActionSuffixes()) {
            if (action.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
