package com.example.auditledger.service;

import lombok.Getter;

public class AuditLedgerException extends RuntimeException {

    public enum Code {
        /** Contention on a chain head; the caller may retry. */
        WRITE_CONFLICT,
        STORAGE_ERROR,
        IMMUTABILITY_VIOLATION,
        ARCHIVAL_INCONSISTENCY,
        INVALID_REQUEST
    }

    @Getter
    private final Code code;

    private AuditLedgerException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code == Code.WRITE_CONFLICT;
    }

    public static AuditLedgerException writeConflict(String chainScope, String reason) {
        return new AuditLedgerException(Code.WRITE_CONFLICT,
                "Write conflict on chain " + chainScope + ": " + reason, null);
    }

    public static AuditLedgerException writeConflict(String chainScope, Throwable cause) {
        return new AuditLedgerException(Code.WRITE_CONFLICT,
                "Write conflict on chain " + chainScope, cause);
    }

    public static AuditLedgerException storageError(String operation, Throwable cause) {
        return new AuditLedgerException(Code.STORAGE_ERROR,
                "Audit store failure during " + operation + ": " + cause.getMessage(), cause);
    }

    public static AuditLedgerException immutabilityViolation(String chainScope, String detail) {
        return new AuditLedgerException(Code.IMMUTABILITY_VIOLATION,
                "Audit records in chain " + chainScope + " are immutable: " + detail, null);
    }

    public static AuditLedgerException archivalInconsistency(String chainScope, String detail, Throwable cause) {
        return new AuditLedgerException(Code.ARCHIVAL_INCONSISTENCY,
                "Archival of chain " + chainScope + " was not applied: " + detail, cause);
    }

    public static AuditLedgerException invalidRequest(String message) {
        return new AuditLedgerException(Code.INVALID_REQUEST, message, null);
    }
}
