package com.example.auditledger.models;

import java.time.Instant;

/**
 * One integrity violation reported by chain verification. Findings are data, not errors:
 * an empty list means every examined record is consistent.
 */
public record VerificationFinding(
        String recordId,
        String chainScope,
        Instant createdAt,
        boolean valid,
        String errorMessage,
        String expectedHash,
        String actualHash
) {

    public static final String RECORD_HASH_MISMATCH = "Record hash mismatch";
    public static final String PREVIOUS_HASH_MISMATCH = "Previous hash mismatch";
    public static final String CHAIN_ORIGIN_NOT_FOUND = "Chain origin not found";

    public static VerificationFinding recordHashMismatch(AuditRecord record, String computed) {
        return of(record, RECORD_HASH_MISMATCH, computed, record.getRecordHash());
    }

    public static VerificationFinding previousHashMismatch(AuditRecord record, String expected) {
        return of(record, PREVIOUS_HASH_MISMATCH, expected, record.getPreviousHash());
    }

    public static VerificationFinding chainOriginNotFound(AuditRecord record, String expected) {
        return of(record, CHAIN_ORIGIN_NOT_FOUND, expected, record.getPreviousHash());
    }

    private static VerificationFinding of(AuditRecord record, String message, String expected, String actual) {
        return new VerificationFinding(record.getId(), record.getChainScope(), record.getCreatedAt(),
                false, message, expected, actual);
    }
}
