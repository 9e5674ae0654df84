package com.example.auditledger.service;

import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.requests.AuditEventRequest;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for route handlers emitting audit events. Critical events propagate any append
 * failure so the business operation fails with them; other events are best effort.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    private final ChainAppender appender;
    private final AuditActions actions;

    /**
     * @return the committed record, or empty when a non-critical event could not be recorded
     * @throws AuditLedgerException when a critical event could not be recorded
     */
    public Optional<AuditRecord> emit(AuditEventRequest request) {
        boolean critical = actions.isCritical(request);
        try {
            return Optional.of(appender.append(request));
        } catch (AuditLedgerException ex) {
            if (critical) {
                log.error("Failed to record critical audit event {} ({}): {}",
                        request.action(), ex.getCode(), ex.getMessage());
                throw ex;
            }
            log.error("Failed to record audit event {} ({}), continuing: {}",
                    request.action(), ex.getCode(), ex.getMessage(), ex);
            return Optional.empty();
        } catch (RuntimeException ex) {
            if (critical) {
                throw ex;
            }
            log.error("Failed to record audit event {}, continuing", request.action(), ex);
            return Optional.empty();
        }
    }
}
