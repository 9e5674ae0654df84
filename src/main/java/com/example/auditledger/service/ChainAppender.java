package com.example.auditledger.service;

import com.example.auditledger.access.AuditLedgerAccess;
import com.example.auditledger.config.AuditChainProperties;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.example.auditledger.models.ChainHead;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.requests.AuditEventRequest;
import com.example.auditledger.shipping.AuditRecordShipper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Appends records to their chain scope. The tip is read from the store on every attempt and the
 * write is conditioned on it not having moved, so concurrent appenders in any number of
 * processes can never fork a chain. Contention is retried a bounded number of times.
 */
@Service
@Slf4j
public class ChainAppender {

    private final AuditLedgerAccess access;
    private final AuditChainProperties properties;
    private final Clock clock;
    private final List<AuditRecordShipper> shippers;

    public ChainAppender(AuditLedgerAccess access,
                         AuditChainProperties properties,
                         Clock clock,
                         List<AuditRecordShipper> shippers) {
        this.access = access;
        this.properties = properties;
        this.clock = clock;
        this.shippers = List.copyOf(shippers);
    }

    public AuditRecord append(AuditEventRequest request) {
        Objects.requireNonNull(request, "request");
        String chainScope = ChainScope.of(request.workspaceId());
        int maxAttempts = Math.max(1, properties.getAppendMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            try {
                AuditRecord record = appendOnce(chainScope, request);
                log.debug("Appended {} to chain {} (record={}, attempt={})",
                        record.getAction(), chainScope, record.getId(), attempt);
                ship(record);
                return record;
            } catch (AuditLedgerException ex) {
                if (!ex.isRetryable()) {
                    throw ex;
                }
                if (attempt >= maxAttempts) {
                    log.warn("Giving up append of {} to chain {} after {} attempts",
                            request.action(), chainScope, attempt);
                    throw AuditLedgerException.writeConflict(chainScope,
                            "chain head still contended after " + attempt + " attempts");
                }
                backOff(chainScope, attempt);
            }
        }
    }

    private AuditRecord appendOnce(String chainScope, AuditEventRequest request) {
        Optional<ChainHead> head = access.findHead(chainScope);

        String previousHash = head.map(ChainHead::getTipRecordHash).orElse(ChainHash.GENESIS);
        Instant now = ChainHash.truncate(clock.instant());
        // keep created_at strictly increasing within the scope even if clocks disagree
        Instant createdAt = head.map(ChainHead::getTipCreatedAt)
                .map(tip -> tip.plusMillis(1))
                .filter(next -> next.isAfter(now))
                .orElse(now);

        AuditRecord record = AuditRecord.builder()
                .id(UUID.randomUUID().toString())
                .createdAt(createdAt)
                .actorUserId(request.actorUserId())
                .workspaceId(request.workspaceId())
                .action(request.action())
                .resourceType(request.resourceType())
                .resourceId(request.resourceId())
                .details(request.details())
                .ipAddress(request.ipAddress())
                .userAgent(request.userAgent())
                .previousHash(previousHash)
                .build();

        ChainHead next = head.map(h -> h.advance(record)).orElseGet(() -> ChainHead.start(record));
        access.append(record, head.orElse(null), next);
        return record;
    }

    private void ship(AuditRecord record) {
        for (AuditRecordShipper shipper : shippers) {
            try {
                shipper.ship(record);
            } catch (RuntimeException ex) {
                log.warn("Shipping audit record {} to {} failed: {}",
                        record.getId(), shipper.name(), ex.getMessage(), ex);
            }
        }
    }

    private void backOff(String chainScope, int attempt) {
        long millis = properties.getAppendBackoff().toMillis() * attempt;
        log.debug("Chain {} head contended, retrying in {}ms (attempt {})", chainScope, millis, attempt);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw AuditLedgerException.writeConflict(chainScope, ie);
        }
    }
}
