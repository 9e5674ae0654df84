package com.example.auditledger.service;

import com.example.auditledger.access.AuditLedgerAccess;
import com.example.auditledger.config.AuditArchivalProperties;
import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.ChainHead;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that archives audit records older than the configured retention period.
 * Every known chain scope is archived independently; a failure on one scope does not stop the
 * others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "audit.archival.enabled", havingValue = "true")
public class AuditArchivalJob {

    private final Clock clock;
    private final AuditArchivalProperties properties;
    private final AuditLedgerAccess access;
    private final ChainArchiveService archiveService;

    @Scheduled(cron = "${audit.archival.schedule:0 30 3 * * *}")
    public void archiveExpiredRecords() {
        long startTime = clock.millis();
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
        log.info("Starting audit archival job (retention period: {} days, cutoff: {})",
                properties.getRetentionDays(), cutoff);

        List<ChainHead> heads = access.findAllHeads();
        int archivedScopes = 0;
        int untouchedScopes = 0;
        int failedScopes = 0;

        for (ChainHead head : heads) {
            try {
                Optional<ArchiveCheckpoint> checkpoint =
                        archiveService.archive(head.getChainScope(), cutoff, ChainArchiveService.SCHEDULED_JOB);
                if (checkpoint.isPresent()) {
                    archivedScopes++;
                } else {
                    untouchedScopes++;
                }
            } catch (RuntimeException ex) {
                failedScopes++;
                log.warn("Failed to archive chain {}: {}", head.getChainScope(), ex.getMessage());
            }
        }

        long duration = clock.millis() - startTime;
        log.info("Completed audit archival job in {}ms: archived={}, untouched={}, failed={}",
                duration, archivedScopes, untouchedScopes, failedScopes);
    }
}
