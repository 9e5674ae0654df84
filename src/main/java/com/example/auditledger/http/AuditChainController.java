package com.example.auditledger.http;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.models.VerificationFinding;
import com.example.auditledger.requests.ArchiveChainHttpRequest;
import com.example.auditledger.requests.VerifyChainHttpRequest;
import com.example.auditledger.service.ArchivePreview;
import com.example.auditledger.service.ChainArchiveService;
import com.example.auditledger.service.ChainVerificationService;
import com.example.auditledger.service.VerificationReport;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints over whole chains: integrity verification and manual archival (with a
 * dry-run mode that writes nothing).
 */
@RestController
public class AuditChainController {

    private final ChainVerificationService verificationService;
    private final ChainArchiveService archiveService;
    private final Clock clock;

    public AuditChainController(ChainVerificationService verificationService,
                                ChainArchiveService archiveService,
                                Clock clock) {
        this.verificationService = verificationService;
        this.archiveService = archiveService;
        this.clock = clock;
    }

    @PostMapping("/audit-records/verify")
    public ResponseEntity<VerificationReportResponse> verify(
            @Valid @RequestBody(required = false) VerifyChainHttpRequest request) {
        String workspaceId = request != null ? request.workspaceId() : null;
        Integer limit = request != null ? request.limit() : null;
        VerificationReport report = verificationService.verify(workspaceId, limit);
        return ResponseEntity.ok(new VerificationReportResponse(
                report.valid(),
                report.recordsChecked(),
                report.chainScopes(),
                report.findings().stream().map(AuditChainController::map).toList()
        ));
    }

    @PostMapping("/audit-records/archive")
    public ResponseEntity<?> archive(@Valid @RequestBody ArchiveChainHttpRequest request) {
        String chainScope = ChainScope.of(request.workspaceId());
        Instant cutoff = request.cutoff(clock);
        if (request.isDryRun()) {
            return ResponseEntity.ok(map(archiveService.preview(chainScope, cutoff)));
        }
        return archiveService.archive(chainScope, cutoff, request.archivedBy())
                .<ResponseEntity<?>>map(cp -> ResponseEntity.ok(map(cp)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private static VerificationReportResponse.Finding map(VerificationFinding finding) {
        return new VerificationReportResponse.Finding(
                finding.recordId(),
                finding.chainScope(),
                finding.createdAt(),
                finding.valid(),
                finding.errorMessage(),
                finding.expectedHash(),
                finding.actualHash()
        );
    }

    static CheckpointResponse map(ArchiveCheckpoint checkpoint) {
        return new CheckpointResponse(
                checkpoint.getId(),
                checkpoint.getChainScope(),
                checkpoint.getWorkspaceId(),
                checkpoint.getLastRecordId(),
                checkpoint.getLastRecordCreatedAt(),
                checkpoint.getLastRecordHash(),
                checkpoint.getRecordsArchived(),
                checkpoint.getArchivedAt(),
                checkpoint.getArchivedBy(),
                checkpoint.getArchiveLocation(),
                checkpoint.getArchiveChecksum()
        );
    }

    static ArchivePreviewResponse map(ArchivePreview preview) {
        return new ArchivePreviewResponse(
                true,
                preview.chainScope(),
                preview.cutoff(),
                preview.recordsToArchive(),
                preview.more(),
                preview.oldestRecord(),
                preview.newestRecord(),
                preview.batches()
        );
    }
}
