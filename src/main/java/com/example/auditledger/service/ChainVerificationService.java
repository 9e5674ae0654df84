package com.example.auditledger.service;

import com.example.auditledger.access.AuditLedgerAccess;
import com.example.auditledger.config.AuditChainProperties;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHead;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.models.VerificationFinding;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs {@link ChainVerifier} against the ledger store. A limit bounds each scope to its most
 * recent records; tampering older than the window is not visible to that run.
 */
@Service
@Slf4j
public class ChainVerificationService {

    private final AuditLedgerAccess access;
    private final AuditChainProperties properties;
    private final ChainVerifier verifier;

    public ChainVerificationService(AuditLedgerAccess access, AuditChainProperties properties) {
        this.access = access;
        this.properties = properties;
        this.verifier = new ChainVerifier(this::loadWindow);
    }

    /**
     * Verifies one workspace's chain, or every chain (global included) when {@code workspaceId}
     * is null. The limit applies to each chain, so an all-chains report can check up to
     * {@code limit} records per scope.
     */
    public VerificationReport verify(String workspaceId, Integer limit) {
        List<String> scopes = workspaceId == null || workspaceId.isBlank()
                ? allScopes()
                : List.of(ChainScope.of(workspaceId));
        return verifyScopes(scopes, limit);
    }

    private VerificationReport verifyScopes(List<String> scopes, Integer limit) {
        int effectiveLimit = effectiveLimit(limit);
        List<VerificationFinding> findings = new ArrayList<>();
        int checked = 0;

        for (String scope : scopes) {
            ChainWindow window = loadWindow(scope, effectiveLimit);
            List<VerificationFinding> scopeFindings = ChainVerifier.check(window);
            checked += window.records().size();
            findings.addAll(scopeFindings);
            if (scopeFindings.isEmpty()) {
                log.debug("Chain {} verified clean ({} records)", scope, window.records().size());
            } else {
                log.warn("Chain {} has {} integrity findings in {} records",
                        scope, scopeFindings.size(), window.records().size());
            }
        }
        return VerificationReport.of(checked, scopes, findings);
    }

    /**
     * Findings only, for callers that do not need the report envelope.
     */
    public List<VerificationFinding> findings(String chainScope, Integer limit) {
        return verifier.verify(chainScope, effectiveLimit(limit));
    }

    ChainWindow loadWindow(String chainScope, int limit) {
        // one extra record tells whether older live records exist before the window
        List<AuditRecord> newest = access.findLatest(chainScope, limit + 1);
        boolean truncated = newest.size() > limit;
        List<AuditRecord> records = truncated ? newest.subList(1, newest.size()) : newest;
        return new ChainWindow(chainScope, records, access.findCheckpoints(chainScope), truncated);
    }

    private int effectiveLimit(Integer requested) {
        if (requested == null) {
            return properties.getVerifyDefaultLimit();
        }
        if (requested < 1) {
            throw AuditLedgerException.invalidRequest("limit must be positive");
        }
        return Math.min(requested, properties.getVerifyMaxLimit());
    }

    private List<String> allScopes() {
        return access.findAllHeads().stream()
                .map(ChainHead::getChainScope)
                .sorted()
                .toList();
    }
}
