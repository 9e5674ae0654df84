package com.example.auditledger.service;

import com.example.auditledger.access.AuditLedgerAccess;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHead;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.requests.AuditRecordQuery;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Filtered, paged reads over committed records, newest first. A query without a workspace is
 * answered from every chain scope and merged by creation time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditQueryService {

    private static final Comparator<AuditRecord> NEWEST_FIRST =
            Comparator.comparing(AuditRecord::getCreatedAt, Comparator.reverseOrder())
                    .thenComparing(AuditRecord::getId, Comparator.reverseOrder());

    private final AuditLedgerAccess access;

    public List<AuditRecord> search(AuditRecordQuery query) {
        List<String> scopes = query.workspaceId() != null
                ? List.of(ChainScope.of(query.workspaceId()))
                : access.findAllHeads().stream().map(ChainHead::getChainScope).sorted().toList();

        // every scope must supply enough matches to fill the requested page on its own
        int window = query.offset() + query.limit();
        List<AuditRecord> merged = new ArrayList<>();
        for (String scope : scopes) {
            merged.addAll(access.search(scope, query.startDate(), query.endDate(), query::matches, window));
        }
        merged.sort(NEWEST_FIRST);

        int from = Math.min(query.offset(), merged.size());
        int to = Math.min(window, merged.size());
        log.debug("Audit query over {} scopes matched {} records, returning {}", scopes.size(), merged.size(), to - from);
        return new ArrayList<>(merged.subList(from, to));
    }
}
