package com.example.auditledger.service;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.example.auditledger.models.VerificationFinding;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replays a chain window and reports every record that breaks it. Independent of any store:
 * records come from the injected {@link ChainSource}.
 *
 * <p>Per record, in chain order:
 * <ol>
 *   <li>Link. The first record of an untruncated window must point at the nearest preceding
 *   checkpoint's anchor, or {@link ChainHash#GENESIS} when the scope was never archived; a
 *   pointer to neither genesis nor any checkpoint is reported as an unknown origin. The first
 *   record of a truncated window links outside the window and is not checked. Every other record
 *   must point at its predecessor's stored hash, or at the predecessor's recomputed hash when
 *   that predecessor was itself reported for a hash mismatch.</li>
 *   <li>Content. When the link holds, the recomputed hash must equal {@code record_hash}.</li>
 * </ol>
 * A single tampered field therefore yields exactly one finding, on the tampered record.
 */
public class ChainVerifier {

    static final Comparator<AuditRecord> CHAIN_ORDER = Comparator
            .comparing(AuditRecord::getCreatedAt)
            .thenComparing(AuditRecord::getId);

    private final ChainSource source;

    public ChainVerifier(ChainSource source) {
        this.source = source;
    }

    public List<VerificationFinding> verify(String chainScope, int limit) {
        return check(source.fetch(chainScope, limit));
    }

    public static List<VerificationFinding> check(ChainWindow window) {
        List<AuditRecord> ordered = window.records().stream()
                .sorted(CHAIN_ORDER)
                .collect(Collectors.toList());
        Set<String> anchors = window.checkpoints().stream()
                .map(ArchiveCheckpoint::getLastRecordHash)
                .collect(Collectors.toSet());

        List<VerificationFinding> findings = new ArrayList<>();
        Collection<String> acceptedPrevious = List.of();
        AuditRecord predecessor = null;

        for (AuditRecord record : ordered) {
            String previousHash = record.getPreviousHash();
            boolean linkBroken = false;

            if (predecessor == null) {
                if (!window.truncated()) {
                    String expected = nearestAnchor(window.checkpoints(), record).orElse(ChainHash.GENESIS);
                    if (!expected.equals(previousHash)) {
                        linkBroken = true;
                        if (ChainHash.GENESIS.equals(previousHash) || anchors.contains(previousHash)) {
                            findings.add(VerificationFinding.previousHashMismatch(record, expected));
                        } else {
                            findings.add(VerificationFinding.chainOriginNotFound(record, expected));
                        }
                    }
                }
            } else if (!acceptedPrevious.contains(previousHash)) {
                linkBroken = true;
                findings.add(VerificationFinding.previousHashMismatch(record, predecessor.getRecordHash()));
            }

            String computed = ChainHash.compute(record);
            boolean contentBroken = !computed.equals(record.getRecordHash());
            if (contentBroken && !linkBroken) {
                findings.add(VerificationFinding.recordHashMismatch(record, computed));
            }

            acceptedPrevious = contentBroken
                    ? Arrays.asList(record.getRecordHash(), computed)
                    : Arrays.asList(record.getRecordHash());
            predecessor = record;
        }
        return findings;
    }

    /**
     * The checkpoint with the newest anchor that is not after {@code record}.
     */
    static Optional<String> nearestAnchor(List<ArchiveCheckpoint> checkpoints, AuditRecord record) {
        return checkpoints.stream()
                .filter(c -> c.getLastRecordCreatedAt() != null)
                .filter(c -> !c.getLastRecordCreatedAt().isAfter(record.getCreatedAt()))
                .max(Comparator.comparing(ArchiveCheckpoint::getLastRecordCreatedAt)
                        .thenComparing(ArchiveCheckpoint::getSortKey, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(ArchiveCheckpoint::getLastRecordHash);
    }
}
