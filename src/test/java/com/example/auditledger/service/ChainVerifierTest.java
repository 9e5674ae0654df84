package com.example.auditledger.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.example.auditledger.models.VerificationFinding;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChainVerifierTest {

    private static final String SCOPE = "ws:w1";
    private static final Instant T0 = Instant.parse("2024-10-01T00:00:00Z");

    private static List<AuditRecord> chain(String startHash, int count, Instant start) {
        List<AuditRecord> records = new ArrayList<>();
        String previous = startHash;
        for (int i = 0; i < count; i++) {
            AuditRecord record = AuditRecord.builder()
                    .id("r" + i)
                    .createdAt(start.plusSeconds(i))
                    .actorUserId("u1")
                    .workspaceId("w1")
                    .action("document.update")
                    .resourceType("document")
                    .resourceId("d" + i)
                    .previousHash(previous)
                    .build();
            records.add(record);
            previous = record.getRecordHash();
        }
        return records;
    }

    private static ChainWindow window(List<AuditRecord> records) {
        return new ChainWindow(SCOPE, records, List.of(), false);
    }

    @Test
    @DisplayName("intact chain has no findings")
    void intactChain() {
        assertTrue(ChainVerifier.check(window(chain(ChainHash.GENESIS, 5, T0))).isEmpty());
    }

    @Test
    @DisplayName("empty window has no findings")
    void emptyWindow() {
        assertTrue(ChainVerifier.check(window(List.of())).isEmpty());
    }

    @Test
    @DisplayName("records are replayed in chain order regardless of input order")
    void inputOrderIrrelevant() {
        List<AuditRecord> records = chain(ChainHash.GENESIS, 5, T0);
        Collections.reverse(records);

        assertTrue(ChainVerifier.check(window(records)).isEmpty());
    }

    @Test
    @DisplayName("edited field yields exactly one record hash mismatch")
    void editedRecord() {
        List<AuditRecord> records = chain(ChainHash.GENESIS, 5, T0);
        records.get(2).setAction("document.delete");

        List<VerificationFinding> findings = ChainVerifier.check(window(records));

        assertEquals(1, findings.size());
        VerificationFinding finding = findings.get(0);
        assertEquals("r2", finding.recordId());
        assertEquals(VerificationFinding.RECORD_HASH_MISMATCH, finding.errorMessage());
        assertFalse(finding.valid());
        assertEquals(ChainHash.compute(records.get(2)), finding.expectedHash());
        assertEquals(records.get(2).getRecordHash(), finding.actualHash());
    }

    @Test
    @DisplayName("re-hashed forgery is caught at the successor's link")
    void rehashedRecord() {
        List<AuditRecord> records = chain(ChainHash.GENESIS, 5, T0);
        AuditRecord forged = records.get(2).toBuilder().actorUserId("attacker").build();
        records.set(2, forged);

        List<VerificationFinding> findings = ChainVerifier.check(window(records));

        assertEquals(1, findings.size());
        assertEquals("r3", findings.get(0).recordId());
        assertEquals(VerificationFinding.PREVIOUS_HASH_MISMATCH, findings.get(0).errorMessage());
    }

    @Test
    @DisplayName("deleted record breaks the successor's link")
    void deletedRecord() {
        List<AuditRecord> records = chain(ChainHash.GENESIS, 5, T0);
        records.remove(2);

        List<VerificationFinding> findings = ChainVerifier.check(window(records));

        assertEquals(1, findings.size());
        assertEquals("r3", findings.get(0).recordId());
        assertEquals(VerificationFinding.PREVIOUS_HASH_MISMATCH, findings.get(0).errorMessage());
    }

    @Test
    @DisplayName("unknown origin of the first record is reported as such")
    void unknownOrigin() {
        List<AuditRecord> records = chain("f".repeat(64), 3, T0);

        List<VerificationFinding> findings = ChainVerifier.check(window(records));

        assertEquals(1, findings.size());
        assertEquals("r0", findings.get(0).recordId());
        assertEquals(VerificationFinding.CHAIN_ORIGIN_NOT_FOUND, findings.get(0).errorMessage());
        assertEquals(ChainHash.GENESIS, findings.get(0).expectedHash());
    }

    @Test
    @DisplayName("first surviving record links to the checkpoint anchor")
    void checkpointAnchor() {
        List<AuditRecord> all = chain(ChainHash.GENESIS, 6, T0);
        AuditRecord anchor = all.get(2);
        ArchiveCheckpoint checkpoint = ArchiveCheckpoint.builder()
                .id("cp1")
                .lastRecordId(anchor.getId())
                .lastRecordCreatedAt(anchor.getCreatedAt())
                .lastRecordHash(anchor.getRecordHash())
                .recordsArchived(3)
                .workspaceId("w1")
                .build();

        List<AuditRecord> survivors = new ArrayList<>(all.subList(3, 6));

        assertTrue(ChainVerifier.check(new ChainWindow(SCOPE, survivors, List.of(checkpoint), false)).isEmpty());
    }

    @Test
    @DisplayName("genesis link after archival is a previous hash mismatch")
    void genesisAfterArchival() {
        List<AuditRecord> all = chain(ChainHash.GENESIS, 4, T0);
        ArchiveCheckpoint checkpoint = ArchiveCheckpoint.builder()
                .id("cp1")
                .lastRecordId("gone")
                .lastRecordCreatedAt(T0.minusSeconds(10))
                .lastRecordHash("a".repeat(64))
                .recordsArchived(1)
                .workspaceId("w1")
                .build();

        List<VerificationFinding> findings =
                ChainVerifier.check(new ChainWindow(SCOPE, all, List.of(checkpoint), false));

        assertEquals(1, findings.size());
        assertEquals(VerificationFinding.PREVIOUS_HASH_MISMATCH, findings.get(0).errorMessage());
        assertEquals("a".repeat(64), findings.get(0).expectedHash());
    }

    @Test
    @DisplayName("nearest anchor is the newest checkpoint not after the record")
    void nearestAnchor() {
        AuditRecord record = chain(ChainHash.GENESIS, 1, T0.plusSeconds(100)).get(0);
        ArchiveCheckpoint older = ArchiveCheckpoint.builder()
                .id("a").lastRecordId("x").lastRecordCreatedAt(T0).lastRecordHash("1".repeat(64))
                .recordsArchived(1).build();
        ArchiveCheckpoint newer = ArchiveCheckpoint.builder()
                .id("b").lastRecordId("y").lastRecordCreatedAt(T0.plusSeconds(50)).lastRecordHash("2".repeat(64))
                .recordsArchived(1).build();
        ArchiveCheckpoint future = ArchiveCheckpoint.builder()
                .id("c").lastRecordId("z").lastRecordCreatedAt(T0.plusSeconds(500)).lastRecordHash("3".repeat(64))
                .recordsArchived(1).build();

        assertEquals("2".repeat(64),
                ChainVerifier.nearestAnchor(List.of(future, newer, older), record).orElseThrow());
        assertTrue(ChainVerifier.nearestAnchor(List.of(future), record).isEmpty());
    }

    @Test
    @DisplayName("first record of a truncated window is not link-checked")
    void truncatedWindow() {
        List<AuditRecord> all = chain(ChainHash.GENESIS, 6, T0);
        List<AuditRecord> newest = new ArrayList<>(all.subList(3, 6));

        assertTrue(ChainVerifier.check(new ChainWindow(SCOPE, newest, List.of(), true)).isEmpty());
        assertEquals(1, ChainVerifier.check(new ChainWindow(SCOPE, newest, List.of(), false)).size());
    }

    @Test
    @DisplayName("content of the first record of a truncated window is still checked")
    void truncatedWindowContent() {
        List<AuditRecord> all = chain(ChainHash.GENESIS, 6, T0);
        List<AuditRecord> newest = new ArrayList<>(all.subList(3, 6));
        newest.get(0).setResourceId("other");

        List<VerificationFinding> findings = ChainVerifier.check(new ChainWindow(SCOPE, newest, List.of(), true));

        assertEquals(1, findings.size());
        assertEquals("r3", findings.get(0).recordId());
        assertEquals(VerificationFinding.RECORD_HASH_MISMATCH, findings.get(0).errorMessage());
    }

    @Test
    @DisplayName("verify pulls its window from the source")
    void verifyUsesSource() {
        List<AuditRecord> records = chain(ChainHash.GENESIS, 3, T0);
        records.get(1).setActorUserId("someone-else");
        ChainVerifier verifier = new ChainVerifier((scope, limit) -> window(records));

        List<VerificationFinding> findings = verifier.verify(SCOPE, 10);

        assertEquals(1, findings.size());
        assertEquals("r1", findings.get(0).recordId());
    }
}
