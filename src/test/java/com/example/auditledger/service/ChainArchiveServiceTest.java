package com.example.auditledger.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.auditledger.access.ArchiveBatch;
import com.example.auditledger.access.ImmutabilityGuard;
import com.example.auditledger.access.MaintenanceWindow;
import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHead;
import com.example.auditledger.shipping.ArchiveExport;
import com.example.auditledger.shipping.AuditArchiveSink;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChainArchiveServiceTest {

    private static final Instant CUTOFF = LedgerFixture.START.plus(Duration.ofHours(12));

    /** Ten records on day one, three on day two. */
    private static List<AuditRecord> seed(LedgerFixture fx) {
        List<AuditRecord> old = fx.appendSeries("w1", 10);
        fx.clock.advance(Duration.ofDays(1));
        fx.appendSeries("w1", 3);
        return old;
    }

    private static List<String> actions(LedgerFixture fx, String scope) {
        return fx.access.records(scope).stream().map(AuditRecord::getAction).collect(Collectors.toList());
    }

    @Test
    @DisplayName("archives records older than the cutoff behind a checkpoint")
    void archivesOldRecords() {
        LedgerFixture fx = new LedgerFixture();
        List<AuditRecord> old = seed(fx);

        ArchiveCheckpoint checkpoint = fx.archiveService.archive("ws:w1", CUTOFF, "ops@example.com").orElseThrow();

        AuditRecord newestArchived = old.get(9);
        assertEquals(newestArchived.getId(), checkpoint.getLastRecordId());
        assertEquals(newestArchived.getCreatedAt(), checkpoint.getLastRecordCreatedAt());
        assertEquals(newestArchived.getRecordHash(), checkpoint.getLastRecordHash());
        assertEquals(10, checkpoint.getRecordsArchived());
        assertEquals("w1", checkpoint.getWorkspaceId());
        assertEquals("ops@example.com", checkpoint.getArchivedBy());
        assertEquals(List.of(checkpoint.getId()),
                fx.access.findCheckpoints("ws:w1").stream().map(ArchiveCheckpoint::getId).collect(Collectors.toList()));

        List<AuditRecord> survivors = fx.access.records("ws:w1");
        assertTrue(survivors.stream().noneMatch(r -> r.getCreatedAt().isBefore(CUTOFF)));
        assertEquals(newestArchived.getRecordHash(), survivors.get(0).getPreviousHash());

        ChainHead head = fx.access.findHead("ws:w1").orElseThrow();
        assertEquals(checkpoint.getId(), head.getLatestCheckpointId());
        assertEquals((long) survivors.size(), head.getRecordCount());
    }

    @Test
    @DisplayName("archival is itself recorded in the chain")
    void recordsMaintenanceEvents() {
        LedgerFixture fx = new LedgerFixture();
        seed(fx);

        ArchiveCheckpoint checkpoint = fx.archiveService.archive("ws:w1", CUTOFF, null).orElseThrow();

        List<String> actions = actions(fx, "ws:w1");
        assertEquals(List.of(AuditActions.MAINTENANCE_STARTED, AuditActions.RECORDS_ARCHIVED,
                AuditActions.MAINTENANCE_ENDED), actions.subList(3, 6));

        AuditRecord archived = fx.access.records("ws:w1").get(4);
        assertEquals(AuditActions.LEDGER_RESOURCE_TYPE, archived.getResourceType());
        assertEquals(checkpoint.getId(), archived.getResourceId());
        assertEquals(10, archived.getDetails().get("records_archived"));
        assertEquals(checkpoint.getId(), archived.getDetails().get("checkpoint_id"));
        assertEquals(CUTOFF.toString(), archived.getDetails().get("cutoff"));
        assertEquals(ChainArchiveService.SCHEDULED_JOB, checkpoint.getArchivedBy());

        AuditRecord ended = fx.access.records("ws:w1").get(5);
        assertEquals(Boolean.TRUE, ended.getDetails().get("succeeded"));
    }

    @Test
    @DisplayName("large backlogs are archived in bounded batches")
    void batches() {
        LedgerFixture fx = new LedgerFixture();
        fx.archivalProperties.setBatchSize(4);
        seed(fx);

        ArchiveCheckpoint last = fx.archiveService.archive("ws:w1", CUTOFF, "ops").orElseThrow();

        List<ArchiveCheckpoint> checkpoints = fx.access.findCheckpoints("ws:w1");
        assertEquals(3, checkpoints.size());
        assertEquals(List.of(4, 4, 2), checkpoints.stream().map(ArchiveCheckpoint::getRecordsArchived)
                .collect(Collectors.toList()));
        assertEquals(last.getId(), checkpoints.get(2).getId());
        assertEquals(10, fx.access.records("ws:w1").get(4).getDetails().get("records_archived"));
        assertTrue(fx.verificationService.verify("w1", null).valid());
    }

    @Test
    @DisplayName("nothing to archive returns empty and writes no checkpoint")
    void nothingToArchive() {
        LedgerFixture fx = new LedgerFixture();
        seed(fx);

        Optional<ArchiveCheckpoint> result = fx.archiveService.archive("ws:w1", LedgerFixture.START, "ops");

        assertTrue(result.isEmpty());
        assertTrue(fx.access.findCheckpoints("ws:w1").isEmpty());
        assertFalse(actions(fx, "ws:w1").contains(AuditActions.RECORDS_ARCHIVED));
    }

    @Test
    @DisplayName("cutoff in the future never archives records written during maintenance")
    void futureCutoff() {
        LedgerFixture fx = new LedgerFixture();
        seed(fx);

        fx.archiveService.archive("ws:w1", Instant.parse("2100-01-01T00:00:00Z"), "ops");

        assertEquals(List.of(AuditActions.MAINTENANCE_STARTED, AuditActions.RECORDS_ARCHIVED,
                AuditActions.MAINTENANCE_ENDED), actions(fx, "ws:w1"));
        assertTrue(fx.verificationService.verify("w1", null).valid());
    }

    @Test
    @DisplayName("appends after archival link to the retained tip")
    void appendAfterArchival() {
        LedgerFixture fx = new LedgerFixture();
        seed(fx);
        fx.archiveService.archive("ws:w1", CUTOFF, "ops");
        String tip = fx.access.findHead("ws:w1").orElseThrow().getTipRecordHash();

        AuditRecord next = fx.append("w1", "document.create");

        assertEquals(tip, next.getPreviousHash());
        assertTrue(fx.verificationService.verify("w1", null).valid());
    }

    @Test
    @DisplayName("other scopes are untouched")
    void scopeIsolation() {
        LedgerFixture fx = new LedgerFixture();
        fx.appendSeries("w2", 4);
        seed(fx);

        fx.archiveService.archive("ws:w1", CUTOFF, "ops");

        assertEquals(4, fx.access.records("ws:w2").size());
        assertTrue(fx.access.findCheckpoints("ws:w2").isEmpty());
    }

    @Test
    @DisplayName("head conflicts re-read the batch and retry")
    void retriesConflicts() {
        AtomicInteger calls = new AtomicInteger();
        LedgerFixture fx = new LedgerFixture(guard -> new InMemoryAuditLedgerAccess(guard) {
            @Override
            public synchronized void archive(MaintenanceWindow window, ArchiveBatch batch) {
                if (calls.incrementAndGet() == 1) {
                    throw AuditLedgerException.writeConflict(batch.chainScope(), "chain head moved");
                }
                super.archive(window, batch);
            }
        }, List.of());
        seed(fx);

        ArchiveCheckpoint checkpoint = fx.archiveService.archive("ws:w1", CUTOFF, "ops").orElseThrow();

        assertEquals(2, calls.get());
        assertEquals(10, checkpoint.getRecordsArchived());
        assertTrue(fx.verificationService.verify("w1", null).valid());
    }

    @Test
    @DisplayName("persistent conflicts give up with WRITE_CONFLICT")
    void givesUpOnConflicts() {
        LedgerFixture fx = new LedgerFixture(guard -> new InMemoryAuditLedgerAccess(guard) {
            @Override
            public synchronized void archive(MaintenanceWindow window, ArchiveBatch batch) {
                throw AuditLedgerException.writeConflict(batch.chainScope(), "chain head moved");
            }
        }, List.of());
        fx.archivalProperties.setMaxConflictRetries(3);
        seed(fx);

        AuditLedgerException ex = assertThrows(AuditLedgerException.class,
                () -> fx.archiveService.archive("ws:w1", CUTOFF, "ops"));

        assertEquals(AuditLedgerException.Code.WRITE_CONFLICT, ex.getCode());
        assertEquals(13, fx.access.records("ws:w1").stream()
                .filter(r -> r.getAction().equals("document.update")).count());
    }

    @Test
    @DisplayName("inconsistency aborts, keeps the records and records a failed window")
    void inconsistencyAborts() {
        LedgerFixture fx = new LedgerFixture(guard -> new InMemoryAuditLedgerAccess(guard) {
            @Override
            public synchronized void archive(MaintenanceWindow window, ArchiveBatch batch) {
                throw AuditLedgerException.archivalInconsistency(batch.chainScope(), "record vanished", null);
            }
        }, List.of());
        seed(fx);

        AuditLedgerException ex = assertThrows(AuditLedgerException.class,
                () -> fx.archiveService.archive("ws:w1", CUTOFF, "ops"));

        assertEquals(AuditLedgerException.Code.ARCHIVAL_INCONSISTENCY, ex.getCode());
        assertTrue(fx.access.findCheckpoints("ws:w1").isEmpty());
        List<AuditRecord> records = fx.access.records("ws:w1");
        AuditRecord last = records.get(records.size() - 1);
        assertEquals(AuditActions.MAINTENANCE_ENDED, last.getAction());
        assertEquals(Boolean.FALSE, last.getDetails().get("succeeded"));
    }

    @Test
    @DisplayName("second archival of the same scope in flight is rejected")
    void oneWindowPerScope() {
        LedgerFixture fx = new LedgerFixture();
        seed(fx);
        ImmutabilityGuard guard = fx.guard;

        AuditLedgerException ex = guard.withMaintenance("ws:w1", "outer", "ops",
                window -> assertThrows(AuditLedgerException.class,
                        () -> fx.archiveService.archive("ws:w1", CUTOFF, "ops")));

        assertEquals(AuditLedgerException.Code.WRITE_CONFLICT, ex.getCode());
    }

    /** Keeps exported batches in memory and checks they were still live when exported. */
    private static class RecordingSink implements AuditArchiveSink {
        final AtomicReference<LedgerFixture> fixture = new AtomicReference<>();
        final List<List<AuditRecord>> batches = new ArrayList<>();

        @Override
        public ArchiveExport export(String chainScope, String checkpointId, List<AuditRecord> records) {
            List<String> live = fixture.get().access.records(chainScope).stream()
                    .map(AuditRecord::getId).collect(Collectors.toList());
            assertTrue(records.stream().allMatch(r -> live.contains(r.getId())));
            batches.add(List.copyOf(records));
            return new ArchiveExport("mem://" + chainScope + "/" + checkpointId, "c" + batches.size());
        }

        @Override
        public String name() {
            return "memory";
        }
    }

    @Test
    @DisplayName("each batch is exported before deletion and the checkpoint keeps its location")
    void exportsBeforeDelete() {
        RecordingSink sink = new RecordingSink();
        LedgerFixture fx = new LedgerFixture(sink);
        sink.fixture.set(fx);
        fx.archivalProperties.setBatchSize(4);
        List<AuditRecord> old = seed(fx);

        ArchiveCheckpoint last = fx.archiveService.archive("ws:w1", CUTOFF, "ops").orElseThrow();

        assertEquals(List.of(4, 4, 2), sink.batches.stream().map(List::size).collect(Collectors.toList()));
        assertEquals(old.stream().map(AuditRecord::getId).collect(Collectors.toList()),
                sink.batches.stream().flatMap(List::stream).map(AuditRecord::getId).collect(Collectors.toList()));

        List<ArchiveCheckpoint> checkpoints = fx.access.findCheckpoints("ws:w1");
        assertEquals("mem://ws:w1/" + checkpoints.get(0).getId(), checkpoints.get(0).getArchiveLocation());
        assertEquals("c1", checkpoints.get(0).getArchiveChecksum());
        assertEquals("c3", last.getArchiveChecksum());

        AuditRecord archivedEvent = fx.access.records("ws:w1").stream()
                .filter(r -> r.getAction().equals(AuditActions.RECORDS_ARCHIVED))
                .findFirst().orElseThrow();
        assertEquals(checkpoints.stream().map(ArchiveCheckpoint::getArchiveLocation).collect(Collectors.toList()),
                archivedEvent.getDetails().get("archive_locations"));
        assertTrue(fx.verificationService.verify("w1", null).valid());
    }

    @Test
    @DisplayName("without a sink checkpoints carry no export location")
    void noSink() {
        LedgerFixture fx = new LedgerFixture();
        seed(fx);

        ArchiveCheckpoint checkpoint = fx.archiveService.archive("ws:w1", CUTOFF, "ops").orElseThrow();

        assertNull(checkpoint.getArchiveLocation());
        assertNull(checkpoint.getArchiveChecksum());
    }

    @Test
    @DisplayName("failed export aborts before anything is deleted")
    void failedExportKeepsRecords() {
        LedgerFixture fx = new LedgerFixture(new AuditArchiveSink() {
            @Override
            public ArchiveExport export(String chainScope, String checkpointId, List<AuditRecord> records) {
                throw AuditLedgerException.storageError("archive export", new RuntimeException("bucket gone"));
            }

            @Override
            public String name() {
                return "broken";
            }
        });
        seed(fx);

        AuditLedgerException ex = assertThrows(AuditLedgerException.class,
                () -> fx.archiveService.archive("ws:w1", CUTOFF, "ops"));

        assertEquals(AuditLedgerException.Code.STORAGE_ERROR, ex.getCode());
        assertTrue(fx.access.findCheckpoints("ws:w1").isEmpty());
        assertEquals(13, fx.access.records("ws:w1").stream()
                .filter(r -> r.getAction().equals("document.update")).count());
        List<AuditRecord> records = fx.access.records("ws:w1");
        AuditRecord last = records.get(records.size() - 1);
        assertEquals(AuditActions.MAINTENANCE_ENDED, last.getAction());
        assertEquals(Boolean.FALSE, last.getDetails().get("succeeded"));
        assertTrue(fx.verificationService.verify("w1", null).valid());
    }

    @Test
    @DisplayName("dry run reports candidates without a maintenance window or any write")
    void previewWritesNothing() {
        LedgerFixture fx = new LedgerFixture();
        fx.archivalProperties.setBatchSize(4);
        List<AuditRecord> old = seed(fx);
        int before = fx.access.allRecords().size();

        ArchivePreview preview = fx.archiveService.preview("ws:w1", CUTOFF);

        assertEquals("ws:w1", preview.chainScope());
        assertEquals(CUTOFF, preview.cutoff());
        assertEquals(10, preview.recordsToArchive());
        assertFalse(preview.more());
        assertEquals(old.get(0).getCreatedAt(), preview.oldestRecord());
        assertEquals(old.get(9).getCreatedAt(), preview.newestRecord());
        assertEquals(3, preview.batches());

        assertEquals(before, fx.access.allRecords().size());
        assertTrue(fx.access.findCheckpoints("ws:w1").isEmpty());
        assertFalse(actions(fx, "ws:w1").contains(AuditActions.MAINTENANCE_STARTED));
    }

    @Test
    @DisplayName("dry run caps its scan and flags that more records qualify")
    void previewLimit() {
        LedgerFixture fx = new LedgerFixture();
        fx.archivalProperties.setPreviewLimit(4);
        seed(fx);

        ArchivePreview capped = fx.archiveService.preview("ws:w1", CUTOFF);
        ArchivePreview empty = fx.archiveService.preview("ws:w1", LedgerFixture.START);

        assertEquals(4, capped.recordsToArchive());
        assertTrue(capped.more());
        assertEquals(0, empty.recordsToArchive());
        assertNull(empty.oldestRecord());
        assertEquals(0, empty.batches());
    }
}
