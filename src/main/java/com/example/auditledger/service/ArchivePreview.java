package com.example.auditledger.service;

import java.time.Instant;

/**
 * What an archival run would remove from a chain scope right now. {@code more} is set when
 * candidates exceed the preview limit and {@code recordsToArchive} is a lower bound.
 */
public record ArchivePreview(
        String chainScope,
        Instant cutoff,
        int recordsToArchive,
        boolean more,
        Instant oldestRecord,
        Instant newestRecord,
        int batches
) {}
