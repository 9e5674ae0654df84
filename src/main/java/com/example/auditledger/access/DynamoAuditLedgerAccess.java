package com.example.auditledger.access;

import com.example.auditledger.models.ArchiveCheckpoint;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.example.auditledger.models.ChainHead;
import com.example.auditledger.service.AuditLedgerException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactDeleteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

/**
 * DynamoDB implementation of the ledger store. Appends and archive batches are
 * {@code TransactWriteItems} calls whose first action is the conditional head rewrite, so
 * cancellation reason 0 always identifies head contention.
 */
@Component
@Slf4j
public class DynamoAuditLedgerAccess implements AuditLedgerAccess {

    public static final String RECORDS_TABLE = "audit_records";
    public static final String HEADS_TABLE = "audit_chain_heads";
    public static final String CHECKPOINTS_TABLE = "audit_archive_checkpoints";

    // DynamoDB allows 100 actions per transaction: head + checkpoint + deletes
    public static final int MAX_ARCHIVE_BATCH = 98;

    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
    private static final Expression KEY_ABSENT = Expression.builder()
            .expression("attribute_not_exists(#pk)")
            .putExpressionName("#pk", "chain_scope")
            .build();
    private static final Expression KEY_PRESENT = Expression.builder()
            .expression("attribute_exists(#pk)")
            .putExpressionName("#pk", "chain_scope")
            .build();

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<AuditRecord> records;
    private final DynamoDbTable<ChainHead> heads;
    private final DynamoDbTable<ArchiveCheckpoint> checkpoints;
    private final ImmutabilityGuard guard;

    public DynamoAuditLedgerAccess(DynamoDbEnhancedClient enhancedClient, ImmutabilityGuard guard) {
        this.enhancedClient = enhancedClient;
        this.records = enhancedClient.table(RECORDS_TABLE, TableSchema.fromBean(AuditRecord.class));
        this.heads = enhancedClient.table(HEADS_TABLE, TableSchema.fromBean(ChainHead.class));
        this.checkpoints = enhancedClient.table(CHECKPOINTS_TABLE, TableSchema.fromBean(ArchiveCheckpoint.class));
        this.guard = guard;
    }

    @Override
    public Optional<ChainHead> findHead(String chainScope) {
        try {
            return Optional.ofNullable(heads.getItem(r -> r.key(partitionKey(chainScope)).consistentRead(true)));
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("head lookup", ex);
        }
    }

    @Override
    public List<ChainHead> findAllHeads() {
        try {
            return heads.scan(r -> r.consistentRead(true))
                    .items()
                    .stream()
                    .collect(Collectors.toList());
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("head scan", ex);
        }
    }

    @Override
    public void append(AuditRecord record, ChainHead expectedHead, ChainHead nextHead) {
        TransactWriteItemsEnhancedRequest request = TransactWriteItemsEnhancedRequest.builder()
                .addPutItem(heads, TransactPutItemEnhancedRequest.builder(ChainHead.class)
                        .item(nextHead)
                        .conditionExpression(headCondition(expectedHead))
                        .build())
                .addPutItem(records, TransactPutItemEnhancedRequest.builder(AuditRecord.class)
                        .item(record)
                        .conditionExpression(KEY_ABSENT)
                        .build())
                .build();
        try {
            enhancedClient.transactWriteItems(request);
        } catch (TransactionCanceledException ex) {
            List<CancellationReason> reasons = ex.cancellationReasons();
            if (failedCondition(reasons, 1)) {
                throw guard.rejectOverwrite(record.getChainScope(), record.getId());
            }
            throw AuditLedgerException.writeConflict(record.getChainScope(), ex);
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("append", ex);
        }
    }

    @Override
    public List<AuditRecord> findLatest(String chainScope, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            List<AuditRecord> newestFirst = records.query(r -> r
                            .queryConditional(QueryConditional.keyEqualTo(partitionKey(chainScope)))
                            .scanIndexForward(false)
                            .consistentRead(true)
                            .limit(limit))
                    .items()
                    .stream()
                    .limit(limit)
                    .collect(Collectors.toCollection(ArrayList::new));
            Collections.reverse(newestFirst);
            return newestFirst;
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("record query", ex);
        }
    }

    @Override
    public List<AuditRecord> search(String chainScope, Instant from, Instant to,
                                    Predicate<AuditRecord> filter, int max) {
        if (max <= 0) {
            return List.of();
        }
        try {
            // pages are fetched lazily, so the walk stops once max matches are found
            return records.query(r -> r
                            .queryConditional(createdBetween(chainScope, from, to))
                            .scanIndexForward(false)
                            .consistentRead(true))
                    .items()
                    .stream()
                    .filter(filter)
                    .limit(max)
                    .collect(Collectors.toList());
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("record search", ex);
        }
    }

    @Override
    public List<AuditRecord> findOldest(String chainScope, Instant createdBefore, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        // "<ts>#<id>" sorts after "<ts>", so records created exactly at the cutoff are excluded
        Key upperBound = Key.builder()
                .partitionValue(chainScope)
                .sortValue(ChainHash.formatTimestamp(createdBefore))
                .build();
        try {
            return records.query(r -> r
                            .queryConditional(QueryConditional.sortLessThan(upperBound))
                            .scanIndexForward(true)
                            .consistentRead(true)
                            .limit(limit))
                    .items()
                    .stream()
                    .limit(limit)
                    .collect(Collectors.toList());
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("archival query", ex);
        }
    }

    @Override
    public List<ArchiveCheckpoint> findCheckpoints(String chainScope) {
        try {
            return checkpoints.query(r -> r
                            .queryConditional(QueryConditional.keyEqualTo(partitionKey(chainScope)))
                            .scanIndexForward(true)
                            .consistentRead(true))
                    .items()
                    .stream()
                    .collect(Collectors.toList());
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("checkpoint query", ex);
        }
    }

    @Override
    public void archive(MaintenanceWindow window, ArchiveBatch batch) {
        guard.requireMaintenance(window, batch.chainScope());
        if (batch.records().size() > MAX_ARCHIVE_BATCH) {
            throw new IllegalArgumentException("archive batch exceeds " + MAX_ARCHIVE_BATCH + " records");
        }

        TransactWriteItemsEnhancedRequest.Builder tx = TransactWriteItemsEnhancedRequest.builder()
                .addPutItem(heads, TransactPutItemEnhancedRequest.builder(ChainHead.class)
                        .item(batch.nextHead())
                        .conditionExpression(headCondition(batch.expectedHead()))
                        .build())
                .addPutItem(checkpoints, TransactPutItemEnhancedRequest.builder(ArchiveCheckpoint.class)
                        .item(batch.checkpoint())
                        .conditionExpression(KEY_ABSENT)
                        .build());
        for (AuditRecord record : batch.records()) {
            tx.addDeleteItem(records, TransactDeleteItemEnhancedRequest.builder()
                    .key(Key.builder()
                            .partitionValue(record.getChainScope())
                            .sortValue(record.getSortKey())
                            .build())
                    .conditionExpression(KEY_PRESENT)
                    .build());
        }

        try {
            enhancedClient.transactWriteItems(tx.build());
            log.info("Archived {} records from chain {} behind checkpoint {}",
                    batch.records().size(), batch.chainScope(), batch.checkpoint().getId());
        } catch (TransactionCanceledException ex) {
            List<CancellationReason> reasons = ex.cancellationReasons();
            if (reasons == null || reasons.isEmpty() || failedCondition(reasons, 0) || !anyFailedCondition(reasons)) {
                throw AuditLedgerException.writeConflict(batch.chainScope(), ex);
            }
            throw AuditLedgerException.archivalInconsistency(batch.chainScope(),
                    "checkpoint or record precondition failed", ex);
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("archive", ex);
        }
    }

    private static Expression headCondition(ChainHead expectedHead) {
        if (expectedHead == null) {
            return KEY_ABSENT;
        }
        return Expression.builder()
                .expression("#v = :v")
                .putExpressionName("#v", "version")
                .putExpressionValue(":v", AttributeValue.builder().n(String.valueOf(expectedHead.getVersion())).build())
                .build();
    }

    private static boolean failedCondition(List<CancellationReason> reasons, int index) {
        return reasons != null
                && reasons.size() > index
                && CONDITIONAL_CHECK_FAILED.equals(reasons.get(index).code());
    }

    private static boolean anyFailedCondition(List<CancellationReason> reasons) {
        return reasons.stream().anyMatch(r -> CONDITIONAL_CHECK_FAILED.equals(r.code()));
    }

    // "<ts>#<id>" keys: from <= key < formatted(to + 1ms) covers every record created in [from, to]
    private static QueryConditional createdBetween(String chainScope, Instant from, Instant to) {
        Key lower = from == null ? null : sortKey(chainScope, ChainHash.formatTimestamp(from));
        Key upper = to == null ? null : sortKey(chainScope, ChainHash.formatTimestamp(to.plusMillis(1)));
        if (lower != null && upper != null) {
            return QueryConditional.sortBetween(lower, upper);
        }
        if (lower != null) {
            return QueryConditional.sortGreaterThanOrEqualTo(lower);
        }
        if (upper != null) {
            return QueryConditional.sortLessThan(upper);
        }
        return QueryConditional.keyEqualTo(partitionKey(chainScope));
    }

    private static Key sortKey(String chainScope, String sortValue) {
        return Key.builder().partitionValue(chainScope).sortValue(sortValue).build();
    }

    private static Key partitionKey(String chainScope) {
        return Key.builder().partitionValue(chainScope).build();
    }
}
