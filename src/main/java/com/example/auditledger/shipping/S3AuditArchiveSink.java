package com.example.auditledger.shipping;

import com.example.auditledger.config.ArchiveExportProperties;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.example.auditledger.models.ChainScope;
import com.example.auditledger.service.AuditLedgerException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Writes each archive batch to S3 as a JSON Lines object at
 * {@code <prefix>/<workspace_id | cross-workspace>/<checkpoint_id>.jsonl}. The SHA-256 of the
 * object body is stored as object metadata and on the checkpoint.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "audit.archival.export.enabled", havingValue = "true")
public class S3AuditArchiveSink implements AuditArchiveSink {

    static final String CROSS_WORKSPACE = "cross-workspace";
    static final String CONTENT_TYPE = "application/x-ndjson";

    private final S3Client s3;
    private final ArchiveExportProperties properties;
    private final AuditRecordJson json;

    public S3AuditArchiveSink(S3Client s3, ArchiveExportProperties properties, AuditRecordJson json) {
        if (properties.getBucket() == null || properties.getBucket().isBlank()) {
            throw new IllegalStateException("audit.archival.export.bucket is required when export is enabled");
        }
        this.s3 = s3;
        this.properties = properties;
        this.json = json;
    }

    @Override
    public ArchiveExport export(String chainScope, String checkpointId, List<AuditRecord> records) {
        byte[] body = json.writeLines(records);
        String checksum = ChainHash.sha256Hex(body);
        String key = keyFor(chainScope, checkpointId);

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(properties.getBucket())
                .key(key)
                .contentType(CONTENT_TYPE)
                .contentLength((long) body.length)
                .metadata(Map.of(
                        "checksum-sha256", checksum,
                        "chain-scope", chainScope,
                        "record-count", String.valueOf(records.size())))
                .build();
        try {
            s3.putObject(request, RequestBody.fromBytes(body));
        } catch (SdkException ex) {
            throw AuditLedgerException.storageError("archive export to s3://" + properties.getBucket() + "/" + key, ex);
        }

        String location = "s3://" + properties.getBucket() + "/" + key;
        log.info("Exported {} records of chain {} to {}", records.size(), chainScope, location);
        return new ArchiveExport(location, checksum);
    }

    @Override
    public String name() {
        return "s3";
    }

    String keyFor(String chainScope, String checkpointId) {
        String workspaceId = ChainScope.workspaceIdOf(chainScope);
        String folder = workspaceId == null ? CROSS_WORKSPACE : workspaceId;
        String prefix = properties.getPrefix() == null || properties.getPrefix().isBlank()
                ? ""
                : properties.getPrefix().replaceAll("/+$", "") + "/";
        return prefix + folder + "/" + checkpointId + ".jsonl";
    }
}
