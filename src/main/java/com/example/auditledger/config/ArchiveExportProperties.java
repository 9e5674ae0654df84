package com.example.auditledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Export of archived batches to S3 (audit.archival.export.*). When enabled a bucket is required.
 */
@Component
@ConfigurationProperties(prefix = "audit.archival.export")
@Data
public class ArchiveExportProperties {

    private boolean enabled = false;
    private String bucket;
    private String prefix = "audit-archives";
}
