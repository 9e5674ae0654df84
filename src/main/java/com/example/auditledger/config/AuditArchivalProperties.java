package com.example.auditledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for audit record archival.
 * These values are bound from application.yml (audit.archival.*).
 * To enable the scheduled job, set audit.archival.enabled=true in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "audit.archival")
@Data
public class AuditArchivalProperties {

    private boolean enabled = false;
    private String schedule = "0 30 3 * * *";
    private int retentionDays = 365;
    private int batchSize = 98;  // capped at the DynamoDB transaction limit
    private int maxConflictRetries = 5;
    private int previewLimit = 10_000;
}
