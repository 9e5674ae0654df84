package com.example.auditledger.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Forwarding of committed audit records to CloudWatch Logs (audit.shipping.cloudwatch.*).
 */
@Component
@ConfigurationProperties(prefix = "audit.shipping.cloudwatch")
@Data
public class CloudWatchShippingProperties {

    private boolean enabled = false;
    private String logGroup = "/audit-ledger/records";
    private String logStream = "audit-ledger";
    // upper bound a slow CloudWatch adds to a critical emit
    private Duration apiCallTimeout = Duration.ofSeconds(2);
}
