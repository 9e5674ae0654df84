package com.example.auditledger.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for appending to and verifying the audit chain.
 * These values are bound from application.yml (audit.chain.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "audit.chain")
@Data
public class AuditChainProperties {

    private int appendMaxAttempts = 5;
    private Duration appendBackoff = Duration.ofMillis(20);
    private int verifyDefaultLimit = 10000;
    private int verifyMaxLimit = 100000;
    private List<String> criticalActionPrefixes = new ArrayList<>(List.of("document.", "api_token.", "auth.", "audit."));
    private List<String> criticalActionSuffixes = new ArrayList<>(List.of("_denied"));
}
