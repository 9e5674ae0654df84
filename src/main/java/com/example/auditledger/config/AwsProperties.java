package com.example.auditledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * AWS connection settings shared by every client (server.aws.*). With use-localstack the
 * clients point at {@code endpoint} with static test credentials.
 */
@Component
@ConfigurationProperties(prefix = "server.aws")
@Data
public class AwsProperties {

    private String region = "us-east-1";
    private String endpoint = "http://localhost:4566";
    private boolean useLocalstack = true;
}
