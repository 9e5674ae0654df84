package com.example.auditledger.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
public class AwsClientConfig {

    @Bean
    public DynamoDbClient dynamo(AwsProperties aws) {
        return configure(DynamoDbClient.builder(), aws).build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoEnhanced(DynamoDbClient dynamo) {
        return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
    }

    // shipping runs on the appending thread, so every call is bounded
    @Bean
    @ConditionalOnProperty(value = "audit.shipping.cloudwatch.enabled", havingValue = "true")
    public CloudWatchLogsClient cloudWatchLogs(AwsProperties aws, CloudWatchShippingProperties shipping) {
        return configure(CloudWatchLogsClient.builder(), aws)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(shipping.getApiCallTimeout())
                        .build())
                .build();
    }

    @Bean
    @ConditionalOnProperty(value = "audit.archival.export.enabled", havingValue = "true")
    public S3Client s3(AwsProperties aws) {
        // LocalStack serves buckets by path, not by virtual host
        return configure(S3Client.builder(), aws)
                .forcePathStyle(aws.isUseLocalstack())
                .build();
    }

    private static <B extends AwsClientBuilder<B, C>, C> B configure(B builder, AwsProperties aws) {
        builder.region(Region.of(aws.getRegion()));
        if (aws.isUseLocalstack()) {
            builder.endpointOverride(URI.create(aws.getEndpoint()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("test", "test")));
        }
        return builder;
    }
}
