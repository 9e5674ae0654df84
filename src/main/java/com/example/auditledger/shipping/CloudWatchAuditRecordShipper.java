package com.example.auditledger.shipping;

import com.example.auditledger.config.CloudWatchShippingProperties;
import com.example.auditledger.models.AuditRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

/**
 * Forwards each committed record to CloudWatch Logs as one JSON event. Events are sent once;
 * a failed put is not retried so the external log never receives duplicates from this side.
 *
 * <p>An unreachable CloudWatch at startup does not fail the context: stream creation is retried
 * before the next put until it succeeds.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "audit.shipping.cloudwatch.enabled", havingValue = "true")
public class CloudWatchAuditRecordShipper implements AuditRecordShipper {

    private final CloudWatchLogsClient logs;
    private final CloudWatchShippingProperties properties;
    private final AuditRecordJson json;
    private volatile boolean streamReady;

    public CloudWatchAuditRecordShipper(CloudWatchLogsClient logs,
                                        CloudWatchShippingProperties properties,
                                        AuditRecordJson json) {
        this.logs = logs;
        this.properties = properties;
        this.json = json;
        this.streamReady = ensureLogStream();
    }

    @Override
    public void ship(AuditRecord record) {
        if (!streamReady) {
            streamReady = ensureLogStream();
        }
        logs.putLogEvents(r -> r
                .logGroupName(properties.getLogGroup())
                .logStreamName(properties.getLogStream())
                .logEvents(InputLogEvent.builder()
                        .timestamp(record.getCreatedAt().toEpochMilli())
                        .message(json.write(record))
                        .build()));
    }

    @Override
    public String name() {
        return "cloudwatch";
    }

    boolean isStreamReady() {
        return streamReady;
    }

    private boolean ensureLogStream() {
        try {
            logs.createLogStream(r -> r
                    .logGroupName(properties.getLogGroup())
                    .logStreamName(properties.getLogStream()));
            log.info("Created CloudWatch log stream {}/{}", properties.getLogGroup(), properties.getLogStream());
            return true;
        } catch (ResourceAlreadyExistsException ex) {
            log.debug("CloudWatch log stream {}/{} already exists", properties.getLogGroup(), properties.getLogStream());
            return true;
        } catch (SdkException ex) {
            log.warn("Could not prepare CloudWatch log stream {}/{}, will retry on next record: {}",
                    properties.getLogGroup(), properties.getLogStream(), ex.getMessage());
            return false;
        }
    }
}
