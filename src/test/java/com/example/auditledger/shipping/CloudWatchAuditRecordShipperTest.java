package com.example.auditledger.shipping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auditledger.config.CloudWatchShippingProperties;
import com.example.auditledger.models.AuditRecord;
import com.example.auditledger.models.ChainHash;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

class CloudWatchAuditRecordShipperTest {

    private static final AuditRecordJson JSON = new AuditRecordJson(new ObjectMapper());

    private static AuditRecord record() {
        return AuditRecord.builder()
                .id("rec-1")
                .createdAt(Instant.parse("2024-10-01T12:34:56.789Z"))
                .actorUserId("u1")
                .workspaceId("w1")
                .action("document.create")
                .resourceType("document")
                .resourceId("d1")
                .details(Map.of("title", "Plan"))
                .previousHash(ChainHash.GENESIS)
                .build();
    }

    @Test
    @DisplayName("existing log stream is reused and records are put")
    @SuppressWarnings("unchecked")
    void ships() {
        CloudWatchLogsClient logs = mock(CloudWatchLogsClient.class);
        when(logs.createLogStream(any(Consumer.class)))
                .thenThrow(ResourceAlreadyExistsException.builder().message("exists").build());

        CloudWatchAuditRecordShipper shipper =
                new CloudWatchAuditRecordShipper(logs, new CloudWatchShippingProperties(), JSON);
        shipper.ship(record());

        verify(logs).createLogStream(any(Consumer.class));
        verify(logs).putLogEvents(any(Consumer.class));
        assertEquals("cloudwatch", shipper.name());
    }

    @Test
    @DisplayName("unreachable CloudWatch at startup does not fail construction; stream is created on next ship")
    @SuppressWarnings("unchecked")
    void streamCreationRetriedLazily() {
        CloudWatchLogsClient logs = mock(CloudWatchLogsClient.class);
        when(logs.createLogStream(any(Consumer.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request: connect timed out"))
                .thenReturn(CreateLogStreamResponse.builder().build());

        CloudWatchAuditRecordShipper shipper =
                new CloudWatchAuditRecordShipper(logs, new CloudWatchShippingProperties(), JSON);
        assertFalse(shipper.isStreamReady());

        shipper.ship(record());
        shipper.ship(record());

        assertTrue(shipper.isStreamReady());
        verify(logs, times(2)).createLogStream(any(Consumer.class));
        verify(logs, times(2)).putLogEvents(any(Consumer.class));
    }
}
