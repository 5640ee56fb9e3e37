package com.fueltrack.archival.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fueltrack.archival.config.ArchivalProperties;
import com.fueltrack.archival.dto.ArchivalRunResult;
import com.fueltrack.archival.dto.CollectionArchiveResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ArchivalEventPublisherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ArchivalEventPublisher publisher(boolean enabled) {
        ArchivalProperties properties = new ArchivalProperties();
        properties.getNotifications().setEnabled(enabled);
        return new ArchivalEventPublisher(rabbitTemplate, objectMapper, properties);
    }

    private static ArchivalRunResult result() {
        ArchivalRunResult result = ArchivalRunResult.builder().runId("run-1").success(true).build();
        result.addCollection("FuelRecord", new CollectionArchiveResult(12, 40, Instant.parse("2024-09-01T00:00:00Z")));
        return result;
    }

    @Test
    public void testPublish_SendsSummary() throws Exception {
        publisher(true).publishRunCompleted(result(), "scheduled-job");

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(rabbitTemplate).convertAndSend(eq("archival-events"), eq("archival.run.completed"), payload.capture());
        JsonNode event = objectMapper.readTree(payload.getValue());
        assertEquals("ARCHIVAL_RUN_COMPLETED", event.get("event").asText());
        assertEquals("run-1", event.get("runId").asText());
        assertEquals(12, event.get("totalRecordsArchived").asLong());
        assertEquals("FuelRecord", event.get("collections").get(0).asText());
    }

    @Test
    public void testPublish_DisabledSendsNothing() {
        publisher(false).publishRunCompleted(result(), "admin");

        verifyNoInteractions(rabbitTemplate);
    }

    @Test
    public void testPublish_BrokerFailureIsSwallowedAndLogged() {
        doThrow(new AmqpConnectException(new ConnectException("refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), anyString());

        assertDoesNotThrow(() -> publisher(true).publishRunCompleted(result(), "admin"));
    }
}
