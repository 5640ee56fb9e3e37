package com.fueltrack.archival.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fueltrack.archival.config.ArchivalProperties;
import com.fueltrack.archival.dto.ArchivalRunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tells the notification layer that an archival run finished. Delivery is best effort.
 */
@Service
@Slf4j
public class ArchivalEventPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;
    private final ArchivalProperties.Notifications notifications;

    public ArchivalEventPublisher(RabbitTemplate rabbitTemplate, ObjectMapper objectMapper,
            ArchivalProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.objectMapper = objectMapper;
        this.notifications = properties.getNotifications();
    }

    public void publishRunCompleted(ArchivalRunResult result, String initiatedBy) {
        if (!notifications.isEnabled()) {
            return;
        }
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("event", "ARCHIVAL_RUN_COMPLETED");
            event.put("runId", result.getRunId());
            event.put("initiatedBy", initiatedBy);
            event.put("success", result.isSuccess());
            event.put("totalRecordsArchived", result.getTotalRecordsArchived());
            event.put("totalDuration", result.getTotalDuration());
            event.put("collections", result.getCollectionsArchived().keySet());
            event.put("errors", result.getErrors());

            rabbitTemplate.convertAndSend(notifications.getExchange(), notifications.getRoutingKey(),
                    objectMapper.writeValueAsString(event));
            log.info("Published run-completed event for run {} to {}", result.getRunId(),
                    notifications.getExchange());
        } catch (Exception e) {
            log.error("Failed to publish run-completed event for run {}: {}", result.getRunId(), e.getMessage(), e);
        }
    }
}
