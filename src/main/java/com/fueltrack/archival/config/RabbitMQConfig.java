package com.fueltrack.archival.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Topology for run-completed notifications. Only declared when notifications are enabled.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.archival.notifications", name = "enabled", havingValue = "true")
public class RabbitMQConfig {

    private final ArchivalProperties.Notifications notifications;

    public RabbitMQConfig(ArchivalProperties properties) {
        this.notifications = properties.getNotifications();
    }

    @Bean
    Exchange archivalExchange() {
        return ExchangeBuilder.topicExchange(notifications.getExchange()).durable(true).build();
    }

    @Bean
    Queue archivalRunQueue() {
        return QueueBuilder.durable(notifications.getQueue()).build();
    }

    @Bean
    Binding archivalRunBinding() {
        return BindingBuilder.bind(archivalRunQueue())
                .to(archivalExchange())
                .with(notifications.getRoutingKey())
                .noargs();
    }
}
