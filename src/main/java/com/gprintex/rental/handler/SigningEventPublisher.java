package com.gprintex.rental.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.camel.ProducerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Enqueues raw signing notifications onto the signing-event worker.
 */
@Component("signingEventPublisher")
public class SigningEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SigningEventPublisher.class);

    public static final String QUEUE = "seda:signing-events";

    private final ProducerTemplate producerTemplate;

    public SigningEventPublisher(ProducerTemplate producerTemplate) {
        this.producerTemplate = producerTemplate;
    }

    /**
     * @return number of notifications enqueued
     */
    public int publishAll(JsonNode notifications) {
        if (notifications == null) {
            return 0;
        }
        if (!notifications.isArray()) {
            publish(notifications);
            return 1;
        }
        notifications.forEach(this::publish);
        return notifications.size();
    }

    public void publish(JsonNode notification) {
        var messageId = UUID.randomUUID().toString();
        producerTemplate.sendBodyAndHeader(QUEUE, notification.toString(), "messageId", messageId);
        log.debug("Queued signing notification {}", messageId);
    }
}
