package com.gprintex.rental.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.camel.ProducerTemplate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SigningEventPublisherTests {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void publishAll_queuesEachElement() throws Exception {
        var template = mock(ProducerTemplate.class);
        var publisher = new SigningEventPublisher(template);

        var queued = publisher.publishAll(objectMapper.readTree("""
            [{"envelopeId": "env-1", "status": "sent"}, {"envelopeId": "env-1", "status": "completed"}]
            """));

        assertEquals(2, queued);
        verify(template).sendBodyAndHeader(eq(SigningEventPublisher.QUEUE),
            eq("{\"envelopeId\":\"env-1\",\"status\":\"sent\"}"), eq("messageId"), anyString());
        verify(template).sendBodyAndHeader(eq(SigningEventPublisher.QUEUE),
            eq("{\"envelopeId\":\"env-1\",\"status\":\"completed\"}"), eq("messageId"), anyString());
    }

    @Test
    void publishAll_nullIsNothing() {
        var template = mock(ProducerTemplate.class);

        assertEquals(0, new SigningEventPublisher(template).publishAll(null));
        verifyNoInteractions(template);
    }
}
