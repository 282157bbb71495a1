package com.koni.product.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.product.domain.event.ProductEvent;
import com.koni.product.domain.exception.SerializationFailureException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Encodes ProductEvents to the JSON text carried as Kafka record values.
 */
@Component
@RequiredArgsConstructor
public class ProductEventSerializer {

    private final ObjectMapper objectMapper;

    /**
     * @param event the event to encode
     * @return the JSON payload, e.g. {@code {"id":"p1","name":"Widget","type":"Gadget","version":"v4","event":"UPDATED"}}
     * @throws SerializationFailureException if Jackson cannot write the event
     */
    public String serialize(ProductEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new SerializationFailureException(
                    "Failed to serialize product event: id=" + event.getId(), e);
        }
    }
}
