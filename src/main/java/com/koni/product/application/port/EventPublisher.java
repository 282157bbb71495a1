package com.koni.product.application.port;

import com.koni.product.domain.event.ProductEvent;

/**
 * Port interface for publishing product events.
 * Implemented by infrastructure adapters (e.g. the Kafka publisher); the application
 * layer depends only on this abstraction.
 */
public interface EventPublisher {

    /**
     * Publishes a ProductEvent and blocks until the broker has accepted it.
     *
     * @param event the ProductEvent to publish
     * @throws IllegalArgumentException if event is null
     * @throws com.koni.product.domain.exception.SerializationFailureException if the event cannot be encoded
     * @throws com.koni.product.domain.exception.ConnectionUnavailableException if no usable connection exists
     * @throws com.koni.product.domain.exception.DeliveryFailureException if the broker does not accept the event
     */
    void publish(ProductEvent event);
}
