package com.koni.product.application.service;

import com.koni.product.application.port.EventPublisher;
import com.koni.product.domain.event.ProductEvent;
import com.koni.product.domain.event.ProductEventFactory;
import com.koni.product.domain.event.ProductEventType;
import com.koni.product.domain.model.Product;
import com.koni.product.infrastructure.observability.ProductEventMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Application service translating product create/update/delete operations into
 * published ProductEvents.
 *
 * Responsibilities:
 * - Build the event for the invoked operation
 * - Publish it through the EventPublisher port and wait for the broker
 * - Surface every failure to the caller unchanged (no retry, no fallback)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductEventService {

    private final ProductEventFactory eventFactory;
    private final EventPublisher eventPublisher;
    private final ProductEventMetrics metrics;

    /**
     * Publishes a CREATED event for the given product.
     *
     * @param product the snapshot of the new product
     * @return the event as acknowledged by the broker
     */
    public ProductEvent create(Product product) {
        return handle(product, ProductEventType.CREATED);
    }

    /**
     * Publishes an UPDATED event for the given product.
     *
     * @param product the snapshot carrying the last published version
     * @return the event as acknowledged by the broker
     */
    public ProductEvent update(Product product) {
        return handle(product, ProductEventType.UPDATED);
    }

    /**
     * Publishes a DELETED event for the given product.
     *
     * @param product the snapshot carrying the last published version
     * @return the event as acknowledged by the broker
     */
    public ProductEvent delete(Product product) {
        return handle(product, ProductEventType.DELETED);
    }

    private ProductEvent handle(Product product, ProductEventType eventType) {
        log.debug("Handling {} for product: {}", eventType, product);

        return metrics.recordPublishTime(() -> {
            try {
                ProductEvent event = eventFactory.buildEvent(product, eventType);
                eventPublisher.publish(event);
                metrics.recordPublished(eventType);
                log.info("Product event published: id={}, version={}, event={}",
                        event.getId(), event.getVersion(), event.getEventType());
                return event;
            } catch (RuntimeException e) {
                metrics.recordFailed(eventType);
                throw e;
            }
        });
    }
}
