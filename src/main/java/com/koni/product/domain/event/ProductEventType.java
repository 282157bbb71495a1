package com.koni.product.domain.event;

/**
 * Kind of change a {@link ProductEvent} describes.
 * Chosen by the operation that was invoked, never derived from the snapshot.
 */
public enum ProductEventType {
    CREATED,
    UPDATED,
    DELETED
}
