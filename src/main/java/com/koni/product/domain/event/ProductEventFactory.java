package com.koni.product.domain.event;

import com.koni.product.domain.model.Product;
import com.koni.product.domain.model.ProductVersion;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds {@link ProductEvent}s from product snapshots.
 *
 * The snapshot identifier is reused verbatim when present, otherwise a random UUID is
 * assigned. The event version is the snapshot version plus one, or {@code v1} when the
 * snapshot has never been versioned. Name and type are copied without validation.
 */
public class ProductEventFactory {

    private final Supplier<String> idGenerator;

    public ProductEventFactory() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * @param idGenerator source of identifiers for snapshots that have none
     */
    public ProductEventFactory(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Builds the event for the given snapshot and operation.
     *
     * @param product the caller-supplied snapshot
     * @param eventType the operation being performed
     * @return the immutable event to publish
     * @throws com.koni.product.domain.exception.MalformedVersionException if the snapshot version is malformed
     */
    public ProductEvent buildEvent(Product product, ProductEventType eventType) {
        Objects.requireNonNull(product, "product");
        Objects.requireNonNull(eventType, "eventType");

        ProductVersion version = product.getVersion()
                .map(ProductVersion::parse)
                .map(ProductVersion::next)
                .orElseGet(ProductVersion::initial);

        String id = product.getId().orElseGet(idGenerator);

        return new ProductEvent(id, product.getName(), product.getType(), version.toString(), eventType);
    }
}
