package com.koni.product.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * ProductEvent domain event.
 * This immutable event is published to the products topic whenever a product is
 * created, updated or deleted. Downstream consumers read it as
 * {@code {"id", "name", "type", "version", "event"}}.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"id", "name", "type", "version", "event"})
public final class ProductEvent {

    private final String id;
    private final String name;
    private final String type;
    private final String version;

    @JsonProperty("event")
    private final ProductEventType eventType;

    /**
     * Creates a new ProductEvent.
     * This constructor is used by Jackson for JSON deserialization.
     *
     * @param id the product identifier, never empty
     * @param name the product name
     * @param type the product kind
     * @param version the version carried by this event, e.g. "v2"
     * @param eventType the operation that produced this event
     */
    @JsonCreator
    public ProductEvent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("version") String version,
            @JsonProperty("event") ProductEventType eventType) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Event id cannot be empty");
        }
        this.id = id;
        this.name = name;
        this.type = type;
        this.version = Objects.requireNonNull(version, "version");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
    }
}
