package com.koni.product.domain.model;

import lombok.EqualsAndHashCode;

import java.util.Optional;

/**
 * Product snapshot as supplied by the caller at the moment of a create, update or delete.
 * This is transient input to event construction and is never persisted.
 *
 * The identifier and version are optional: a missing identifier means a new one is
 * generated for the event, a missing version means the event starts at {@code v1}.
 * Only null means absent; any other value is used as given.
 */
@EqualsAndHashCode
public final class Product {

    private final String id;
    private final String name;
    private final String type;
    private final String version;

    /**
     * Creates a new Product snapshot.
     *
     * @param id the product identifier, or null when none has been assigned yet
     * @param name the product name
     * @param type the product kind, e.g. "Product Range"
     * @param version the last published version, or null for a product never published
     * @throws IllegalArgumentException if id is the empty string
     */
    public Product(String id, String name, String type, String version) {
        if (id != null && id.isEmpty()) {
            throw new IllegalArgumentException("Product id cannot be empty");
        }
        this.id = id;
        this.name = name;
        this.type = type;
        this.version = version;
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Optional<String> getVersion() {
        return Optional.ofNullable(version);
    }

    /**
     * Returns a copy of this snapshot carrying the given identifier.
     *
     * @param newId the identifier to assign
     * @return a new Product with the same name, type and version
     */
    public Product withId(String newId) {
        return new Product(newId, name, type, version);
    }

    @Override
    public String toString() {
        return "Product{" +
                "id=" + id +
                ", name=" + name +
                ", type=" + type +
                ", version=" + version +
                '}';
    }
}
