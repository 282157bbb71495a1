package com.koni.product.infrastructure.web.dto;

import com.koni.product.domain.model.Product;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object for a product snapshot received via REST API.
 *
 * Contains:
 * - id: product identifier, optional on create; must not be empty when given
 * - name: product name (required)
 * - type: product kind (required)
 * - version: last published version such as "v3", absent for a product never published
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    @Size(min = 1, message = "id must not be empty")
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    @NotBlank(message = "type is required")
    private String type;

    private String version;

    public Product toProduct() {
        return new Product(id, name, type, version);
    }
}
