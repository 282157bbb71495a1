package com.koni.product.infrastructure.web.controller;

import com.koni.product.application.service.ProductEventService;
import com.koni.product.domain.event.ProductEvent;
import com.koni.product.domain.model.Product;
import com.koni.product.infrastructure.web.dto.ProductRequest;
import com.koni.product.infrastructure.web.exception.InvalidRequestException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for product changes.
 * Each endpoint publishes one ProductEvent and responds once Kafka has acknowledged it.
 *
 * Endpoints:
 * - POST /products: publish CREATED (201 Created)
 * - PUT /products/{id}: publish UPDATED (200 OK)
 * - DELETE /products/{id}: publish DELETED (200 OK)
 *
 * Example request:
 * PUT /products/p1
 * {
 *   "name": "Widget",
 *   "type": "Gadget",
 *   "version": "v3"
 * }
 */
@RestController
@RequestMapping("/products")
@RequiredArgsConstructor
@Slf4j
public class ProductController {

    private final ProductEventService productEventService;

    @PostMapping
    public ResponseEntity<ProductEvent> createProduct(@RequestBody @Valid ProductRequest request) {
        log.info("Received product create: id={}, name={}", request.getId(), request.getName());

        ProductEvent event = productEventService.create(request.toProduct());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ProductEvent> updateProduct(@PathVariable String id,
                                                      @RequestBody @Valid ProductRequest request) {
        log.info("Received product update: id={}, version={}", id, request.getVersion());

        ProductEvent event = productEventService.update(resolve(id, request));
        return ResponseEntity.ok(event);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ProductEvent> deleteProduct(@PathVariable String id,
                                                      @RequestBody @Valid ProductRequest request) {
        log.info("Received product delete: id={}, version={}", id, request.getVersion());

        ProductEvent event = productEventService.delete(resolve(id, request));
        return ResponseEntity.ok(event);
    }

    /**
     * The path id fills in a missing body id; a conflicting body id is rejected.
     */
    private Product resolve(String pathId, ProductRequest request) {
        Product product = request.toProduct();
        return product.getId()
                .map(bodyId -> {
                    if (!bodyId.equals(pathId)) {
                        throw new InvalidRequestException(
                                "Body id '" + bodyId + "' does not match path id '" + pathId + "'");
                    }
                    return product;
                })
                .orElseGet(() -> product.withId(pathId));
    }
}
