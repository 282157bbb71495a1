package com.koni.product;

import com.koni.product.domain.event.ProductEventFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class ProductEventsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProductEventsApplication.class, args);
    }

    @Bean
    public ProductEventFactory productEventFactory() {
        return new ProductEventFactory();
    }
}
