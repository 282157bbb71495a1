package com.koni.product.infrastructure.observability;

import com.koni.product.domain.event.ProductEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Counters and timers for product event publishing, tagged by event type.
 */
@Slf4j
@Component
public class ProductEventMetrics {

    private final Map<ProductEventType, Counter> published = new EnumMap<>(ProductEventType.class);
    private final Map<ProductEventType, Counter> failed = new EnumMap<>(ProductEventType.class);
    private final Timer publishTime;

    public ProductEventMetrics(MeterRegistry registry) {
        for (ProductEventType type : ProductEventType.values()) {
            published.put(type, Counter.builder("product.events.published.total")
                    .description("Total product events acknowledged by the broker")
                    .tag("event", type.name())
                    .register(registry));
            failed.put(type, Counter.builder("product.events.failed.total")
                    .description("Total product events that could not be built or published")
                    .tag("event", type.name())
                    .register(registry));
        }

        this.publishTime = Timer.builder("product.events.publish.time")
                .description("Time to build and publish a product event, including broker acknowledgement")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordPublished(ProductEventType type) {
        published.get(type).increment();
        log.debug("Published counter incremented: event={}", type);
    }

    public void recordFailed(ProductEventType type) {
        failed.get(type).increment();
        log.debug("Failed counter incremented: event={}", type);
    }

    /**
     * Record the time taken by a publish operation.
     *
     * @param operation the operation to time
     * @param <T> the return type of the operation
     * @return the result of the operation
     */
    public <T> T recordPublishTime(Supplier<T> operation) {
        return publishTime.record(operation);
    }
}
