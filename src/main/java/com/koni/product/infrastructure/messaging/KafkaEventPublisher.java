package com.koni.product.infrastructure.messaging;

import com.koni.product.application.port.EventPublisher;
import com.koni.product.domain.event.ProductEvent;
import com.koni.product.domain.exception.ConnectionUnavailableException;
import com.koni.product.domain.exception.DeliveryFailureException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Kafka implementation of the EventPublisher port.
 * This adapter publishes ProductEvents as JSON text to a single, fixed topic.
 *
 * Features:
 * - One KafkaTemplate per publisher, used by at most one publish at a time
 * - Fair lock so records are handed to the producer in call-arrival order
 * - Blocks until the broker acknowledges the record; unbounded unless an ack timeout is configured
 * - Uses the product id as record key and tags the record with its content type
 */
@Slf4j
@Service
public class KafkaEventPublisher implements EventPublisher {

    static final String CONTENT_TYPE_HEADER = "contentType";
    static final String CONTENT_TYPE_JSON = "application/json";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ProductEventSerializer serializer;
    private final String topic;
    private final Duration ackTimeout;
    private final ReentrantLock sendLock = new ReentrantLock(true);

    public KafkaEventPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ProductEventSerializer serializer,
            @Value("${products.kafka.topic}") String topic,
            @Value("${products.kafka.ack-timeout:0s}") Duration ackTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.serializer = serializer;
        this.topic = topic;
        this.ackTimeout = ackTimeout;
    }

    /**
     * Publishes a ProductEvent to Kafka and waits for the acknowledgement.
     *
     * @param event the ProductEvent to publish
     * @throws IllegalArgumentException if event is null
     * @throws ConnectionUnavailableException if the producer cannot accept the record
     * @throws DeliveryFailureException if the send fails, times out or the wait is interrupted
     */
    @Override
    public void publish(ProductEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        String payload = serializer.serialize(event);
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, event.getId(), payload);
        record.headers().add(new RecordHeader(CONTENT_TYPE_HEADER, CONTENT_TYPE_JSON.getBytes(StandardCharsets.UTF_8)));

        log.debug("Publishing ProductEvent: id={}, version={}, event={}",
                event.getId(), event.getVersion(), event.getEventType());

        sendLock.lock();
        try {
            SendResult<String, String> result = awaitAck(submit(record, event), event);

            log.info("Successfully published event to Kafka: topic={}, partition={}, offset={}, id={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getId());
        } finally {
            sendLock.unlock();
        }
    }

    private CompletableFuture<SendResult<String, String>> submit(ProducerRecord<String, String> record, ProductEvent event) {
        try {
            return kafkaTemplate.send(record);
        } catch (RuntimeException e) {
            log.error("Kafka producer unavailable: id={}, event={}", event.getId(), event.getEventType(), e);
            throw new ConnectionUnavailableException(
                    "Kafka producer unavailable: " + e.getMessage(), e);
        }
    }

    private SendResult<String, String> awaitAck(CompletableFuture<SendResult<String, String>> future, ProductEvent event) {
        try {
            if (ackTimeout.isZero() || ackTimeout.isNegative()) {
                return future.get();
            }
            return future.get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryFailureException(
                    "Interrupted while waiting for Kafka acknowledgement: id=" + event.getId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to publish event to Kafka: id={}, event={}", event.getId(), event.getEventType(), cause);
            throw new DeliveryFailureException(
                    "Failed to publish event to Kafka: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            log.error("Kafka acknowledgement timed out after {}: id={}", ackTimeout, event.getId());
            throw new DeliveryFailureException(
                    "Kafka acknowledgement timed out after " + ackTimeout + ": id=" + event.getId(), e);
        }
    }
}
