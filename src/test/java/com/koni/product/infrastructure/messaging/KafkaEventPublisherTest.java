package com.koni.product.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.product.domain.event.ProductEvent;
import com.koni.product.domain.event.ProductEventType;
import com.koni.product.domain.exception.ConnectionUnavailableException;
import com.koni.product.domain.exception.DeliveryFailureException;
import com.koni.product.tags.UnitTest;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KafkaEventPublisher.
 * Tests record layout, error classification and serialized access to the template.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class KafkaEventPublisherTest {

    private static final String TOPIC = "products";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private KafkaEventPublisher publisher;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        publisher = new KafkaEventPublisher(kafkaTemplate, new ProductEventSerializer(new ObjectMapper()), TOPIC, Duration.ZERO);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldPublishJsonRecordKeyedByProductId() {
        // Given
        ProductEvent event = new ProductEvent("p1", "Widget", "Gadget", "v4", ProductEventType.UPDATED);
        when(kafkaTemplate.send(anyRecord())).thenAnswer(invocation -> acked(invocation.getArgument(0)));

        // When
        publisher.publish(event);

        // Then
        verify(kafkaTemplate).send(recordCaptor.capture());

        ProducerRecord<String, String> record = recordCaptor.getValue();
        assertThat(record.topic()).isEqualTo(TOPIC);
        assertThat(record.key()).isEqualTo("p1");
        assertThat(record.value()).isEqualTo(
                "{\"id\":\"p1\",\"name\":\"Widget\",\"type\":\"Gadget\",\"version\":\"v4\",\"event\":\"UPDATED\"}");

        Header contentType = record.headers().lastHeader("contentType");
        assertThat(contentType).isNotNull();
        assertThat(new String(contentType.value(), StandardCharsets.UTF_8)).isEqualTo("application/json");
    }

    @Test
    void shouldThrowDeliveryFailureWhenSendFails() {
        // Given
        CompletableFuture<SendResult<String, String>> future = new CompletableFuture<>();
        future.completeExceptionally(new KafkaException("Broker rejected record"));
        when(kafkaTemplate.send(anyRecord())).thenReturn(future);

        // When/Then
        assertThatThrownBy(() -> publisher.publish(event("p1")))
                .isInstanceOf(DeliveryFailureException.class)
                .hasMessageContaining("Failed to publish event to Kafka")
                .hasCauseInstanceOf(KafkaException.class);

        verify(kafkaTemplate, times(1)).send(anyRecord());
    }

    @Test
    void shouldThrowConnectionUnavailableWhenProducerRejectsSubmission() {
        // Given
        when(kafkaTemplate.send(anyRecord())).thenThrow(new KafkaException("Producer closed"));

        // When/Then
        assertThatThrownBy(() -> publisher.publish(event("p1")))
                .isInstanceOf(ConnectionUnavailableException.class)
                .hasMessageContaining("Producer closed");
    }

    @Test
    void shouldThrowDeliveryFailureWhenConfiguredAckTimeoutExpires() {
        // Given
        KafkaEventPublisher bounded = new KafkaEventPublisher(
                kafkaTemplate, new ProductEventSerializer(new ObjectMapper()), TOPIC, Duration.ofMillis(50));
        when(kafkaTemplate.send(anyRecord())).thenReturn(new CompletableFuture<>());

        // When/Then
        assertThatThrownBy(() -> bounded.publish(event("p1")))
                .isInstanceOf(DeliveryFailureException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void shouldThrowIllegalArgumentExceptionWhenEventIsNull() {
        assertThatThrownBy(() -> publisher.publish(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Event cannot be null");

        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void shouldSubmitSequentialPublishesInCallOrder() {
        // Given
        when(kafkaTemplate.send(anyRecord())).thenAnswer(invocation -> acked(invocation.getArgument(0)));

        // When
        for (int i = 1; i <= 5; i++) {
            publisher.publish(event("p" + i));
        }

        // Then
        verify(kafkaTemplate, times(5)).send(recordCaptor.capture());
        assertThat(recordCaptor.getAllValues())
                .extracting(ProducerRecord::key)
                .containsExactly("p1", "p2", "p3", "p4", "p5");
    }

    @Test
    void shouldHoldSecondPublishUntilFirstIsAcknowledged() throws Exception {
        // Given
        CompletableFuture<SendResult<String, String>> firstAck = new CompletableFuture<>();
        AtomicInteger sends = new AtomicInteger();
        when(kafkaTemplate.send(anyRecord())).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            return sends.incrementAndGet() == 1 ? firstAck : acked(record);
        });

        // When
        Future<?> first = executor.submit(() -> publisher.publish(event("first")));
        await().atMost(Duration.ofSeconds(2)).until(() -> sends.get() == 1);

        Future<?> second = executor.submit(() -> publisher.publish(event("second")));

        // Then the second publish does not reach the template while the first awaits its ack
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> sends.get() == 1);
        assertThat(second.isDone()).isFalse();

        firstAck.complete(sendResult(new ProducerRecord<>(TOPIC, "first", "{}")));
        first.get(2, TimeUnit.SECONDS);
        second.get(2, TimeUnit.SECONDS);

        verify(kafkaTemplate, times(2)).send(recordCaptor.capture());
        List<String> keys = recordCaptor.getAllValues().stream().map(ProducerRecord::key).toList();
        assertThat(keys).containsExactly("first", "second");
    }

    private static ProducerRecord<String, String> anyRecord() {
        return ArgumentMatchers.<ProducerRecord<String, String>>any();
    }

    private static ProductEvent event(String id) {
        return new ProductEvent(id, "Widget", "Gadget", "v1", ProductEventType.CREATED);
    }

    private static CompletableFuture<SendResult<String, String>> acked(ProducerRecord<String, String> record) {
        return CompletableFuture.completedFuture(sendResult(record));
    }

    private static SendResult<String, String> sendResult(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(
                new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return new SendResult<>(record, metadata);
    }
}
