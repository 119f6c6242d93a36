package com.storefront.checkout.outbox;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

@Component
public class OutboxPublisher {

    private static final Logger log = LoggerFactory.getLogger(OutboxPublisher.class);

    private static final Map<String, String> AGGREGATE_TO_TOPIC = Map.of(
            OutboxWriter.ORDER_AGGREGATE, "order-events",
            OutboxWriter.CART_AGGREGATE, "cart-events"
    );

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    public OutboxPublisher(OutboxRepository outboxRepository,
                           KafkaTemplate<String, String> kafkaTemplate,
                           MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.interval-ms:500}")
    public void publishPendingEvents() {
        List<OutboxEvent> events = outboxRepository.findTop100ByPublishedFalseOrderByCreatedAtAsc();
        for (OutboxEvent event : events) {
            try {
                publishSingleEvent(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while publishing outbox event {}, resuming on the next run", event.getId());
                break;
            } catch (Exception e) {
                // keep ordering: stop at the first failure and retry on the next tick
                log.error("Failed to publish outbox event {}: {}", event.getId(), e.getMessage());
                break;
            }
        }
    }

    void publishSingleEvent(OutboxEvent event) throws ExecutionException, InterruptedException {
        String topic = AGGREGATE_TO_TOPIC.get(event.getAggregateType());
        if (topic == null) {
            throw new IllegalStateException("No topic for aggregate type " + event.getAggregateType());
        }
        kafkaTemplate.send(topic, event.getAggregateId().toString(), event.getPayload()).get();
        event.markPublished();
        outboxRepository.save(event);
        meterRegistry.counter("outbox_published_total", "topic", topic).increment();
        log.info("Published outbox event {} of type {} to topic {}",
                event.getId(), event.getEventType(), topic);
    }
}
