package com.storefront.checkout.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.storefront.events.EventEnvelope;
import com.storefront.events.serde.EventObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Appends an event to the outbox inside the caller's transaction, so the event
 * exists if and only if the state change it describes was committed.
 */
@Component
public class OutboxWriter {

    public static final String ORDER_AGGREGATE = "Order";
    public static final String CART_AGGREGATE = "Cart";

    private final OutboxRepository outboxRepository;

    public OutboxWriter(OutboxRepository outboxRepository) {
        this.outboxRepository = outboxRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public <T> void append(String aggregateType, UUID aggregateId, String eventType, T event) {
        EventEnvelope<T> envelope = EventEnvelope.wrap(eventType, event, aggregateId);
        try {
            String payload = EventObjectMapper.instance().writeValueAsString(envelope);
            outboxRepository.save(new OutboxEvent(aggregateType, aggregateId, eventType, payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event for outbox", e);
        }
    }
}
