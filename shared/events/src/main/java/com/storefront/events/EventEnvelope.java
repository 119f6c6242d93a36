package com.storefront.events;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;
import java.util.UUID;

public record EventEnvelope<T>(
        UUID eventId,
        String eventType,
        Instant occurredAt,
        UUID correlationId,
        int version,
        @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType", include = JsonTypeInfo.As.EXTERNAL_PROPERTY)
        T payload
) {
    public static <T> EventEnvelope<T> wrap(String eventType, T payload, UUID correlationId) {
        return new EventEnvelope<>(
                UUID.randomUUID(),
                eventType,
                Instant.now(),
                correlationId,
                1,
                payload
        );
    }
}
