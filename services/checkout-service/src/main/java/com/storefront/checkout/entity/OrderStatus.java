package com.storefront.checkout.entity;

import java.util.Set;

public enum OrderStatus {
    PENDING,
    PAID,
    FAILED,
    CANCELLED;

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    private Set<OrderStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> Set.of(PAID, FAILED, CANCELLED);
            case PAID, FAILED, CANCELLED -> Set.of();
        };
    }
}
