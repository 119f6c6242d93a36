package com.storefront.checkout.service;

import com.storefront.checkout.entity.Order;
import com.storefront.checkout.entity.OrderItem;
import com.storefront.checkout.entity.OrderStatus;
import com.storefront.checkout.gateway.RefundResult;
import com.storefront.checkout.outbox.OutboxWriter;
import com.storefront.checkout.repository.OrderRepository;
import com.storefront.events.EventTypes;
import com.storefront.events.OrderLineItem;
import com.storefront.events.order.OrderCancelledEvent;
import com.storefront.events.order.OrderPaidEvent;
import com.storefront.events.order.OrderPaymentFailedEvent;
import com.storefront.events.order.OrderRefundedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every write to an order goes through here. Creation shares one transaction
 * with the stock decrement; afterwards each change is a conditional update whose
 * boolean result says whether this caller applied it.
 */
@Component
public class OrderStore {

    private static final Logger log = LoggerFactory.getLogger(OrderStore.class);

    private final OrderRepository orderRepository;
    private final StockLedger stockLedger;
    private final OutboxWriter outboxWriter;

    public OrderStore(OrderRepository orderRepository, StockLedger stockLedger, OutboxWriter outboxWriter) {
        this.orderRepository = orderRepository;
        this.stockLedger = stockLedger;
        this.outboxWriter = outboxWriter;
    }

    /**
     * Persists a new pending order with its items and takes their stock. Nothing is
     * visible to other transactions unless all of it succeeds.
     */
    @Transactional
    public Order createWithStock(Order order) {
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new IllegalArgumentException("New orders must be pending, was " + order.getStatus());
        }
        orderRepository.save(order);
        stockLedger.decrement(order.getItems());
        log.info("Order created: id={}, total={} {}, items={}",
                order.getId(), order.getTotalAmount(), order.getCurrency(), order.getItems().size());
        return order;
    }

    @Transactional
    public boolean attachGatewayOrderId(UUID orderId, String gatewayOrderId) {
        return orderRepository.attachGatewayOrderId(orderId, gatewayOrderId, Instant.now()) == 1;
    }

    /**
     * Moves a pending order to {@code target}. On FAILED the stock is put back in
     * the same transaction when {@code restoreStock} is set.
     *
     * @return {@code false} when the order was no longer pending
     */
    @Transactional
    public boolean settle(Order order, OrderStatus target, String gatewayPaymentId, String failureReason,
                          boolean restoreStock) {
        if (target != OrderStatus.PAID && target != OrderStatus.FAILED) {
            throw new IllegalArgumentException("Settlement target must be PAID or FAILED, was " + target);
        }
        int updated = orderRepository.compareAndSetStatus(order.getId(), OrderStatus.PENDING, target,
                gatewayPaymentId, failureReason, Instant.now());
        if (updated == 0) {
            log.warn("Order {} ignoring transition PENDING -> {}: no longer pending", order.getId(), target);
            return false;
        }

        if (target == OrderStatus.PAID) {
            outboxWriter.append(OutboxWriter.ORDER_AGGREGATE, order.getId(), EventTypes.ORDER_PAID,
                    new OrderPaidEvent(order.getId(), order.getUserId(), order.getTotalAmount(),
                            order.getCurrency(), order.getGateway(), gatewayPaymentId));
        } else {
            if (restoreStock) {
                stockLedger.restore(order.getItems());
            }
            outboxWriter.append(OutboxWriter.ORDER_AGGREGATE, order.getId(), EventTypes.ORDER_PAYMENT_FAILED,
                    new OrderPaymentFailedEvent(order.getId(), order.getUserId(), order.getGateway(),
                            failureReason, restoreStock, lineItems(order)));
        }
        log.info("Order {} status changed: PENDING -> {}", order.getId(), target);
        return true;
    }

    /**
     * Cancels an order that is still pending and has not shipped, returning its
     * stock.
     *
     * @return {@code false} when the order was paid, failed, cancelled or shipped
     */
    @Transactional
    public boolean cancel(Order order, String reason) {
        if (orderRepository.cancelIfPendingAndUnshipped(order.getId(), reason, Instant.now()) == 0) {
            return false;
        }
        stockLedger.restore(order.getItems());
        outboxWriter.append(OutboxWriter.ORDER_AGGREGATE, order.getId(), EventTypes.ORDER_CANCELLED,
                new OrderCancelledEvent(order.getId(), reason, lineItems(order)));
        log.info("Order {} status changed: PENDING -> CANCELLED ({})", order.getId(), reason);
        return true;
    }

    @Transactional
    public boolean markShipped(UUID orderId) {
        return orderRepository.markShippedIfPaid(orderId, Instant.now()) == 1;
    }

    /**
     * Reserves the order's one refund under {@code refundId} before the provider is
     * called, so two concurrent requests cannot both reach it.
     *
     * @return {@code false} when the order is not paid or already carries a refund
     */
    @Transactional
    public boolean claimRefund(UUID orderId, String refundId, long amount) {
        return orderRepository.claimRefund(orderId, refundId, amount, Instant.now()) == 1;
    }

    /**
     * Stores the provider's acceptance of a claimed refund and publishes it.
     */
    @Transactional
    public boolean recordRefund(Order order, String refundId, long amount, RefundResult result, String reason) {
        if (!result.accepted()) {
            throw new IllegalArgumentException("Only accepted refunds are recorded, got " + result.status());
        }
        if (orderRepository.recordRefund(order.getId(), refundId, result.gatewayRefundId(), result.status(),
                Instant.now()) == 0) {
            log.warn("Order {} refund {} was no longer awaiting an outcome", order.getId(), refundId);
            return false;
        }
        outboxWriter.append(OutboxWriter.ORDER_AGGREGATE, order.getId(), EventTypes.ORDER_REFUNDED,
                new OrderRefundedEvent(order.getId(), order.getUserId(), refundId, result.gatewayRefundId(),
                        amount, order.getCurrency(), order.getGateway(), result.status().name(), reason));
        log.info("Order {} refund {} recorded: {} {} {}", order.getId(), refundId, amount, order.getCurrency(),
                result.status());
        return true;
    }

    @Transactional
    public boolean releaseRefundClaim(UUID orderId, String refundId) {
        return orderRepository.releaseRefundClaim(orderId, refundId, Instant.now()) == 1;
    }

    @Transactional(readOnly = true)
    public Optional<Order> findById(UUID orderId) {
        return orderRepository.findWithItemsById(orderId);
    }

    @Transactional(readOnly = true)
    public Optional<Order> findByCorrelationId(String correlationId) {
        return orderRepository.findWithItemsByCorrelationId(correlationId);
    }

    private static List<OrderLineItem> lineItems(Order order) {
        return order.getItems().stream()
                .map(OrderStore::lineItem)
                .toList();
    }

    private static OrderLineItem lineItem(OrderItem item) {
        return new OrderLineItem(item.getProductId(), item.getQuantity(), item.getUnitPrice());
    }
}
