package com.storefront.checkout.repository;

import com.storefront.checkout.entity.Order;
import com.storefront.checkout.entity.OrderStatus;
import com.storefront.checkout.entity.RefundStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface OrderRepository extends JpaRepository<Order, UUID> {

    @EntityGraph(attributePaths = "items")
    @Query("select o from Order o where o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "items")
    @Query("select o from Order o where o.merchantTransactionId = :correlationId or o.gatewayOrderId = :correlationId")
    Optional<Order> findWithItemsByCorrelationId(@Param("correlationId") String correlationId);

    // All status writes below are compare-and-set: the row count tells the caller whether it won.

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.status = :target,
                   o.gatewayPaymentId = coalesce(:gatewayPaymentId, o.gatewayPaymentId),
                   o.failureReason = :failureReason,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id and o.status = :expected
            """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") OrderStatus expected,
                            @Param("target") OrderStatus target,
                            @Param("gatewayPaymentId") String gatewayPaymentId,
                            @Param("failureReason") String failureReason,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.status = com.storefront.checkout.entity.OrderStatus.CANCELLED,
                   o.failureReason = :reason,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id
               and o.status = com.storefront.checkout.entity.OrderStatus.PENDING
               and o.shippedAt is null
            """)
    int cancelIfPendingAndUnshipped(@Param("id") UUID id,
                                    @Param("reason") String reason,
                                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.shippedAt = :now,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id
               and o.status = com.storefront.checkout.entity.OrderStatus.PAID
               and o.shippedAt is null
            """)
    int markShippedIfPaid(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.gatewayOrderId = :gatewayOrderId,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id
               and o.status = com.storefront.checkout.entity.OrderStatus.PENDING
               and o.gatewayOrderId is null
            """)
    int attachGatewayOrderId(@Param("id") UUID id,
                             @Param("gatewayOrderId") String gatewayOrderId,
                             @Param("now") Instant now);

    // Refund writes never touch status; an order keeps PAID through its refund.

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.refundId = :refundId,
                   o.refundStatus = com.storefront.checkout.entity.RefundStatus.REQUESTED,
                   o.refundAmount = :amount,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id
               and o.status = com.storefront.checkout.entity.OrderStatus.PAID
               and o.refundId is null
            """)
    int claimRefund(@Param("id") UUID id,
                    @Param("refundId") String refundId,
                    @Param("amount") long amount,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.gatewayRefundId = :gatewayRefundId,
                   o.refundStatus = :refundStatus,
                   o.refundedAt = :now,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id
               and o.refundId = :refundId
               and o.refundStatus = com.storefront.checkout.entity.RefundStatus.REQUESTED
            """)
    int recordRefund(@Param("id") UUID id,
                     @Param("refundId") String refundId,
                     @Param("gatewayRefundId") String gatewayRefundId,
                     @Param("refundStatus") RefundStatus refundStatus,
                     @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Order o
               set o.refundId = null,
                   o.refundStatus = null,
                   o.refundAmount = null,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             where o.id = :id
               and o.refundId = :refundId
               and o.refundStatus = com.storefront.checkout.entity.RefundStatus.REQUESTED
            """)
    int releaseRefundClaim(@Param("id") UUID id,
                           @Param("refundId") String refundId,
                           @Param("now") Instant now);
}
