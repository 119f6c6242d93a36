package com.storefront.checkout.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders")
public class Order {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    // paise
    @Column(name = "total_amount", nullable = false)
    private long totalAmount;

    @Column(nullable = false)
    private String currency;

    @Column(nullable = false)
    private String gateway;

    @Column(name = "merchant_transaction_id", nullable = false, unique = true)
    private String merchantTransactionId;

    @Column(nullable = false)
    private String receipt;

    @Column(name = "gateway_order_id")
    private String gatewayOrderId;

    @Column(name = "gateway_payment_id")
    private String gatewayPaymentId;

    @Embedded
    private ShippingAddress shippingAddress;

    private String notes;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    // merchant-side id, claimed before the provider is called
    @Column(name = "refund_id")
    private String refundId;

    @Column(name = "gateway_refund_id")
    private String gatewayRefundId;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_status")
    private RefundStatus refundStatus;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    protected Order() {}

    public Order(UUID userId, String currency, String gateway, String merchantTransactionId,
                 String receipt, ShippingAddress shippingAddress, String notes) {
        this.id = UUID.randomUUID();
        this.userId = userId;
        this.status = OrderStatus.PENDING;
        this.totalAmount = 0L;
        this.currency = currency;
        this.gateway = gateway;
        this.merchantTransactionId = merchantTransactionId;
        this.receipt = receipt;
        this.shippingAddress = shippingAddress;
        this.notes = notes;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Adds a line frozen at the given unit price and keeps the order total equal
     * to the sum of its lines.
     */
    public void addItem(UUID productId, String productName, String productDescription,
                        int quantity, long unitPrice) {
        OrderItem item = new OrderItem(this, productId, productName, productDescription, quantity, unitPrice);
        items.add(item);
        totalAmount = Math.addExact(totalAmount, item.getLineTotal());
    }

    /**
     * The id the order's gateway tracks the payment by: the provider's own order
     * id once issued, otherwise the merchant transaction id.
     */
    public String gatewayReference() {
        return gatewayOrderId != null ? gatewayOrderId : merchantTransactionId;
    }

    public boolean matchesCorrelation(String correlationId) {
        return correlationId.equals(merchantTransactionId) || correlationId.equals(gatewayOrderId);
    }

    public boolean isShipped() {
        return shippedAt != null;
    }

    public boolean hasRefund() {
        return refundId != null;
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public OrderStatus getStatus() { return status; }
    public long getTotalAmount() { return totalAmount; }
    public String getCurrency() { return currency; }
    public String getGateway() { return gateway; }
    public String getMerchantTransactionId() { return merchantTransactionId; }
    public String getReceipt() { return receipt; }
    public String getGatewayOrderId() { return gatewayOrderId; }
    public String getGatewayPaymentId() { return gatewayPaymentId; }
    public ShippingAddress getShippingAddress() { return shippingAddress; }
    public String getNotes() { return notes; }
    public String getFailureReason() { return failureReason; }
    public Instant getShippedAt() { return shippedAt; }
    public String getRefundId() { return refundId; }
    public String getGatewayRefundId() { return gatewayRefundId; }
    public RefundStatus getRefundStatus() { return refundStatus; }
    public Long getRefundAmount() { return refundAmount; }
    public Instant getRefundedAt() { return refundedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public List<OrderItem> getItems() { return items; }
}
