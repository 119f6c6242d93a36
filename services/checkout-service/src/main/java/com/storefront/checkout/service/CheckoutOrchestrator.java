package com.storefront.checkout.service;

import com.storefront.checkout.cart.CartClearer;
import com.storefront.checkout.dto.CartItemRequest;
import com.storefront.checkout.dto.CheckoutRequest;
import com.storefront.checkout.dto.CheckoutResult;
import com.storefront.checkout.dto.OrderResponse;
import com.storefront.checkout.dto.PaymentVerificationResult;
import com.storefront.checkout.dto.WebhookResult;
import com.storefront.checkout.entity.Order;
import com.storefront.checkout.entity.OrderStatus;
import com.storefront.checkout.entity.Product;
import com.storefront.checkout.exception.GatewayUnavailableException;
import com.storefront.checkout.exception.InsufficientStockException;
import com.storefront.checkout.exception.InvalidOrderStateException;
import com.storefront.checkout.exception.InvalidSignatureException;
import com.storefront.checkout.exception.OrderNotCancellableException;
import com.storefront.checkout.exception.OrderNotFoundException;
import com.storefront.checkout.exception.PaymentGatewayException;
import com.storefront.checkout.exception.ValidationException;
import com.storefront.checkout.gateway.PaymentGateway;
import com.storefront.checkout.gateway.PaymentGatewayFactory;
import com.storefront.checkout.gateway.PaymentOrderContext;
import com.storefront.checkout.gateway.PaymentRequestResult;
import com.storefront.checkout.gateway.RefundRequest;
import com.storefront.checkout.gateway.RefundResult;
import com.storefront.checkout.gateway.VerificationResult;
import com.storefront.checkout.repository.ProductRepository;
import com.storefront.checkout.validation.OrderValidator;
import com.storefront.checkout.validation.ValidationReport;
import com.storefront.checkout.webhook.WebhookAdapter;
import com.storefront.checkout.webhook.WebhookNotification;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checkout and payment settlement.
 *
 * <p>An order is committed together with its stock before the provider is
 * called, because the provider call cannot take part in a database transaction.
 * If the call fails the order is marked failed and, under
 * {@link StockCompensationPolicy#RESTORE}, its stock is returned.
 *
 * <p>Redirect verification, status polling and webhooks all settle through the
 * same compare-and-set on {@code status = PENDING}; whichever caller wins applies
 * the transition and clears the cart, every other caller gets the settled status
 * back.
 *
 * <p>This class performs no I/O of its own outside {@link OrderStore} and the
 * gateways, and holds no transaction across a provider call.
 */
@Service
public class CheckoutOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CheckoutOrchestrator.class);

    private final OrderValidator orderValidator;
    private final OrderStore orderStore;
    private final ProductRepository productRepository;
    private final PaymentGatewayFactory gatewayFactory;
    private final PaymentVerifier paymentVerifier;
    private final Map<String, WebhookAdapter> webhookAdapters;
    private final CartClearer cartClearer;
    private final TransactionIdGenerator transactionIds;
    private final MeterRegistry meterRegistry;
    private final StockCompensationPolicy compensationPolicy;
    private final String currency;

    public CheckoutOrchestrator(OrderValidator orderValidator,
                                OrderStore orderStore,
                                ProductRepository productRepository,
                                PaymentGatewayFactory gatewayFactory,
                                PaymentVerifier paymentVerifier,
                                List<WebhookAdapter> webhookAdapters,
                                CartClearer cartClearer,
                                TransactionIdGenerator transactionIds,
                                MeterRegistry meterRegistry,
                                @Value("${checkout.stock.on-gateway-failure:RESTORE}") StockCompensationPolicy compensationPolicy,
                                @Value("${checkout.currency:INR}") String currency) {
        this.orderValidator = orderValidator;
        this.orderStore = orderStore;
        this.productRepository = productRepository;
        this.gatewayFactory = gatewayFactory;
        this.paymentVerifier = paymentVerifier;
        this.webhookAdapters = webhookAdapters.stream()
                .collect(Collectors.toMap(WebhookAdapter::gateway, Function.identity()));
        this.cartClearer = cartClearer;
        this.transactionIds = transactionIds;
        this.meterRegistry = meterRegistry;
        this.compensationPolicy = compensationPolicy;
        this.currency = currency;
    }

    public CheckoutResult initiateCheckout(UUID userId, CheckoutRequest request) {
        if (userId == null) {
            throw new ValidationException(List.of("User is required"));
        }
        ValidationReport report = orderValidator.validateCartItems(request.items())
                .and(orderValidator.validateShippingAddress(request.address()))
                .and(orderValidator.validateNotes(request.notes()));
        if (!report.isValid()) {
            throw new ValidationException(report.errors());
        }

        Map<UUID, Product> products = loadProducts(request.items());
        ValidationReport stockReport = orderValidator.validateStockAvailability(request.items(),
                productId -> Optional.ofNullable(products.get(productId)).map(Product::getStock));
        if (!stockReport.isValid()) {
            meterRegistry.counter("checkouts_failed_total", "reason", "stock").increment();
            throw new InsufficientStockException(stockReport.errors());
        }

        // resolved before the commit so a misconfigured gateway never leaves an order behind
        PaymentGateway gateway = gatewayFactory.getDefaultGateway();

        Order order = new Order(userId, currency, gateway.name(), transactionIds.merchantTransactionId(),
                transactionIds.receipt(), request.address().toSnapshot(), request.notes());
        for (CartItemRequest item : request.items()) {
            Product product = products.get(item.productId());
            order.addItem(product.getId(), product.getName(), product.getDescription(),
                    item.quantity(), product.unitPrice());
        }

        try {
            orderStore.createWithStock(order);
        } catch (InsufficientStockException e) {
            meterRegistry.counter("checkouts_failed_total", "reason", "stock").increment();
            throw e;
        }
        meterRegistry.counter("checkouts_initiated_total", "gateway", gateway.name()).increment();

        PaymentRequestResult payment;
        try {
            payment = gateway.createPaymentRequest(PaymentOrderContext.from(order));
        } catch (RuntimeException e) {
            throw failCheckout(order, e);
        }

        if (payment.gatewayOrderId() != null && !orderStore.attachGatewayOrderId(order.getId(), payment.gatewayOrderId())) {
            log.warn("Order {} settled before gateway order id {} could be attached",
                    order.getId(), payment.gatewayOrderId());
        }

        log.info("Checkout initiated: order={}, gateway={}, merchantTransactionId={}, amount={} {}",
                order.getId(), gateway.name(), order.getMerchantTransactionId(),
                order.getTotalAmount(), order.getCurrency());
        return new CheckoutResult(
                order.getId(),
                payment.paymentUrl(),
                order.getMerchantTransactionId(),
                payment.gatewayOrderId(),
                gateway.name(),
                order.getTotalAmount(),
                order.getCurrency(),
                order.getReceipt());
    }

    public PaymentVerificationResult verifyPayment(UUID orderId, Map<String, String> payload) {
        Order order = orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (order.getStatus() != OrderStatus.PENDING) {
            log.info("Order {} already {}, skipping verification", orderId, order.getStatus());
            return PaymentVerificationResult.alreadyProcessed(order);
        }

        PaymentGateway gateway = gatewayFactory.getGateway(order.getGateway());
        ValidationReport report = orderValidator.validatePaymentPayload(payload, gateway.requiredPaymentFields());
        if (!report.isValid()) {
            throw new ValidationException(report.errors());
        }
        return applyVerification(order, gateway.verifyPaymentResponse(payload));
    }

    public PaymentVerificationResult checkPaymentStatus(String correlationId) {
        Order order = orderStore.findByCorrelationId(correlationId)
                .orElseThrow(() -> new OrderNotFoundException(correlationId));
        if (order.getStatus() != OrderStatus.PENDING) {
            return PaymentVerificationResult.alreadyProcessed(order);
        }
        PaymentGateway gateway = gatewayFactory.getGateway(order.getGateway());
        return applyVerification(order, gateway.checkStatus(order.gatewayReference()));
    }

    /**
     * Processes one provider callback. The signature is checked over the untouched
     * body before anything reads it; a rejected delivery has no effect beyond a log
     * line and a counter.
     *
     * @throws InvalidSignatureException when the signature is missing or wrong
     */
    public WebhookResult handleWebhook(String gatewayType, byte[] rawBody, String signatureHeader) {
        PaymentGateway gateway = gatewayFactory.getGateway(gatewayType);
        meterRegistry.counter("webhooks_received_total", "gateway", gateway.name()).increment();

        if (signatureHeader == null || signatureHeader.isBlank()
                || !gateway.verifyWebhookSignature(rawBody, signatureHeader)) {
            meterRegistry.counter("webhooks_rejected_total", "gateway", gateway.name()).increment();
            log.warn("SECURITY: rejected {} webhook with missing or invalid signature ({} bytes)",
                    gateway.name(), rawBody == null ? 0 : rawBody.length);
            throw new InvalidSignatureException();
        }

        WebhookAdapter adapter = webhookAdapters.get(gateway.name());
        if (adapter == null) {
            throw new GatewayUnavailableException("No webhook support for gateway " + gateway.name());
        }
        WebhookNotification notification = adapter.normalize(rawBody);
        if (!notification.actionable()) {
            log.info("Ignoring {} webhook event {}", gateway.name(), notification.event());
            return WebhookResult.acknowledged();
        }

        Order order = orderStore.findByCorrelationId(notification.correlationId())
                .orElseThrow(() -> new OrderNotFoundException(notification.correlationId()));
        if (!order.getGateway().equals(gateway.name())) {
            throw new ValidationException(List.of("Webhook gateway does not match order " + order.getId()));
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            log.info("Duplicate {} webhook for order {} already {}", gateway.name(), order.getId(), order.getStatus());
            return WebhookResult.from(PaymentVerificationResult.alreadyProcessed(order));
        }
        VerificationResult result = notification.result();
        if (result.rawStatus() == null) {
            log.info("{} webhook for order {} names no payment status, asking the provider",
                    gateway.name(), order.getId());
            result = gateway.checkStatus(order.gatewayReference());
        }
        return WebhookResult.from(applyVerification(order, result));
    }

    /**
     * @throws OrderNotCancellableException when the order is not pending or has shipped
     */
    public OrderResponse cancelOrder(UUID orderId, String reason) {
        Order order = orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        String cancelReason = reason == null || reason.isBlank() ? "Cancelled by customer" : reason;
        if (!orderStore.cancel(order, cancelReason)) {
            Order current = reload(orderId);
            log.warn("Order {} cannot be cancelled from status {} (shipped={})",
                    orderId, current.getStatus(), current.isShipped());
            throw new OrderNotCancellableException(orderId, current.getStatus(), current.isShipped());
        }
        meterRegistry.counter("orders_cancelled_total").increment();
        return OrderResponse.from(reload(orderId));
    }

    public OrderResponse markShipped(UUID orderId) {
        Order order = orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!orderStore.markShipped(orderId)) {
            Order current = reload(orderId);
            throw new InvalidOrderStateException(orderId, current.getStatus(),
                    current.isShipped() ? "shipped again" : "shipped");
        }
        log.info("Order {} shipped", order.getId());
        return OrderResponse.from(reload(orderId));
    }

    /**
     * Refunds a paid order once, in full when {@code amount} is {@code null}. The
     * refund is claimed on the order row before the provider is called; a refusal
     * releases the claim, while a failed call keeps it, since the provider may
     * have acted on it.
     *
     * @throws InvalidOrderStateException when the order is not paid or already has a refund
     * @throws PaymentGatewayException when the provider refuses or cannot be reached
     */
    public OrderResponse refundOrder(UUID orderId, Long amount, String reason) {
        Order order = orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (order.getStatus() != OrderStatus.PAID) {
            throw new InvalidOrderStateException(orderId, order.getStatus(), "refunded");
        }
        if (order.hasRefund()) {
            throw new InvalidOrderStateException(orderId, order.getStatus(), "refunded again");
        }
        long refundAmount = amount == null ? order.getTotalAmount() : amount;
        if (refundAmount < 1 || refundAmount > order.getTotalAmount()) {
            throw new ValidationException(List.of(
                    "Refund amount must be between 1 and " + order.getTotalAmount() + " paise"));
        }
        String refundReason = reason == null || reason.isBlank() ? "Refund requested by merchant" : reason;
        PaymentGateway gateway = gatewayFactory.getGateway(order.getGateway());

        String refundId = transactionIds.refundId();
        if (!orderStore.claimRefund(orderId, refundId, refundAmount)) {
            Order current = reload(orderId);
            throw new InvalidOrderStateException(orderId, current.getStatus(),
                    current.hasRefund() ? "refunded again" : "refunded");
        }

        RefundResult result;
        try {
            result = gateway.refund(RefundRequest.from(order, refundId, refundAmount, refundReason));
        } catch (PaymentGatewayException e) {
            throw refundOutcomeUnknown(order, refundId, e);
        } catch (RuntimeException e) {
            throw refundOutcomeUnknown(order, refundId,
                    new PaymentGatewayException(gateway.name(), "Refund failed: " + e.getMessage(), e));
        }

        if (!result.accepted()) {
            orderStore.releaseRefundClaim(orderId, refundId);
            meterRegistry.counter("refunds_total", "gateway", gateway.name(), "outcome", "rejected").increment();
            throw new PaymentGatewayException(gateway.name(), "Refund rejected: " + result.rawStatus());
        }
        orderStore.recordRefund(order, refundId, refundAmount, result, refundReason);
        meterRegistry.counter("refunds_total", "gateway", gateway.name(),
                "outcome", result.status().name().toLowerCase()).increment();
        return OrderResponse.from(reload(orderId));
    }

    public OrderResponse getOrder(UUID orderId) {
        return OrderResponse.from(reload(orderId));
    }

    public Map<String, Object> gatewayClientConfig() {
        PaymentGateway gateway = gatewayFactory.getDefaultGateway();
        Map<String, Object> config = new LinkedHashMap<>(gateway.clientConfig());
        config.put("currency", currency);
        config.put("availableGateways", gatewayFactory.getAvailableGateways());
        return config;
    }

    private PaymentVerificationResult applyVerification(Order order, VerificationResult result) {
        if (result.correlationId() != null && !order.matchesCorrelation(result.correlationId())) {
            log.warn("SECURITY: {} payment for {} presented against order {}",
                    order.getGateway(), result.correlationId(), order.getId());
            throw new ValidationException(List.of("Payment does not belong to order " + order.getId()));
        }

        OrderStatus target = paymentVerifier.determineStatus(order.getGateway(), result);
        if (target == OrderStatus.PENDING) {
            log.info("Order {} payment not settled yet: verified={}, status={}",
                    order.getId(), result.verified(), result.rawStatus());
            return PaymentVerificationResult.pending(order,
                    result.verified() ? "Payment pending" : "Payment could not be verified");
        }

        String failureReason = target == OrderStatus.FAILED ? "Payment failed: " + result.rawStatus() : null;
        boolean applied = orderStore.settle(order, target, result.transactionId(), failureReason,
                compensationPolicy == StockCompensationPolicy.RESTORE);
        if (!applied) {
            return PaymentVerificationResult.alreadyProcessed(reload(order.getId()));
        }

        meterRegistry.counter("payments_settled_total", "gateway", order.getGateway(),
                "outcome", target.name().toLowerCase()).increment();
        if (target == OrderStatus.PAID) {
            clearCart(order);
        }
        return PaymentVerificationResult.settled(order, target);
    }

    private PaymentGatewayException failCheckout(Order order, RuntimeException cause) {
        String message = "Failed to create payment request: " + cause.getMessage();
        boolean restore = compensationPolicy == StockCompensationPolicy.RESTORE;
        log.error("Gateway {} failed for order {}: {}", order.getGateway(), order.getId(), cause.getMessage());

        PaymentGatewayException failure = new PaymentGatewayException(order.getGateway(), message, cause);
        try {
            if (orderStore.settle(order, OrderStatus.FAILED, null, message, restore)) {
                log.info("Order {} marked FAILED after gateway error (stock {})",
                        order.getId(), restore ? "restored" : "kept reserved");
            }
        } catch (RuntimeException e) {
            log.error("Order {} could not be marked FAILED after gateway error: {}", order.getId(), e.getMessage());
            failure.addSuppressed(e);
        }
        meterRegistry.counter("checkouts_failed_total", "reason", "gateway").increment();
        return failure;
    }

    private PaymentGatewayException refundOutcomeUnknown(Order order, String refundId, PaymentGatewayException e) {
        log.error("Refund {} for order {} has an unknown outcome, left as requested: {}",
                refundId, order.getId(), e.getMessage());
        meterRegistry.counter("refunds_total", "gateway", order.getGateway(), "outcome", "unknown").increment();
        return e;
    }

    private void clearCart(Order order) {
        try {
            cartClearer.clearCart(order.getUserId());
        } catch (RuntimeException e) {
            log.warn("Cart clear failed for user {} after order {} was paid: {}",
                    order.getUserId(), order.getId(), e.getMessage());
        }
    }

    private Map<UUID, Product> loadProducts(List<CartItemRequest> items) {
        List<UUID> ids = items.stream().map(CartItemRequest::productId).distinct().toList();
        return productRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
    }

    private Order reload(UUID orderId) {
        return orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
