package com.storefront.checkout.service;

import com.storefront.checkout.entity.OrderItem;
import com.storefront.checkout.entity.Product;
import com.storefront.checkout.exception.InsufficientStockException;
import com.storefront.checkout.repository.ProductRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Stock movements for order lines. Both operations join the caller's transaction
 * and take a row lock per product, in ascending product id order so concurrent
 * checkouts never lock the same rows in opposite orders.
 */
@Component
public class StockLedger {

    private static final Logger log = LoggerFactory.getLogger(StockLedger.class);

    private final ProductRepository productRepository;
    private final MeterRegistry meterRegistry;

    public StockLedger(ProductRepository productRepository, MeterRegistry meterRegistry) {
        this.productRepository = productRepository;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws InsufficientStockException listing every product that is short; the
     *         caller's transaction must roll back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void decrement(Collection<OrderItem> items) {
        List<String> shortfalls = new ArrayList<>();
        aggregate(items).forEach((productId, quantity) -> {
            Product product = productRepository.findByIdForUpdate(productId).orElse(null);
            if (product == null) {
                shortfalls.add("Product " + productId + ": Stock information not available");
            } else if (!product.decrementStock(quantity)) {
                shortfalls.add("Product " + productId + ": Insufficient stock. Available: "
                        + product.getStock() + ", Requested: " + quantity);
            }
        });
        if (!shortfalls.isEmpty()) {
            throw new InsufficientStockException(shortfalls);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void restore(Collection<OrderItem> items) {
        aggregate(items).forEach((productId, quantity) -> {
            Product product = productRepository.findByIdForUpdate(productId).orElse(null);
            if (product == null) {
                log.warn("Cannot restore {} units: product {} no longer exists", quantity, productId);
                return;
            }
            product.restoreStock(quantity);
            meterRegistry.counter("stock_restored_total").increment(quantity);
        });
    }

    private static Map<UUID, Integer> aggregate(Collection<OrderItem> items) {
        Map<UUID, Integer> quantities = new TreeMap<>();
        for (OrderItem item : items) {
            quantities.merge(item.getProductId(), item.getQuantity(), Integer::sum);
        }
        return quantities;
    }
}
