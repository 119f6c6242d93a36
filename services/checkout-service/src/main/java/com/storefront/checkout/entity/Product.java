package com.storefront.checkout.entity;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * Catalog row as seen by checkout. Only the stock column is ever written here.
 */
@Entity
@Table(name = "products")
public class Product {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(name = "price_paise", nullable = false)
    private long pricePaise;

    @Column(name = "sale_price_paise")
    private Long salePricePaise;

    @Column(nullable = false)
    private int stock;

    protected Product() {}

    public Product(UUID id, String name, String description, long pricePaise, Long salePricePaise, int stock) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.pricePaise = pricePaise;
        this.salePricePaise = salePricePaise;
        this.stock = stock;
    }

    public long unitPrice() {
        if (salePricePaise != null && salePricePaise > 0) {
            return salePricePaise;
        }
        return pricePaise;
    }

    public boolean decrementStock(int quantity) {
        if (stock >= quantity) {
            stock -= quantity;
            return true;
        }
        return false;
    }

    public void restoreStock(int quantity) {
        stock += quantity;
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public long getPricePaise() { return pricePaise; }
    public Long getSalePricePaise() { return salePricePaise; }
    public int getStock() { return stock; }
}
