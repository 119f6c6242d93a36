package com.storefront.checkout.service;

/**
 * What happens to the stock taken by an order whose payment never completes.
 */
public enum StockCompensationPolicy {
    /** Put the units back in the same transaction that marks the order failed. */
    RESTORE,
    /** Keep the units reserved; the failed order still holds them. */
    RESERVE
}
