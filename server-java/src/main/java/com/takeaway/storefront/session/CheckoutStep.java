package com.takeaway.storefront.session;

public enum CheckoutStep {
    EMPTY_CART,
    DETAILS_PENDING,
    DETAILS_CAPTURED,
    PAYMENT_PENDING,
    PAYMENT_CAPTURED,
    COMMITTED
}
