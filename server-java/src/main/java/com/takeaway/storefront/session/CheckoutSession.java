package com.takeaway.storefront.session;

import com.takeaway.storefront.dto.DeliveryDetails;

import java.time.Instant;

/**
 * Checkout state for a single authenticated customer: the cart, the last submitted
 * delivery details and how far through checkout the customer has got.
 */
public class CheckoutSession {

    private final Long userId;
    private final String email;
    private final SessionCart cart = new SessionCart();

    private DeliveryDetails deliveryDetails;
    private boolean detailsCaptured;
    private CheckoutStep step = CheckoutStep.EMPTY_CART;
    private Instant updatedAt = Instant.now();

    public CheckoutSession(Long userId, String email) {
        this.userId = userId;
        this.email = email;
    }

    public Long getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public SessionCart getCart() {
        return cart;
    }

    public synchronized DeliveryDetails getDeliveryDetails() {
        return deliveryDetails;
    }

    /**
     * Replaces the stored details. {@code valid} records whether they passed validation;
     * only valid details unlock the payment step.
     */
    public synchronized void storeDeliveryDetails(DeliveryDetails details, boolean valid) {
        this.deliveryDetails = details;
        this.detailsCaptured = valid;
        touch();
    }

    public synchronized boolean hasCapturedDetails() {
        return detailsCaptured && deliveryDetails != null;
    }

    public synchronized CheckoutStep getStep() {
        return step;
    }

    public synchronized void moveTo(CheckoutStep next) {
        this.step = next;
        touch();
    }

    /** Closes a successful checkout: empties the cart and requires fresh details next time. */
    public synchronized void markCommitted() {
        cart.clear();
        this.detailsCaptured = false;
        this.step = CheckoutStep.COMMITTED;
        touch();
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized void touch() {
        this.updatedAt = Instant.now();
    }
}
