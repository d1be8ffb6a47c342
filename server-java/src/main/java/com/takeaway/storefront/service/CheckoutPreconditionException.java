package com.takeaway.storefront.service;

/**
 * The customer tried to reach a checkout step before completing the one it depends on.
 * {@link #getRedirect()} names the step to send them back to.
 */
public class CheckoutPreconditionException extends RuntimeException {

    public static final String CART = "cart";
    public static final String CHECKOUT = "checkout";

    private final String redirect;

    public CheckoutPreconditionException(String redirect, String notice) {
        super(notice);
        this.redirect = redirect;
    }

    public String getRedirect() {
        return redirect;
    }
}
