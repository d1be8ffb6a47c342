package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.CartView;
import com.takeaway.storefront.dto.DeliveryDetails;
import com.takeaway.storefront.dto.PaymentForm;
import com.takeaway.storefront.dto.PlacedOrder;
import com.takeaway.storefront.notification.OrderNotifier;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutStep;
import com.takeaway.storefront.util.PrivacyMaskingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Drives a customer from cart to placed order:
 * cart, delivery details, payment details, order commit, notifications.
 * Each step refuses to run until the steps before it are complete.
 */
@Service
public class CheckoutService {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutService.class);

    static final String EMPTY_CART_NOTICE = "Your cart is empty.";
    static final String MISSING_DETAILS_NOTICE = "Please enter delivery details first.";
    static final String NOTHING_AVAILABLE_NOTICE = "None of the items in your cart are on the menu any more.";
    static final String PAY_FIRST_NOTICE = "Please go to checkout and complete payment before placing an order.";

    private final CartService cartService;
    private final OrderService orderService;
    private final CheckoutValidator validator;
    private final OrderNotifier orderNotifier;

    public CheckoutService(CartService cartService, OrderService orderService,
                           CheckoutValidator validator, OrderNotifier orderNotifier) {
        this.cartService = cartService;
        this.orderService = orderService;
        this.validator = validator;
        this.orderNotifier = orderNotifier;
    }

    /**
     * Enters the delivery-details step.
     *
     * @return the details submitted last time (possibly invalid), or null, for re-populating the form
     */
    public DeliveryDetails openCheckout(CheckoutSession session) {
        synchronized (session) {
            requireCart(session);
            CheckoutStep step = session.getStep();
            if (step == CheckoutStep.EMPTY_CART || step == CheckoutStep.COMMITTED) {
                session.moveTo(CheckoutStep.DETAILS_PENDING);
            }
            return session.getDeliveryDetails();
        }
    }

    /**
     * Stores the submitted details whether or not they are valid, so the form can be shown
     * again with what the customer typed.
     *
     * @throws CheckoutValidationException listing every invalid field
     */
    public DeliveryDetails submitDeliveryDetails(CheckoutSession session, DeliveryDetails form) {
        DeliveryDetails details = (form == null ? new DeliveryDetails() : form).normalized();
        synchronized (session) {
            requireCart(session);
            Map<String, String> errors = validator.validateDeliveryDetails(details);
            session.storeDeliveryDetails(details, errors.isEmpty());
            if (!errors.isEmpty()) {
                session.moveTo(CheckoutStep.DETAILS_PENDING);
                logger.info("User {} delivery details rejected: {}", session.getUserId(), errors.keySet());
                throw new CheckoutValidationException(errors);
            }
            session.moveTo(CheckoutStep.DETAILS_CAPTURED);
            return details;
        }
    }

    /** Enters the payment step and returns the cart as it will be charged. */
    public CartView openPayment(CheckoutSession session) {
        synchronized (session) {
            requireCart(session);
            requireDetails(session);
            session.moveTo(CheckoutStep.PAYMENT_PENDING);
            return cartService.view(session);
        }
    }

    /**
     * Validates the card fields, commits the order and clears the cart. The event log and
     * receipt calls run after the commit and cannot undo it.
     *
     * @throws CheckoutValidationException listing every invalid card field; nothing is committed
     * @throws OrderCommitException when the order could not be stored; the cart is kept for a retry
     */
    public PlacedOrder submitPayment(CheckoutSession session, PaymentForm form) {
        PaymentForm payment = form == null ? new PaymentForm() : form;
        PlacedOrder placed;
        DeliveryDetails details;
        synchronized (session) {
            requireCart(session);
            requireDetails(session);

            Map<String, String> errors = validator.validatePayment(payment);
            if (!errors.isEmpty()) {
                session.moveTo(CheckoutStep.PAYMENT_PENDING);
                logger.info("User {} payment rejected: {}", session.getUserId(), errors.keySet());
                throw new CheckoutValidationException(errors);
            }
            session.moveTo(CheckoutStep.PAYMENT_CAPTURED);
            logger.info("User {} payment details accepted for card {}",
                    session.getUserId(), PrivacyMaskingUtil.maskCardNumber(payment.getCardNumber()));

            Map<Long, Integer> cart = session.getCart().snapshot();
            CartView view = cartService.view(cart);
            if (view.isEmpty()) {
                session.moveTo(CheckoutStep.PAYMENT_PENDING);
                throw new CheckoutPreconditionException(CheckoutPreconditionException.CART, NOTHING_AVAILABLE_NOTICE);
            }

            try {
                placed = orderService.placeOrder(session.getUserId(), cart);
            } catch (OrderCommitException e) {
                session.moveTo(CheckoutStep.PAYMENT_PENDING);
                throw e;
            }
            details = session.getDeliveryDetails();
            session.markCommitted();
        }

        orderNotifier.orderPlaced(placed, session.getEmail(), details);
        return placed;
    }

    /** Orders are only created through payment; this always sends the customer to checkout. */
    public void placeOrderWithoutPayment(CheckoutSession session) {
        logger.debug("User {} tried to place an order without paying", session.getUserId());
        throw new CheckoutPreconditionException(CheckoutPreconditionException.CHECKOUT, PAY_FIRST_NOTICE);
    }

    private void requireCart(CheckoutSession session) {
        if (session.getCart().isEmpty()) {
            session.moveTo(CheckoutStep.EMPTY_CART);
            throw new CheckoutPreconditionException(CheckoutPreconditionException.CART, EMPTY_CART_NOTICE);
        }
    }

    private void requireDetails(CheckoutSession session) {
        if (!session.hasCapturedDetails()) {
            throw new CheckoutPreconditionException(CheckoutPreconditionException.CHECKOUT, MISSING_DETAILS_NOTICE);
        }
    }
}
