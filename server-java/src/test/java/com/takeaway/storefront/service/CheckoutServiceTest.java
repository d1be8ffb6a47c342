package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.DeliveryDetails;
import com.takeaway.storefront.dto.PaymentForm;
import com.takeaway.storefront.dto.PlacedOrder;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.notification.OrderNotifier;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CheckoutServiceTest {

    @Mock
    private MenuService menuService;

    @Mock
    private OrderService orderService;

    @Mock
    private OrderNotifier orderNotifier;

    private CheckoutService checkoutService;
    private CheckoutSession session;

    @BeforeEach
    void setUp() {
        CartService cartService = new CartService(menuService);
        checkoutService = new CheckoutService(cartService, orderService, new CheckoutValidator(), orderNotifier);
        session = new CheckoutSession(7L, "jane@example.com");

        MenuItem pizza = new MenuItem("Margherita", "Pizza", "", new BigDecimal("9.50"), null);
        pizza.setId(3L);
        when(menuService.findByIds(anyCollection())).thenReturn(Map.of(3L, pizza));
    }

    @Test
    void openCheckoutWithEmptyCartRedirectsToCart() {
        CheckoutPreconditionException e = assertThrows(CheckoutPreconditionException.class,
                () -> checkoutService.openCheckout(session));

        assertThat(e.getRedirect()).isEqualTo(CheckoutPreconditionException.CART);
        assertThat(e.getMessage()).isEqualTo("Your cart is empty.");
        assertThat(session.getStep()).isEqualTo(CheckoutStep.EMPTY_CART);
    }

    @Test
    void openCheckoutMovesToDetailsPending() {
        session.getCart().add(3L);

        checkoutService.openCheckout(session);

        assertThat(session.getStep()).isEqualTo(CheckoutStep.DETAILS_PENDING);
    }

    @Test
    void invalidDetailsAreStoredButDoNotUnlockPayment() {
        session.getCart().add(3L);
        DeliveryDetails bad = new DeliveryDetails("Jane", "", "1 High St", "", "London", "nope");

        CheckoutValidationException e = assertThrows(CheckoutValidationException.class,
                () -> checkoutService.submitDeliveryDetails(session, bad));

        assertThat(e.getFieldErrors()).containsOnlyKeys("phone", "postcode");
        assertThat(session.getDeliveryDetails().getPostcode()).isEqualTo("NOPE");
        assertThat(session.hasCapturedDetails()).isFalse();
        assertThat(session.getStep()).isEqualTo(CheckoutStep.DETAILS_PENDING);

        CheckoutPreconditionException redirect = assertThrows(CheckoutPreconditionException.class,
                () -> checkoutService.openPayment(session));
        assertThat(redirect.getRedirect()).isEqualTo(CheckoutPreconditionException.CHECKOUT);
        assertThat(redirect.getMessage()).isEqualTo("Please enter delivery details first.");
    }

    @Test
    void paymentWithoutDetailsRedirectsToCheckout() {
        session.getCart().add(3L);

        CheckoutPreconditionException e = assertThrows(CheckoutPreconditionException.class,
                () -> checkoutService.submitPayment(session, validPayment()));

        assertThat(e.getRedirect()).isEqualTo(CheckoutPreconditionException.CHECKOUT);
        verify(orderService, never()).placeOrder(anyLong(), anyMap());
    }

    @Test
    void invalidPaymentKeepsPaymentPendingAndCommitsNothing() {
        readyForPayment();
        PaymentForm bad = new PaymentForm("Jane", "1234", "13/25", "1", "SW1A 1AA", true);

        CheckoutValidationException e = assertThrows(CheckoutValidationException.class,
                () -> checkoutService.submitPayment(session, bad));

        assertThat(e.getFieldErrors()).containsOnlyKeys("card_number", "exp", "cvc");
        assertThat(session.getStep()).isEqualTo(CheckoutStep.PAYMENT_PENDING);
        assertThat(session.getCart().isEmpty()).isFalse();
        verify(orderService, never()).placeOrder(anyLong(), anyMap());
    }

    @Test
    void successfulPaymentCommitsClearsCartAndNotifies() {
        readyForPayment();
        PlacedOrder placed = new PlacedOrder(42L, new BigDecimal("19.00"), 1);
        when(orderService.placeOrder(eq(7L), anyMap())).thenReturn(placed);

        PlacedOrder result = checkoutService.submitPayment(session, validPayment());

        assertThat(result.getOrderId()).isEqualTo(42L);
        assertThat(session.getStep()).isEqualTo(CheckoutStep.COMMITTED);
        assertThat(session.getCart().isEmpty()).isTrue();
        assertThat(session.hasCapturedDetails()).isFalse();
        verify(orderService).placeOrder(7L, Map.of(3L, 2));
        verify(orderNotifier).orderPlaced(eq(placed), eq("jane@example.com"), any(DeliveryDetails.class));
    }

    @Test
    void commitFailureKeepsCartForRetry() {
        readyForPayment();
        when(orderService.placeOrder(eq(7L), anyMap()))
                .thenThrow(new OrderCommitException("Could not place your order. Please try again.", new RuntimeException("disk")));

        assertThrows(OrderCommitException.class, () -> checkoutService.submitPayment(session, validPayment()));

        assertThat(session.getStep()).isEqualTo(CheckoutStep.PAYMENT_PENDING);
        assertThat(session.getCart().snapshot()).containsEntry(3L, 2);
        assertThat(session.hasCapturedDetails()).isTrue();
        verify(orderNotifier, never()).orderPlaced(any(), any(), any());
    }

    @Test
    void allItemsGoneSendsCustomerBackToCart() {
        readyForPayment();
        when(menuService.findByIds(anyCollection())).thenReturn(Map.of());

        CheckoutPreconditionException e = assertThrows(CheckoutPreconditionException.class,
                () -> checkoutService.submitPayment(session, validPayment()));

        assertThat(e.getRedirect()).isEqualTo(CheckoutPreconditionException.CART);
        verify(orderService, never()).placeOrder(anyLong(), anyMap());
    }

    @Test
    void placingWithoutPaymentNeverCreatesAnOrder() {
        session.getCart().add(3L);

        CheckoutPreconditionException e = assertThrows(CheckoutPreconditionException.class,
                () -> checkoutService.placeOrderWithoutPayment(session));

        assertThat(e.getRedirect()).isEqualTo(CheckoutPreconditionException.CHECKOUT);
        verify(orderService, never()).placeOrder(anyLong(), anyMap());
    }

    private void readyForPayment() {
        session.getCart().add(3L);
        session.getCart().add(3L);
        checkoutService.openCheckout(session);
        checkoutService.submitDeliveryDetails(session,
                new DeliveryDetails("Jane Doe", "07700 900123", "1 High St", "", "London", "sw1a 1aa"));
        checkoutService.openPayment(session);
    }

    private static PaymentForm validPayment() {
        return new PaymentForm("Jane Doe", "4111 1111 1111 1111", "12/29", "123", "SW1A 1AA", true);
    }
}
