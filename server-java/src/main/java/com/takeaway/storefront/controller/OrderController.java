package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.OrderSummaryDto;
import com.takeaway.storefront.service.CheckoutService;
import com.takeaway.storefront.service.OrderService;
import com.takeaway.storefront.session.CheckoutSessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderService orderService;
    private final CheckoutService checkoutService;
    private final CheckoutSessionService checkoutSessionService;

    public OrderController(OrderService orderService, CheckoutService checkoutService,
                           CheckoutSessionService checkoutSessionService) {
        this.orderService = orderService;
        this.checkoutService = checkoutService;
        this.checkoutSessionService = checkoutSessionService;
    }

    @GetMapping
    public ResponseEntity<List<OrderSummaryDto>> getMyOrders(Authentication authentication) {
        return ResponseEntity.ok(orderService.getUserOrders(CurrentUser.idOf(authentication)));
    }

    /** Kept for old clients; orders are only placed through the payment step. */
    @PostMapping("/place")
    public ResponseEntity<?> placeOrder(Authentication authentication) {
        checkoutService.placeOrderWithoutPayment(
                checkoutSessionService.sessionFor(CurrentUser.idOf(authentication)));
        return ResponseEntity.noContent().build();
    }
}
