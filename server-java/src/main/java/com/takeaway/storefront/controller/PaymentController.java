package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.CartView;
import com.takeaway.storefront.dto.PaymentForm;
import com.takeaway.storefront.dto.PlacedOrder;
import com.takeaway.storefront.service.CheckoutService;
import com.takeaway.storefront.service.CheckoutValidationException;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutSessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/payment")
public class PaymentController {

    private final CheckoutService checkoutService;
    private final CheckoutSessionService checkoutSessionService;

    public PaymentController(CheckoutService checkoutService, CheckoutSessionService checkoutSessionService) {
        this.checkoutService = checkoutService;
        this.checkoutSessionService = checkoutSessionService;
    }

    @GetMapping
    public ResponseEntity<?> openPayment(Authentication authentication) {
        CheckoutSession session = checkoutSessionService.sessionFor(CurrentUser.idOf(authentication));
        CartView cart = checkoutService.openPayment(session);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cart", cart);
        body.put("details", session.getDeliveryDetails());
        return ResponseEntity.ok(body);
    }

    @PostMapping
    public ResponseEntity<?> submitPayment(@RequestBody(required = false) PaymentForm form,
                                           Authentication authentication) {
        CheckoutSession session = checkoutSessionService.sessionFor(CurrentUser.idOf(authentication));
        try {
            PlacedOrder placed = checkoutService.submitPayment(session, form);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("order_id", placed.getOrderId());
            body.put("total", placed.getTotal());
            body.put("redirect", "orders");
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        } catch (CheckoutValidationException e) {
            Map<String, Object> body = CheckoutExceptionHandler.validationBody(e);
            body.put("form", echo(form));
            return ResponseEntity.badRequest().body(body);
        }
    }

    // card number and CVC are never sent back
    private static Map<String, Object> echo(PaymentForm form) {
        Map<String, Object> echoed = new LinkedHashMap<>();
        if (form != null) {
            echoed.put("card_name", form.getCardName());
            echoed.put("exp", form.getExp());
            echoed.put("billing_postcode", form.getBillingPostcode());
            echoed.put("agree", Boolean.TRUE.equals(form.getAgree()));
        }
        return echoed;
    }
}
