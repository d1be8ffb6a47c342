package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.DeliveryDetails;
import com.takeaway.storefront.service.CheckoutService;
import com.takeaway.storefront.service.CheckoutValidationException;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutSessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final CheckoutSessionService checkoutSessionService;

    public CheckoutController(CheckoutService checkoutService, CheckoutSessionService checkoutSessionService) {
        this.checkoutService = checkoutService;
        this.checkoutSessionService = checkoutSessionService;
    }

    @GetMapping
    public ResponseEntity<?> openCheckout(Authentication authentication) {
        CheckoutSession session = checkoutSessionService.sessionFor(CurrentUser.idOf(authentication));
        DeliveryDetails details = checkoutService.openCheckout(session);
        Map<String, Object> body = new HashMap<>();
        body.put("details", details != null ? details : new DeliveryDetails());
        body.put("step", session.getStep().name());
        return ResponseEntity.ok(body);
    }

    @PostMapping
    public ResponseEntity<?> submitDetails(@RequestBody(required = false) DeliveryDetails form,
                                           Authentication authentication) {
        CheckoutSession session = checkoutSessionService.sessionFor(CurrentUser.idOf(authentication));
        try {
            DeliveryDetails details = checkoutService.submitDeliveryDetails(session, form);
            return ResponseEntity.ok(Map.of("details", details, "next", "payment"));
        } catch (CheckoutValidationException e) {
            Map<String, Object> body = CheckoutExceptionHandler.validationBody(e);
            body.put("details", session.getDeliveryDetails());
            return ResponseEntity.badRequest().body(body);
        }
    }
}
