package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.CartView;
import com.takeaway.storefront.service.CartService;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutSessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/cart")
public class CartController {

    private final CartService cartService;
    private final CheckoutSessionService checkoutSessionService;

    public CartController(CartService cartService, CheckoutSessionService checkoutSessionService) {
        this.cartService = cartService;
        this.checkoutSessionService = checkoutSessionService;
    }

    @GetMapping
    public ResponseEntity<CartView> viewCart(Authentication authentication) {
        return ResponseEntity.ok(cartService.view(session(authentication)));
    }

    @PostMapping("/items/{itemId}")
    public ResponseEntity<Map<String, Object>> addItem(@PathVariable Long itemId, Authentication authentication) {
        CheckoutSession session = session(authentication);
        int qty = cartService.add(session, itemId);
        return ResponseEntity.ok(lineResult(session, itemId, qty));
    }

    @PostMapping("/items/{itemId}/update")
    public ResponseEntity<Map<String, Object>> updateItem(@PathVariable Long itemId,
                                                          @RequestBody(required = false) Map<String, String> request,
                                                          Authentication authentication) {
        CheckoutSession session = session(authentication);
        String action = request == null ? null : request.get("action");
        int qty = cartService.update(session, itemId, action);
        return ResponseEntity.ok(lineResult(session, itemId, qty));
    }

    @DeleteMapping("/items/{itemId}")
    public ResponseEntity<CartView> removeItem(@PathVariable Long itemId, Authentication authentication) {
        CheckoutSession session = session(authentication);
        cartService.remove(session, itemId);
        return ResponseEntity.ok(cartService.view(session));
    }

    @DeleteMapping
    public ResponseEntity<CartView> clearCart(Authentication authentication) {
        CheckoutSession session = session(authentication);
        cartService.clear(session);
        return ResponseEntity.ok(cartService.view(session));
    }

    private Map<String, Object> lineResult(CheckoutSession session, Long itemId, int qty) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("menu_item_id", itemId);
        body.put("qty", qty);
        body.put("cart", cartService.view(session));
        return body;
    }

    private CheckoutSession session(Authentication authentication) {
        return checkoutSessionService.sessionFor(CurrentUser.idOf(authentication));
    }
}
