package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.AuthRequest;
import com.takeaway.storefront.dto.AuthResponse;
import com.takeaway.storefront.service.AuthService;
import com.takeaway.storefront.session.CheckoutSessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;
    private final CheckoutSessionService checkoutSessionService;

    public AuthController(AuthService authService, CheckoutSessionService checkoutSessionService) {
        this.authService = authService;
        this.checkoutSessionService = checkoutSessionService;
    }

    @PostMapping("/register")
    public ResponseEntity<?> register(@Valid @RequestBody AuthRequest request) {
        try {
            AuthResponse response = authService.register(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (RuntimeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody AuthRequest request) {
        try {
            AuthResponse response = authService.login(request);
            return ResponseEntity.ok(response);
        } catch (RuntimeException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", e.getMessage()));
        }
    }

    /** Tokens are stateless, so logging out only discards the cart and checkout progress. */
    @PostMapping("/logout")
    public ResponseEntity<?> logout(Authentication authentication) {
        checkoutSessionService.invalidate(CurrentUser.idOf(authentication));
        return ResponseEntity.ok(Map.of("message", "Logged out"));
    }
}
