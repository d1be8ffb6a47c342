package com.takeaway.storefront.controller;

import com.takeaway.storefront.service.CheckoutPreconditionException;
import com.takeaway.storefront.service.CheckoutValidationException;
import com.takeaway.storefront.service.MenuItemNotFoundException;
import com.takeaway.storefront.service.OrderCommitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns storefront exceptions into {@code {"error": ...}} bodies. Controllers that want to
 * echo form input back catch {@link CheckoutValidationException} themselves and reuse
 * {@link #validationBody}.
 */
@RestControllerAdvice
public class CheckoutExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutExceptionHandler.class);

    static final String VALIDATION_MESSAGE = "Please correct the highlighted fields.";

    static Map<String, Object> validationBody(CheckoutValidationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", VALIDATION_MESSAGE);
        body.put("errors", e.getMessages());
        body.put("fields", e.getFieldErrors());
        return body;
    }

    @ExceptionHandler(CheckoutValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(CheckoutValidationException e) {
        return ResponseEntity.badRequest().body(validationBody(e));
    }

    @ExceptionHandler(CheckoutPreconditionException.class)
    public ResponseEntity<Map<String, Object>> handlePrecondition(CheckoutPreconditionException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("notice", e.getMessage());
        body.put("redirect", e.getRedirect());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(OrderCommitException.class)
    public ResponseEntity<Map<String, Object>> handleCommitFailure(OrderCommitException e) {
        logger.error("Order commit failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MenuItemNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(MenuItemNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
