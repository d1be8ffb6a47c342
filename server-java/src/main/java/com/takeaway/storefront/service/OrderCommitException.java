package com.takeaway.storefront.service;

public class OrderCommitException extends RuntimeException {
    public OrderCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
