package com.takeaway.storefront.service;

public class MenuItemNotFoundException extends RuntimeException {
    public MenuItemNotFoundException(Long id) {
        super("Menu item " + id + " not found");
    }
}
