package com.takeaway.storefront.controller;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;

final class CurrentUser {

    private CurrentUser() {
    }

    /** The JWT filter stores the user id as the principal name. */
    static Long idOf(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new AuthenticationCredentialsNotFoundException("Authentication required");
        }
        return Long.parseLong(authentication.getName());
    }
}
