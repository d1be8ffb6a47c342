package com.takeaway.storefront.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CheckoutValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public CheckoutValidationException(Map<String, String> fieldErrors) {
        super("Checkout form has " + fieldErrors.size() + " invalid field(s): " + fieldErrors.keySet());
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public List<String> getMessages() {
        return new ArrayList<>(fieldErrors.values());
    }
}
