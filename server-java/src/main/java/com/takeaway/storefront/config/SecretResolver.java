package com.takeaway.storefront.config;

import java.util.Optional;

/**
 * Looks up deployment secrets such as notification endpoint URLs.
 * An empty result means the feature that needs the secret is switched off.
 */
public interface SecretResolver {

    String RECEIPT_FUNCTION_URL = "RECEIPT_FUNCTION_URL";
    String DAILY_SUMMARY_FUNCTION_URL = "DAILY_SUMMARY_FUNCTION_URL";
    String EVENT_LOG_MONGO_URI = "EVENT_LOG_MONGO_URI";

    Optional<String> resolve(String name);
}
