package com.takeaway.storefront.util;

/**
 * Masks customer data before it is written to the application log.
 */
public class PrivacyMaskingUtil {

    public static final String MASKED_VALUE = "***";

    private PrivacyMaskingUtil() {
    }

    /**
     * Keeps the last four digits of a card number, e.g. {@code ************1111}.
     */
    public static String maskCardNumber(String cardNumber) {
        if (cardNumber == null) {
            return MASKED_VALUE;
        }
        String digits = cardNumber.replace(" ", "").trim();
        if (digits.length() <= 4) {
            return MASKED_VALUE;
        }
        return "*".repeat(digits.length() - 4) + digits.substring(digits.length() - 4);
    }

    /**
     * Keeps the first character of the local part and the whole domain:
     * {@code jane@example.com} becomes {@code j***@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return MASKED_VALUE;
        }
        return email.charAt(0) + MASKED_VALUE + email.substring(at);
    }
}
