package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.DeliveryDetails;
import com.takeaway.storefront.dto.PaymentForm;
import com.takeaway.storefront.util.UkPostcodeUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Field checks for the two checkout forms. Each method reports every failing field,
 * keyed by field name, in form order; an empty map means the form is acceptable.
 */
@Component
public class CheckoutValidator {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern EXPIRY = Pattern.compile("^(0[1-9]|1[0-2])/\\d{2}$");

    public Map<String, String> validateDeliveryDetails(DeliveryDetails details) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (isBlank(details.getFullName())) {
            errors.put("full_name", "Full name is required.");
        }
        if (isBlank(details.getPhone())) {
            errors.put("phone", "Phone number is required.");
        }
        if (isBlank(details.getAddress1())) {
            errors.put("address1", "Address line 1 is required.");
        }
        if (isBlank(details.getCity())) {
            errors.put("city", "Town/City is required.");
        }
        if (!UkPostcodeUtils.isValid(details.getPostcode())) {
            errors.put("postcode", "Please enter a valid UK postcode.");
        }
        return errors;
    }

    public Map<String, String> validatePayment(PaymentForm form) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (isBlank(form.getCardName())) {
            errors.put("card_name", "Name on card is required.");
        }
        if (!isValidCardNumber(form.getCardNumber())) {
            errors.put("card_number", "Card number looks invalid (digits only).");
        }
        if (!isValidExpiry(form.getExp())) {
            errors.put("exp", "Expiry must be in MM/YY format.");
        }
        if (!isValidCvc(form.getCvc())) {
            errors.put("cvc", "CVC looks invalid (3 or 4 digits).");
        }
        if (!UkPostcodeUtils.isValid(form.getBillingPostcode())) {
            errors.put("billing_postcode", "Billing postcode must be a valid UK postcode.");
        }
        if (!Boolean.TRUE.equals(form.getAgree())) {
            errors.put("agree", "You must confirm you are authorised to use this payment method.");
        }
        return errors;
    }

    /** Spaces are ignored, so "4111 1111 1111 1111" is accepted. */
    public boolean isValidCardNumber(String cardNumber) {
        if (cardNumber == null) {
            return false;
        }
        String digits = cardNumber.replace(" ", "").trim();
        return DIGITS.matcher(digits).matches() && digits.length() >= 12 && digits.length() <= 19;
    }

    public boolean isValidExpiry(String expiry) {
        return expiry != null && EXPIRY.matcher(expiry.trim()).matches();
    }

    public boolean isValidCvc(String cvc) {
        if (cvc == null) {
            return false;
        }
        String trimmed = cvc.trim();
        return DIGITS.matcher(trimmed).matches() && (trimmed.length() == 3 || trimmed.length() == 4);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
