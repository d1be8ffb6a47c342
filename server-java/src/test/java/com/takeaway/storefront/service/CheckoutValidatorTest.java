package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.DeliveryDetails;
import com.takeaway.storefront.dto.PaymentForm;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CheckoutValidatorTest {

    private final CheckoutValidator validator = new CheckoutValidator();

    @Test
    void validDeliveryDetailsProduceNoErrors() {
        DeliveryDetails details = new DeliveryDetails("Jane Doe", "07700 900123", "1 High St", "", "London", "SW1A 1AA");

        assertThat(validator.validateDeliveryDetails(details)).isEmpty();
    }

    @Test
    void deliveryDetailsReportEveryMissingField() {
        DeliveryDetails details = new DeliveryDetails().normalized();

        Map<String, String> errors = validator.validateDeliveryDetails(details);

        assertThat(errors).containsOnlyKeys("full_name", "phone", "address1", "city", "postcode");
        assertThat(errors.get("postcode")).isEqualTo("Please enter a valid UK postcode.");
    }

    @Test
    void lowerCasePostcodeIsAcceptedAfterNormalising() {
        DeliveryDetails details = new DeliveryDetails(" Jane ", "0770", "1 High St", null, "Leeds", " ls1 4ap ").normalized();

        assertThat(details.getPostcode()).isEqualTo("LS1 4AP");
        assertThat(details.getFullName()).isEqualTo("Jane");
        assertThat(validator.validateDeliveryDetails(details)).isEmpty();
    }

    @Test
    void validPaymentProducesNoErrors() {
        PaymentForm form = new PaymentForm("Jane Doe", "4111 1111 1111 1111", "12/29", "123", "SW1A 1AA", true);

        assertThat(validator.validatePayment(form)).isEmpty();
    }

    @Test
    void paymentErrorsAccumulate() {
        PaymentForm form = new PaymentForm("", "4111-1111", "13/25", "12", "12345", false);

        Map<String, String> errors = validator.validatePayment(form);

        assertThat(errors).containsOnlyKeys("card_name", "card_number", "exp", "cvc", "billing_postcode", "agree");
    }

    @Test
    void missingAgreementIsAnError() {
        PaymentForm form = new PaymentForm("Jane Doe", "4111111111111111", "01/30", "1234", "M1 1AE", null);

        assertThat(validator.validatePayment(form)).containsOnlyKeys("agree");
    }

    @Test
    void cardNumberLengthBounds() {
        assertThat(validator.isValidCardNumber("12345678901")).isFalse();
        assertThat(validator.isValidCardNumber("123456789012")).isTrue();
        assertThat(validator.isValidCardNumber("1234567890123456789")).isTrue();
        assertThat(validator.isValidCardNumber("12345678901234567890")).isFalse();
        assertThat(validator.isValidCardNumber("4111 abcd 1111 1111")).isFalse();
    }

    @Test
    void expiryNeedsTwoDigitMonthAndYear() {
        assertThat(validator.isValidExpiry("01/26")).isTrue();
        assertThat(validator.isValidExpiry("12/99")).isTrue();
        assertThat(validator.isValidExpiry("00/26")).isFalse();
        assertThat(validator.isValidExpiry("1/26")).isFalse();
        assertThat(validator.isValidExpiry("01/2026")).isFalse();
    }

    @Test
    void cvcIsThreeOrFourDigits() {
        assertThat(validator.isValidCvc("123")).isTrue();
        assertThat(validator.isValidCvc("1234")).isTrue();
        assertThat(validator.isValidCvc("12")).isFalse();
        assertThat(validator.isValidCvc("12a")).isFalse();
        assertThat(validator.isValidCvc(null)).isFalse();
    }
}
