package com.takeaway.storefront.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Card fields as typed by the customer. Only checked for shape, never sent anywhere.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentForm {
    @JsonProperty("card_name")
    private String cardName;

    @JsonProperty("card_number")
    private String cardNumber;

    private String exp;

    private String cvc;

    @JsonProperty("billing_postcode")
    private String billingPostcode;

    private Boolean agree;
}
