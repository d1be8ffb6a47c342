package com.takeaway.storefront.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryDetails {
    @JsonProperty("full_name")
    private String fullName;

    private String phone;

    private String address1;

    private String address2;

    private String city;

    private String postcode;

    /** Trimmed copy with the postcode upper-cased; missing fields become empty strings. */
    public DeliveryDetails normalized() {
        return new DeliveryDetails(
                trim(fullName),
                trim(phone),
                trim(address1),
                trim(address2),
                trim(city),
                trim(postcode).toUpperCase(Locale.ROOT)
        );
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("full_name", fullName);
        payload.put("phone", phone);
        payload.put("address1", address1);
        payload.put("address2", address2);
        payload.put("city", city);
        payload.put("postcode", postcode);
        return payload;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
