package com.takeaway.storefront.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CartViewTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void jsonCarriesOnlyLinesTotalAndUnavailableIds() throws Exception {
        CartView view = new CartView(List.of(), new BigDecimal("0.00"), List.of(7L));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(view));

        assertThat(json.has("empty")).isFalse();
        assertThat(json.get("unavailable_item_ids").get(0).asLong()).isEqualTo(7L);
        assertThat(json.get("total").decimalValue()).isEqualByComparingTo("0.00");
    }
}
