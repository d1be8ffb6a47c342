package com.takeaway.storefront.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@AllArgsConstructor
public class CartView {
    private List<CartLineDto> lines;

    private BigDecimal total;

    // cart entries whose menu item no longer exists; left out of lines and total
    @JsonProperty("unavailable_item_ids")
    private List<Long> unavailableItemIds;

    @JsonIgnore
    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
