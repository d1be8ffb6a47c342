package com.takeaway.storefront.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class CartLineDto {
    private MenuItemDto item;

    @JsonProperty("qty")
    private int quantity;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;
}
