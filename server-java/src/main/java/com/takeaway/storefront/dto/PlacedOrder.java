package com.takeaway.storefront.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class PlacedOrder {
    @JsonProperty("order_id")
    private Long orderId;

    private BigDecimal total;

    @JsonProperty("line_count")
    private int lineCount;
}
