package com.takeaway.storefront.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class SalesSummary {
    private String date;

    @JsonProperty("total_sales")
    private BigDecimal totalSales;

    @JsonProperty("order_count")
    private long orderCount;
}
