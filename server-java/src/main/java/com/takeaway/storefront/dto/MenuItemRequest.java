package com.takeaway.storefront.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin form for creating or editing a menu item. The price stays text so that values
 * like "£9.99" or "9,99" can be accepted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MenuItemRequest {
    private String name;
    private String category;
    private String description;
    private String price;
    private String image;
}
