package com.takeaway.storefront.dto;

import com.takeaway.storefront.model.MenuItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MenuItemDto {
    private Long id;
    private String name;
    private String category;
    private String description;
    private BigDecimal price;
    private String image;

    public static MenuItemDto from(MenuItem item) {
        return new MenuItemDto(item.getId(), item.getName(), item.getCategory(),
                item.getDescription(), item.getPrice(), item.getImage());
    }
}
