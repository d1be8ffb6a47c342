package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.MenuItemDto;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.service.MenuService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/menu")
public class MenuController {

    private final MenuService menuService;

    public MenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @GetMapping
    public ResponseEntity<List<MenuItemDto>> getMenu() {
        return ResponseEntity.ok(toDtos(menuService.listMenu(null)));
    }

    @GetMapping("/items")
    public ResponseEntity<Map<String, Object>> getItems(@RequestParam(required = false) String category) {
        String selected = category == null ? "" : category.trim();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("items", toDtos(menuService.listMenu(selected)));
        body.put("categories", menuService.listCategories());
        body.put("selected", selected);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/categories")
    public ResponseEntity<List<String>> getCategories() {
        return ResponseEntity.ok(menuService.listCategories());
    }

    static List<MenuItemDto> toDtos(List<MenuItem> items) {
        return items.stream().map(MenuItemDto::from).collect(Collectors.toList());
    }
}
