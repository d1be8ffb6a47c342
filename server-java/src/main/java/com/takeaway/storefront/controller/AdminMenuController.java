package com.takeaway.storefront.controller;

import com.takeaway.storefront.dto.MenuItemDto;
import com.takeaway.storefront.dto.MenuItemRequest;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.service.MenuService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/menu")
@PreAuthorize("hasRole('ADMIN')")
public class AdminMenuController {

    private final MenuService menuService;

    public AdminMenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @GetMapping
    public ResponseEntity<List<MenuItemDto>> listItems() {
        return ResponseEntity.ok(MenuController.toDtos(menuService.listForAdmin()));
    }

    @PostMapping
    public ResponseEntity<?> createItem(@RequestBody MenuItemRequest request) {
        MenuItem item = menuService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("ok", true, "id", item.getId(), "item", MenuItemDto.from(item)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<MenuItemDto> updateItem(@PathVariable Long id, @RequestBody MenuItemRequest request) {
        return ResponseEntity.ok(MenuItemDto.from(menuService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteItem(@PathVariable Long id) {
        menuService.delete(id);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
