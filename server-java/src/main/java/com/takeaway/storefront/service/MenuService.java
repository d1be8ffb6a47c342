package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.MenuItemRequest;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.repository.MenuItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class MenuService {

    private static final Logger logger = LoggerFactory.getLogger(MenuService.class);

    static final String DEFAULT_CATEGORY = "Main";
    static final Set<String> ALLOWED_IMAGE_EXTS = Set.of("png", "jpg", "jpeg", "webp");

    private final MenuItemRepository menuItemRepository;

    public MenuService(MenuItemRepository menuItemRepository) {
        this.menuItemRepository = menuItemRepository;
    }

    /** Items sorted by category then name; a blank category means the whole menu. */
    public List<MenuItem> listMenu(String category) {
        String selected = category == null ? "" : category.trim();
        if (selected.isEmpty()) {
            return menuItemRepository.findAllByOrderByCategoryAscNameAsc();
        }
        return menuItemRepository.findByCategoryOrderByNameAsc(selected);
    }

    public List<String> listCategories() {
        return menuItemRepository.findDistinctCategories();
    }

    public List<MenuItem> listForAdmin() {
        return menuItemRepository.findAllByOrderByIdDesc();
    }

    /** Looks up the given ids; ids with no menu item are simply absent from the result. */
    public Map<Long, MenuItem> findByIds(Collection<Long> ids) {
        Map<Long, MenuItem> items = new HashMap<>();
        if (ids.isEmpty()) {
            return items;
        }
        for (MenuItem item : menuItemRepository.findAllById(ids)) {
            items.put(item.getId(), item);
        }
        return items;
    }

    @Transactional
    public MenuItem create(MenuItemRequest request) {
        BigDecimal price = parsePrice(request.getPrice());
        String name = requireName(request.getName());
        String image = checkImage(request.getImage());

        MenuItem item = new MenuItem(name, categoryOf(request.getCategory()),
                trimToEmpty(request.getDescription()), price, image);
        MenuItem saved = menuItemRepository.save(item);
        logger.info("Menu item {} created: {} @ {}", saved.getId(), saved.getName(), saved.getPrice());
        return saved;
    }

    @Transactional
    public MenuItem update(Long id, MenuItemRequest request) {
        BigDecimal price = parsePrice(request.getPrice());
        String name = requireName(request.getName());
        String image = checkImage(request.getImage());

        MenuItem item = menuItemRepository.findById(id)
                .orElseThrow(() -> new MenuItemNotFoundException(id));
        item.setName(name);
        item.setCategory(categoryOf(request.getCategory()));
        item.setDescription(trimToEmpty(request.getDescription()));
        item.setPrice(price);
        if (image != null) {
            item.setImage(image);
        }
        logger.info("Menu item {} updated: {} @ {}", id, name, price);
        return menuItemRepository.save(item);
    }

    /** Removing an item that does not exist is not an error. */
    @Transactional
    public void delete(Long id) {
        menuItemRepository.findById(id).ifPresent(item -> {
            menuItemRepository.delete(item);
            logger.info("Menu item {} deleted", id);
        });
    }

    /**
     * Accepts admin-typed prices such as "9.99", "£9.99" or "9,99".
     */
    public static BigDecimal parsePrice(String value) {
        String cleaned = value == null ? "" : value.trim().replace("£", "").replace(",", ".").trim();
        BigDecimal price;
        try {
            price = new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Price must be a number like 9.99 (don't include £).");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative.");
        }
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Name is required.");
        }
        return name.trim();
    }

    private static String categoryOf(String category) {
        String trimmed = trimToEmpty(category);
        return trimmed.isEmpty() ? DEFAULT_CATEGORY : trimmed;
    }

    private static String checkImage(String image) {
        String trimmed = trimToEmpty(image);
        if (trimmed.isEmpty()) {
            return null;
        }
        int dot = trimmed.lastIndexOf('.');
        String ext = dot >= 0 ? trimmed.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (!ALLOWED_IMAGE_EXTS.contains(ext) || trimmed.contains("/") || trimmed.contains("\\")) {
            throw new IllegalArgumentException("Invalid file type. Use png, jpg, jpeg, webp.");
        }
        return trimmed;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
