package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.CartLineDto;
import com.takeaway.storefront.dto.CartView;
import com.takeaway.storefront.dto.MenuItemDto;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutStep;
import com.takeaway.storefront.session.SessionCart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class CartService {

    private static final Logger logger = LoggerFactory.getLogger(CartService.class);

    private final MenuService menuService;

    public CartService(MenuService menuService) {
        this.menuService = menuService;
    }

    /** The item is not checked against the menu here; unknown ids drop out when the cart is viewed. */
    // Mutators hold the session lock so they cannot interleave with a payment commit.

    public int add(CheckoutSession session, Long itemId) {
        synchronized (session) {
            int qty = session.getCart().add(itemId);
            logger.debug("User {} cart: item {} -> {}", session.getUserId(), itemId, qty);
            return qty;
        }
    }

    public int update(CheckoutSession session, Long itemId, String action) {
        synchronized (session) {
            int qty = session.getCart().update(itemId, action);
            syncEmptyCart(session);
            return qty;
        }
    }

    public void remove(CheckoutSession session, Long itemId) {
        synchronized (session) {
            session.getCart().remove(itemId);
            syncEmptyCart(session);
        }
    }

    public void clear(CheckoutSession session) {
        synchronized (session) {
            session.getCart().clear();
            syncEmptyCart(session);
        }
    }

    public CartView view(CheckoutSession session) {
        return view(session.getCart().snapshot());
    }

    /**
     * Prices each entry at the current menu price. Entries whose item no longer exists are
     * left out of the lines and the total and reported in {@code unavailableItemIds}.
     */
    public CartView view(Map<Long, Integer> cart) {
        Map<Long, MenuItem> items = menuService.findByIds(cart.keySet());

        List<CartLineDto> lines = new ArrayList<>();
        List<Long> unavailable = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<Long, Integer> entry : cart.entrySet()) {
            MenuItem item = items.get(entry.getKey());
            if (item == null) {
                unavailable.add(entry.getKey());
                continue;
            }
            int qty = entry.getValue();
            BigDecimal lineTotal = item.getPrice().multiply(BigDecimal.valueOf(qty)).setScale(2, RoundingMode.HALF_UP);
            total = total.add(lineTotal);
            lines.add(new CartLineDto(MenuItemDto.from(item), qty, lineTotal));
        }
        return new CartView(lines, total.setScale(2, RoundingMode.HALF_UP), unavailable);
    }

    private void syncEmptyCart(CheckoutSession session) {
        SessionCart cart = session.getCart();
        if (cart.isEmpty() && session.getStep() != CheckoutStep.COMMITTED) {
            session.moveTo(CheckoutStep.EMPTY_CART);
        }
    }
}
