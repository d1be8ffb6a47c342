package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.OrderLineDto;
import com.takeaway.storefront.dto.OrderSummaryDto;
import com.takeaway.storefront.dto.PlacedOrder;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.model.Order;
import com.takeaway.storefront.model.OrderItem;
import com.takeaway.storefront.repository.OrderItemRepository;
import com.takeaway.storefront.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final MenuService menuService;
    private final TransactionTemplate orderTxTemplate;

    public OrderService(OrderRepository orderRepository, OrderItemRepository orderItemRepository,
                        MenuService menuService, PlatformTransactionManager transactionManager) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.menuService = menuService;
        this.orderTxTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Turns a cart into an order in one transaction. Each line records the menu price at
     * this moment; cart ids that are no longer on the menu are skipped.
     *
     * @throws OrderCommitException if anything fails while writing; nothing is persisted then
     */
    public PlacedOrder placeOrder(Long userId, Map<Long, Integer> cart) {
        if (cart == null || cart.isEmpty()) {
            throw new IllegalArgumentException("Cannot place an order from an empty cart");
        }
        try {
            PlacedOrder placed = orderTxTemplate.execute(status -> placeOrderInternal(userId, cart));
            logger.info("Order {} placed for user {}: {} line(s), total {}",
                    placed.getOrderId(), userId, placed.getLineCount(), placed.getTotal());
            return placed;
        } catch (RuntimeException e) {
            logger.error("Order commit failed for user {}; transaction rolled back", userId, e);
            throw new OrderCommitException("Could not place your order. Please try again.", e);
        }
    }

    private PlacedOrder placeOrderInternal(Long userId, Map<Long, Integer> cart) {
        Map<Long, MenuItem> menuItems = menuService.findByIds(cart.keySet());

        Order order = orderRepository.saveAndFlush(new Order(userId));

        List<OrderItem> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<Long, Integer> entry : cart.entrySet()) {
            MenuItem menuItem = menuItems.get(entry.getKey());
            if (menuItem == null) {
                logger.debug("Skipping item {} for order {}: no longer on the menu", entry.getKey(), order.getId());
                continue;
            }
            int qty = entry.getValue();
            OrderItem line = new OrderItem(order, menuItem.getId(), qty, menuItem.getPrice());
            lines.add(line);
            total = total.add(line.getLineTotal());
        }

        List<OrderItem> saved = orderItemRepository.saveAll(lines);
        orderItemRepository.flush();
        order.getItems().addAll(saved);

        return new PlacedOrder(order.getId(), total.setScale(2, RoundingMode.HALF_UP), saved.size());
    }

    /** The user's orders, newest first, totals computed from the recorded unit prices. */
    @Transactional(readOnly = true)
    public List<OrderSummaryDto> getUserOrders(Long userId) {
        List<Order> orders = orderRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId);
        Set<Long> menuItemIds = orders.stream()
                .flatMap(order -> order.getItems().stream())
                .map(OrderItem::getMenuItemId)
                .collect(Collectors.toSet());
        Map<Long, MenuItem> menuItems = menuService.findByIds(menuItemIds);

        return orders.stream().map(order -> OrderSummaryDto.builder()
                .id(order.getId())
                .status(order.getStatus())
                .createdAt(order.getCreatedAt())
                .total(order.getTotal())
                .items(order.getItems().stream().map(item -> {
                    MenuItem menuItem = menuItems.get(item.getMenuItemId());
                    return new OrderLineDto(
                            item.getMenuItemId(),
                            menuItem != null ? menuItem.getName() : null,
                            item.getQuantity(),
                            item.getUnitPrice(),
                            item.getLineTotal().setScale(2, RoundingMode.HALF_UP));
                }).toList())
                .build()
        ).toList();
    }
}
