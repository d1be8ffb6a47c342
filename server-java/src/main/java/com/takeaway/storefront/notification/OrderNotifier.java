package com.takeaway.storefront.notification;

import com.takeaway.storefront.dto.DeliveryDetails;
import com.takeaway.storefront.dto.PlacedOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tells the outside world about a committed order. Must only be called after the order
 * transaction has committed; nothing here can fail the caller.
 */
@Component
public class OrderNotifier {

    private static final Logger logger = LoggerFactory.getLogger(OrderNotifier.class);

    private final OrderEventLogger eventLogger;
    private final ReceiptClient receiptClient;

    public OrderNotifier(OrderEventLogger eventLogger, ReceiptClient receiptClient) {
        this.eventLogger = eventLogger;
        this.receiptClient = receiptClient;
    }

    public void orderPlaced(PlacedOrder order, String email, DeliveryDetails delivery) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("delivery", delivery != null ? delivery.toPayload() : Map.of());
            eventLogger.logEvent(order.getOrderId(), email, OrderEventLogger.PAYMENT_AUTHORISED, payload);
        } catch (RuntimeException e) {
            logger.error("Event log step failed for order {}", order.getOrderId(), e);
        }

        try {
            receiptClient.sendReceipt(order.getOrderId(), email, order.getTotal());
        } catch (RuntimeException e) {
            logger.error("Receipt step failed for order {}", order.getOrderId(), e);
        }
    }
}
