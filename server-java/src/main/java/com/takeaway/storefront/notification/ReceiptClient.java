package com.takeaway.storefront.notification;

import com.takeaway.storefront.config.SecretResolver;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ReceiptClient {

    private final WebhookClient webhookClient;

    public ReceiptClient(WebhookClient webhookClient) {
        this.webhookClient = webhookClient;
    }

    public boolean sendReceipt(Long orderId, String email, BigDecimal total) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("order_id", orderId);
        body.put("email", email == null ? "" : email);
        body.put("total", total);
        return webhookClient.post(SecretResolver.RECEIPT_FUNCTION_URL, body);
    }
}
