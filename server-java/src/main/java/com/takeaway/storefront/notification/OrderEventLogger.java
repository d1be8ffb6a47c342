package com.takeaway.storefront.notification;

import com.takeaway.storefront.util.PrivacyMaskingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records order events in the event log. Transient store failures are retried; every
 * other outcome short of success is logged and swallowed.
 */
@Component
public class OrderEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(OrderEventLogger.class);

    public static final String COLLECTION = "order_events";
    public static final String PAYMENT_AUTHORISED = "PAYMENT_AUTHORISED";

    private final EventLogSink sink;
    private final BoundedRetry retry;

    public OrderEventLogger(EventLogSink sink, @Qualifier("eventLogRetry") BoundedRetry retry) {
        this.sink = sink;
        this.retry = retry;
    }

    /**
     * @return the stored document id, or empty when logging is disabled or failed
     */
    public Optional<String> logEvent(Long orderId, String userEmail, String event, Map<String, Object> payload) {
        if (!sink.isEnabled()) {
            logger.info("Event log not configured; skipping {} for order {}", event, orderId);
            return Optional.empty();
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("order_id", String.valueOf(orderId));
        document.put("user_email", userEmail == null ? "" : userEmail);
        document.put("event", event);
        document.put("payload", payload == null ? Map.of() : payload);
        document.put("created_at_iso", OffsetDateTime.now(ZoneOffset.UTC).toString());

        try {
            String id = retry.call("Event log write for order " + orderId,
                    () -> sink.append(COLLECTION, document),
                    OrderEventLogger::isRetryable);
            logger.info("Event {} for order {} ({}) stored as {}",
                    event, orderId, PrivacyMaskingUtil.maskEmail(userEmail), id);
            return Optional.of(id);
        } catch (RuntimeException e) {
            logger.error("Event {} for order {} was not logged: {}", event, orderId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    static boolean isRetryable(RuntimeException e) {
        return e instanceof EventLogWriteException && ((EventLogWriteException) e).isTransient();
    }
}
