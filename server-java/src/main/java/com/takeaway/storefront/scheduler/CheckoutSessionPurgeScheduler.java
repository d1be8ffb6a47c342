package com.takeaway.storefront.scheduler;

import com.takeaway.storefront.session.CheckoutSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CheckoutSessionPurgeScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutSessionPurgeScheduler.class);

    private final CheckoutSessionService checkoutSessionService;

    public CheckoutSessionPurgeScheduler(CheckoutSessionService checkoutSessionService) {
        this.checkoutSessionService = checkoutSessionService;
    }

    /**
     * Drops idle sessions even when nobody is using the store, so abandoned carts
     * do not stay in memory until the next request.
     */
    @Scheduled(fixedDelayString = "${storefront.session.purge-interval-ms:300000}")
    public void purgeIdleSessions() {
        try {
            checkoutSessionService.purgeExpiredSessions();
        } catch (RuntimeException e) {
            logger.error("[CheckoutSessionPurgeScheduler] purge failed: {}", e.getMessage(), e);
        }
    }
}
