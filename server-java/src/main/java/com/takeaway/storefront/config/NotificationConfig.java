package com.takeaway.storefront.config;

import com.takeaway.storefront.notification.BoundedRetry;
import com.takeaway.storefront.notification.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class NotificationConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD_SLEEP;
    }

    /** Used for the receipt and daily-summary webhooks. */
    @Bean(name = "notificationRestTemplate")
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder,
                                                 @Value("${storefront.notification.timeout-seconds:10}") long timeoutSeconds) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean(name = "eventLogRetry")
    public BoundedRetry eventLogRetry(@Value("${storefront.event-log.max-attempts:3}") int maxAttempts,
                                      @Value("${storefront.event-log.base-delay-ms:1000}") long baseDelayMs,
                                      Sleeper sleeper) {
        return new BoundedRetry(maxAttempts, Duration.ofMillis(baseDelayMs), sleeper);
    }
}
