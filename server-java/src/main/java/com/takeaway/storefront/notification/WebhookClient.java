package com.takeaway.storefront.notification;

import com.takeaway.storefront.config.SecretResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.Optional;

/**
 * Posts JSON to an endpoint whose URL is stored as a secret. One attempt only; the
 * outcome is logged and reported as a boolean, never thrown.
 */
@Component
public class WebhookClient {

    private static final Logger logger = LoggerFactory.getLogger(WebhookClient.class);

    private final RestTemplate restTemplate;
    private final SecretResolver secretResolver;

    public WebhookClient(@Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                         SecretResolver secretResolver) {
        this.restTemplate = restTemplate;
        this.secretResolver = secretResolver;
    }

    /**
     * @return true when the endpoint answered with a 2xx status
     */
    public boolean post(String urlSecretName, Map<String, Object> body) {
        Optional<String> url = secretResolver.resolve(urlSecretName);
        if (url.isEmpty()) {
            logger.info("{} not set; skipping call", urlSecretName);
            return false;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url.get(), new HttpEntity<>(body, headers), String.class);
            logger.info("{} answered {}", urlSecretName, response.getStatusCode().value());
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            logger.warn("{} call failed: {}", urlSecretName, e.getMessage());
            return false;
        }
    }
}
