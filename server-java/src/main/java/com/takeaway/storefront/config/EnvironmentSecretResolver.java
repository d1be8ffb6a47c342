package com.takeaway.storefront.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves secrets from the Spring environment: OS environment variables, system
 * properties and application.properties, in Spring's usual precedence.
 */
@Component
public class EnvironmentSecretResolver implements SecretResolver {

    private final Environment environment;

    public EnvironmentSecretResolver(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> resolve(String name) {
        String value = environment.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
