package com.takeaway.storefront.config;

import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.model.User;
import com.takeaway.storefront.repository.MenuItemRepository;
import com.takeaway.storefront.repository.UserRepository;
import com.takeaway.storefront.util.PrivacyMaskingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Creates the admin account and a starter menu on an empty database.
 * Switched off with {@code storefront.seed.enabled=false}.
 */
@Component
public class DataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final MenuItemRepository menuItemRepository;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final boolean enabled;
    private final String adminEmail;
    private final String adminPassword;

    public DataInitializer(MenuItemRepository menuItemRepository, UserRepository userRepository,
                           PasswordEncoder passwordEncoder,
                           @Value("${storefront.seed.enabled:true}") boolean enabled,
                           @Value("${storefront.seed.admin-email:admin@storefront.local}") String adminEmail,
                           @Value("${storefront.seed.admin-password:admin123}") String adminPassword) {
        this.menuItemRepository = menuItemRepository;
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.enabled = enabled;
        this.adminEmail = adminEmail.trim().toLowerCase(Locale.ROOT);
        this.adminPassword = adminPassword;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (!enabled) {
            logger.info("[DataInitializer] Seeding disabled");
            return;
        }
        seedAdmin();
        seedMenu();
    }

    private void seedAdmin() {
        if (userRepository.existsByEmail(adminEmail)) {
            return;
        }
        User admin = new User();
        admin.setEmail(adminEmail);
        admin.setPasswordHash(passwordEncoder.encode(adminPassword));
        admin.setRole(User.ROLE_ADMIN);
        userRepository.save(admin);
        logger.info("[DataInitializer] Created admin account {}", PrivacyMaskingUtil.maskEmail(adminEmail));
    }

    private void seedMenu() {
        if (menuItemRepository.count() > 0) {
            return;
        }
        List<MenuItem> starters = List.of(
                new MenuItem("Margherita Pizza", "Pizza", "Tomato, mozzarella and basil", new BigDecimal("9.50"), null),
                new MenuItem("Pepperoni Pizza", "Pizza", "Tomato, mozzarella and pepperoni", new BigDecimal("10.95"), null),
                new MenuItem("Chicken Tikka Masala", "Main", "Served with pilau rice", new BigDecimal("11.50"), null),
                new MenuItem("Fish and Chips", "Main", "Battered cod, chips and mushy peas", new BigDecimal("12.00"), null),
                new MenuItem("Garlic Bread", "Sides", null, new BigDecimal("3.50"), null),
                new MenuItem("Sticky Toffee Pudding", "Desserts", "With custard", new BigDecimal("5.25"), null),
                new MenuItem("Cola", "Drinks", "330ml can", new BigDecimal("1.50"), null)
        );
        menuItemRepository.saveAll(starters);
        logger.info("[DataInitializer] Added {} starter menu items", starters.size());
    }
}
