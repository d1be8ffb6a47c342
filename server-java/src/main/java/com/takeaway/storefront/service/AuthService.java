package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.AuthRequest;
import com.takeaway.storefront.dto.AuthResponse;
import com.takeaway.storefront.dto.UserDto;
import com.takeaway.storefront.model.User;
import com.takeaway.storefront.repository.UserRepository;
import com.takeaway.storefront.util.PrivacyMaskingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final boolean adminRegistrationAllowed;

    public AuthService(UserRepository userRepository, PasswordEncoder passwordEncoder, JwtService jwtService,
                       @Value("${storefront.auth.allow-admin-registration:false}") boolean adminRegistrationAllowed) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.adminRegistrationAllowed = adminRegistrationAllowed;
    }

    public AuthResponse register(AuthRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (userRepository.existsByEmail(email)) {
            throw new RuntimeException("User already exists");
        }

        String role = request.getRole();
        if (role == null || role.isBlank()) {
            role = User.ROLE_CUSTOMER;
        }
        role = role.trim().toLowerCase(Locale.ROOT);
        if (!role.equals(User.ROLE_CUSTOMER) && !role.equals(User.ROLE_ADMIN)) {
            throw new RuntimeException("Invalid role. Must be customer or admin");
        }
        if (role.equals(User.ROLE_ADMIN) && !adminRegistrationAllowed) {
            throw new RuntimeException("Admin accounts cannot be self-registered");
        }

        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        user.setRole(role);
        User savedUser = userRepository.save(user);
        logger.info("Registered {} account {}", role, PrivacyMaskingUtil.maskEmail(email));

        String token = jwtService.generateToken(savedUser.getId(), savedUser.getEmail(), savedUser.getRole());
        return new AuthResponse("User registered successfully", token, UserDto.from(savedUser));
    }

    public AuthResponse login(AuthRequest request) {
        User user = userRepository.findByEmail(normalizeEmail(request.getEmail()))
                .orElseThrow(() -> new RuntimeException("Invalid credentials"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            throw new RuntimeException("Invalid credentials");
        }

        String token = jwtService.generateToken(user.getId(), user.getEmail(), user.getRole());
        return new AuthResponse("Login successful", token, UserDto.from(user));
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
