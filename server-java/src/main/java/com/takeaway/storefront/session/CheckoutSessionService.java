package com.takeaway.storefront.session;

import com.takeaway.storefront.model.User;
import com.takeaway.storefront.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class CheckoutSessionService {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutSessionService.class);

    private final Map<Long, CheckoutSession> sessions = new ConcurrentHashMap<>();
    private final UserRepository userRepository;
    private final Duration ttl;

    public CheckoutSessionService(UserRepository userRepository,
                                  @Value("${storefront.session.ttl-minutes:120}") long ttlMinutes) {
        this.userRepository = userRepository;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    /** Returns the caller's session, loading the account e-mail when the session is new. */
    public CheckoutSession sessionFor(Long userId) {
        purgeExpiredSessions();
        CheckoutSession session = sessions.computeIfAbsent(userId, id -> new CheckoutSession(id,
                userRepository.findById(id).map(User::getEmail).orElse(null)));
        session.touch();
        return session;
    }

    public Optional<CheckoutSession> findSession(Long userId) {
        purgeExpiredSessions();
        return Optional.ofNullable(sessions.get(userId));
    }

    /** Drops the cart and any captured details, e.g. on logout. */
    public void invalidate(Long userId) {
        if (sessions.remove(userId) != null) {
            logger.info("Checkout session for user {} discarded", userId);
        }
    }

    public void purgeExpiredSessions() {
        Instant now = Instant.now();
        sessions.values().removeIf(session -> now.isAfter(session.getUpdatedAt().plus(ttl)));
    }
}
