package com.awardhub.backend.modules.auth.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.global.cache.RedisJsonCache;
import com.awardhub.backend.modules.auth.domain.PendingSignup;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Pending registration forms keyed by verification id.
 */
@Component
public class PendingSignupStore {

    static final String KEY_PREFIX = "signup:pending:";

    private final RedisJsonCache cache;
    private final Duration ttl;

    public PendingSignupStore(RedisJsonCache cache, @Value("${awardhub.signup.ttl-seconds:300}") long ttlSeconds) {
        this.cache = cache;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public void save(UUID verificationId, PendingSignup pendingSignup) {
        cache.put(key(verificationId), pendingSignup, ttl);
    }

    public Optional<PendingSignup> find(UUID verificationId) {
        return cache.get(key(verificationId), PendingSignup.class);
    }

    public void remove(UUID verificationId) {
        cache.evict(key(verificationId));
    }

    public Duration getTtl() {
        return ttl;
    }

    private String key(UUID verificationId) {
        return KEY_PREFIX + verificationId;
    }
}
