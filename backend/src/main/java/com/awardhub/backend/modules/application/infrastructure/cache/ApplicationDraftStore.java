package com.awardhub.backend.modules.application.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.global.cache.RedisJsonCache;
import com.awardhub.backend.modules.application.domain.ApplicationDraft;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Wizard drafts keyed by user and reward. Writes are unconditional: the last step submission wins.
 */
@Component
public class ApplicationDraftStore {

    static final String KEY_PREFIX = "application:draft:";

    private final RedisJsonCache cache;
    private final Duration ttl;

    public ApplicationDraftStore(RedisJsonCache cache,
                                 @Value("${awardhub.wizard.draft-ttl-seconds:3600}") long ttlSeconds) {
        this.cache = cache;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public Optional<ApplicationDraft> find(UUID userId, UUID rewardId) {
        return cache.get(key(userId, rewardId), ApplicationDraft.class);
    }

    public ApplicationDraft load(UUID userId, UUID rewardId) {
        return find(userId, rewardId).orElseGet(ApplicationDraft::empty);
    }

    public void save(UUID userId, UUID rewardId, ApplicationDraft draft) {
        cache.put(key(userId, rewardId), draft, ttl);
    }

    public void remove(UUID userId, UUID rewardId) {
        cache.evict(key(userId, rewardId));
    }

    static String key(UUID userId, UUID rewardId) {
        return KEY_PREFIX + userId + ":" + rewardId;
    }
}
