package com.demoBank.advisor.gateway.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.gateway.model.AdvisorySession;
import com.demoBank.advisor.gateway.util.UserIdMasker;
import com.demoBank.advisor.router.model.ClarificationState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Session service - keeps advisory sessions in a Caffeine cache.
 *
 * Responsibilities:
 * - Get or create the session of a customer, with a fresh clarification state
 * - Expire sessions after 30 minutes idle
 * - Invalidate on logout
 */
@Slf4j
@Service
public class SessionService {

    private static final Duration SESSION_TTL = Duration.ofMinutes(30);

    private final RouterSettings routerSettings;

    private final Cache<String, AdvisorySession> sessionCache = Caffeine.newBuilder()
            .expireAfterAccess(SESSION_TTL)
            .maximumSize(10_000)
            .removalListener((String key, AdvisorySession value, RemovalCause cause) -> {
                if (value != null) {
                    log.debug("Session removed - customerId: {}, sessionId: {}, cause: {}",
                            UserIdMasker.mask(key), value.getSessionId(), cause);
                }
            })
            .build();

    public SessionService(RouterSettings routerSettings) {
        this.routerSettings = routerSettings;
    }

    public AdvisorySession getOrCreateSession(String customerId) {
        AdvisorySession session = sessionCache.getIfPresent(customerId);
        if (session != null) {
            session.touch();
            log.debug("Retrieved existing session - customerId: {}, sessionId: {}",
                    UserIdMasker.mask(customerId), session.getSessionId());
            return session;
        }

        Instant now = Instant.now();
        AdvisorySession created = AdvisorySession.builder()
                .sessionId(UUID.randomUUID().toString())
                .customerId(customerId)
                .clarificationState(ClarificationState.initial(routerSettings.maxClarifyQuestions()))
                .createdAt(now)
                .lastAccessedAt(now)
                .build();
        AdvisorySession existing = sessionCache.asMap().putIfAbsent(customerId, created);
        if (existing != null) {
            existing.touch();
            return existing;
        }
        log.info("Created new session - customerId: {}, sessionId: {}",
                UserIdMasker.mask(customerId), created.getSessionId());
        return created;
    }

    public void updateSession(AdvisorySession session) {
        if (session == null || session.getCustomerId() == null) {
            log.warn("Attempted to update null session or session without customerId");
            return;
        }
        session.touch();
        sessionCache.put(session.getCustomerId(), session);
    }

    public void invalidateSession(String customerId) {
        sessionCache.invalidate(customerId);
        log.info("Invalidated session - customerId: {}", UserIdMasker.mask(customerId));
    }

    public long getActiveSessionCount() {
        return sessionCache.estimatedSize();
    }
}
