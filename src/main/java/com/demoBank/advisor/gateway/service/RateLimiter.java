package com.demoBank.advisor.gateway.service;

import com.demoBank.advisor.gateway.util.UserIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sliding-window rate limiter, per customer.
 * Default: 15 requests per minute.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final long WINDOW_SIZE_SECONDS = 60;

    private final int maxRequestsPerMinute;
    private final Map<String, RequestWindow> customerWindows = new ConcurrentHashMap<>();

    public RateLimiter(@Value("${advisor.gateway.max-requests-per-minute:15}") int maxRequestsPerMinute) {
        this.maxRequestsPerMinute = Math.max(1, maxRequestsPerMinute);
    }

    /**
     * Checks and records one request.
     *
     * @param customerId The customer ID to check rate limit for
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String customerId) {
        RequestWindow window = customerWindows.computeIfAbsent(customerId, k -> new RequestWindow());
        Instant now = Instant.now();
        if (!window.tryAdd(now, maxRequestsPerMinute)) {
            log.warn("Rate limit exceeded for customerId: {}", UserIdMasker.mask(customerId));
            return false;
        }
        return true;
    }

    private static class RequestWindow {
        private final List<Instant> requests = new ArrayList<>();

        synchronized boolean tryAdd(Instant now, int limit) {
            Instant cutoff = now.minusSeconds(WINDOW_SIZE_SECONDS);
            requests.removeIf(timestamp -> timestamp.isBefore(cutoff));
            if (requests.size() >= limit) {
                return false;
            }
            requests.add(now);
            return true;
        }
    }
}
