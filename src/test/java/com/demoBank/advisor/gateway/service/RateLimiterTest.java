package com.demoBank.advisor.gateway.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RateLimiter")
class RateLimiterTest {

    @Test
    @DisplayName("allows up to the limit per customer within the window")
    void limitsPerCustomer() {
        RateLimiter limiter = new RateLimiter(3);

        assertTrue(limiter.isAllowed("user-1"));
        assertTrue(limiter.isAllowed("user-1"));
        assertTrue(limiter.isAllowed("user-1"));
        assertFalse(limiter.isAllowed("user-1"));
        assertTrue(limiter.isAllowed("user-2"));
    }

    @Test
    @DisplayName("a non-positive limit still admits one request")
    void minimumLimit() {
        RateLimiter limiter = new RateLimiter(0);

        assertTrue(limiter.isAllowed("user-1"));
        assertFalse(limiter.isAllowed("user-1"));
    }
}
