package com.demoBank.advisor.gateway.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.gateway.model.AdvisorySession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionService")
class SessionServiceTest {

    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        sessionService = new SessionService(RouterSettings.defaults());
    }

    @Test
    @DisplayName("creates a session with a fresh clarification state and reuses it")
    void getOrCreate() {
        AdvisorySession first = sessionService.getOrCreateSession("user-1");
        AdvisorySession second = sessionService.getOrCreateSession("user-1");

        assertSame(first, second);
        assertFalse(first.getClarificationState().isPending());
        assertEquals(0, first.getClarificationState().getRound());
        assertEquals(RouterSettings.defaults().maxClarifyQuestions(), first.getClarificationState().getMaxQuestions());
    }

    @Test
    @DisplayName("logout drops the session")
    void invalidate() {
        AdvisorySession first = sessionService.getOrCreateSession("user-1");

        sessionService.invalidateSession("user-1");

        assertNotEquals(first.getSessionId(), sessionService.getOrCreateSession("user-1").getSessionId());
    }

    @Test
    @DisplayName("sessions are kept per customer")
    void perCustomer() {
        AdvisorySession first = sessionService.getOrCreateSession("user-1");
        AdvisorySession other = sessionService.getOrCreateSession("user-2");

        assertNotEquals(first.getSessionId(), other.getSessionId());
        assertEquals("user-2", other.getCustomerId());
    }
}
