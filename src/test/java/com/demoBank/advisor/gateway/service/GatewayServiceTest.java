package com.demoBank.advisor.gateway.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.gateway.dto.AdvisoryRequest;
import com.demoBank.advisor.gateway.dto.AdvisoryResponse;
import com.demoBank.advisor.gateway.exception.MissingCustomerIdException;
import com.demoBank.advisor.gateway.exception.RateLimitExceededException;
import com.demoBank.advisor.gateway.model.AdvisorySession;
import com.demoBank.advisor.gateway.model.RequestContext;
import com.demoBank.advisor.orchestrator.service.OrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("GatewayService")
class GatewayServiceTest {

    private OrchestratorService orchestratorService;
    private SessionService sessionService;
    private GatewayService gatewayService;

    @BeforeEach
    void setUp() {
        orchestratorService = mock(OrchestratorService.class);
        sessionService = new SessionService(RouterSettings.defaults());
        gatewayService = new GatewayService(new TraceIdService(), new RateLimiter(2), sessionService,
                orchestratorService);
    }

    private static AdvisoryRequest request(String prompt) {
        AdvisoryRequest request = new AdvisoryRequest();
        request.setPrompt(prompt);
        return request;
    }

    @Test
    @DisplayName("builds the request context and stores the first language in the session")
    void processesRequest() {
        when(orchestratorService.orchestrate(any()))
                .thenReturn(AdvisoryResponse.builder().response("ok").language("vi").build());

        AdvisoryResponse response = gatewayService.processAdvisoryRequest(request("Chi tiêu tháng này?"),
                " user-1 ", "Bearer token");

        ArgumentCaptor<RequestContext> context = ArgumentCaptor.forClass(RequestContext.class);
        verify(orchestratorService).orchestrate(context.capture());
        assertEquals("ok", response.getResponse());
        assertEquals("user-1", context.getValue().getCustomerId());
        assertEquals("Bearer token", context.getValue().getAuthToken());
        assertTrue(context.getValue().getTraceId().matches("trc_[0-9a-f]{8}"));

        AdvisorySession session = sessionService.getOrCreateSession("user-1");
        assertEquals(context.getValue().getSessionId(), session.getSessionId());
        assertEquals("vi", session.getLanguageCode());
    }

    @Test
    @DisplayName("keeps the language established by the first turn")
    void languageEstablishedOnce() {
        when(orchestratorService.orchestrate(any()))
                .thenReturn(AdvisoryResponse.builder().response("ok").language("en").build(),
                        AdvisoryResponse.builder().response("ok").language("vi").build());

        gatewayService.processAdvisoryRequest(request("Summary please"), "user-1", null);
        gatewayService.processAdvisoryRequest(request("Tóm tắt giúp tôi"), "user-1", null);

        assertEquals("en", sessionService.getOrCreateSession("user-1").getLanguageCode());
    }

    @Test
    @DisplayName("rejects a missing user id header")
    void missingUserId() {
        assertThrows(MissingCustomerIdException.class,
                () -> gatewayService.processAdvisoryRequest(request("hello"), "  ", null));
        verifyNoInteractions(orchestratorService);
    }

    @Test
    @DisplayName("rejects requests over the rate limit")
    void rateLimited() {
        when(orchestratorService.orchestrate(any())).thenReturn(AdvisoryResponse.builder().response("ok").build());

        gatewayService.processAdvisoryRequest(request("one"), "user-1", null);
        gatewayService.processAdvisoryRequest(request("two"), "user-1", null);

        assertThrows(RateLimitExceededException.class,
                () -> gatewayService.processAdvisoryRequest(request("three"), "user-1", null));
    }
}
