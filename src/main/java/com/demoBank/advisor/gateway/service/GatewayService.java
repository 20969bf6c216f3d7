package com.demoBank.advisor.gateway.service;

import com.demoBank.advisor.gateway.dto.AdvisoryRequest;
import com.demoBank.advisor.gateway.dto.AdvisoryResponse;
import com.demoBank.advisor.gateway.exception.MissingCustomerIdException;
import com.demoBank.advisor.gateway.exception.RateLimitExceededException;
import com.demoBank.advisor.gateway.model.AdvisorySession;
import com.demoBank.advisor.gateway.model.RequestContext;
import com.demoBank.advisor.gateway.util.UserIdMasker;
import com.demoBank.advisor.orchestrator.service.OrchestratorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Gateway service - handles all business logic in front of the pipeline.
 *
 * Responsibilities:
 * - Extract and validate the user id from the header (trusted source)
 * - Generate the trace id
 * - Enforce rate limiting
 * - Fetch or create the session (clarification state lives there)
 * - Store the first detected language in the session, for audit
 * - Forward to the orchestrator and persist the advanced session
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final TraceIdService traceIdService;
    private final RateLimiter rateLimiter;
    private final SessionService sessionService;
    private final OrchestratorService orchestratorService;

    /**
     * Processes one advisory turn.
     *
     * @param request       advisory request containing the prompt
     * @param userIdHeader  user id from HTTP header (trusted)
     * @param authorization caller Authorization header, may be null
     * @return advisory response
     * @throws MissingCustomerIdException if the user id header is missing
     * @throws RateLimitExceededException if the rate limit is exceeded
     */
    public AdvisoryResponse processAdvisoryRequest(AdvisoryRequest request, String userIdHeader, String authorization) {
        String customerId = extractAndValidateCustomerId(userIdHeader);

        String traceId = traceIdService.generateTraceId();

        validateRateLimit(customerId, traceId);

        AdvisorySession session = sessionService.getOrCreateSession(customerId);

        RequestContext context = RequestContext.builder()
                .customerId(customerId)
                .traceId(traceId)
                .sessionId(session.getSessionId())
                .session(session)
                .prompt(request.getPrompt())
                .authToken(authorization)
                .receivedAt(Instant.now())
                .build();

        log.info("Advisory request received - traceId: {}, customerId: {}, sessionId: {}, clarifyPending: {}",
                traceId, UserIdMasker.mask(customerId), session.getSessionId(),
                session.getClarificationState() != null && session.getClarificationState().isPending());

        AdvisoryResponse response = orchestratorService.orchestrate(context);

        establishLanguage(session, response.getLanguage(), traceId);
        sessionService.updateSession(session);
        return response;
    }

    /**
     * Logout - removes the session of the user from memory.
     *
     * @param userIdHeader user id from HTTP header (trusted)
     */
    public void logout(String userIdHeader) {
        String customerId = extractAndValidateCustomerId(userIdHeader);
        String traceId = traceIdService.generateTraceId();

        log.info("Logout request - traceId: {}, customerId: {}", traceId, UserIdMasker.mask(customerId));

        sessionService.invalidateSession(customerId);
    }

    private String extractAndValidateCustomerId(String userIdHeader) {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            log.error("Missing user id header");
            throw new MissingCustomerIdException("X-User-ID header is required");
        }
        return userIdHeader.trim();
    }

    private void validateRateLimit(String customerId, String traceId) {
        if (!rateLimiter.isAllowed(customerId)) {
            log.warn("Rate limit exceeded for customerId: {} (traceId: {})",
                    UserIdMasker.mask(customerId), traceId);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }
    }

    /**
     * Stores the language in the session the first time only.
     */
    private void establishLanguage(AdvisorySession session, String languageCode, String traceId) {
        if (!session.isLanguageEstablished() && languageCode != null) {
            session.setLanguageCode(languageCode);
            log.debug("Stored language in session for first time - traceId: {}, sessionId: {}, language: {}",
                    traceId, session.getSessionId(), languageCode);
        }
    }
}
