package com.demoBank.advisor.gateway.controller;

import com.demoBank.advisor.gateway.dto.AdvisoryRequest;
import com.demoBank.advisor.gateway.dto.AdvisoryResponse;
import com.demoBank.advisor.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Advisor REST controller - thin HTTP layer for advisory chat turns.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract the user id and the bearer token from HTTP headers
 * - Delegate business logic to GatewayService
 */
@RestController
@RequestMapping("/api/v1/advisor")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class AdvisorController {

    static final String USER_ID_HEADER = "X-User-ID";

    private final GatewayService gatewayService;

    /**
     * Handle preflight OPTIONS requests for CORS.
     */
    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> options() {
        return ResponseEntity.ok().build();
    }

    /**
     * Chat endpoint - one advisory turn.
     *
     * @param request      advisory request containing the prompt
     * @param userIdHeader user id from HTTP header (trusted)
     * @param authorization caller Authorization header, forwarded to the tool gateway
     * @return advisory response with trace id, tool calls and response metadata
     */
    @PostMapping("/chat")
    public ResponseEntity<AdvisoryResponse> chat(
            @Valid @RequestBody AdvisoryRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        AdvisoryResponse response = gatewayService.processAdvisoryRequest(request, userIdHeader, authorization);
        return ResponseEntity.ok(response);
    }

    /**
     * Logout endpoint - drops the session, and with it any pending clarification.
     *
     * @param userIdHeader user id from HTTP header (trusted)
     * @return success response
     */
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader) {

        gatewayService.logout(userIdHeader);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Logged out successfully");
        return ResponseEntity.ok(response);
    }
}
