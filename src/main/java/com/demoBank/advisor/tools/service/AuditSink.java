package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one audit record per turn to the backend.
 * Audit is best effort: failures are logged and never reach the caller.
 */
@Slf4j
@Service
public class AuditSink {

    static final String EVENT_TYPE = "agent_summary";
    private static final int AUDIT_TIMEOUT_MS = 10_000;

    private final ToolGatewaySettings settings;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public AuditSink(ToolGatewaySettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(AUDIT_TIMEOUT_MS);
        requestFactory.setReadTimeout(AUDIT_TIMEOUT_MS);
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Writes the audit record.
     *
     * @return the payload fingerprint recorded for the turn
     */
    public String write(String userId, String traceId, Map<String, Object> payload, String authToken) {
        String fingerprint = fingerprint(payload);
        if (settings.localMocksActive() || settings.backendUrl() == null || settings.backendUrl().isBlank()) {
            log.info("Audit recorded locally - traceId: {}, fingerprint: {}", traceId, fingerprint);
            return fingerprint;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("trace_id", traceId);
        body.put("event_type", EVENT_TYPE);
        Map<String, Object> auditPayload = new LinkedHashMap<>(payload);
        auditPayload.put("user_id", userId);
        body.put("payload", auditPayload);

        try {
            RestClient.RequestBodySpec spec = restClient.post().uri(trimTrailingSlash(settings.backendUrl()) + "/audit");
            String bearer = ToolGatewayClient.bearer(authToken);
            if (bearer != null) {
                spec = spec.header(HttpHeaders.AUTHORIZATION, bearer);
            }
            spec.body(body).retrieve().toBodilessEntity();
            log.debug("Audit written - traceId: {}, fingerprint: {}", traceId, fingerprint);
        } catch (Exception e) {
            log.warn("Audit write failed - traceId: {}, fingerprint: {}, error: {}", traceId, fingerprint, e.getMessage());
        }
        return fingerprint;
    }

    String fingerprint(Map<String, Object> payload) {
        try {
            byte[] json = objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            log.warn("Could not fingerprint audit payload: {}", e.getMessage());
            return "unavailable";
        }
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
