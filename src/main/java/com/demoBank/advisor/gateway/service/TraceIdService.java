package com.demoBank.advisor.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates trace ids for request tracking and audit.
 */
@Service
public class TraceIdService {

    /**
     * @return a trace id of the form {@code trc_<8 hex chars>}
     */
    public String generateTraceId() {
        return "trc_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
