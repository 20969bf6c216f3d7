package com.demoBank.advisor.orchestrator.model;

/**
 * Stages of one advisory turn, in execution order.
 */
public enum PipelineStage {
    GATE,
    ROUTE,
    GUARD,
    FAN_OUT,
    KNOWLEDGE,
    DERIVE,
    SYNTHESIZE,
    RENDER,
    AUDIT
}
