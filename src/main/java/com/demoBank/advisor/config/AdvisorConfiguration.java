package com.demoBank.advisor.config;

import com.demoBank.advisor.response.model.ResponseMode;
import com.demoBank.advisor.router.model.RouterMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the immutable module settings from application.yaml.
 */
@Slf4j
@Configuration
public class AdvisorConfiguration {

    @Bean
    public EncodingGateSettings encodingGateSettings(
            @Value("${advisor.encoding.enabled:true}") boolean enabled,
            @Value("${advisor.encoding.repair-enabled:true}") boolean repairEnabled,
            @Value("${advisor.encoding.repair-score-min:0.12}") double repairScoreMin,
            @Value("${advisor.encoding.failfast-score-min:0.45}") double failfastScoreMin,
            @Value("${advisor.encoding.repair-min-delta:0.10}") double repairMinDelta,
            @Value("${advisor.encoding.normalization-form:NFC}") String normalizationForm) {
        return new EncodingGateSettings(enabled, repairEnabled, repairScoreMin, failfastScoreMin,
                repairMinDelta, normalizationForm);
    }

    @Bean
    public RouterSettings routerSettings(
            @Value("${advisor.router.mode:semantic_enforce}") String mode,
            @Value("${advisor.router.policy-version:v1}") String policyVersion,
            @Value("${advisor.router.intent-conf-min:0.70}") double intentConfMin,
            @Value("${advisor.router.top2-gap-min:0.15}") double top2GapMin,
            @Value("${advisor.router.scenario-conf-min:0.75}") double scenarioConfMin,
            @Value("${advisor.router.max-clarify-questions:2}") int maxClarifyQuestions,
            @Value("${advisor.router.extractor-retries:1}") int extractorRetries) {
        RouterSettings settings = new RouterSettings(RouterMode.fromConfig(mode), policyVersion, intentConfMin,
                top2GapMin, scenarioConfMin, maxClarifyQuestions, extractorRetries);
        log.info("Router settings - mode: {}, policyVersion: {}, maxClarifyQuestions: {}",
                settings.mode().code(), settings.policyVersion(), settings.maxClarifyQuestions());
        return settings;
    }

    @Bean
    public ResponseSettings responseSettings(
            @Value("${advisor.response.mode:llm_shadow}") String mode,
            @Value("${advisor.response.prompt-version:answer_synth_v2}") String promptVersion,
            @Value("${advisor.response.schema-version:answer_plan_v2}") String schemaVersion,
            @Value("${advisor.response.policy-version:advice_policy_v1}") String policyVersion,
            @Value("${advisor.response.required-disclaimer:}") String requiredDisclaimer,
            @Value("${advisor.response.max-tokens:900}") int maxTokens) {
        ResponseSettings settings = new ResponseSettings(ResponseMode.fromConfig(mode), promptVersion, schemaVersion,
                policyVersion, requiredDisclaimer, maxTokens);
        log.info("Response settings - mode: {}, promptVersion: {}, schemaVersion: {}",
                settings.mode().code(), settings.promptVersion(), settings.schemaVersion());
        return settings;
    }

    @Bean
    public ToolGatewaySettings toolGatewaySettings(
            @Value("${advisor.tools.gateway-url:}") String gatewayUrl,
            @Value("${advisor.tools.backend-url:http://localhost:8010}") String backendUrl,
            @Value("${advisor.tools.kb-tool-name:}") String kbToolName,
            @Value("${advisor.tools.kb-enabled:true}") boolean kbEnabled,
            @Value("${advisor.tools.max-workers:6}") int maxWorkers,
            @Value("${advisor.tools.fan-out-timeout:PT60S}") Duration fanOutTimeout,
            @Value("${advisor.tools.call-timeout:PT20S}") Duration callTimeout,
            @Value("${advisor.tools.max-retries:2}") int maxRetries,
            @Value("${advisor.tools.retry-backoff:PT0.2S}") Duration retryBackoff,
            @Value("${advisor.tools.use-local-mocks:false}") boolean useLocalMocks) {
        ToolGatewaySettings settings = new ToolGatewaySettings(gatewayUrl, backendUrl, kbToolName, kbEnabled,
                maxWorkers, fanOutTimeout, callTimeout, maxRetries, retryBackoff, useLocalMocks);
        log.info("Tool gateway settings - endpoint: {}, maxWorkers: {}, fanOutTimeout: {}, localMocks: {}",
                settings.mcpEndpoint(), settings.maxWorkers(), settings.fanOutTimeout(), settings.localMocksActive());
        return settings;
    }
}
