package com.demoBank.advisor.inference.service;

import com.demoBank.advisor.inference.dto.ChatCompletionRequest;
import com.demoBank.advisor.inference.dto.ChatCompletionResponse;
import com.demoBank.advisor.inference.exception.InferenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;

/**
 * Client for the Groq chat completions endpoint.
 * Both the intent extractor and the answer synthesizer send a single user message with temperature 0.
 */
@Slf4j
@Service
public class GroqApiClient {

    private static final String DEFAULT_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;
    private final String apiKey;
    private final String model;

    public GroqApiClient(
            @Value("${groq.api.url:" + DEFAULT_API_URL + "}") String apiUrl,
            @Value("${groq.api.key:}") String apiKey,
            @Value("${groq.api.model:" + DEFAULT_MODEL + "}") String model,
            @Value("${groq.api.timeout:PT30S}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        this.restClient = RestClient.builder()
                .baseUrl(apiUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        this.model = model;
    }

    /**
     * Whether an API key is configured. Callers map an unconfigured client to a reason code instead of calling.
     */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Sends one user message and returns the completion text.
     *
     * @param prompt    full prompt text
     * @param maxTokens completion token budget
     * @return completion text, never null
     * @throws IllegalStateException if no API key is configured
     * @throws InferenceException    if the call fails or returns no content
     */
    public String complete(String prompt, int maxTokens) {
        if (!isConfigured()) {
            throw new IllegalStateException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .messages(List.of(
                        ChatCompletionRequest.Message.builder()
                                .role("user")
                                .content(prompt)
                                .build()
                ))
                .model(model)
                .temperature(0.0)
                .maxCompletionTokens(maxTokens)
                .topP(1.0)
                .stream(false)
                .build();

        ChatCompletionResponse response;
        try {
            log.debug("Calling Groq API - model: {}, prompt length: {}, maxTokens: {}", model, prompt.length(), maxTokens);

            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (Exception e) {
            log.error("Error calling Groq API - model: {}, error: {}", model, e.getMessage());
            throw new InferenceException("Failed to call Groq API: " + e.getMessage(), e);
        }

        String content = response != null ? response.getContent() : null;
        if (content == null) {
            throw new InferenceException("Groq API returned no content");
        }

        log.debug("Groq API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");
        return content;
    }
}
