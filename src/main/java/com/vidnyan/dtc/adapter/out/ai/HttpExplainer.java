package com.vidnyan.dtc.adapter.out.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dtc.DtcProperties;
import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.model.CodeRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Explainer backed by an OpenAI-compatible chat completions endpoint.
 * Any transport or protocol failure falls back to the template explanation.
 */
@Slf4j
public class HttpExplainer implements Explainer {

    private static final String SYSTEM_PROMPT = """
            You are an automotive diagnostics assistant. Explain the diagnostic trouble code
            to a vehicle owner in plain language: what it means, how urgent it is, and what
            a mechanic will most likely check first. Use only the facts provided.""";

    private final DtcProperties.Explainer config;
    private final ObjectMapper objectMapper;
    private final Explainer fallback;
    private final HttpClient httpClient;

    public HttpExplainer(DtcProperties.Explainer config, ObjectMapper objectMapper, Explainer fallback) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.fallback = fallback;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build();
    }

    @Override
    public Explanation explain(CodeRecord record) {
        try {
            String content = chat(SYSTEM_PROMPT, userPrompt(record));
            return new Explanation(record.code(), content, "remote:" + config.getModel());
        } catch (IOException e) {
            log.warn("Explainer call failed for {}: {}. Using template.", record.code(), e.getMessage());
            return fallback.explain(record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Explainer call interrupted for {}. Using template.", record.code());
            return fallback.explain(record);
        }
    }

    String userPrompt(CodeRecord record) {
        return "Code: " + record.code() + "\n"
                + "Description: " + record.description() + "\n"
                + "Severity: " + record.severity().label() + "\n"
                + "System: " + record.system() + "\n"
                + "Possible causes: " + String.join("; ", record.possibleCauses()) + "\n"
                + "Recommended actions: " + String.join("; ", record.recommendedActions());
    }

    private String chat(String systemPrompt, String userPrompt) throws IOException, InterruptedException {
        log.debug("Explainer request - Endpoint: {}, Model: {}", config.getEndpoint(), config.getModel());

        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)),
                "temperature", 0.2);

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(config.getEndpoint()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            request.header("Authorization", "Bearer " + config.getApiKey());
        }

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode());
        }

        JsonNode content = objectMapper.readTree(response.body())
                .path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new IOException("response has no message content");
        }
        log.debug("Explainer response received: {} chars", content.asText().length());
        return content.asText();
    }
}
