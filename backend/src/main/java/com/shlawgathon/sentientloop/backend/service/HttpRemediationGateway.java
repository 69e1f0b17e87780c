package com.shlawgathon.sentientloop.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.sentientloop.backend.exception.ExternalDependencyException;
import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.RecoveryOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * POSTs the chosen option to {@code {base-url}/remediation/{moduleId}}. A 2xx
 * answer counts as success unless its body says {@code "success": false}.
 */
@Component
public class HttpRemediationGateway implements RemediationGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpRemediationGateway.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpRemediationGateway(
            ObjectMapper objectMapper,
            @Value("${sentientloop.remediation.base-url:}") String baseUrl,
            @Value("${sentientloop.remediation.timeout-seconds:30}") long timeoutSeconds) {
        this.requestTimeout = Duration.ofSeconds(timeoutSeconds);
        // Module endpoints are plain HTTP/1.1 services
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public RemediationOutcome execute(FailureRecord failure, RecoveryOption option) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return RemediationOutcome.failed("No remediation endpoint configured");
        }

        String url = baseUrl + "/remediation/" + URLEncoder.encode(failure.getModuleId(), StandardCharsets.UTF_8);
        try {
            Map<String, Object> body = new HashMap<>();
            body.put("failureId", failure.getId());
            body.put("operationName", failure.getOperationName());
            body.put("moduleId", failure.getModuleId());
            body.put("failureType", failure.getType().name());
            body.put("optionId", option.getId());
            body.put("action", option.getAction().name());
            body.put("metadata", failure.getMetadata());

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            log.info("[RECOVERY] POST {} action {}", url, option.getAction());
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return interpret(response);
        } catch (IOException e) {
            throw new ExternalDependencyException("Remediation call to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalDependencyException("Remediation call to " + url + " interrupted", e);
        }
    }

    private RemediationOutcome interpret(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("[RECOVERY] Remediation endpoint answered {}: {}", status, response.body());
            return RemediationOutcome.failed("Remediation endpoint answered " + status);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return RemediationOutcome.succeeded("Remediation accepted");
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            boolean success = !json.has("success") || json.get("success").asBoolean();
            String message = json.hasNonNull("message") ? json.get("message").asText() : "Remediation completed";
            return new RemediationOutcome(success, message);
        } catch (IOException e) {
            log.debug("[RECOVERY] Non-JSON remediation response, treating as success");
            return RemediationOutcome.succeeded("Remediation accepted");
        }
    }
}
