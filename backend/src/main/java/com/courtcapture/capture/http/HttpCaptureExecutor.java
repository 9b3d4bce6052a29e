package com.courtcapture.capture.http;

import com.courtcapture.capture.dispatch.CaptureExecutionException;
import com.courtcapture.capture.dispatch.CaptureExecutor;
import com.courtcapture.capture.model.CaptureRequest;
import com.courtcapture.capture.model.CaptureResult;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.config.CaptureProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Sends captures to the browser automation worker over HTTP: {@code POST {base-url}/captures/{job-type}}.
 */
@Service
public class HttpCaptureExecutor implements CaptureExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpCaptureExecutor.class);
    private static final int MAX_ERROR_BODY = 500;

    private final CaptureProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    @Autowired
    public HttpCaptureExecutor(
        CaptureProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this(
            properties,
            objectMapper,
            HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getExecutor().getConnectTimeoutSeconds()))
                .version(HttpClient.Version.HTTP_1_1)
                .executor(httpExecutor)
                .build()
        );
    }

    HttpCaptureExecutor(CaptureProperties properties, ObjectMapper objectMapper, HttpClient client) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = client;
    }

    @Override
    public boolean supports(JobType jobType) {
        return true;
    }

    @Override
    public CaptureResult capture(CaptureRequest request) {
        URI uri = URI.create(properties.getExecutor().getBaseUrl() + "/captures/" + request.jobType().code());
        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody(request));
        } catch (JsonProcessingException e) {
            throw new CaptureExecutionException("Unable to serialize capture request", e);
        }
        HttpRequest httpRequest = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getExecutor().getRequestTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        Instant startedAt = Instant.now();
        HttpResponse<String> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new CaptureExecutionException(
                "Capture timed out after " + properties.getExecutor().getRequestTimeoutSeconds() + "s",
                e
            );
        } catch (IOException e) {
            throw new CaptureExecutionException("Automation worker unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptureExecutionException("Capture interrupted", e);
        }

        CredentialContext credential = request.credential();
        log.info(
            "Capture {} for {} {} (credential {}) returned HTTP {} in {} ms",
            request.jobType().code(),
            credential.court(),
            credential.degree().code(),
            credential.credentialId(),
            response.statusCode(),
            Duration.between(startedAt, Instant.now()).toMillis()
        );
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new CaptureExecutionException(
                "Automation worker returned HTTP " + response.statusCode() + ": " + errorDetail(response.body())
            );
        }
        try {
            return objectMapper.readValue(response.body(), CaptureResult.class);
        } catch (JsonProcessingException e) {
            throw new CaptureExecutionException("Malformed capture response: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> requestBody(CaptureRequest request) {
        CredentialContext credential = request.credential();
        Map<String, Object> credentialBody = new LinkedHashMap<>();
        credentialBody.put("credentialId", credential.credentialId());
        credentialBody.put("tenantId", credential.tenantId());
        credentialBody.put("login", credential.login());
        credentialBody.put("secret", credential.secret());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobType", request.jobType().code());
        body.put("court", credential.court());
        body.put("degree", credential.degree().code());
        body.put("credential", credentialBody);
        body.put("courtConfig", request.courtConfig());
        body.put("params", request.params());
        return body;
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "empty body";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Automation worker error body is not JSON: {}", e.getOriginalMessage());
        }
        String trimmed = body.trim();
        return trimmed.length() <= MAX_ERROR_BODY ? trimmed : trimmed.substring(0, MAX_ERROR_BODY);
    }
}
