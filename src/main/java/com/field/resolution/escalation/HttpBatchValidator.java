package com.field.resolution.escalation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.field.resolution.core.model.ConfidenceLabel;
import com.field.resolution.core.model.RawFieldCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Batch validator that delegates to a remote arbitration service over HTTP.
 *
 * <p>The whole batch is sent in one JSON POST:</p>
 * <pre>
 * {"tables": {"1": [{"id": "A", "contents": ["Quinits", "500"]}]}}
 * </pre>
 * <p>and the service answers with one verdict per field:</p>
 * <pre>
 * {"results": {"1": [{"id": "A", "value": 500, "confidence": "alta", "rationale": "..."}]}}
 * </pre>
 *
 * <p>Usage:</p>
 * <pre>
 * HttpBatchValidator validator = HttpBatchValidator.builder()
 *     .endpoint(URI.create("http://arbiter.internal/validate"))
 *     .apiKey(key)
 *     .build();
 * </pre>
 */
public class HttpBatchValidator implements BatchValidator {
    private static final Logger log = LoggerFactory.getLogger(HttpBatchValidator.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final String API_KEY_HEADER = "api-key";

    private final URI endpoint;
    private final Duration timeout;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpBatchValidator(Builder builder) {
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint is required");
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.apiKey = builder.apiKey;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public EscalationResponse validate(EscalationBatch batch) throws EscalationException {
        log.info("Sending {} escalated fields from {} tables to {}", batch.size(), batch.tableIds().size(), endpoint);

        String body;
        try {
            body = objectMapper.writeValueAsString(toRequest(batch));
        } catch (JsonProcessingException e) {
            throw new EscalationException("Could not serialize escalation batch", e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiKey != null) {
            request.header(API_KEY_HEADER, apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EscalationException("Validator unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EscalationException("Interrupted while waiting for validator", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new EscalationException("Validator returned status " + response.statusCode() + ": " + response.body());
        }

        return parseResponse(response.body());
    }

    @Override
    public String getValidatorName() {
        return "HTTP/" + endpoint.getHost();
    }

    private ValidationRequest toRequest(EscalationBatch batch) {
        Map<String, List<FieldPayload>> tables = new LinkedHashMap<>();
        batch.tables().forEach((tableId, fields) -> {
            List<FieldPayload> payload = new ArrayList<>();
            for (RawFieldCandidate field : fields) {
                payload.add(new FieldPayload(field.fieldId(), field.contents()));
            }
            tables.put(String.valueOf(tableId), payload);
        });
        return new ValidationRequest(tables);
    }

    /**
     * Parses the validator's JSON answer.
     */
    EscalationResponse parseResponse(String body) throws EscalationException {
        ValidationResponse parsed;
        try {
            parsed = objectMapper.readValue(body, ValidationResponse.class);
        } catch (JsonProcessingException e) {
            throw new EscalationException("Malformed validator response: " + e.getOriginalMessage(), e);
        }
        if (parsed == null || parsed.results() == null) {
            throw new EscalationException("Validator response has no results");
        }

        List<ExternalVerdict> verdicts = new ArrayList<>();
        for (Map.Entry<String, List<VerdictPayload>> table : parsed.results().entrySet()) {
            int tableId;
            try {
                tableId = Integer.parseInt(table.getKey().trim());
            } catch (NumberFormatException e) {
                throw new EscalationException("Invalid table id in validator response: " + table.getKey(), e);
            }
            if (table.getValue() == null) {
                continue;
            }
            for (VerdictPayload verdict : table.getValue()) {
                if (verdict == null || verdict.id() == null || verdict.id().isBlank()) {
                    log.warn("Skipping verdict without field id in table {}", tableId);
                    continue;
                }
                verdicts.add(new ExternalVerdict(verdict.id().trim(), tableId, verdict.value(),
                        ConfidenceLabel.fromLabel(verdict.confidence()), verdict.rationale()));
            }
        }

        log.debug("Validator answered {} verdicts", verdicts.size());
        return EscalationResponse.of(verdicts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private URI endpoint;
        private Duration timeout;
        private String apiKey;

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = URI.create(endpoint);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public HttpBatchValidator build() {
            return new HttpBatchValidator(this);
        }
    }

    // Wire DTOs
    private record ValidationRequest(Map<String, List<FieldPayload>> tables) {}

    private record FieldPayload(String id, List<String> contents) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ValidationResponse(Map<String, List<VerdictPayload>> results) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record VerdictPayload(String id, Integer value, String confidence, String rationale) {}
}
