package com.outbreaksentinel.core.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.validation.Case;
import com.outbreaksentinel.core.validation.EvidenceBundle;
import com.outbreaksentinel.core.validation.StageVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link NarrativeAssistant} backed by an OpenAI-compatible chat-completions
 * endpoint.
 *
 * <p>
 * The prompt is built only from structured case fields (scores, severity,
 * evidence counts, verdict rationales, actions), never from free text in the
 * input data.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpNarrativeAssistant implements NarrativeAssistant {

    private static final Logger LOG = LoggerFactory.getLogger(HttpNarrativeAssistant.class);

    static final String SYSTEM_PROMPT = "You are a public-health surveillance analyst. "
            + "Explain in at most three sentences why this outbreak alert was raised. "
            + "Use only the facts provided.";

    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public HttpNarrativeAssistant(URI endpoint, String apiKey, String model, Duration requestTimeout) {
        this(endpoint, apiKey, model, requestTimeout,
                HttpClient.newBuilder().connectTimeout(requestTimeout).build(), new ObjectMapper());
    }

    HttpNarrativeAssistant(URI endpoint, String apiKey, String model, Duration requestTimeout,
            HttpClient httpClient, ObjectMapper mapper) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.apiKey = apiKey;
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String generateRationale(Case escalated) {
        String body;
        try {
            body = mapper.writeValueAsString(requestBody(escalated));
        } catch (IOException e) {
            throw new NarrativeUnavailableException("Failed to encode narrative request", e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NarrativeUnavailableException("Narrative endpoint unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NarrativeUnavailableException("Interrupted calling narrative endpoint", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new NarrativeUnavailableException("Narrative endpoint returned HTTP " + response.statusCode());
        }
        return extractText(response.body());
    }

    ObjectNode requestBody(Case escalated) {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", 0.3);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", facts(escalated));
        return root;
    }

    static String facts(Case c) {
        EvidenceBundle e = c.getEvidence();
        StringBuilder sb = new StringBuilder();
        sb.append("Location: ").append(c.getKey().getLocation()).append('\n');
        sb.append("Date: ").append(c.getKey().getTimeBucket()).append('\n');
        sb.append("Severity: ").append(c.getSeverity() != null ? c.getSeverity().key() : "unknown").append('\n');
        sb.append(String.format(Locale.ROOT, "Anomaly score: %.3f, confidence: %.3f%n",
                c.getFusion().getCompositeScore(), c.getFusion().getConfidence()));
        if (e.hasHospitalData()) {
            sb.append("Hospital events: ").append(e.getHospitalEvents())
                    .append(", top symptoms: ").append(e.getTopSymptoms()).append('\n');
        }
        if (e.hasSocialData()) {
            sb.append("Social mentions: ").append(e.getSocialMentions())
                    .append(", top keywords: ").append(e.getTopKeywords()).append('\n');
        }
        if (e.getEnvironmentalRisk() != null) {
            sb.append("Environmental risk: ").append(e.getEnvironmentalRisk().getLevel().key())
                    .append(' ').append(e.getEnvironmentalRisk().getFactors()).append('\n');
        }
        for (StageVerdict v : c.getVerdicts()) {
            sb.append("Check ").append(v.getStage()).append(": ").append(v.getRationale()).append('\n');
        }
        for (RecommendedAction a : c.getActions()) {
            sb.append("Action: ").append(a.getAction()).append('\n');
        }
        return sb.toString();
    }

    String extractText(String responseBody) {
        try {
            JsonNode content = mapper.readTree(responseBody).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new NarrativeUnavailableException("Narrative response has no message content");
            }
            LOG.debug("Narrative received ({} chars)", content.asText().length());
            return content.asText();
        } catch (IOException e) {
            throw new NarrativeUnavailableException("Malformed narrative response", e);
        }
    }
}
