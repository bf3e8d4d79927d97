package com.codeagent.providers;

import com.codeagent.shared.model.Message;
import com.codeagent.shared.model.Role;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Set;

/**
 * {@code POST /chat/completions} against any OpenAI-compatible endpoint.
 * Classifies every failure as transient or fatal; retrying is left to
 * {@link RetryingBackend}.
 */
public abstract class OpenAiCompatibleBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleBackend.class);

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 409, 425, 429);
    private static final List<String> RETRYABLE_400_MARKERS = List.of(
            "developer instruction is not enabled",
            "provider returned error",
            "no providers available",
            "temporarily unavailable",
            "upstream error",
            "try again");
    private static final int MAX_ERROR_DETAIL = 2000;

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ResponseParser parser;
    private final ObjectMapper mapper = new ObjectMapper();

    protected OpenAiCompatibleBackend(String apiKey, String baseUrl, String model,
                                      Duration requestTimeout, ResponseParser parser, HttpClient httpClient) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.model = model;
        this.requestTimeout = requestTimeout;
        this.parser = parser;
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public String model() { return model; }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String json;
        try {
            json = mapper.writeValueAsString(buildBody(request));
        } catch (JsonProcessingException e) {
            throw new FatalBackendException("Cannot serialize request: " + e.getOriginalMessage(), 0, e);
        }

        var httpReq = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        HttpResponse<String> resp;
        try {
            resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientBackendException(id() + " request failed: " + e, 0, null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalBackendException(id() + " request interrupted", 0, e);
        }

        if (resp.statusCode() >= 400) {
            throw classify(resp);
        }

        JsonNode root;
        try {
            root = mapper.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new TransientBackendException(id() + " returned unreadable JSON", resp.statusCode(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new TransientBackendException(id() + " returned non-object JSON response");
        }
        log.debug("{} responded with model={}", id(), root.path("model").asText(model));
        return parser.parse(root, request.hasTools());
    }

    Map<String, Object> buildBody(GenerationRequest request) {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", model);
        var messages = new ArrayList<Map<String, Object>>();
        for (var m : request.messages()) messages.add(toWire(m));
        body.put("messages", messages);
        if (request.hasTools()) {
            body.put("tools", request.tools());
        }
        request.decoding().forEach((k, v) -> {
            if (v != null) body.put(k, v);
        });
        return body;
    }

    private Map<String, Object> toWire(Message m) {
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", m.role().wireName());
        msg.put("content", m.content());
        if (m.role() == Role.ASSISTANT && m.hasToolCalls()) {
            var tcList = new ArrayList<Map<String, Object>>();
            for (var tc : m.toolCalls()) {
                String args;
                try {
                    args = mapper.writeValueAsString(tc.arguments());
                } catch (JsonProcessingException e) {
                    throw new FatalBackendException("Cannot serialize tool arguments of " + tc.name(), 0, e);
                }
                tcList.add(Map.of(
                        "id", tc.id() != null ? tc.id() : "",
                        "type", "function",
                        "function", Map.of("name", tc.name(), "arguments", args)));
            }
            msg.put("tool_calls", tcList);
        }
        if (m.role() == Role.TOOL) {
            msg.put("tool_call_id", m.toolCallId() != null ? m.toolCallId() : "unknown");
            if (m.toolName() != null) msg.put("name", m.toolName());
        }
        return msg;
    }

    private BackendException classify(HttpResponse<String> resp) {
        int status = resp.statusCode();
        var body = resp.body() != null ? resp.body() : "";
        var detail = body.length() > MAX_ERROR_DETAIL ? body.substring(0, MAX_ERROR_DETAIL) : body;
        var message = id() + " error " + status + ": " + detail;
        if (isRetryableStatus(status, detail)) {
            return new TransientBackendException(message, status, retryAfter(resp), null);
        }
        return new FatalBackendException(message, status, null);
    }

    static boolean isRetryableStatus(int status, String detail) {
        if (RETRYABLE_STATUS.contains(status) || status >= 500) return true;
        if (status != 400) return false;
        var lowered = detail.toLowerCase();
        return RETRYABLE_400_MARKERS.stream().anyMatch(lowered::contains);
    }

    private static Duration retryAfter(HttpResponse<String> resp) {
        var header = resp.headers().firstValue("Retry-After");
        if (header.isEmpty()) return null;
        try {
            double secs = Double.parseDouble(header.get().strip());
            if (Double.isFinite(secs) && secs >= 0) return Duration.ofMillis((long) (secs * 1000));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", header.get());
        }
        return null;
    }
}
