package com.report.validation.judge;

import com.report.validation.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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
import java.util.List;

/**
 * Judge backed by a local Ollama model.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * The model is asked for a JSON verdict:
 * <pre>
 * {"score": 0-100, "evidence": ["..."],
 *  "issues": [{"severity": "low|medium|high|critical", "description": "...",
 *              "evidence": ["..."], "priority": 1-10, "suggestedAction": "..."}]}
 * </pre>
 *
 * Usage:
 * <pre>
 * JudgeOracle judge = OllamaJudgeOracle.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaJudgeOracle implements JudgeOracle {
    private static final Logger log = LoggerFactory.getLogger(OllamaJudgeOracle.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    static final String PROMPT_REVISION = "v1";
    private static final int MAX_FRAGMENT_CHARS = 6_000;

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaJudgeOracle(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public JudgeVerdict evaluate(JudgeRequest request) {
        log.debug("Judging node {} for {} via Ollama/{}", request.nodeId(), request.category(), model);
        String response;
        try {
            response = callOllama(buildPrompt(request));
        } catch (IOException e) {
            throw new JudgeUnavailableException("Ollama call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JudgeUnavailableException("Interrupted while calling Ollama", e);
        }
        return parseVerdict(response, objectMapper);
    }

    @Override
    public String getJudgeVersion() {
        return "ollama/" + model + "/" + PROMPT_REVISION;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    String buildPrompt(JudgeRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a reviewer of professional assessment reports. ");
        prompt.append("Evaluate the ").append(request.nodeType().wireName()).append(" section below for ");
        prompt.append(request.category().wireName()).append(".\n\n");

        prompt.append("Criterion: ").append(request.criterion().name()).append("\n");
        for (String check : request.criterion().checks()) {
            prompt.append("- ").append(check).append("\n");
        }

        prompt.append("\nSection:\n\"\"\"\n").append(truncate(request.contentFragment())).append("\n\"\"\"\n");

        if (!request.relatedContent().isEmpty()) {
            prompt.append("\nRelated sections of the same report:\n");
            for (String related : request.relatedContent()) {
                prompt.append("- ").append(truncate(related)).append("\n");
            }
        }

        prompt.append("\nRespond with JSON only, in this exact shape:\n");
        prompt.append("{\"score\": <0-100>, \"evidence\": [\"...\"], \"issues\": [{\"severity\": ");
        prompt.append("\"low|medium|high|critical\", \"description\": \"...\", \"evidence\": [\"...\"], ");
        prompt.append("\"priority\": <1-10>, \"suggestedAction\": \"...\"}]}\n");
        prompt.append("Use an empty issues array when the section has no defects for this criterion.\n");
        return prompt.toString();
    }

    private String callOllama(String prompt) throws IOException, InterruptedException {
        OllamaRequest ollamaRequest = new OllamaRequest(model, prompt, false, "json");
        String requestBody = objectMapper.writeValueAsString(ollamaRequest);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new JudgeUnavailableException("Ollama returned status " + response.statusCode());
        }

        OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
        if (ollamaResponse.response() == null) {
            throw new JudgeUnavailableException("Ollama response has no content");
        }
        return ollamaResponse.response();
    }

    /**
     * Parses the model's JSON verdict. Scores are clamped to 0-100; a verdict without a
     * numeric score is rejected.
     */
    static JudgeVerdict parseVerdict(String response, ObjectMapper mapper) {
        JsonNode root;
        try {
            root = mapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new JudgeUnavailableException("Judge response is not valid JSON", e);
        }
        if (root == null || !root.path("score").isNumber()) {
            throw new JudgeUnavailableException("Judge response has no numeric score");
        }
        int score = (int) Math.max(0, Math.min(100, Math.round(root.get("score").asDouble())));

        List<JudgeFinding> findings = new ArrayList<>();
        for (JsonNode issue : root.path("issues")) {
            String description = issue.path("description").asText("").trim();
            if (description.isEmpty()) {
                continue;
            }
            String action = issue.path("suggestedAction").asText("").trim();
            findings.add(new JudgeFinding(
                    Severity.parse(issue.path("severity").asText(null)),
                    description,
                    textList(issue.path("evidence")),
                    issue.path("priority").asInt(5),
                    action.isEmpty() ? null : action));
        }
        return new JudgeVerdict(score, textList(root.path("evidence")), findings);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> {
                if (v.isTextual() && !v.asText().isBlank()) {
                    values.add(v.asText());
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_FRAGMENT_CHARS ? text : text.substring(0, MAX_FRAGMENT_CHARS) + "...";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a judge for the default local endpoint and model.
     */
    public static OllamaJudgeOracle createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaJudgeOracle build() {
            return new OllamaJudgeOracle(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
