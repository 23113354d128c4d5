package com.tau.verifier.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Oracle backed by the Anthropic Messages API.
 *
 * Every request is one user message: a fixed instruction followed by a JSON payload
 * describing the function. Replies are validated by {@link OracleResponseParser}.
 */
public class AnthropicContractOracle implements ContractOracle {

    private static final Logger logger = LoggerFactory.getLogger(AnthropicContractOracle.class);

    static final String API_VERSION = "2023-06-01";
    static final int REFINE_OUTPUT_CHARS = 4000;
    static final int CLASSIFY_OUTPUT_CHARS = 2000;
    static final int SPECIFICATION_MAX_TOKENS = 2000;

    private final VerifierConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OracleResponseParser parser;

    public AnthropicContractOracle(VerifierConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getOracleTimeoutSeconds()))
                .build());
    }

    public AnthropicContractOracle(VerifierConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.parser = new OracleResponseParser(objectMapper);
    }

    @Override
    public Optional<LoopContract> proposeContract(AnnotatedFunction function) throws OracleException {
        Map<String, Object> payload = basePayload(function);
        String reply = complete(OraclePrompts.PROPOSE, payload, config.getOracleMaxTokens());
        LoopContract contract = parser.parseContract(reply);
        logger.debug("Oracle proposed {} for {}", contract, function.getName());
        return Optional.of(contract);
    }

    @Override
    public Optional<LoopContract> refineContract(AnnotatedFunction function, LoopContract current, String proverOutput)
            throws OracleException {
        Map<String, Object> payload = basePayload(function);
        Map<String, Object> currentContract = new LinkedHashMap<>();
        currentContract.put("invariants", current != null ? current.getInvariants() : null);
        currentContract.put("variant", current != null ? current.getVariant() : null);
        payload.put("current_contract", currentContract);
        payload.put("why3_output", tail(proverOutput, REFINE_OUTPUT_CHARS));

        String reply = complete(OraclePrompts.REFINE, payload, config.getOracleMaxTokens());
        return Optional.of(parser.parseContract(reply));
    }

    @Override
    public Optional<BugAnalysis> classifyBug(AnnotatedFunction function, String proverOutput) throws OracleException {
        Map<String, Object> payload = basePayload(function);
        if (proverOutput != null && !proverOutput.isEmpty()) {
            payload.put("why3_output", tail(proverOutput, CLASSIFY_OUTPUT_CHARS));
        }
        String reply = complete(OraclePrompts.CLASSIFY_BUG, payload, config.getOracleMaxTokens());
        return Optional.of(parser.parseBugAnalysis(reply));
    }

    @Override
    public Optional<GeneratedSpecification> suggestSpecification(AnnotatedFunction function) throws OracleException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("function_name", function.getName());
        payload.put("java_method", function.getSource());
        String reply = complete(OraclePrompts.SUGGEST_SPECIFICATION, payload, SPECIFICATION_MAX_TOKENS);
        return Optional.of(parser.parseSpecification(reply));
    }

    private Map<String, Object> basePayload(AnnotatedFunction function) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("function_name", function.getName());
        payload.put("java_method", function.getSource());
        payload.put("requires", function.getSpecification().getRequires());
        payload.put("ensures", function.getSpecification().getEnsures());
        return payload;
    }

    /**
     * Sends one message and returns the text of the reply.
     */
    String complete(String instruction, Map<String, Object> payload, int maxTokens) throws OracleException {
        if (!config.hasApiKey()) {
            throw new OracleException(OracleException.Kind.UNAVAILABLE, "No API key configured");
        }

        String body;
        try {
            ObjectNode request = objectMapper.createObjectNode();
            request.put("model", config.getOracleModel());
            request.put("max_tokens", maxTokens);
            request.put("temperature", config.getOracleTemperature());
            ObjectNode message = request.putArray("messages").addObject();
            message.put("role", "user");
            message.put("content", instruction + "\n\n" + objectMapper.writeValueAsString(payload));
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.UNAVAILABLE, "Could not encode request", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(config.getOracleEndpoint()))
                .timeout(Duration.ofSeconds(config.getOracleTimeoutSeconds()))
                .header("content-type", "application/json")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new OracleException(OracleException.Kind.UNAVAILABLE, "Oracle request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException(OracleException.Kind.UNAVAILABLE, "Oracle request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new OracleException(OracleException.Kind.UNAVAILABLE,
                    "Oracle returned HTTP " + response.statusCode());
        }
        return extractText(response.body());
    }

    private String extractText(String responseBody) throws OracleException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.SCHEMA_INVALID, "Malformed oracle response", e);
        }
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.has("text")) {
                return block.get("text").asText().trim();
            }
        }
        throw new OracleException(OracleException.Kind.SCHEMA_INVALID, "Oracle response has no text content");
    }

    static String tail(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }
}
