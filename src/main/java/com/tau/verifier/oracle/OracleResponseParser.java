package com.tau.verifier.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates oracle replies against the expected JSON shapes.
 *
 * The reply may wrap the JSON object in prose or a code fence; the text between the
 * first opening brace and the last closing brace is taken as the object.
 */
public class OracleResponseParser {

    private final ObjectMapper objectMapper;

    public OracleResponseParser() {
        this(new ObjectMapper());
    }

    public OracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a loop contract: {@code invariants} must be a list of strings and {@code variant} a string.
     */
    public LoopContract parseContract(String reply) throws OracleException {
        JsonNode root = extractObject(reply);
        JsonNode invariants = root.get("invariants");
        JsonNode variant = root.get("variant");
        if (invariants == null || !invariants.isArray()) {
            throw invalid("missing invariants list");
        }
        if (variant == null || !variant.isTextual()) {
            throw invalid("variant must be a string");
        }
        List<String> clauses = new ArrayList<>();
        for (JsonNode invariant : invariants) {
            if (!invariant.isTextual()) {
                throw invalid("invariants must be strings");
            }
            clauses.add(invariant.asText());
        }
        return new LoopContract(clauses, variant.asText());
    }

    /**
     * Parses a bug verdict. {@code bug_detected} is required and may be a boolean or the strings "true"/"false".
     */
    public BugAnalysis parseBugAnalysis(String reply) throws OracleException {
        JsonNode root = extractObject(reply);
        JsonNode detected = root.get("bug_detected");
        if (detected == null) {
            throw invalid("missing bug_detected");
        }
        boolean bug;
        if (detected.isBoolean()) {
            bug = detected.asBoolean();
        } else if (detected.isTextual()) {
            bug = "true".equalsIgnoreCase(detected.asText().trim());
        } else {
            throw invalid("bug_detected must be a boolean");
        }
        ObjectNode normalized = ((ObjectNode) root).put("bug_detected", bug);
        return convert(normalized, BugAnalysis.class);
    }

    /**
     * Parses suggested requires/ensures clauses; a missing list means {@code ["true"]}.
     */
    public GeneratedSpecification parseSpecification(String reply) throws OracleException {
        ObjectNode root = (ObjectNode) extractObject(reply);
        for (String field : List.of("requires", "ensures")) {
            JsonNode clauses = root.get(field);
            if (clauses == null || clauses.isNull()) {
                ArrayNode trivial = root.putArray(field);
                trivial.add("true");
            } else if (clauses.isTextual()) {
                root.putArray(field).add(clauses.asText());
            } else if (!clauses.isArray()) {
                throw invalid(field + " must be a list of strings");
            }
        }
        return convert(root, GeneratedSpecification.class);
    }

    JsonNode extractObject(String reply) throws OracleException {
        if (reply == null) {
            throw invalid("empty reply");
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw invalid("no JSON object in reply");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(reply.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.SCHEMA_INVALID, "Malformed JSON in reply: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid("reply is not a JSON object");
        }
        return root;
    }

    private <T> T convert(JsonNode node, Class<T> type) throws OracleException {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.SCHEMA_INVALID,
                    "Reply does not match " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private static OracleException invalid(String reason) {
        return new OracleException(OracleException.Kind.SCHEMA_INVALID, "Invalid oracle reply: " + reason);
    }
}
