package com.tau.verifier.evaluation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.processor.VerificationResult;
import com.tau.verifier.processor.VerificationSummary;
import com.tau.verifier.proofs.FunctionHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes verification summaries as JSON reports and logs a readable digest.
 */
public class VerificationReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(VerificationReportWriter.class);

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String VERIFIER_VERSION = "tau-0.1.0";

    private final VerifierConfig config;
    private final ObjectMapper objectMapper;

    public VerificationReportWriter(VerifierConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Exports the summary to a JSON file, creating parent directories as needed.
     */
    public void exportJSON(VerificationSummary summary, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(summary), StandardCharsets.UTF_8);
        logger.info("Report written to {}", outputPath);
    }

    public String toJson(VerificationSummary summary) throws IOException {
        return objectMapper.writeValueAsString(toTree(summary));
    }

    /**
     * Builds the report tree: schema version, metadata, summary and one entry per function.
     */
    public ObjectNode toTree(VerificationSummary summary) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("schema_version", SCHEMA_VERSION);

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("timestamp", Instant.now().toString());
        metadata.put("source_file", summary.getSourceFile());
        metadata.put("verifier_version", VERIFIER_VERSION);
        metadata.put("prover", config.getProverId());
        metadata.put("prover_timeout", config.getProverTimeoutSeconds());

        ObjectNode totals = root.putObject("summary");
        totals.put("total_functions", summary.getTotal());
        totals.put("passed", summary.getPassed());
        totals.put("failed", summary.getFailed());
        totals.put("success_rate", Math.round(summary.getSuccessRate() * 10000) / 100.0);
        totals.put("bugs_detected", summary.getBugsDetected());

        ArrayNode results = root.putArray("results");
        for (VerificationResult result : summary.getResults()) {
            results.add(resultNode(result));
        }
        return root;
    }

    private ObjectNode resultNode(VerificationResult result) {
        ObjectNode node = objectMapper.createObjectNode();

        ObjectNode function = node.putObject("function");
        function.put("name", result.getFunctionName());
        function.put("line", result.getLineNumber());
        function.put("source_hash", FunctionHasher.sha256(result.getSource()).substring(0, 16));
        function.put("source_length", result.getSource().length());

        ObjectNode verification = node.putObject("verification");
        verification.put("verified", result.isVerified());
        verification.put("status", result.isVerified() ? "PASS" : "FAIL");
        verification.put("reason", result.getReason());
        verification.put("duration_seconds", Math.round(result.getDurationSeconds() * 1000) / 1000.0);
        verification.put("cached", result.isCached());
        if (result.getHash() != null) {
            verification.put("certificate", result.getHash());
        }

        FunctionSpecification spec = result.getSpecification();
        if (spec != null) {
            ObjectNode specification = node.putObject("specification");
            specification.put("requires", spec.getRequires());
            specification.put("ensures", spec.getEnsures());
            ArrayNode invariants = specification.putArray("invariants");
            spec.getInvariants().forEach(invariants::add);
            if (spec.getVariant() != null) {
                specification.put("variant", spec.getVariant());
            }
        }

        if (result.isUsedOracle()) {
            ObjectNode llm = node.putObject("llm");
            llm.put("used", true);
            llm.put("rounds", result.getRounds());
        }

        BugAnalysis bug = result.getBugAnalysis();
        if (bug != null && bug.isBugDetected()) {
            ObjectNode analysis = node.putObject("bug_analysis");
            analysis.put("bug_type", bug.getBugType());
            analysis.put("explanation", bug.getExplanation());
            analysis.put("actual_behavior", bug.getActualBehavior());
            analysis.put("expected_behavior", bug.getExpectedBehavior());
            analysis.put("confidence", bug.getConfidence());
        }

        if (result.getWhymlFile() != null || result.getLeanFile() != null) {
            ObjectNode artifacts = node.putObject("artifacts");
            artifacts.put("whyml_file", result.getWhymlFile());
            artifacts.put("lean_file", result.getLeanFile());
        }
        return node;
    }

    /**
     * Logs one line per function followed by the totals.
     */
    public void printSummary(VerificationSummary summary) {
        logger.info("=== Verification Report: {} ===", summary.getSourceFile());
        for (VerificationResult result : summary.getResults()) {
            logger.info("  {} {} (line {}){}: {}", result.isVerified() ? "PASS" : "FAIL",
                    result.getFunctionName(), result.getLineNumber(), result.isCached() ? " [cached]" : "",
                    result.getReason());
        }
        logger.info("Total: {}  Passed: {}  Failed: {}  Bugs: {}  Success rate: {}%",
                summary.getTotal(), summary.getPassed(), summary.getFailed(), summary.getBugsDetected(),
                String.format("%.1f", summary.getSuccessRate() * 100));
    }
}
