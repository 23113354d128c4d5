package com.tau.verifier.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.processor.VerificationResult;
import com.tau.verifier.processor.VerificationSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationReportWriterTest {

    private final VerifierConfig config = new VerifierConfig().setProverId("Alt-Ergo,2.6.2").setProverTimeoutSeconds(7);

    private static VerificationSummary summary() {
        VerificationSummary summary = new VerificationSummary("Counters.java");

        VerificationResult passed = new VerificationResult("countTo", 12, "static int countTo(int n) { ... }");
        passed.setVerified(true);
        passed.setReason("Proof succeeded (LLM generated invariants in 2 rounds)");
        passed.setUsedOracle(true);
        passed.setRounds(2);
        passed.setDurationSeconds(1.23456);
        passed.setSpecification(new FunctionSpecification("n >= 0", "result = n", List.of("0 <= !i <= n"), "n - !i"));
        passed.setWhymlFile("why_out/countTo_round02.mlw");
        summary.addResult(passed);

        VerificationResult failed = new VerificationResult("add", 30, "static int add(int a, int b) { ... }");
        failed.setReason("Bug detected: overflow");
        failed.setBugAnalysis(new BugAnalysis(true, "overflow", "sum exceeds range"));
        summary.addResult(failed);
        return summary;
    }

    @Test
    void writesReportSections(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("reports").resolve("report.json");
        new VerificationReportWriter(config).exportJSON(summary(), output);

        JsonNode report = new ObjectMapper().readTree(output.toFile());
        assertEquals("1.0.0", report.path("schema_version").asText());

        JsonNode metadata = report.path("metadata");
        assertEquals("Counters.java", metadata.path("source_file").asText());
        assertEquals("tau-0.1.0", metadata.path("verifier_version").asText());
        assertEquals("Alt-Ergo,2.6.2", metadata.path("prover").asText());
        assertEquals(7, metadata.path("prover_timeout").asInt());
        assertFalse(metadata.path("timestamp").asText().isEmpty());

        JsonNode totals = report.path("summary");
        assertEquals(2, totals.path("total_functions").asInt());
        assertEquals(1, totals.path("passed").asInt());
        assertEquals(1, totals.path("failed").asInt());
        assertEquals(50.0, totals.path("success_rate").asDouble(), 1e-9);
        assertEquals(1, totals.path("bugs_detected").asInt());
    }

    @Test
    void describesEachFunction() throws Exception {
        JsonNode results = new VerificationReportWriter(config).toTree(summary()).path("results");
        assertEquals(2, results.size());

        JsonNode countTo = results.get(0);
        assertEquals("countTo", countTo.path("function").path("name").asText());
        assertEquals(12, countTo.path("function").path("line").asInt());
        assertEquals(16, countTo.path("function").path("source_hash").asText().length());
        assertEquals("PASS", countTo.path("verification").path("status").asText());
        assertEquals(1.235, countTo.path("verification").path("duration_seconds").asDouble(), 1e-9);
        assertEquals("n - !i", countTo.path("specification").path("variant").asText());
        assertEquals(2, countTo.path("llm").path("rounds").asInt());
        assertEquals("why_out/countTo_round02.mlw", countTo.path("artifacts").path("whyml_file").asText());
        assertTrue(countTo.path("bug_analysis").isMissingNode());

        JsonNode add = results.get(1);
        assertEquals("FAIL", add.path("verification").path("status").asText());
        assertEquals("overflow", add.path("bug_analysis").path("bug_type").asText());
        assertTrue(add.path("llm").isMissingNode());
        assertTrue(add.path("artifacts").isMissingNode());
    }

    @Test
    void handlesEmptySummary() {
        JsonNode report = new VerificationReportWriter(config).toTree(new VerificationSummary("Empty.java"));
        assertEquals(0, report.path("summary").path("total_functions").asInt());
        assertEquals(0.0, report.path("summary").path("success_rate").asDouble(), 1e-9);
    }
}
