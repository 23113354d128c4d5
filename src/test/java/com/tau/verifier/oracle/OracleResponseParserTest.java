package com.tau.verifier.oracle;

import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponseParserTest {

    private final OracleResponseParser parser = new OracleResponseParser();

    @Test
    void parsesContractInsideProse() throws Exception {
        String reply = "Here is the contract:\n```json\n"
                + "{\"invariants\": [\"0 <= !i <= n\", \"!s = !i\"], \"variant\": \"n - !i\"}\n```";
        LoopContract contract = parser.parseContract(reply);
        assertEquals(List.of("0 <= !i <= n", "!s = !i"), contract.getInvariants());
        assertEquals("n - !i", contract.getVariant());
    }

    @Test
    void rejectsMalformedContracts() {
        assertSchemaInvalid(() -> parser.parseContract("no json here"));
        assertSchemaInvalid(() -> parser.parseContract("{\"variant\": \"n\"}"));
        assertSchemaInvalid(() -> parser.parseContract("{\"invariants\": \"x\", \"variant\": \"n\"}"));
        assertSchemaInvalid(() -> parser.parseContract("{\"invariants\": [1], \"variant\": \"n\"}"));
        assertSchemaInvalid(() -> parser.parseContract("{\"invariants\": [\"true\"], \"variant\": 3}"));
        assertSchemaInvalid(() -> parser.parseContract("{\"invariants\": [\"true\"], "));
    }

    @Test
    void parsesBugVerdict() throws Exception {
        BugAnalysis bug = parser.parseBugAnalysis("{\"bug_detected\": true, \"bug_type\": \"off-by-one\", "
                + "\"explanation\": \"loop runs one step too far\", \"confidence\": 0.9, \"extra\": 1}");
        assertTrue(bug.isBugDetected());
        assertEquals("off-by-one", bug.getBugType());
        assertEquals("loop runs one step too far", bug.getExplanation());
        assertEquals(0.9, bug.getConfidence(), 1e-9);
    }

    @Test
    void acceptsStringBugFlag() throws Exception {
        assertTrue(parser.parseBugAnalysis("{\"bug_detected\": \"true\"}").isBugDetected());
        assertFalse(parser.parseBugAnalysis("{\"bug_detected\": \"no\"}").isBugDetected());
        assertSchemaInvalid(() -> parser.parseBugAnalysis("{\"bug_type\": \"none\"}"));
        assertSchemaInvalid(() -> parser.parseBugAnalysis("{\"bug_detected\": 1}"));
    }

    @Test
    void parsesSpecificationWithDefaults() throws Exception {
        GeneratedSpecification spec = parser.parseSpecification(
                "{\"ensures\": [\"result >= a\", \"result >= b\"], \"reasoning\": \"max\", \"confidence\": 0.8}");
        assertEquals(List.of("true"), spec.getRequires());
        assertEquals(List.of("result >= a", "result >= b"), spec.getEnsures());
        assertEquals("true", spec.toSpecification().getRequires());
        assertEquals("result >= a /\\ result >= b", spec.toSpecification().getEnsures());
    }

    @Test
    void wrapsSingleClause() throws Exception {
        GeneratedSpecification spec = parser.parseSpecification("{\"requires\": \"n >= 0\", \"ensures\": null}");
        assertEquals(List.of("n >= 0"), spec.getRequires());
        assertEquals(List.of("true"), spec.getEnsures());
        assertSchemaInvalid(() -> parser.parseSpecification("{\"requires\": 5}"));
    }

    private static void assertSchemaInvalid(Executable call) {
        OracleException e = assertThrows(OracleException.class, call);
        assertEquals(OracleException.Kind.SCHEMA_INVALID, e.getKind());
    }
}
