package com.tau.verifier.oracle;

import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.LoopContract;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicContractOracleTest {

    private final HeuristicContractOracle oracle = new HeuristicContractOracle();

    private LoopContract propose(String name, String source) throws OracleException {
        return oracle.proposeContract(new AnnotatedFunction(name, source, null)).orElseThrow();
    }

    @Test
    void boundsStrictCountingLoop() throws Exception {
        LoopContract contract = propose("countTo",
                "int countTo(int n) { int i = 0; while (i < n) { i = i + 1; } return i; }");
        assertEquals(List.of("0 <= !i <= n"), contract.getInvariants());
        assertEquals("n - !i", contract.getVariant());
    }

    @Test
    void boundsInclusiveCountingLoop() throws Exception {
        LoopContract contract = propose("countTo",
                "int countTo(int n) { int i = 0; while (i <= n) { i = i + 1; } return i; }");
        assertEquals(List.of("0 <= !i <= n + 1"), contract.getInvariants());
        assertEquals("n - !i", contract.getVariant());
    }

    @Test
    void usesLiteralStartAsLowerBound() throws Exception {
        LoopContract contract = propose("fromOne",
                "int fromOne(int n) { int i = 1; while (i < 10) { i = i + 1; } return i; }");
        assertEquals(List.of("1 <= !i <= 10"), contract.getInvariants());
        assertEquals("10 - !i", contract.getVariant());
    }

    @Test
    void relatesPairedCounters() throws Exception {
        LoopContract contract = propose("steps",
                "int steps(int n) { int i = 0; int s = 0; while (i < n) { s = s + 1; i = i + 1; } return s; }");
        assertEquals(List.of("0 <= !i <= n", "!s = !i"), contract.getInvariants());
    }

    @Test
    void ignoresCountersWithDifferentStart() throws Exception {
        LoopContract contract = propose("steps",
                "int steps(int n) { int i = 0; int s = 5; while (i < n) { s = s + 1; i = i + 1; } return s; }");
        assertEquals(List.of("0 <= !i <= n"), contract.getInvariants());
    }

    @Test
    void fallsBackToTrivialContract() throws Exception {
        assertEquals(LoopContract.trivial(), propose("f", "int f(int x) { return x; }"));
        assertEquals(LoopContract.trivial(),
                propose("g", "int g(int n) { int i = 0; while (i != n) { i = i + 1; } return i; }"));
        assertEquals(LoopContract.trivial(), propose("h", "int h(int n) { while ( }"));
    }

    @Test
    void neverAnswersOtherRequests() throws Exception {
        AnnotatedFunction function = new AnnotatedFunction("f", "int f(int x) { return x; }", null);
        assertTrue(oracle.refineContract(function, LoopContract.trivial(), "").isEmpty());
        assertTrue(oracle.classifyBug(function, "").isEmpty());
        assertTrue(oracle.suggestSpecification(function).isEmpty());
    }
}
