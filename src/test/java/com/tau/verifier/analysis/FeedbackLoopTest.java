package com.tau.verifier.analysis;

import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.FeedbackRound;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.model.LoopContract;
import com.tau.verifier.oracle.HeuristicContractOracle;
import com.tau.verifier.processor.Transpiler;
import com.tau.verifier.prover.ProverResult;
import com.tau.verifier.testing.ScriptedOracle;
import com.tau.verifier.testing.ScriptedProver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackLoopTest {

    static final String COUNT_TO =
            "int countTo(int n) { int i = 0; while (i < n) { i = i + 1; } return i; }";
    static final String COUNT_PAST_N =
            "int countTo(int n) { int c = 0; int i = 0; while (i <= n) { c = c + 1; i = i + 1; } return c; }";
    static final LoopContract GOOD = new LoopContract(List.of("0 <= !i <= n"), "n - !i");

    @TempDir
    Path outputDir;

    private Transpiler transpiler;
    private AnnotatedFunction countTo;

    @BeforeEach
    void setUp() {
        transpiler = new Transpiler(outputDir);
        countTo = new AnnotatedFunction("countTo", COUNT_TO, new FunctionSpecification("n >= 0", "result = n"));
    }

    private FeedbackLoop loop(ScriptedProver prover, ScriptedOracle live, int maxRounds, boolean classifyEveryRound) {
        return new FeedbackLoop(transpiler, prover, new ContractProposer(live, new HeuristicContractOracle()),
                maxRounds, classifyEveryRound);
    }

    @Test
    void stopsAfterMaxRounds() {
        ScriptedProver prover = ScriptedProver.always(false);
        ScriptedOracle oracle = new ScriptedOracle().propose(LoopContract.trivial());

        FeedbackResult result = loop(prover, oracle, 3, false).run(countTo, null);

        assertFalse(result.isVerified());
        assertEquals(3, result.getRounds().size());
        assertEquals(3, prover.getCalls());
        assertEquals(2, oracle.getRefineCalls());
        assertEquals(1, oracle.getClassifyCalls());
        assertTrue(Files.exists(outputDir.resolve("countTo_round01.mlw")));
        assertTrue(Files.exists(outputDir.resolve("countTo_round03.lean")));
        assertNull(result.getDetectedBug());
        assertNull(result.getError());
    }

    @Test
    void classifiesEveryRoundWhenConfigured() {
        ScriptedOracle oracle = new ScriptedOracle().propose(LoopContract.trivial());
        loop(ScriptedProver.always(false), oracle, 3, true).run(countTo, null);
        assertEquals(3, oracle.getClassifyCalls());
    }

    @Test
    void haltsOnDetectedBug() {
        ScriptedProver prover = ScriptedProver.always(false);
        ScriptedOracle oracle = new ScriptedOracle()
                .propose(LoopContract.trivial())
                .classifyAs(new BugAnalysis(true, "off-by-one", "returns n + 1"));

        FeedbackResult result = loop(prover, oracle, 3, false).run(countTo, null);

        assertFalse(result.isVerified());
        assertEquals(1, result.getRounds().size());
        assertEquals(1, prover.getCalls());
        assertEquals(0, oracle.getRefineCalls());
        assertEquals("returns n + 1", result.getDetectedBug().getExplanation());
    }

    @Test
    void haltsWhenLoopRunsOnePastBound() {
        // returns n + 1, so no contract can establish result = n
        AnnotatedFunction buggy = new AnnotatedFunction("countTo", COUNT_PAST_N,
                new FunctionSpecification("n >= 0", "result = n"));
        ScriptedProver prover = ScriptedProver.always(false);
        ScriptedOracle oracle = new ScriptedOracle()
                .classifyAs(new BugAnalysis(true, "off-by-one", "loop runs while i <= n and returns n + 1"));

        FeedbackResult result = loop(prover, oracle, 3, false).run(buggy, null);

        assertFalse(result.isVerified());
        assertEquals(1, result.getRounds().size());
        assertEquals(0, oracle.getRefineCalls());
        assertEquals("off-by-one", result.getDetectedBug().getBugType());
        String module = prover.getSources().get(0);
        assertTrue(module.contains("while (!i <= n) do"));
        assertTrue(module.contains("invariant { 0 <= !i <= n + 1 }"));
    }

    @Test
    void unavailableProverEndsLoopWithoutClassifying() {
        ScriptedProver prover = ScriptedProver.withoutVerdict(ProverResult.Outcome.UNAVAILABLE);
        ScriptedOracle oracle = new ScriptedOracle()
                .propose(LoopContract.trivial())
                .classifyAs(new BugAnalysis(true, "off-by-one", "returns n + 1"));

        FeedbackResult result = loop(prover, oracle, 3, false).run(countTo, null);

        assertFalse(result.isVerified());
        assertEquals(1, result.getRounds().size());
        assertEquals(0, oracle.getClassifyCalls());
        assertEquals(0, oracle.getRefineCalls());
        assertNull(result.getDetectedBug());
        assertEquals(ProverResult.Outcome.UNAVAILABLE, result.getEnvironmentFailure());
        assertEquals(ProverResult.Outcome.UNAVAILABLE, result.getFinalRound().getOutcome());
    }

    @Test
    void succeedsAfterRefinement() {
        ScriptedProver prover = new ScriptedProver(source -> source.contains("variant { n - !i }"));
        ScriptedOracle oracle = new ScriptedOracle()
                .propose(LoopContract.trivial())
                .refine(GOOD)
                .classifyAs(new BugAnalysis(false, null, "invariants too weak"));

        FeedbackResult result = loop(prover, oracle, 3, false).run(countTo, null);

        assertTrue(result.isVerified());
        assertEquals(2, result.getRounds().size());
        FeedbackRound first = result.getRounds().get(0);
        assertEquals(LoopContract.trivial(), first.getContract());
        assertFalse(first.isVerified());
        assertFalse(first.isBugDetected());
        assertEquals(GOOD, result.getFinalContract());
        assertTrue(result.getFinalRound().isVerified());
        assertEquals(outputDir.resolve("countTo_round02.mlw"), result.getLastTranspile().getModuleFile());
    }

    @Test
    void usesDeclaredCompleteContractWithoutProposing() {
        ScriptedOracle oracle = new ScriptedOracle();
        AnnotatedFunction declared = countTo.withSpecification(countTo.getSpecification().withLoopContract(GOOD));

        FeedbackResult result = loop(ScriptedProver.always(true), oracle, 3, false).run(declared, null);

        assertTrue(result.isVerified());
        assertEquals(0, oracle.getProposeCalls());
        assertEquals(GOOD, result.getFinalContract());
    }

    @Test
    void fallsBackToHeuristicWithoutLiveOracle() {
        ScriptedProver prover = new ScriptedProver(source -> source.contains("invariant { 0 <= !i <= n }"));
        FeedbackLoop loop = new FeedbackLoop(transpiler, prover,
                new ContractProposer(null, new HeuristicContractOracle()), 3, false);

        FeedbackResult result = loop.run(countTo, null);

        assertTrue(result.isVerified());
        assertEquals(1, result.getRounds().size());
    }

    @Test
    void translationErrorEndsLoop() {
        ScriptedProver prover = ScriptedProver.always(true);
        AnnotatedFunction broken = new AnnotatedFunction("f",
                "int f(int x) { if (x > 0) { x = 0; } return x; }", null);

        FeedbackResult result = loop(prover, new ScriptedOracle(), 3, false).run(broken, null);

        assertFalse(result.isVerified());
        assertEquals(1, result.getRounds().size());
        assertEquals(0, prover.getCalls());
        assertNotNull(result.getError());
        assertNull(result.getLastTranspile());
    }

    @Test
    void rejectsNonPositiveRoundLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> loop(ScriptedProver.always(true), new ScriptedOracle(), 0, false));
    }
}
