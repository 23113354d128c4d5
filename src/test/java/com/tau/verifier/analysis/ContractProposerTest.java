package com.tau.verifier.analysis;

import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;
import com.tau.verifier.oracle.HeuristicContractOracle;
import com.tau.verifier.testing.ScriptedOracle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContractProposerTest {

    private final AnnotatedFunction countTo = new AnnotatedFunction("countTo",
            "int countTo(int n) { int i = 0; while (i < n) { i = i + 1; } return i; }", null);
    private final LoopContract oracleContract = new LoopContract(List.of("!i >= 0"), "n - !i");

    @Test
    void prefersLiveOracle() {
        ContractProposer proposer = new ContractProposer(new ScriptedOracle().propose(oracleContract),
                new HeuristicContractOracle());
        assertEquals(oracleContract, proposer.propose(countTo));
        assertTrue(proposer.isOracleAvailable());
    }

    @Test
    void fallsBackToHeuristicWhenOracleFails() {
        ContractProposer proposer = new ContractProposer(new ScriptedOracle().failing(), new HeuristicContractOracle());
        assertEquals(List.of("0 <= !i <= n"), proposer.propose(countTo).getInvariants());
    }

    @Test
    void fallsBackToTrivialWhenNothingAnswers() {
        ContractProposer proposer = new ContractProposer(null, new ScriptedOracle());
        assertEquals(LoopContract.trivial(), proposer.propose(countTo));
        assertFalse(proposer.isOracleAvailable());
    }

    @Test
    void refinementKeepsCurrentContractOnFailure() {
        LoopContract current = LoopContract.trivial();
        assertSame(current, new ContractProposer(null, new HeuristicContractOracle()).refine(countTo, current, ""));
        assertSame(current, new ContractProposer(new ScriptedOracle().failing(), new HeuristicContractOracle())
                .refine(countTo, current, ""));
        assertSame(current, new ContractProposer(new ScriptedOracle(), new HeuristicContractOracle())
                .refine(countTo, current, ""));
        assertEquals(oracleContract, new ContractProposer(new ScriptedOracle().refine(oracleContract),
                new HeuristicContractOracle()).refine(countTo, current, ""));
    }

    @Test
    void classificationNeedsLiveOracle() {
        BugAnalysis bug = new BugAnalysis(true, "overflow", "wraps");
        assertTrue(new ContractProposer(null, new HeuristicContractOracle()).classify(countTo, "").isEmpty());
        assertTrue(new ContractProposer(new ScriptedOracle().failing(), new HeuristicContractOracle())
                .classify(countTo, "").isEmpty());
        assertSame(bug, new ContractProposer(new ScriptedOracle().classifyAs(bug), new HeuristicContractOracle())
                .classify(countTo, "").orElseThrow());
    }

    @Test
    void suggestionTriesEachOracleInTurn() {
        GeneratedSpecification suggestion = new GeneratedSpecification();
        suggestion.setEnsures(List.of("result = n"));
        ScriptedOracle fallback = new ScriptedOracle().suggest(suggestion);

        ContractProposer proposer = new ContractProposer(new ScriptedOracle().failing(), fallback);

        assertSame(suggestion, proposer.suggestSpecification(countTo).orElseThrow());
        assertEquals(1, fallback.getSuggestCalls());
        assertTrue(new ContractProposer(null, new HeuristicContractOracle()).suggestSpecification(countTo).isEmpty());
    }

    @Test
    void createUsesHeuristicsWithoutApiKey() {
        assertFalse(ContractProposer.create(new VerifierConfig()).isOracleAvailable());
        assertTrue(ContractProposer.create(new VerifierConfig().setApiKey("k")).isOracleAvailable());
    }
}
