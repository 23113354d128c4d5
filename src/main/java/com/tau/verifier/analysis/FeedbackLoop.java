package com.tau.verifier.analysis;

import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.ExternalFunctionContract;
import com.tau.verifier.model.FeedbackRound;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.model.LoopContract;
import com.tau.verifier.processor.TranspileResult;
import com.tau.verifier.processor.Transpiler;
import com.tau.verifier.prover.Prover;
import com.tau.verifier.prover.ProverResult;
import com.tau.verifier.visitor.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bounded propose/prove/refine loop for one function.
 *
 * Each round translates the function with the current loop contract under the name
 * {@code <function>_roundNN} and runs the prover. The loop stops at the first proof,
 * at the first detected bug, after a translation error, when the prover is unavailable or
 * times out, or after {@code maxRounds} rounds.
 */
public class FeedbackLoop {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackLoop.class);

    private final Transpiler transpiler;
    private final Prover prover;
    private final ContractProposer proposer;
    private final int maxRounds;
    private final boolean classifyEveryRound;

    /**
     * @param maxRounds Upper bound on rounds; at least 1
     * @param classifyEveryRound Whether to classify every failed round instead of only the first
     */
    public FeedbackLoop(Transpiler transpiler, Prover prover, ContractProposer proposer,
                        int maxRounds, boolean classifyEveryRound) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1, was " + maxRounds);
        }
        this.transpiler = transpiler;
        this.prover = prover;
        this.proposer = proposer;
        this.maxRounds = maxRounds;
        this.classifyEveryRound = classifyEveryRound;
    }

    /**
     * Runs the loop.
     *
     * @param function The function to verify; its source must define a method of the same name
     * @param externals External contracts for called functions; may be null
     * @return Every round's record and the final verdict
     */
    public FeedbackResult run(AnnotatedFunction function, Map<String, ExternalFunctionContract> externals) {
        String name = function.getName();
        FunctionSpecification specification = function.getSpecification();

        LoopContract contract;
        if (specification.hasCompleteLoopContract()) {
            contract = specification.getLoopContract();
        } else {
            logger.info("Proposing initial loop contract for {}", name);
            contract = proposer.propose(function);
        }

        List<FeedbackRound> rounds = new ArrayList<>();
        TranspileResult lastTranspile = null;
        boolean verified = false;
        boolean classified = false;

        for (int round = 1; round <= maxRounds; round++) {
            logger.info("Round {}/{} for {} with {}", round, maxRounds, name, contract);
            String baseName = String.format("%s_round%02d", name, round);

            TranspileResult transpiled;
            try {
                transpiled = transpiler.transpile(function.getSource(),
                        Map.of(name, specification.withLoopContract(contract)), externals, null, baseName);
            } catch (TranslationException | IllegalArgumentException | IOException e) {
                // Rerunning with another contract cannot fix the translation
                logger.error("Round {} for {} could not be translated: {}", round, name, e.getMessage());
                rounds.add(new FeedbackRound(round, contract, null, null, null, null, e.getMessage()));
                break;
            }
            lastTranspile = transpiled;

            ProverResult proof = prover.prove(transpiled.getModuleFile());
            if (proof.isProved()) {
                verified = true;
                rounds.add(new FeedbackRound(round, contract, transpiled.getModuleFile(),
                        transpiled.getSkeletonFile(), proof, null, null));
                logger.info("Proof of {} succeeded in round {}", name, round);
                break;
            }
            if (proof.getOutcome() != ProverResult.Outcome.NOT_PROVED) {
                // without a verdict there is nothing to classify or refine
                logger.error("Prover gave no verdict for {} in round {}: {}", name, round, proof.getOutcome());
                rounds.add(new FeedbackRound(round, contract, transpiled.getModuleFile(),
                        transpiled.getSkeletonFile(), proof, null, null));
                break;
            }
            logger.info("Proof of {} failed in round {}", name, round);

            BugAnalysis bug = null;
            if (!classified || classifyEveryRound) {
                classified = true;
                bug = proposer.classify(function, proof.getOutput()).orElse(null);
            }
            rounds.add(new FeedbackRound(round, contract, transpiled.getModuleFile(),
                    transpiled.getSkeletonFile(), proof, bug, null));

            if (bug != null && bug.isBugDetected()) {
                logger.warn("Bug detected in {}: {} - {}", name, bug.getBugType(), bug.getExplanation());
                break;
            }

            if (round < maxRounds) {
                contract = proposer.refine(function, contract, proof.getOutput());
            }
        }

        return new FeedbackResult(rounds, verified, lastTranspile);
    }

    public int getMaxRounds() {
        return maxRounds;
    }
}
