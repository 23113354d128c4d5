package com.tau.verifier.analysis;

import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;
import com.tau.verifier.oracle.AnthropicContractOracle;
import com.tau.verifier.oracle.ContractOracle;
import com.tau.verifier.oracle.HeuristicContractOracle;
import com.tau.verifier.oracle.OracleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Chooses between the live oracle and the heuristic fallback for each request.
 *
 * Oracle failures never escape: a failed proposal falls back to the heuristic, a
 * failed refinement keeps the current contract and a failed classification yields
 * no verdict.
 */
public class ContractProposer {

    private static final Logger logger = LoggerFactory.getLogger(ContractProposer.class);

    private final ContractOracle live;
    private final ContractOracle fallback;

    /**
     * @param live The live oracle, or null when none is configured
     * @param fallback The deterministic oracle used when the live one cannot answer
     */
    public ContractProposer(ContractOracle live, ContractOracle fallback) {
        this.live = live;
        this.fallback = fallback;
    }

    /**
     * Uses the Anthropic oracle when an API key is configured, the heuristic otherwise.
     */
    public static ContractProposer create(VerifierConfig config) {
        ContractOracle live = config.hasApiKey() ? new AnthropicContractOracle(config) : null;
        if (live == null) {
            logger.info("No oracle API key configured, using loop heuristics only");
        }
        return new ContractProposer(live, new HeuristicContractOracle());
    }

    public boolean isOracleAvailable() {
        return live != null;
    }

    /**
     * Proposes an initial loop contract; never null.
     */
    public LoopContract propose(AnnotatedFunction function) {
        if (live != null) {
            try {
                Optional<LoopContract> proposed = live.proposeContract(function);
                if (proposed.isPresent()) {
                    return proposed.get();
                }
            } catch (OracleException e) {
                logger.warn("Oracle proposal failed for {} ({}), using heuristic: {}",
                        function.getName(), e.getKind(), e.getMessage());
            }
        }
        try {
            return fallback.proposeContract(function).orElse(LoopContract.trivial());
        } catch (OracleException e) {
            logger.warn("Fallback proposal failed for {}: {}", function.getName(), e.getMessage());
            return LoopContract.trivial();
        }
    }

    /**
     * Asks for a revised contract, keeping {@code current} when no better one is available.
     */
    public LoopContract refine(AnnotatedFunction function, LoopContract current, String proverOutput) {
        if (live == null) {
            logger.debug("No oracle available, keeping current contract for {}", function.getName());
            return current;
        }
        try {
            return live.refineContract(function, current, proverOutput).orElse(current);
        } catch (OracleException e) {
            logger.warn("Oracle refinement failed for {} ({}), keeping current contract: {}",
                    function.getName(), e.getKind(), e.getMessage());
            return current;
        }
    }

    /**
     * Asks whether a failed proof points at a real defect. Empty when no verdict could be obtained.
     */
    public Optional<BugAnalysis> classify(AnnotatedFunction function, String proverOutput) {
        if (live == null) {
            return Optional.empty();
        }
        try {
            return live.classifyBug(function, proverOutput);
        } catch (OracleException e) {
            logger.warn("Bug classification failed for {}: {}", function.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Asks for requires/ensures clauses. Empty when no suggestion could be obtained.
     */
    public Optional<GeneratedSpecification> suggestSpecification(AnnotatedFunction function) {
        List<ContractOracle> oracles = live != null ? List.of(live, fallback) : List.of(fallback);
        for (ContractOracle oracle : oracles) {
            try {
                Optional<GeneratedSpecification> suggestion = oracle.suggestSpecification(function);
                if (suggestion.isPresent()) {
                    return suggestion;
                }
            } catch (OracleException e) {
                logger.warn("Specification suggestion failed for {}: {}", function.getName(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
