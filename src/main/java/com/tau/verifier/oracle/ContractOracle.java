package com.tau.verifier.oracle;

import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;

import java.util.Optional;

/**
 * Source of loop contracts, bug verdicts and specification suggestions.
 *
 * An empty result means the oracle has no answer for the request; an
 * {@link OracleException} means it tried and failed.
 */
public interface ContractOracle {

    /**
     * Proposes invariants and a variant for the function's loop.
     */
    Optional<LoopContract> proposeContract(AnnotatedFunction function) throws OracleException;

    /**
     * Proposes a revised contract after a failed proof.
     *
     * @param current The contract the failed round used
     * @param proverOutput Raw prover output of the failed round
     */
    Optional<LoopContract> refineContract(AnnotatedFunction function, LoopContract current, String proverOutput)
            throws OracleException;

    /**
     * Decides whether a failed proof reflects a defect in the code rather than weak invariants.
     */
    Optional<BugAnalysis> classifyBug(AnnotatedFunction function, String proverOutput) throws OracleException;

    /**
     * Suggests requires and ensures clauses for a function that declares none.
     */
    Optional<GeneratedSpecification> suggestSpecification(AnnotatedFunction function) throws OracleException;
}
