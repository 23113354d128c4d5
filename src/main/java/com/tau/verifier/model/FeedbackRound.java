package com.tau.verifier.model;

import com.tau.verifier.prover.ProverResult;

import java.nio.file.Path;

/**
 * Evidence of one round of the verification loop.
 */
public class FeedbackRound {

    private final int round;
    private final LoopContract contract;
    private final Path moduleFile;
    private final Path skeletonFile;
    private final String proverOutput;
    private final ProverResult.Outcome outcome;
    private final boolean verified;
    private final BugAnalysis bugAnalysis;
    private final String error;

    public FeedbackRound(int round, LoopContract contract, Path moduleFile, Path skeletonFile,
                         ProverResult proof, BugAnalysis bugAnalysis, String error) {
        this.round = round;
        this.contract = contract;
        this.moduleFile = moduleFile;
        this.skeletonFile = skeletonFile;
        this.proverOutput = proof != null ? proof.getOutput() : "";
        this.outcome = proof != null ? proof.getOutcome() : null;
        this.verified = proof != null && proof.isProved();
        this.bugAnalysis = bugAnalysis;
        this.error = error;
    }

    public int getRound() {
        return round;
    }

    /**
     * The loop contract the round was translated with.
     */
    public LoopContract getContract() {
        return contract;
    }

    public Path getModuleFile() {
        return moduleFile;
    }

    public Path getSkeletonFile() {
        return skeletonFile;
    }

    public String getProverOutput() {
        return proverOutput;
    }

    /**
     * @return the prover outcome, or null when the round never reached the prover
     */
    public ProverResult.Outcome getOutcome() {
        return outcome;
    }

    /**
     * Whether the prover could not give a verdict: it was missing or was killed at its time limit.
     */
    public boolean isEnvironmentFailure() {
        return outcome == ProverResult.Outcome.UNAVAILABLE || outcome == ProverResult.Outcome.TIMEOUT;
    }

    public boolean isVerified() {
        return verified;
    }

    /**
     * @return the bug analysis, or null when classification did not run in this round
     */
    public BugAnalysis getBugAnalysis() {
        return bugAnalysis;
    }

    public boolean isBugDetected() {
        return bugAnalysis != null && bugAnalysis.isBugDetected();
    }

    /**
     * @return a translation error that ended the loop, or null
     */
    public String getError() {
        return error;
    }
}
