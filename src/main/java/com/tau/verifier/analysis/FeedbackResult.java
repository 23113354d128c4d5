package com.tau.verifier.analysis;

import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.FeedbackRound;
import com.tau.verifier.model.LoopContract;
import com.tau.verifier.processor.TranspileResult;
import com.tau.verifier.prover.ProverResult;

import java.util.List;

/**
 * Outcome of the feedback loop: every round's record plus the artifacts of the last translated round.
 */
public class FeedbackResult {

    private final List<FeedbackRound> rounds;
    private final boolean verified;
    private final TranspileResult lastTranspile;

    public FeedbackResult(List<FeedbackRound> rounds, boolean verified, TranspileResult lastTranspile) {
        this.rounds = List.copyOf(rounds);
        this.verified = verified;
        this.lastTranspile = lastTranspile;
    }

    public List<FeedbackRound> getRounds() {
        return rounds;
    }

    public boolean isVerified() {
        return verified;
    }

    public FeedbackRound getFinalRound() {
        return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
    }

    /**
     * Artifacts of the last round that translated successfully, or null if none did.
     */
    public TranspileResult getLastTranspile() {
        return lastTranspile;
    }

    /**
     * The contract used by the final round.
     */
    public LoopContract getFinalContract() {
        FeedbackRound last = getFinalRound();
        return last != null ? last.getContract() : null;
    }

    /**
     * The bug analysis that stopped the loop, or null.
     */
    public BugAnalysis getDetectedBug() {
        for (FeedbackRound round : rounds) {
            if (round.isBugDetected()) {
                return round.getBugAnalysis();
            }
        }
        return null;
    }

    /**
     * The translation error that ended the loop, or null.
     */
    public String getError() {
        FeedbackRound last = getFinalRound();
        return last != null ? last.getError() : null;
    }

    /**
     * The prover outcome that ended the loop without a verdict, or null.
     */
    public ProverResult.Outcome getEnvironmentFailure() {
        FeedbackRound last = getFinalRound();
        return last != null && last.isEnvironmentFailure() ? last.getOutcome() : null;
    }
}
