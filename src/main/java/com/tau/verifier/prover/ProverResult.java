package com.tau.verifier.prover;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Outcome of one prover run together with its raw output.
 */
public final class ProverResult {

    public enum Outcome {
        PROVED,
        NOT_PROVED,
        /** The prover process could not be started. */
        UNAVAILABLE,
        /** The prover exceeded its wall-clock limit and was killed. */
        TIMEOUT
    }

    static final String SUCCESS_TOKEN = "Valid";
    private static final Pattern VERDICT = Pattern.compile("Prover result is:\\s*(\\w+)");

    private final Outcome outcome;
    private final String output;

    public ProverResult(Outcome outcome, String output) {
        this.outcome = outcome;
        this.output = output == null ? "" : output;
    }

    /**
     * Classifies the output of a prover run that finished on its own.
     */
    public static ProverResult fromOutput(String output) {
        return new ProverResult(isProved(output) ? Outcome.PROVED : Outcome.NOT_PROVED, output);
    }

    /**
     * Whether every goal in the output was reported valid.
     *
     * Requires the success token and at least one {@code Prover result is: Valid} line,
     * and rejects the output if any goal reports a different verdict.
     */
    public static boolean isProved(String output) {
        if (output == null || !output.contains(SUCCESS_TOKEN)) {
            return false;
        }
        Matcher matcher = VERDICT.matcher(output);
        boolean anyValid = false;
        while (matcher.find()) {
            if (!SUCCESS_TOKEN.equals(matcher.group(1))) {
                return false;
            }
            anyValid = true;
        }
        return anyValid;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getOutput() {
        return output;
    }

    public boolean isProved() {
        return outcome == Outcome.PROVED;
    }

    @Override
    public String toString() {
        return outcome.name();
    }
}
