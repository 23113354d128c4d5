package com.tau.verifier.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results of verifying every marked method of one source file.
 */
public class VerificationSummary {

    private final String sourceFile;
    private final List<VerificationResult> results = new ArrayList<>();

    public VerificationSummary(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    public void addResult(VerificationResult result) {
        results.add(result);
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public List<VerificationResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public int getTotal() {
        return results.size();
    }

    public int getPassed() {
        return (int) results.stream().filter(VerificationResult::isVerified).count();
    }

    public int getFailed() {
        return getTotal() - getPassed();
    }

    public int getBugsDetected() {
        return (int) results.stream().filter(VerificationResult::isBugDetected).count();
    }

    /**
     * Fraction of functions verified, 0 when there are none.
     */
    public double getSuccessRate() {
        return results.isEmpty() ? 0.0 : (double) getPassed() / getTotal();
    }

    public boolean isAllVerified() {
        return getFailed() == 0;
    }
}
