package com.tau.verifier.processor;

import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.FunctionSpecification;

/**
 * Per-function outcome of a verification request.
 */
public class VerificationResult {

    private final String functionName;
    private final int lineNumber;
    private final String source;
    private boolean verified;
    private String reason = "";
    private boolean usedOracle;
    private boolean cached;
    private int rounds;
    private BugAnalysis bugAnalysis;
    private FunctionSpecification specification;
    private String whymlFile;
    private String leanFile;
    private String hash;
    private double durationSeconds;

    public VerificationResult(String functionName, int lineNumber, String source) {
        this.functionName = functionName;
        this.lineNumber = lineNumber;
        this.source = source;
    }

    public String getFunctionName() {
        return functionName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getSource() {
        return source;
    }

    public boolean isVerified() {
        return verified;
    }

    public void setVerified(boolean verified) {
        this.verified = verified;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    /**
     * Whether loop contracts were discovered through the feedback loop rather than supplied.
     */
    public boolean isUsedOracle() {
        return usedOracle;
    }

    public void setUsedOracle(boolean usedOracle) {
        this.usedOracle = usedOracle;
    }

    /**
     * Whether the outcome was served from the proof cache.
     */
    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    public int getRounds() {
        return rounds;
    }

    public void setRounds(int rounds) {
        this.rounds = rounds;
    }

    public BugAnalysis getBugAnalysis() {
        return bugAnalysis;
    }

    public void setBugAnalysis(BugAnalysis bugAnalysis) {
        this.bugAnalysis = bugAnalysis;
    }

    public boolean isBugDetected() {
        return bugAnalysis != null && bugAnalysis.isBugDetected();
    }

    /**
     * The specification the outcome refers to, including any discovered loop contract.
     */
    public FunctionSpecification getSpecification() {
        return specification;
    }

    public void setSpecification(FunctionSpecification specification) {
        this.specification = specification;
    }

    public String getWhymlFile() {
        return whymlFile;
    }

    public void setWhymlFile(String whymlFile) {
        this.whymlFile = whymlFile;
    }

    public String getLeanFile() {
        return leanFile;
    }

    public void setLeanFile(String leanFile) {
        this.leanFile = leanFile;
    }

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    @Override
    public String toString() {
        return (verified ? "PASS " : "FAIL ") + functionName + ":" + lineNumber + " - " + reason;
    }
}
