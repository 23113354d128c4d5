package com.tau.verifier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * The oracle's verdict on whether a failed proof reflects a real defect in the code
 * or only invariants that are too weak.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BugAnalysis {

    private boolean bugDetected;
    private String bugType;
    private String explanation;
    private String actualBehavior;
    private String expectedBehavior;
    private String analysis;
    private double confidence;

    public BugAnalysis() {
    }

    public BugAnalysis(boolean bugDetected, String bugType, String explanation) {
        this.bugDetected = bugDetected;
        this.bugType = bugType;
        this.explanation = explanation;
    }

    public boolean isBugDetected() {
        return bugDetected;
    }

    public void setBugDetected(boolean bugDetected) {
        this.bugDetected = bugDetected;
    }

    public String getBugType() {
        return bugType;
    }

    public void setBugType(String bugType) {
        this.bugType = bugType;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    public String getActualBehavior() {
        return actualBehavior;
    }

    public void setActualBehavior(String actualBehavior) {
        this.actualBehavior = actualBehavior;
    }

    public String getExpectedBehavior() {
        return expectedBehavior;
    }

    public void setExpectedBehavior(String expectedBehavior) {
        this.expectedBehavior = expectedBehavior;
    }

    public String getAnalysis() {
        return analysis;
    }

    public void setAnalysis(String analysis) {
        this.analysis = analysis;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }
}
