package com.tau.verifier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre- and postconditions suggested by the oracle for a function marked for automatic specification.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeneratedSpecification {

    private List<String> requires = new ArrayList<>();
    private List<String> ensures = new ArrayList<>();
    private String reasoning;
    private double confidence;
    private List<String> suggestedInvariants = new ArrayList<>();
    private String suggestedVariant;

    public List<String> getRequires() {
        return requires;
    }

    public void setRequires(List<String> requires) {
        this.requires = requires;
    }

    public List<String> getEnsures() {
        return ensures;
    }

    public void setEnsures(List<String> ensures) {
        this.ensures = ensures;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public List<String> getSuggestedInvariants() {
        return suggestedInvariants;
    }

    public void setSuggestedInvariants(List<String> suggestedInvariants) {
        this.suggestedInvariants = suggestedInvariants;
    }

    public String getSuggestedVariant() {
        return suggestedVariant;
    }

    public void setSuggestedVariant(String suggestedVariant) {
        this.suggestedVariant = suggestedVariant;
    }

    /**
     * Joins the suggested clauses into a specification, conjoining multiple clauses with {@code /\}.
     */
    public FunctionSpecification toSpecification() {
        return new FunctionSpecification(String.join(" /\\ ", requires), String.join(" /\\ ", ensures));
    }
}
