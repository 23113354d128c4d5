package com.tau.verifier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The verification metadata attached to one function: its pre- and postcondition
 * and, optionally, the loop invariants and variant for its single loop.
 * Expressions are WhyML text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FunctionSpecification {

    public static final String TRIVIAL = "true";

    private String requires = TRIVIAL;
    private String ensures = TRIVIAL;
    private List<String> invariants = new ArrayList<>();
    private String variant;

    public FunctionSpecification() {
    }

    public FunctionSpecification(String requires, String ensures) {
        this(requires, ensures, null, null);
    }

    public FunctionSpecification(String requires, String ensures, List<String> invariants, String variant) {
        setRequires(requires);
        setEnsures(ensures);
        setInvariants(invariants);
        this.variant = variant;
    }

    public String getRequires() {
        return requires;
    }

    public void setRequires(String requires) {
        this.requires = requires == null || requires.isBlank() ? TRIVIAL : requires;
    }

    public String getEnsures() {
        return ensures;
    }

    public void setEnsures(String ensures) {
        this.ensures = ensures == null || ensures.isBlank() ? TRIVIAL : ensures;
    }

    public List<String> getInvariants() {
        return invariants;
    }

    public void setInvariants(List<String> invariants) {
        this.invariants = invariants == null ? new ArrayList<>() : new ArrayList<>(invariants);
    }

    public void addInvariant(String invariant) {
        this.invariants.add(invariant);
    }

    public String getVariant() {
        return variant;
    }

    public void setVariant(String variant) {
        this.variant = variant;
    }

    /**
     * Whether the caller supplied any part of a loop contract.
     */
    @JsonIgnore
    public boolean hasLoopContract() {
        return !invariants.isEmpty() || (variant != null && !variant.isBlank());
    }

    /**
     * Whether both invariants and a variant are present.
     */
    @JsonIgnore
    public boolean hasCompleteLoopContract() {
        return !invariants.isEmpty() && variant != null && !variant.isBlank();
    }

    /**
     * Gets the loop contract, or null when neither invariants nor a variant are given.
     */
    @JsonIgnore
    public LoopContract getLoopContract() {
        if (!hasLoopContract()) {
            return null;
        }
        return new LoopContract(invariants, variant);
    }

    /**
     * Returns a copy with the invariants and variant replaced by the given contract.
     */
    public FunctionSpecification withLoopContract(LoopContract contract) {
        if (contract == null) {
            return new FunctionSpecification(requires, ensures);
        }
        return new FunctionSpecification(requires, ensures, contract.getInvariants(), contract.getVariant());
    }

    public FunctionSpecification copy() {
        return new FunctionSpecification(requires, ensures, invariants, variant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSpecification)) return false;
        FunctionSpecification that = (FunctionSpecification) o;
        return requires.equals(that.requires) && ensures.equals(that.ensures)
                && invariants.equals(that.invariants) && Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requires, ensures, invariants, variant);
    }

    @Override
    public String toString() {
        return "requires { " + requires + " } ensures { " + ensures + " } invariants " + invariants
                + (variant != null ? " variant { " + variant + " }" : "");
    }
}
