package com.tau.verifier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Proof obligations for the single loop of a function: ordered invariants
 * and an optional termination variant.
 */
public final class LoopContract {

    private final List<String> invariants;
    private final String variant;

    @JsonCreator
    public LoopContract(@JsonProperty("invariants") List<String> invariants,
                        @JsonProperty("variant") String variant) {
        this.invariants = invariants == null ? Collections.emptyList() : List.copyOf(invariants);
        this.variant = variant == null || variant.isBlank() ? null : variant;
    }

    /**
     * The contract used when nothing better is known.
     */
    public static LoopContract trivial() {
        return new LoopContract(List.of("true"), "0");
    }

    public List<String> getInvariants() {
        return invariants;
    }

    public String getVariant() {
        return variant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LoopContract)) return false;
        LoopContract that = (LoopContract) o;
        return invariants.equals(that.invariants) && Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invariants, variant);
    }

    @Override
    public String toString() {
        return "invariants=" + invariants + ", variant=" + variant;
    }
}
