package com.tau.verifier.model;

import java.util.Objects;

/**
 * A named, WhyML-typed parameter.
 */
public final class FunctionParameter {

    private final String name;
    private final String type;

    public FunctionParameter(String name, String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionParameter)) return false;
        FunctionParameter that = (FunctionParameter) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "(" + name + ":" + type + ")";
    }
}
