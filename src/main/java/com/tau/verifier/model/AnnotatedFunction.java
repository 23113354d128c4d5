package com.tau.verifier.model;

import java.util.Objects;

/**
 * A source function marked for verification together with its specification.
 * This is the unit handed to the verification service and to proof-cache queries.
 */
public class AnnotatedFunction {

    private final String name;
    private final String source;
    private final int lineNumber;
    private final FunctionSpecification specification;
    private final boolean autoMode;

    public AnnotatedFunction(String name, String source, FunctionSpecification specification) {
        this(name, source, 1, specification, false);
    }

    public AnnotatedFunction(String name, String source, int lineNumber,
                             FunctionSpecification specification, boolean autoMode) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = Objects.requireNonNull(source, "source");
        this.lineNumber = lineNumber;
        this.specification = specification != null ? specification : new FunctionSpecification();
        this.autoMode = autoMode;
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public FunctionSpecification getSpecification() {
        return specification;
    }

    /**
     * True when requires/ensures should be suggested by the oracle rather than read from the source.
     */
    public boolean isAutoMode() {
        return autoMode;
    }

    /**
     * Returns the same function with a different specification.
     */
    public AnnotatedFunction withSpecification(FunctionSpecification newSpecification) {
        return new AnnotatedFunction(name, source, lineNumber, newSpecification, autoMode);
    }

    @Override
    public String toString() {
        return name + ":" + lineNumber;
    }
}
