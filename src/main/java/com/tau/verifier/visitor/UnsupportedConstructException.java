package com.tau.verifier.visitor;

/**
 * Raised for a statement or expression shape outside the supported subset.
 */
public class UnsupportedConstructException extends TranslationException {

    private final String construct;

    public UnsupportedConstructException(String construct) {
        this(construct, "Unsupported construct: " + construct);
    }

    public UnsupportedConstructException(String construct, String message) {
        super(message);
        this.construct = construct;
    }

    /**
     * The kind of the offending node, e.g. {@code ForStmt} or {@code StringLiteralExpr}.
     */
    public String getConstruct() {
        return construct;
    }
}
