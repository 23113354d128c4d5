package com.tau.verifier.visitor;

/**
 * Raised for a call to a function that is neither defined in the module nor given an external contract.
 */
public class UnknownFunctionException extends TranslationException {

    private final String callee;

    public UnknownFunctionException(String callee) {
        super("Unknown function: " + callee);
        this.callee = callee;
    }

    public String getCallee() {
        return callee;
    }
}
