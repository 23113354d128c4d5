package com.tau.verifier.visitor;

/**
 * Base class of structural errors raised while translating a function.
 * Translation errors are fatal for the function being translated and are never retried.
 */
public abstract class TranslationException extends RuntimeException {

    private String functionName;

    protected TranslationException(String message) {
        super(message);
    }

    /**
     * The function whose translation failed, if known.
     */
    public String getFunctionName() {
        return functionName;
    }

    /**
     * Attributes this error to a function; the first attribution wins.
     */
    public TranslationException inFunction(String name) {
        if (this.functionName == null) {
            this.functionName = name;
        }
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return functionName == null ? message : message + " (in function " + functionName + ")";
    }
}
