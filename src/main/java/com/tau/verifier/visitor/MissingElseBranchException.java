package com.tau.verifier.visitor;

/**
 * Raised for an {@code if} without an {@code else}; both branches must be given explicitly.
 */
public class MissingElseBranchException extends TranslationException {

    public MissingElseBranchException(String condition) {
        super("Both if/else branches required, missing else for condition: " + condition);
    }
}
