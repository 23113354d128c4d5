package com.tau.verifier.visitor;

/**
 * Raised when a function contains more than one loop.
 */
public class MultipleLoopsUnsupportedException extends TranslationException {

    public MultipleLoopsUnsupportedException() {
        super("Only one loop per function is supported");
    }
}
