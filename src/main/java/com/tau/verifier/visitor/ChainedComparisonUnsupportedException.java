package com.tau.verifier.visitor;

/**
 * Raised for comparisons such as {@code a < b < c}; only one operator between two operands is accepted.
 */
public class ChainedComparisonUnsupportedException extends TranslationException {

    public ChainedComparisonUnsupportedException(String expression) {
        super("Chained comparisons not supported: " + expression);
    }
}
