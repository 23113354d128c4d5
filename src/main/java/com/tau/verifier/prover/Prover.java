package com.tau.verifier.prover;

import java.nio.file.Path;

/**
 * Checks a generated WhyML module with an external prover.
 */
public interface Prover {

    /**
     * Proves every goal of a module.
     *
     * @param moduleFile The {@code .mlw} file to check
     * @return The outcome and the prover's combined output; never null
     */
    ProverResult prove(Path moduleFile);
}
