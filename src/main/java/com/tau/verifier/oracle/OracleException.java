package com.tau.verifier.oracle;

/**
 * Raised when the oracle cannot be reached or answers outside the expected schema.
 * Never fatal: callers fall back to heuristics or keep the previous contract.
 */
public class OracleException extends Exception {

    public enum Kind {
        UNAVAILABLE,
        SCHEMA_INVALID
    }

    private final Kind kind;

    public OracleException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OracleException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
