package com.tau.verifier.proofs;

/**
 * Generated documents stored alongside a certificate. Any of them may be null.
 */
public final class ProofArtifacts {

    private static final ProofArtifacts NONE = new ProofArtifacts(null, null, null);

    private final String whymlSource;
    private final String leanSource;
    private final String proverLog;

    public ProofArtifacts(String whymlSource, String leanSource, String proverLog) {
        this.whymlSource = whymlSource;
        this.leanSource = leanSource;
        this.proverLog = proverLog;
    }

    public static ProofArtifacts none() {
        return NONE;
    }

    public String getWhymlSource() {
        return whymlSource;
    }

    public String getLeanSource() {
        return leanSource;
    }

    public String getProverLog() {
        return proverLog;
    }
}
