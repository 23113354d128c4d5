package com.tau.verifier.proofs;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One row of a certificate listing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CertificateSummary {

    private final String hash;
    private final String functionName;
    private final boolean verified;
    private final String createdAt;
    private final String lastAccessed;
    private final long accessCount;

    public CertificateSummary(String hash, IndexEntry entry) {
        this.hash = hash;
        this.functionName = entry.getFunctionName();
        this.verified = entry.isVerified();
        this.createdAt = entry.getCreatedAt();
        this.lastAccessed = entry.getLastAccessed();
        this.accessCount = entry.getAccessCount();
    }

    public String getHash() {
        return hash;
    }

    public String getFunctionName() {
        return functionName;
    }

    public boolean isVerified() {
        return verified;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getLastAccessed() {
        return lastAccessed;
    }

    public long getAccessCount() {
        return accessCount;
    }
}
