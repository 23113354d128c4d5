package com.tau.verifier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Persisted outcome of one verification attempt.
 *
 * The {@code hash} identifies the (body, specification) pair independently of formatting,
 * {@code sourceHash} changes with any textual edit and is kept for auditing only, and
 * {@code bodyHash} identifies the implementation regardless of its specification.
 * Artifact paths are relative to the cache root.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProofCertificate {

    private String hash;
    private String sourceHash;
    private String bodyHash;
    private String functionName;
    private boolean verified;
    private String timestamp;
    private String reason;
    private Double duration;
    private String sourceCode;
    private FunctionSpecification specs;
    private String whymlFile;
    private String leanFile;
    private String logFile;

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    public String getSourceHash() {
        return sourceHash;
    }

    public void setSourceHash(String sourceHash) {
        this.sourceHash = sourceHash;
    }

    public String getBodyHash() {
        return bodyHash;
    }

    public void setBodyHash(String bodyHash) {
        this.bodyHash = bodyHash;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public boolean isVerified() {
        return verified;
    }

    public void setVerified(boolean verified) {
        this.verified = verified;
    }

    /**
     * ISO-8601 creation instant.
     */
    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    /**
     * Verification duration in seconds, if known.
     */
    public Double getDuration() {
        return duration;
    }

    public void setDuration(Double duration) {
        this.duration = duration;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public void setSourceCode(String sourceCode) {
        this.sourceCode = sourceCode;
    }

    public FunctionSpecification getSpecs() {
        return specs;
    }

    public void setSpecs(FunctionSpecification specs) {
        this.specs = specs;
    }

    public String getWhymlFile() {
        return whymlFile;
    }

    public void setWhymlFile(String whymlFile) {
        this.whymlFile = whymlFile;
    }

    public String getLeanFile() {
        return leanFile;
    }

    public void setLeanFile(String leanFile) {
        this.leanFile = leanFile;
    }

    public String getLogFile() {
        return logFile;
    }

    public void setLogFile(String logFile) {
        this.logFile = logFile;
    }
}
