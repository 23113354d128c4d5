package com.tau.verifier.proofs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent form of {@code index.json}.
 *
 * {@code entries} maps full hashes to their metadata; {@code bodyIndex} maps body
 * hashes to the full hashes sharing that body.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheIndex {

    public static final String SCHEMA_VERSION = "2.0.0";

    private String schemaVersion = SCHEMA_VERSION;
    private String createdAt;
    private String lastUpdated;
    private Map<String, IndexEntry> entries = new LinkedHashMap<>();
    private Map<String, List<String>> bodyIndex = new LinkedHashMap<>();
    private CacheStats stats = new CacheStats();

    /**
     * Creates an empty index stamped with the current time.
     */
    public static CacheIndex empty() {
        String now = Instant.now().toString();
        CacheIndex index = new CacheIndex();
        index.createdAt = now;
        index.lastUpdated = now;
        index.stats.setLastCleanup(now);
        return index;
    }

    /**
     * Adds a full hash to its body's list unless already present.
     */
    void linkBody(String bodyHash, String fullHash) {
        List<String> hashes = bodyIndex.computeIfAbsent(bodyHash, key -> new ArrayList<>());
        if (!hashes.contains(fullHash)) {
            hashes.add(fullHash);
        }
    }

    /**
     * Removes a full hash from its body's list, dropping the list once empty.
     */
    void unlinkBody(String bodyHash, String fullHash) {
        if (bodyHash == null) {
            return;
        }
        List<String> hashes = bodyIndex.get(bodyHash);
        if (hashes != null) {
            hashes.remove(fullHash);
            if (hashes.isEmpty()) {
                bodyIndex.remove(bodyHash);
            }
        }
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public String getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(String lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public Map<String, IndexEntry> getEntries() {
        return entries;
    }

    public void setEntries(Map<String, IndexEntry> entries) {
        this.entries = entries != null ? new LinkedHashMap<>(entries) : new LinkedHashMap<>();
    }

    public Map<String, List<String>> getBodyIndex() {
        return bodyIndex;
    }

    public void setBodyIndex(Map<String, List<String>> bodyIndex) {
        this.bodyIndex = new LinkedHashMap<>();
        if (bodyIndex != null) {
            bodyIndex.forEach((body, hashes) -> this.bodyIndex.put(body, new ArrayList<>(hashes)));
        }
    }

    public CacheStats getStats() {
        return stats;
    }

    public void setStats(CacheStats stats) {
        this.stats = stats != null ? stats : new CacheStats();
    }
}
