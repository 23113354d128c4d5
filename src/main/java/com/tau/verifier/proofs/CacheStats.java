package com.tau.verifier.proofs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Aggregate counters of a certificate cache.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheStats {

    private int totalEntries;
    private long cacheHits;
    private long cacheMisses;
    private long cacheSizeBytes;
    private String lastCleanup;

    public CacheStats() {
    }

    public CacheStats(CacheStats other) {
        this.totalEntries = other.totalEntries;
        this.cacheHits = other.cacheHits;
        this.cacheMisses = other.cacheMisses;
        this.cacheSizeBytes = other.cacheSizeBytes;
        this.lastCleanup = other.lastCleanup;
    }

    public int getTotalEntries() {
        return totalEntries;
    }

    public void setTotalEntries(int totalEntries) {
        this.totalEntries = totalEntries;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public void setCacheHits(long cacheHits) {
        this.cacheHits = cacheHits;
    }

    public long getCacheMisses() {
        return cacheMisses;
    }

    public void setCacheMisses(long cacheMisses) {
        this.cacheMisses = cacheMisses;
    }

    public long getCacheSizeBytes() {
        return cacheSizeBytes;
    }

    public void setCacheSizeBytes(long cacheSizeBytes) {
        this.cacheSizeBytes = cacheSizeBytes;
    }

    public String getLastCleanup() {
        return lastCleanup;
    }

    public void setLastCleanup(String lastCleanup) {
        this.lastCleanup = lastCleanup;
    }

    @Override
    public String toString() {
        return "entries=" + totalEntries + ", hits=" + cacheHits + ", misses=" + cacheMisses
                + ", bytes=" + cacheSizeBytes;
    }
}
