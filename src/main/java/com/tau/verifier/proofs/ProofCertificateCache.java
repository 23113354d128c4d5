package com.tau.verifier.proofs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.model.ProofCertificate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Content-addressed store of proof certificates.
 *
 * <pre>
 * root/index.json              index of all certificates
 * root/config.json             optional settings ({@code max_age_days})
 * root/artifacts/&lt;hash&gt;.json  certificate records
 * root/whyml/&lt;hash&gt;.mlw      generated modules
 * root/lean/&lt;hash&gt;.lean      proof skeletons
 * root/logs/&lt;hash&gt;.log       prover output
 * </pre>
 *
 * Every operation holds a lock shared by all instances opened on the same root,
 * re-reads the index from disk, and writes it back before releasing the lock.
 */
public class ProofCertificateCache {

    private static final Logger logger = LoggerFactory.getLogger(ProofCertificateCache.class);

    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    static final String INDEX_FILE = "index.json";
    static final String CONFIG_FILE = "config.json";
    static final String ARTIFACTS_DIR = "artifacts";
    static final String WHYML_DIR = "whyml";
    static final String LEAN_DIR = "lean";
    static final String LOGS_DIR = "logs";

    private final Path root;
    private final Duration defaultMaxAge;
    private final FunctionHasher hasher;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock;

    public ProofCertificateCache(Path root) {
        this(root, Duration.ofDays(365), new FunctionHasher());
    }

    /**
     * @param root The cache directory, created on first use
     * @param defaultMaxAge Retention used by {@link #cleanup()} when {@code config.json} sets none
     * @param hasher Computes the function identities
     */
    public ProofCertificateCache(Path root, Duration defaultMaxAge, FunctionHasher hasher) {
        this.root = root;
        this.defaultMaxAge = defaultMaxAge;
        this.hasher = hasher;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.lock = LOCKS.computeIfAbsent(root.toAbsolutePath().normalize(), key -> new ReentrantLock());
    }

    public Path getRoot() {
        return root;
    }

    public FunctionHasher getHasher() {
        return hasher;
    }

    /**
     * Looks up the certificate for a function's current body and specification.
     *
     * A hit updates the entry's access metadata. An index entry whose certificate file
     * is missing or unreadable is pruned together with its artifacts and counted as a miss.
     *
     * @return The stored certificate, or empty on a miss
     */
    public Optional<ProofCertificate> lookup(AnnotatedFunction function) throws IOException {
        String hash = hasher.fullHash(function);
        lock.lock();
        try {
            CacheIndex index = loadIndex();
            IndexEntry entry = index.getEntries().get(hash);
            if (entry == null) {
                index.getStats().setCacheMisses(index.getStats().getCacheMisses() + 1);
                saveIndex(index);
                logger.debug("Cache miss for {} ({})", function.getName(), shortHash(hash));
                return Optional.empty();
            }

            Optional<ProofCertificate> certificate = readCertificate(hash);
            if (certificate.isEmpty()) {
                logger.warn("Pruning stale cache entry {} for {}: certificate missing or unreadable",
                        shortHash(hash), function.getName());
                removeEntry(index, hash);
                index.getStats().setCacheSizeBytes(computeSize());
                index.getStats().setCacheMisses(index.getStats().getCacheMisses() + 1);
                saveIndex(index);
                return Optional.empty();
            }

            entry.setLastAccessed(Instant.now().toString());
            entry.setAccessCount(entry.getAccessCount() + 1);
            index.getStats().setCacheHits(index.getStats().getCacheHits() + 1);
            saveIndex(index);
            logger.info("Cache hit for {} ({})", function.getName(), shortHash(hash));
            return certificate;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the outcome of a verification attempt, replacing any certificate with the same full hash.
     *
     * @param artifacts Generated documents to keep with the certificate; may be null
     * @param reason Failure reason, or null
     * @param duration Verification time in seconds, or null
     * @return The full hash the certificate is stored under
     */
    public String store(AnnotatedFunction function, boolean verified, ProofArtifacts artifacts,
                        String reason, Double duration) throws IOException {
        return store(function, verified, artifacts, reason, duration, null);
    }

    /**
     * Stores an outcome whose proof used a more complete specification than the function declares,
     * such as discovered loop invariants. The certificate stays keyed by the declared specification.
     *
     * @param provenSpecification The specification recorded in the certificate, or null for the declared one
     */
    public String store(AnnotatedFunction function, boolean verified, ProofArtifacts artifacts,
                        String reason, Double duration, FunctionSpecification provenSpecification)
            throws IOException {
        String hash = hasher.fullHash(function);
        String bodyHash = hasher.bodyHash(function);
        String timestamp = Instant.now().toString();
        ProofArtifacts documents = artifacts != null ? artifacts : ProofArtifacts.none();

        ProofCertificate certificate = new ProofCertificate();
        certificate.setHash(hash);
        certificate.setSourceHash(hasher.sourceHash(function));
        certificate.setBodyHash(bodyHash);
        certificate.setFunctionName(function.getName());
        certificate.setVerified(verified);
        certificate.setTimestamp(timestamp);
        certificate.setReason(reason);
        certificate.setDuration(duration);
        certificate.setSourceCode(function.getSource());
        certificate.setSpecs(provenSpecification != null
                ? provenSpecification.copy()
                : function.getSpecification().copy());

        lock.lock();
        try {
            ensureDirectories();
            CacheIndex index = loadIndex();

            certificate.setWhymlFile(writeArtifact(WHYML_DIR, hash + ".mlw", documents.getWhymlSource()));
            certificate.setLeanFile(writeArtifact(LEAN_DIR, hash + ".lean", documents.getLeanSource()));
            certificate.setLogFile(writeArtifact(LOGS_DIR, hash + ".log", documents.getProverLog()));
            String artifactFile = ARTIFACTS_DIR + "/" + hash + ".json";
            writeAtomically(root.resolve(artifactFile), objectMapper.writeValueAsString(certificate));

            IndexEntry entry = new IndexEntry();
            entry.setFunctionName(function.getName());
            entry.setVerified(verified);
            entry.setBodyHash(bodyHash);
            entry.setCreatedAt(timestamp);
            entry.setLastAccessed(timestamp);
            entry.setAccessCount(0);
            entry.setArtifactFile(artifactFile);

            IndexEntry previous = index.getEntries().put(hash, entry);
            if (previous != null && previous.getBodyHash() != null && !previous.getBodyHash().equals(bodyHash)) {
                index.unlinkBody(previous.getBodyHash(), hash);
            }
            index.linkBody(bodyHash, hash);
            index.getStats().setTotalEntries(index.getEntries().size());
            index.getStats().setCacheSizeBytes(computeSize());
            saveIndex(index);

            logger.info("Stored {} certificate for {} ({})", verified ? "verified" : "failed",
                    function.getName(), shortHash(hash));
            return hash;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes a certificate and all its artifacts.
     *
     * @return true if the hash was in the index
     */
    public boolean invalidate(String hash) throws IOException {
        lock.lock();
        try {
            CacheIndex index = loadIndex();
            if (!removeEntry(index, hash)) {
                return false;
            }
            index.getStats().setCacheSizeBytes(computeSize());
            saveIndex(index);
            logger.info("Invalidated certificate {}", shortHash(hash));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finds certificates stored for the same implementation under any specification, newest first.
     */
    public List<ProofCertificate> findByBody(AnnotatedFunction function) throws IOException {
        String bodyHash = hasher.bodyHash(function);
        lock.lock();
        try {
            CacheIndex index = loadIndex();
            List<String> hashes = index.getBodyIndex().get(bodyHash);
            if (hashes == null) {
                return new ArrayList<>();
            }
            List<ProofCertificate> found = new ArrayList<>();
            for (String hash : hashes) {
                if (index.getEntries().containsKey(hash)) {
                    readCertificate(hash).ifPresent(found::add);
                }
            }
            found.sort(Comparator.comparing((ProofCertificate certificate) -> parseInstant(certificate.getTimestamp()))
                    .reversed());
            return found;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() throws IOException {
        lock.lock();
        try {
            return new CacheStats(loadIndex().getStats());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists stored certificates, newest first.
     *
     * @param verifiedOnly Whether to skip certificates of failed attempts
     */
    public List<CertificateSummary> list(boolean verifiedOnly) throws IOException {
        lock.lock();
        try {
            return loadIndex().getEntries().entrySet().stream()
                    .filter(e -> !verifiedOnly || e.getValue().isVerified())
                    .map(e -> new CertificateSummary(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparing((CertificateSummary summary) -> parseInstant(summary.getCreatedAt()))
                            .reversed())
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every certificate and resets the counters.
     */
    public void clearAll() throws IOException {
        lock.lock();
        try {
            for (String directory : List.of(ARTIFACTS_DIR, WHYML_DIR, LEAN_DIR, LOGS_DIR)) {
                deleteContents(root.resolve(directory));
            }
            CacheIndex index = loadIndex();
            CacheIndex fresh = CacheIndex.empty();
            fresh.setCreatedAt(index.getCreatedAt());
            saveIndex(fresh);
            logger.info("Cleared proof cache at {}", root);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes certificates created more than {@code max_age_days} (from {@code config.json}) ago.
     */
    public int cleanup() throws IOException {
        return cleanup(configuredMaxAge());
    }

    /**
     * Deletes certificates created longer ago than the given age.
     *
     * @return The number of certificates deleted
     */
    public int cleanup(Duration maxAge) throws IOException {
        Instant cutoff = Instant.now().minus(maxAge);
        lock.lock();
        try {
            CacheIndex index = loadIndex();
            List<String> expired = index.getEntries().entrySet().stream()
                    .filter(e -> parseInstant(e.getValue().getCreatedAt()).isBefore(cutoff))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            int deleted = 0;
            for (String hash : expired) {
                if (removeEntry(index, hash)) {
                    deleted++;
                }
            }
            index.getStats().setLastCleanup(Instant.now().toString());
            index.getStats().setCacheSizeBytes(computeSize());
            saveIndex(index);
            logger.info("Cleanup removed {} certificate(s) older than {}", deleted, maxAge);
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    private boolean removeEntry(CacheIndex index, String hash) throws IOException {
        IndexEntry entry = index.getEntries().remove(hash);
        if (entry == null) {
            return false;
        }
        Files.deleteIfExists(root.resolve(ARTIFACTS_DIR).resolve(hash + ".json"));
        Files.deleteIfExists(root.resolve(WHYML_DIR).resolve(hash + ".mlw"));
        Files.deleteIfExists(root.resolve(LEAN_DIR).resolve(hash + ".lean"));
        Files.deleteIfExists(root.resolve(LOGS_DIR).resolve(hash + ".log"));
        index.unlinkBody(entry.getBodyHash(), hash);
        index.getStats().setTotalEntries(index.getEntries().size());
        return true;
    }

    private Duration configuredMaxAge() throws IOException {
        Path config = root.resolve(CONFIG_FILE);
        if (Files.exists(config)) {
            try {
                JsonNode node = objectMapper.readTree(config.toFile()).path("max_age_days");
                if (node.canConvertToInt()) {
                    return Duration.ofDays(node.asInt());
                }
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring malformed {}: {}", config, e.getOriginalMessage());
            }
        }
        return defaultMaxAge;
    }

    private CacheIndex loadIndex() throws IOException {
        Path indexFile = root.resolve(INDEX_FILE);
        if (!Files.exists(indexFile)) {
            return CacheIndex.empty();
        }
        try {
            CacheIndex index = objectMapper.readValue(indexFile.toFile(), CacheIndex.class);
            if (index.getCreatedAt() == null) {
                index.setCreatedAt(Instant.now().toString());
            }
            index.setSchemaVersion(CacheIndex.SCHEMA_VERSION);
            return index;
        } catch (JsonProcessingException e) {
            logger.warn("Cache index {} is corrupt, starting a new one: {}", indexFile, e.getOriginalMessage());
            return CacheIndex.empty();
        }
    }

    private void saveIndex(CacheIndex index) throws IOException {
        ensureDirectories();
        index.setLastUpdated(Instant.now().toString());
        writeAtomically(root.resolve(INDEX_FILE), objectMapper.writeValueAsString(index));
    }

    private Optional<ProofCertificate> readCertificate(String hash) {
        Path file = root.resolve(ARTIFACTS_DIR).resolve(hash + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), ProofCertificate.class));
        } catch (IOException e) {
            logger.warn("Cannot read certificate {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes an artifact if present and returns its path relative to the root.
     */
    private String writeArtifact(String directory, String fileName, String content) throws IOException {
        if (content == null || content.isEmpty()) {
            return null;
        }
        String relative = directory + "/" + fileName;
        writeAtomically(root.resolve(relative), content);
        return relative;
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path temporary = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temporary, content, StandardCharsets.UTF_8);
            try {
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    private void ensureDirectories() throws IOException {
        for (String directory : List.of(ARTIFACTS_DIR, WHYML_DIR, LEAN_DIR, LOGS_DIR)) {
            Files.createDirectories(root.resolve(directory));
        }
    }

    private long computeSize() throws IOException {
        long total = 0;
        for (String directory : List.of(ARTIFACTS_DIR, WHYML_DIR, LEAN_DIR, LOGS_DIR)) {
            Path path = root.resolve(directory);
            if (!Files.isDirectory(path)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(path)) {
                Iterator<Path> iterator = files.filter(Files::isRegularFile).iterator();
                while (iterator.hasNext()) {
                    total += Files.size(iterator.next());
                }
            }
        }
        return total;
    }

    private static void deleteContents(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            if (!path.equals(directory)) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static Instant parseInstant(String timestamp) {
        if (timestamp == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }

    private static String shortHash(String hash) {
        return hash.length() > 8 ? hash.substring(0, 8) : hash;
    }
}
