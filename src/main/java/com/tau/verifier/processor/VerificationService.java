package com.tau.verifier.processor;

import com.tau.verifier.analysis.ContractProposer;
import com.tau.verifier.analysis.FeedbackLoop;
import com.tau.verifier.analysis.FeedbackResult;
import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.ExternalFunctionContract;
import com.tau.verifier.model.FeedbackRound;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.ProofCertificate;
import com.tau.verifier.proofs.FunctionHasher;
import com.tau.verifier.proofs.ProofArtifacts;
import com.tau.verifier.proofs.ProofCertificateCache;
import com.tau.verifier.prover.Prover;
import com.tau.verifier.prover.ProverResult;
import com.tau.verifier.prover.Why3Prover;
import com.tau.verifier.visitor.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies marked functions end to end: cache lookup, optional specification
 * suggestion, translation and proof (directly or through the feedback loop), and
 * storage of the outcome as a proof certificate.
 */
public class VerificationService {

    private static final Logger logger = LoggerFactory.getLogger(VerificationService.class);

    static final String ERROR_PREFIX = "Error: ";

    private final VerifierConfig config;
    private final Transpiler transpiler;
    private final Prover prover;
    private final ContractProposer proposer;
    private final ProofCertificateCache cache;
    private final SafeMethodScanner scanner;

    /**
     * @param cache The proof cache, or null to always verify from scratch
     */
    public VerificationService(VerifierConfig config, Transpiler transpiler, Prover prover,
                               ContractProposer proposer, ProofCertificateCache cache) {
        this.config = config;
        this.transpiler = transpiler;
        this.prover = prover;
        this.proposer = proposer;
        this.cache = cache;
        this.scanner = new SafeMethodScanner();
    }

    /**
     * Wires the Why3 prover, the configured oracle and the on-disk proof cache.
     */
    public static VerificationService create(VerifierConfig config) {
        return new VerificationService(config,
                new Transpiler(config.getOutputDirectory()),
                new Why3Prover(config),
                ContractProposer.create(config),
                new ProofCertificateCache(config.getProofsDirectory(), config.getProofsMaxAge(),
                        new FunctionHasher()));
    }

    /**
     * Scans a source file and verifies every marked method.
     *
     * @param file Path to a Java source file
     * @return One result per marked method, in source order
     * @throws IOException if the file cannot be read
     */
    public VerificationSummary verifyFile(Path file) throws IOException {
        VerificationSummary summary = new VerificationSummary(file.toString());
        List<AnnotatedFunction> functions = scanner.scan(file);
        for (AnnotatedFunction function : functions) {
            VerificationResult result = verify(function);
            logger.info("{}", result);
            summary.addResult(result);
        }
        logger.info("Verified {}/{} function(s) in {}", summary.getPassed(), summary.getTotal(), file);
        return summary;
    }

    public VerificationResult verify(AnnotatedFunction function) {
        return verify(function, Collections.emptyMap());
    }

    /**
     * Verifies one function.
     *
     * @param function The function and its declared specification
     * @param externals Contracts of functions it calls that are not part of its source
     * @return The outcome; never null, failures are reported through the reason
     */
    public VerificationResult verify(AnnotatedFunction function, Map<String, ExternalFunctionContract> externals) {
        long start = System.nanoTime();
        VerificationResult result = new VerificationResult(function.getName(), function.getLineNumber(),
                function.getSource());
        result.setSpecification(function.getSpecification());

        Optional<ProofCertificate> cached = lookup(function);
        if (cached.isPresent()) {
            fromCertificate(result, cached.get());
            result.setDurationSeconds(elapsedSeconds(start));
            return result;
        }

        ProofArtifacts artifacts = ProofArtifacts.none();
        try {
            AnnotatedFunction target = function;
            if (function.isAutoMode()) {
                Optional<GeneratedSpecification> suggested = proposer.suggestSpecification(function);
                if (suggested.isEmpty()) {
                    result.setVerified(false);
                    result.setReason("Auto-generation failed: Could not generate specifications");
                    result.setDurationSeconds(elapsedSeconds(start));
                    return result;
                }
                FunctionSpecification generated = suggested.get().toSpecification();
                logger.info("Using suggested specification for {}: {}", function.getName(), generated);
                target = function.withSpecification(generated);
                result.setSpecification(generated);
            }

            if (target.getSpecification().hasLoopContract()) {
                artifacts = verifyWithDeclaredContract(target, externals, result);
            } else {
                artifacts = verifyWithFeedback(target, externals, result);
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Verification of {} failed", function.getName(), e);
            result.setVerified(false);
            result.setReason(ERROR_PREFIX + e.getMessage());
        }

        result.setDurationSeconds(elapsedSeconds(start));
        store(function, result, artifacts);
        return result;
    }

    private ProofArtifacts verifyWithDeclaredContract(AnnotatedFunction function,
                                                      Map<String, ExternalFunctionContract> externals,
                                                      VerificationResult result) throws IOException {
        String name = function.getName();
        TranspileResult transpiled;
        try {
            transpiled = transpiler.transpile(function.getSource(), Map.of(name, function.getSpecification()),
                    externals, null, name);
        } catch (TranslationException | IllegalArgumentException e) {
            logger.error("Cannot translate {}: {}", name, e.getMessage());
            result.setVerified(false);
            result.setReason(ERROR_PREFIX + e.getMessage());
            return ProofArtifacts.none();
        }
        setFiles(result, transpiled);

        ProverResult proof = prover.prove(transpiled.getModuleFile());
        result.setRounds(1);
        result.setVerified(proof.isProved());
        if (proof.isProved()) {
            result.setReason("Proof succeeded with provided invariants");
        } else if (proof.getOutcome() == ProverResult.Outcome.NOT_PROVED) {
            result.setReason("Proof failed with provided invariants");
        } else {
            result.setReason(noVerdictReason(proof.getOutcome()));
        }
        return new ProofArtifacts(transpiled.getModuleSource(), transpiled.getSkeletonSource(), proof.getOutput());
    }

    private ProofArtifacts verifyWithFeedback(AnnotatedFunction function,
                                              Map<String, ExternalFunctionContract> externals,
                                              VerificationResult result) {
        FeedbackLoop loop = new FeedbackLoop(transpiler, prover, proposer,
                config.getMaxRounds(), config.isClassifyEveryRound());
        FeedbackResult feedback = loop.run(function, externals);

        result.setUsedOracle(true);
        result.setRounds(feedback.getRounds().size());
        result.setVerified(feedback.isVerified());
        if (feedback.getFinalContract() != null) {
            result.setSpecification(function.getSpecification().withLoopContract(feedback.getFinalContract()));
        }

        BugAnalysis bug = feedback.getDetectedBug();
        if (feedback.isVerified()) {
            result.setReason("Proof succeeded (LLM generated invariants in " + feedback.getRounds().size()
                    + " rounds)");
        } else if (bug != null) {
            result.setBugAnalysis(bug);
            result.setReason("Bug detected: " + bug.getExplanation());
        } else if (feedback.getError() != null) {
            result.setReason(ERROR_PREFIX + feedback.getError());
        } else if (feedback.getEnvironmentFailure() != null) {
            result.setReason(noVerdictReason(feedback.getEnvironmentFailure()));
        } else {
            result.setReason("Proof failed (could not generate valid invariants)");
        }

        TranspileResult last = feedback.getLastTranspile();
        if (last == null) {
            return ProofArtifacts.none();
        }
        setFiles(result, last);
        FeedbackRound finalRound = feedback.getFinalRound();
        String log = finalRound != null ? finalRound.getProverOutput() : null;
        return new ProofArtifacts(last.getModuleSource(), last.getSkeletonSource(), log);
    }

    private Optional<ProofCertificate> lookup(AnnotatedFunction function) {
        if (cache == null) {
            return Optional.empty();
        }
        try {
            return cache.lookup(function);
        } catch (IOException e) {
            logger.warn("Proof cache lookup failed for {}: {}", function.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private void store(AnnotatedFunction function, VerificationResult result, ProofArtifacts artifacts) {
        if (cache == null || result.getReason().startsWith(ERROR_PREFIX)) {
            return;
        }
        try {
            String hash = cache.store(function, result.isVerified(), artifacts, result.getReason(),
                    result.getDurationSeconds(), result.getSpecification());
            result.setHash(hash);
        } catch (IOException e) {
            logger.warn("Could not store proof certificate for {}: {}", function.getName(), e.getMessage());
        }
    }

    private void fromCertificate(VerificationResult result, ProofCertificate certificate) {
        result.setCached(true);
        result.setVerified(certificate.isVerified());
        result.setReason(certificate.getReason() != null ? certificate.getReason() : "");
        result.setHash(certificate.getHash());
        if (certificate.getSpecs() != null) {
            result.setSpecification(certificate.getSpecs());
        }
        if (certificate.getWhymlFile() != null) {
            result.setWhymlFile(cache.getRoot().resolve(certificate.getWhymlFile()).toString());
        }
        if (certificate.getLeanFile() != null) {
            result.setLeanFile(cache.getRoot().resolve(certificate.getLeanFile()).toString());
        }
    }

    /**
     * Reason for a run where the prover gave no verdict. It carries the error prefix so the
     * outcome is never cached.
     */
    static String noVerdictReason(ProverResult.Outcome outcome) {
        return outcome == ProverResult.Outcome.TIMEOUT
                ? ERROR_PREFIX + "prover timed out"
                : ERROR_PREFIX + "prover unavailable";
    }

    private static void setFiles(VerificationResult result, TranspileResult transpiled) {
        result.setWhymlFile(transpiled.getModuleFile().toString());
        result.setLeanFile(transpiled.getSkeletonFile().toString());
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
