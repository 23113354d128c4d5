package com.tau.verifier.prover;

import com.tau.verifier.config.VerifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@code why3 prove} as an external process.
 *
 * Standard error is merged into standard output. The per-goal timeout is passed to
 * Why3; the process as a whole is killed five seconds after that, keeping whatever it
 * printed before the kill.
 */
public class Why3Prover implements Prover {

    private static final Logger logger = LoggerFactory.getLogger(Why3Prover.class);

    static final int GRACE_SECONDS = 5;

    private final String command;
    private final String proverId;
    private final int timeoutSeconds;
    private final int graceSeconds;

    public Why3Prover(String command, String proverId, int timeoutSeconds) {
        this(command, proverId, timeoutSeconds, GRACE_SECONDS);
    }

    Why3Prover(String command, String proverId, int timeoutSeconds, int graceSeconds) {
        this.command = command;
        this.proverId = proverId;
        this.timeoutSeconds = timeoutSeconds;
        this.graceSeconds = graceSeconds;
    }

    public Why3Prover(VerifierConfig config) {
        this(config.getProverCommand(), config.getProverId(), config.getProverTimeoutSeconds());
    }

    List<String> buildCommand(Path moduleFile) {
        return List.of(command, "prove", moduleFile.toString(),
                "--prover", proverId, "-t", Integer.toString(timeoutSeconds));
    }

    @Override
    public ProverResult prove(Path moduleFile) {
        List<String> commandLine = buildCommand(moduleFile);
        logger.debug("Running {}", String.join(" ", commandLine));

        Process child;
        try {
            child = new ProcessBuilder(commandLine).redirectErrorStream(true).start();
        } catch (IOException e) {
            logger.warn("Prover {} could not be started: {}", command, e.getMessage());
            return new ProverResult(ProverResult.Outcome.UNAVAILABLE,
                    "Why3 not found (" + e.getMessage() + "). Install with: opam install why3");
        }

        // Drain output concurrently so a chatty prover cannot block on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(child.getInputStream()));
        try {
            boolean finished = child.waitFor(timeoutSeconds + graceSeconds, TimeUnit.SECONDS);
            if (!finished) {
                child.destroyForcibly();
                String partial = partialOutput(output);
                logger.warn("Prover timed out after {}s on {}", timeoutSeconds + graceSeconds, moduleFile);
                return new ProverResult(ProverResult.Outcome.TIMEOUT,
                        partial + "\nWhy3 verification timed out after " + timeoutSeconds + "s");
            }
            String text = output.get(graceSeconds, TimeUnit.SECONDS);
            ProverResult result = ProverResult.fromOutput(text);
            logger.info("Prover result for {}: {}", moduleFile.getFileName(), result.getOutcome());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            child.destroyForcibly();
            return new ProverResult(ProverResult.Outcome.TIMEOUT, "Why3 verification interrupted");
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Could not read prover output for {}", moduleFile, e);
            return new ProverResult(ProverResult.Outcome.NOT_PROVED, "Why3 error: " + e.getMessage());
        } finally {
            child.destroy();
        }
    }

    /**
     * Output of a killed prover. The reader finishes once the pipe closes, which can lag the kill.
     */
    private String partialOutput(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(graceSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            logger.debug("No output captured from killed prover: {}", e.toString());
            return "";
        }
    }

    private static String readAll(InputStream input) {
        try (InputStream in = input) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
