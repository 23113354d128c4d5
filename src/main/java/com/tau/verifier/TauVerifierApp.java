package com.tau.verifier;

import com.tau.verifier.config.VerifierConfig;
import com.tau.verifier.evaluation.VerificationReportWriter;
import com.tau.verifier.processor.VerificationService;
import com.tau.verifier.processor.VerificationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point: verifies every {@code @Safe} and {@code @SafeAuto} method
 * of a Java source file and optionally writes a JSON report.
 * Exits with status 1 when any method fails to verify.
 */
public class TauVerifierApp {

    private static final Logger logger = LoggerFactory.getLogger(TauVerifierApp.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar tau-verifier.jar <file.java> [report.json]");
            System.err.println("Example: java -jar tau-verifier.jar src/main/java/Accounts.java why_out/report.json");
            System.exit(1);
        }

        Path sourceFile = Paths.get(args[0]);
        if (!Files.isRegularFile(sourceFile)) {
            System.err.println("Error: File not found: " + sourceFile);
            System.exit(1);
        }

        logger.info("Starting Tau verifier");
        logger.info("Target file: {}", sourceFile);

        try {
            VerifierConfig config = VerifierConfig.load();
            VerificationService service = VerificationService.create(config);
            VerificationSummary summary = service.verifyFile(sourceFile);

            VerificationReportWriter reportWriter = new VerificationReportWriter(config);
            reportWriter.printSummary(summary);
            if (args.length > 1) {
                reportWriter.exportJSON(summary, Paths.get(args[1]));
            }

            System.exit(summary.isAllVerified() ? 0 : 1);
        } catch (Exception e) {
            logger.error("Error verifying {}", sourceFile, e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
