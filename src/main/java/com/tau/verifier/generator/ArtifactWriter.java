package com.tau.verifier.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Writes generated documents into an output directory, creating it on demand.
 */
public class ArtifactWriter {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

    public static final String MODULE_EXTENSION = ".mlw";
    public static final String SKELETON_EXTENSION = ".lean";

    private final Path outputDirectory;

    public ArtifactWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Returns the given base name, or a fresh {@code bundle_<8 hex>} name when it is blank.
     */
    public static String resolveBaseName(String baseName) {
        if (baseName != null && !baseName.isBlank()) {
            return baseName;
        }
        return "bundle_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public Path writeModule(String baseName, String source) throws IOException {
        return write(baseName + MODULE_EXTENSION, source);
    }

    public Path writeSkeleton(String baseName, String source) throws IOException {
        return write(baseName + SKELETON_EXTENSION, source);
    }

    private Path write(String fileName, String content) throws IOException {
        Files.createDirectories(outputDirectory);
        Path target = outputDirectory.resolve(fileName);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        logger.debug("Wrote {}", target);
        return target;
    }
}
