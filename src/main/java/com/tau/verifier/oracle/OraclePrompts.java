package com.tau.verifier.oracle;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Instruction texts sent ahead of the JSON request payload, loaded from {@code prompts/} on the classpath.
 */
final class OraclePrompts {

    static final String PROPOSE = load("propose.txt");
    static final String REFINE = load("refine.txt");
    static final String CLASSIFY_BUG = load("classify-bug.txt");
    static final String SUGGEST_SPECIFICATION = load("suggest-specification.txt");

    private OraclePrompts() {
    }

    private static String load(String name) {
        String resource = "prompts/" + name;
        try (InputStream in = OraclePrompts.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing prompt resource: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read prompt resource: " + resource, e);
        }
    }
}
