package com.tau.verifier.proofs;

import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.FunctionSpecification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionHasherTest {

    private final FunctionHasher hasher = new FunctionHasher();
    private final FunctionSpecification spec = new FunctionSpecification("c >= 0", "result = c + 1");

    private AnnotatedFunction function(String source) {
        return new AnnotatedFunction("inc", source, spec);
    }

    @Test
    void ignoresFormattingCommentsAndJavadoc() {
        AnnotatedFunction compact = function("int inc(int c){return c+1;}");
        AnnotatedFunction documented = function(String.join("\n",
                "/**",
                " * Adds one.",
                " */",
                "int inc(int c) {",
                "    // the only step",
                "    return c + 1;   ",
                "}"));

        assertEquals(hasher.fullHash(compact), hasher.fullHash(documented));
        assertEquals(hasher.bodyHash(compact), hasher.bodyHash(documented));
        assertNotEquals(hasher.sourceHash(compact), hasher.sourceHash(documented));
    }

    @Test
    void ignoresAnnotations() {
        assertEquals(hasher.fullHash(function("int inc(int c) { return c + 1; }")),
                hasher.fullHash(function("@Safe @Requires(\"c >= 0\") int inc(@Positive int c) { return c + 1; }")));
    }

    @Test
    void changesWithBody() {
        AnnotatedFunction one = function("int inc(int c) { return c + 1; }");
        AnnotatedFunction two = function("int inc(int c) { return c + 2; }");
        assertNotEquals(hasher.fullHash(one), hasher.fullHash(two));
        assertNotEquals(hasher.bodyHash(one), hasher.bodyHash(two));
    }

    @Test
    void changesWithParameterName() {
        assertNotEquals(hasher.bodyHash(function("int inc(int c) { return c + 1; }")),
                hasher.bodyHash(function("int inc(int d) { return d + 1; }")));
    }

    @Test
    void bodyHashIgnoresSpecification() {
        AnnotatedFunction base = function("int inc(int c) { return c + 1; }");
        AnnotatedFunction stronger = base.withSpecification(new FunctionSpecification("c >= 0", "result > c"));
        AnnotatedFunction withLoop = base.withSpecification(
                new FunctionSpecification("c >= 0", "result = c + 1", List.of("true"), "0"));

        assertEquals(hasher.bodyHash(base), hasher.bodyHash(stronger));
        assertNotEquals(hasher.fullHash(base), hasher.fullHash(stronger));
        assertNotEquals(hasher.fullHash(base), hasher.fullHash(withLoop));
    }

    @Test
    void hashesTheNamedMethod() {
        AnnotatedFunction alone = function("int inc(int c) { return c + 1; }");
        AnnotatedFunction withHelper = function("int helper(int x) { return x; }\nint inc(int c) { return c + 1; }");
        assertEquals(hasher.bodyHash(alone), hasher.bodyHash(withHelper));
    }

    @Test
    void fallsBackToTextForUnparsableSource() {
        AnnotatedFunction broken = function("int inc(int c) { return c + ; }");
        assertEquals(hasher.fullHash(broken), hasher.fullHash(broken));
        assertEquals(64, hasher.fullHash(broken).length());
        assertNotEquals(hasher.fullHash(broken), hasher.fullHash(function("int inc(int c) { return c + 1; }")));
    }

    @Test
    void producesLowercaseHexSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", FunctionHasher.sha256(""));
        assertTrue(hasher.fullHash(function("int inc(int c) { return c + 1; }")).matches("[0-9a-f]{64}"));
    }
}
