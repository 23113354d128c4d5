package com.tau.verifier.processor;

import com.tau.verifier.generator.GeneratedModule;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.visitor.MissingElseBranchException;
import com.tau.verifier.visitor.UnknownFunctionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TranspilerTest {

    static final String COUNT_TO = String.join("\n",
            "static int countTo(int n) {",
            "    int i = 0;",
            "    while (i < n) {",
            "        i = i + 1;",
            "    }",
            "    return i;",
            "}");

    @TempDir
    Path outputDir;

    @Test
    void transpilesCountingLoopWithContract() throws Exception {
        Transpiler transpiler = new Transpiler(outputDir);
        FunctionSpecification spec = new FunctionSpecification("n >= 0", "result = n",
                List.of("0 <= !i <= n"), "n - !i");

        TranspileResult result = transpiler.transpile(COUNT_TO, Map.of("countTo", spec), null, null, "countTo");

        assertEquals(outputDir.resolve("countTo.mlw"), result.getModuleFile());
        assertEquals(outputDir.resolve("countTo.lean"), result.getSkeletonFile());
        assertEquals("M_countTo", result.getModuleName());
        assertTrue(result.getModuleSource().contains(String.join("\n",
                "let countTo (n:int) : int =",
                "  requires { n >= 0 }",
                "  ensures  { result = n }",
                "  let i = ref 0 in",
                "  while (!i < n) do",
                "    invariant { 0 <= !i <= n }",
                "    variant { n - !i }",
                "    i := (!i + 1);",
                "  done;",
                "  !i",
                "")));
        assertEquals(result.getModuleSource(), Files.readString(result.getModuleFile(), StandardCharsets.UTF_8));
        assertTrue(Files.readString(result.getSkeletonFile(), StandardCharsets.UTF_8)
                .contains("theorem countTo_correct (n : Int) : Prop := by"));
    }

    @Test
    void acceptsFullCompilationUnits() {
        String source = "public class Calc {\n"
                + "    static int square(int x) { return x * x; }\n"
                + "    static int sumOfSquares(int a, int b) { return square(a) + square(b); }\n"
                + "}\n";
        GeneratedModule module = new Transpiler(outputDir).generate(source, null, null, "Calc");

        assertEquals(2, module.getContracts().size());
        assertTrue(module.getSource().contains("(square(a) + square(b))"));
        assertTrue(module.getSource().indexOf("let square") < module.getSource().indexOf("let sumOfSquares"));
    }

    @Test
    void generatesBundleNameWhenNoneGiven() throws Exception {
        TranspileResult result = new Transpiler(outputDir)
                .transpile("int id(int x) { return x; }", null, null, null, null);
        assertTrue(result.getModuleFile().getFileName().toString().matches("bundle_[0-9a-f]{8}\\.mlw"));
    }

    @Test
    void reportsTranslationErrors() {
        Transpiler transpiler = new Transpiler(outputDir);
        MissingElseBranchException missingElse = assertThrows(MissingElseBranchException.class,
                () -> transpiler.generate("int f(int x) { if (x > 0) { x = 0; } return x; }", null, null, null));
        assertEquals("f", missingElse.getFunctionName());
        assertThrows(UnknownFunctionException.class,
                () -> transpiler.generate("int f(int x) { return helper(x); }", null, null, null));
    }

    @Test
    void rejectsSourceWithoutFunctions() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new Transpiler(outputDir).generate("class Empty { }", null, null, null));
        assertEquals("No functions found in source", e.getMessage());
    }

    @Test
    void rejectsInvalidSyntax() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new Transpiler(outputDir).generate("int f(int x) { return x +; }", null, null, null));
        assertTrue(e.getMessage().startsWith("Invalid syntax"));
    }
}
