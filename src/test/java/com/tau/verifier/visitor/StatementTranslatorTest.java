package com.tau.verifier.visitor;

import com.github.javaparser.StaticJavaParser;
import com.tau.verifier.model.LoopContract;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementTranslatorTest {

    private StatementTranslator translator;
    private TranslationContext context;

    @BeforeEach
    void setUp() {
        translator = new StatementTranslator();
        context = new TranslationContext();
    }

    private String translate(String block, LoopContract contract) {
        return translator.translate(StaticJavaParser.parseBlock(block).getStatements(), context, contract);
    }

    @Test
    void bindsLocalsAsRefCells() {
        String body = translate("{ int x = 1; x = x + 1; return x; }", null);
        assertEquals("let x = ref 1 in\nx := (!x + 1);\n!x", body);
        assertTrue(context.isRefCell("x"));
    }

    @Test
    void firstAssignmentReadsParameterBeforeRebinding() {
        String body = translate("{ n = n + 1; return n; }", null);
        assertEquals("let n = ref (n + 1) in\n!n", body);
    }

    @Test
    void translatesIfElse() {
        String body = translate("{ int r = 0; if (a > b) { r = a; } else { r = b; } return r; }", null);
        assertEquals(String.join("\n",
                "let r = ref 0 in",
                "if (a > b) then (",
                "  r := a;",
                ") else (",
                "  r := b;",
                ")",
                "!r"), body);
    }

    @Test
    void returnsInBothBranches() {
        String body = translate("{ if (x < 0) { return -x; } else { return x; } }", null);
        assertEquals("if (x < 0) then (\n  (-x)\n) else (\n  x\n)", body);
    }

    @Test
    void nameBoundInThenBranchIsRefCellInElseBranch() {
        String body = translate("{ if (a > 0) { y = 1; } else { y = 2; } return y; }", null);
        assertTrue(body.contains("let y = ref 1 in"));
        assertTrue(body.contains("y := 2;"));
        assertTrue(body.endsWith("!y"));
    }

    @Test
    void rejectsIfWithoutElse() {
        MissingElseBranchException e = assertThrows(MissingElseBranchException.class,
                () -> translate("{ if (a > 0) { a = 0; } return a; }", null));
        assertTrue(e.getMessage().contains("a > 0"));
    }

    @Test
    void emitsInvariantsThenVariantAfterLoopHeader() {
        LoopContract contract = new LoopContract(List.of("0 <= !i <= n", "!c = !i"), "n - !i");
        String body = translate("{ int i = 0; int c = 0; while (i < n) { i = i + 1; c = c + 1; } return c; }",
                contract);
        assertEquals(String.join("\n",
                "let i = ref 0 in",
                "let c = ref 0 in",
                "while (!i < n) do",
                "  invariant { 0 <= !i <= n }",
                "  invariant { !c = !i }",
                "  variant { n - !i }",
                "  i := (!i + 1);",
                "  c := (!c + 1);",
                "done;",
                "!c"), body);
    }

    @Test
    void omitsContractLinesWithoutContract() {
        String body = translate("{ int i = 0; while (i < 3) { i = i + 1; } return i; }", null);
        assertFalse(body.contains("invariant"));
        assertFalse(body.contains("variant"));
        assertTrue(context.isLoopSeen());
    }

    @Test
    void rejectsSecondLoop() {
        assertThrows(MultipleLoopsUnsupportedException.class, () -> translate(
                "{ int i = 0; while (i < n) { i = i + 1; } while (i > 0) { i = i - 1; } return i; }", null));
    }

    @Test
    void rejectsForLoop() {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> translate("{ int s = 0; for (int i = 0; i < n; i = i + 1) { s = s + i; } return s; }", null));
        assertEquals("ForStmt", e.getConstruct());
    }

    @Test
    void forLoopAfterWhileCountsAsSecondLoop() {
        assertThrows(MultipleLoopsUnsupportedException.class, () -> translate(
                "{ int i = 0; while (i < n) { i = i + 1; } for (;;) { } }", null));
    }

    @Test
    void rejectsUnsupportedAssignments() {
        assertThrows(UnsupportedConstructException.class, () -> translate("{ int x = 0; x += 1; return x; }", null));
        assertThrows(UnsupportedConstructException.class, () -> translate("{ int a, b; return 0; }", null));
        assertThrows(UnsupportedConstructException.class, () -> translate("{ int x; return 0; }", null));
        assertThrows(UnsupportedConstructException.class, () -> translate("{ a = b = 1; return a; }", null));
    }

    @Test
    void rejectsBareReturnAndOtherStatements() {
        assertThrows(UnsupportedConstructException.class, () -> translate("{ return; }", null));
        assertThrows(UnsupportedConstructException.class,
                () -> translate("{ throw new IllegalStateException(); }", null));
    }

    @Test
    void indentsNonBlankLines() {
        assertEquals("  a\n\n  b", StatementTranslator.indent("a\n\nb"));
    }
}
