package com.tau.verifier.processor;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.FunctionSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds methods marked {@code @Safe} or {@code @SafeAuto} and reads their specification
 * annotations from the source text.
 *
 * The recorded source of each function starts after its last annotation, so the
 * annotations themselves never reach the translator or the hasher.
 */
public class SafeMethodScanner {

    private static final Logger logger = LoggerFactory.getLogger(SafeMethodScanner.class);

    static final String SAFE = "Safe";
    static final String SAFE_AUTO = "SafeAuto";
    static final String REQUIRES = "Requires";
    static final String ENSURES = "Ensures";
    static final String LOOP_INVARIANT = "LoopInvariant";
    static final String VARIANT = "Variant";

    private final SourceParser parser;

    public SafeMethodScanner() {
        this(new SourceParser());
    }

    public SafeMethodScanner(SourceParser parser) {
        this.parser = parser;
    }

    /**
     * Scans a source file.
     *
     * @param file Path to a Java source file
     * @return Marked functions in source order
     * @throws IOException if the file cannot be read
     */
    public List<AnnotatedFunction> scan(Path file) throws IOException {
        logger.info("Scanning {}", file);
        return scan(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Scans source text.
     *
     * @throws IllegalArgumentException if the text does not parse
     */
    public List<AnnotatedFunction> scan(String source) {
        CompilationUnit cu = parser.parse(source);
        String text = parser.parsedText(source, cu);
        int[] lineOffsets = lineOffsets(text);

        List<AnnotatedFunction> functions = new ArrayList<>();
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            boolean safe = hasAnnotation(method, SAFE);
            boolean auto = hasAnnotation(method, SAFE_AUTO);
            if (!safe && !auto) {
                continue;
            }
            if (method.getBody().isEmpty()) {
                logger.warn("Skipping {}: marked method has no body", method.getNameAsString());
                continue;
            }

            FunctionSpecification specification = new FunctionSpecification(
                    String.join(" /\\ ", values(method, REQUIRES)),
                    String.join(" /\\ ", values(method, ENSURES)),
                    values(method, LOOP_INVARIANT),
                    firstValue(method, VARIANT));

            String methodSource = methodText(method, text, lineOffsets);
            int line = method.getName().getBegin().map(p -> p.line).orElse(1) - (text.equals(source) ? 0 : 1);
            functions.add(new AnnotatedFunction(method.getNameAsString(), methodSource, line, specification, auto && !safe));
            logger.debug("Found {} at line {} ({})", method.getNameAsString(), line, auto ? "auto" : "manual");
        }
        logger.info("Found {} marked method(s)", functions.size());
        return functions;
    }

    private static boolean hasAnnotation(MethodDeclaration method, String name) {
        return method.getAnnotations().stream().anyMatch(a -> a.getName().getIdentifier().equals(name));
    }

    private static List<String> values(MethodDeclaration method, String name) {
        List<String> values = new ArrayList<>();
        for (AnnotationExpr annotation : method.getAnnotations()) {
            if (!annotation.getName().getIdentifier().equals(name)) {
                continue;
            }
            Expression value = null;
            if (annotation instanceof SingleMemberAnnotationExpr) {
                value = ((SingleMemberAnnotationExpr) annotation).getMemberValue();
            } else if (annotation instanceof NormalAnnotationExpr) {
                for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                    if (pair.getNameAsString().equals("value")) {
                        value = pair.getValue();
                    }
                }
            }
            if (value != null && value.isStringLiteralExpr()) {
                values.add(value.asStringLiteralExpr().asString());
            } else {
                logger.warn("Ignoring @{} on {}: value must be a string literal", name, method.getNameAsString());
            }
        }
        return values;
    }

    private static String firstValue(MethodDeclaration method, String name) {
        List<String> values = values(method, name);
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * Gets the method's text from the end of its last annotation to its closing brace.
     */
    private static String methodText(MethodDeclaration method, String source, int[] lineOffsets) {
        Position end = method.getEnd().orElseThrow();
        Position start = method.getBegin().orElseThrow();
        int from = toOffset(start, lineOffsets);
        for (AnnotationExpr annotation : method.getAnnotations()) {
            Position annotationEnd = annotation.getEnd().orElse(start);
            from = Math.max(from, toOffset(annotationEnd, lineOffsets) + 1);
        }
        int to = Math.min(source.length(), toOffset(end, lineOffsets) + 1);
        return source.substring(from, to).strip();
    }

    private static int[] lineOffsets(String source) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                offsets.add(i + 1);
            }
        }
        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int toOffset(Position position, int[] lineOffsets) {
        return lineOffsets[position.line - 1] + position.column - 1;
    }
}
