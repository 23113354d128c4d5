package com.tau.verifier.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses source text into method declarations.
 *
 * Accepts a full compilation unit or one or more bare method declarations; the
 * latter are wrapped in a synthetic class before parsing.
 */
public class SourceParser {

    static final String WRAPPER_CLASS = "TauSource";

    private final JavaParser javaParser;

    public SourceParser() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
    }

    /**
     * Parses the source.
     *
     * @param source Java source text
     * @return The parsed unit
     * @throws IllegalArgumentException if the text is neither a compilation unit nor a sequence of methods
     */
    public CompilationUnit parse(String source) {
        ParseResult<CompilationUnit> direct = javaParser.parse(source);
        if (direct.isSuccessful() && direct.getResult().isPresent()) {
            return direct.getResult().get();
        }

        ParseResult<CompilationUnit> wrapped = javaParser.parse(wrap(source));
        if (wrapped.isSuccessful() && wrapped.getResult().isPresent()) {
            return wrapped.getResult().get();
        }
        throw new IllegalArgumentException("Invalid syntax: " + direct.getProblems().stream()
                .map(problem -> problem.getMessage())
                .collect(Collectors.joining("; ")));
    }

    /**
     * Gets the text that was actually parsed for the given unit, which differs from
     * the source when bare methods were wrapped in the synthetic class.
     */
    public String parsedText(String source, CompilationUnit unit) {
        boolean wrapped = unit.getTypes().size() == 1
                && unit.getType(0).getNameAsString().equals(WRAPPER_CLASS)
                && unit.getType(0).getBegin().map(p -> p.line == 1 && p.column == 1).orElse(false)
                && !source.startsWith("class " + WRAPPER_CLASS);
        return wrapped ? wrap(source) : source;
    }

    static String wrap(String source) {
        return "class " + WRAPPER_CLASS + " {\n" + source + "\n}";
    }

    /**
     * Gets every method with a body, in source order.
     */
    public List<MethodDeclaration> parseMethods(String source) {
        return parse(source).findAll(MethodDeclaration.class).stream()
                .filter(method -> method.getBody().isPresent())
                .collect(Collectors.toList());
    }
}
