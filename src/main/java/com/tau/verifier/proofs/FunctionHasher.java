package com.tau.verifier.proofs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.processor.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes the three identities of a function.
 *
 * <ul>
 *   <li>full hash: name, parameter names, structural body dump and the whole specification</li>
 *   <li>body hash: the same without the specification</li>
 *   <li>source hash: the literal source text plus specification, for auditing only</li>
 * </ul>
 *
 * The structural dump is the method re-printed without comments, Javadoc or
 * annotations, so layout and documentation edits do not change it while any change
 * to identifiers or statements does. All digests are SHA-256 in lowercase hex.
 */
public class FunctionHasher {

    private static final Logger logger = LoggerFactory.getLogger(FunctionHasher.class);

    private final SourceParser parser;
    private final ObjectMapper canonicalMapper;
    private final DefaultPrettyPrinter printer;

    public FunctionHasher() {
        this(new SourceParser());
    }

    public FunctionHasher(SourceParser parser) {
        this.parser = parser;
        this.canonicalMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.printer = new DefaultPrettyPrinter(new DefaultPrinterConfiguration()
                .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS))
                .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC)));
    }

    /**
     * Hash of body and specification; the cache key.
     */
    public String fullHash(AnnotatedFunction function) {
        Optional<MethodDeclaration> method = findMethod(function);
        if (method.isEmpty()) {
            return textHash(function);
        }
        FunctionSpecification spec = function.getSpecification();
        Map<String, Object> components = bodyComponents(function.getName(), method.get());
        components.put("requires", spec.getRequires());
        components.put("ensures", spec.getEnsures());
        components.put("invariants", spec.getInvariants());
        components.put("variant", spec.getVariant() != null ? spec.getVariant() : "");
        return sha256(canonical(components));
    }

    /**
     * Hash of the implementation alone.
     */
    public String bodyHash(AnnotatedFunction function) {
        Optional<MethodDeclaration> method = findMethod(function);
        if (method.isEmpty()) {
            return sha256(function.getName() + function.getSource());
        }
        return sha256(canonical(bodyComponents(function.getName(), method.get())));
    }

    /**
     * Hash of the exact text; changes with any edit, including whitespace.
     */
    public String sourceHash(AnnotatedFunction function) {
        return textHash(function);
    }

    /**
     * Prints the method without comments, Javadoc or annotations.
     */
    public String structuralDump(MethodDeclaration method) {
        MethodDeclaration copy = method.clone();
        copy.setAnnotations(new NodeList<>());
        copy.getParameters().forEach(parameter -> parameter.setAnnotations(new NodeList<>()));
        return printer.print(copy);
    }

    private Map<String, Object> bodyComponents(String name, MethodDeclaration method) {
        List<String> parameterNames = method.getParameters().stream()
                .map(Parameter::getNameAsString)
                .collect(Collectors.toList());
        Map<String, Object> components = new TreeMap<>();
        components.put("name", name);
        components.put("args", parameterNames);
        components.put("body_ast", structuralDump(method));
        return components;
    }

    private Optional<MethodDeclaration> findMethod(AnnotatedFunction function) {
        try {
            List<MethodDeclaration> methods = parser.parseMethods(function.getSource());
            Optional<MethodDeclaration> named = methods.stream()
                    .filter(method -> method.getNameAsString().equals(function.getName()))
                    .findFirst();
            return named.isPresent() ? named : methods.stream().findFirst();
        } catch (IllegalArgumentException e) {
            logger.warn("Structural hashing failed for {}, using text hash: {}", function.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private String textHash(AnnotatedFunction function) {
        FunctionSpecification spec = function.getSpecification();
        return sha256(function.getName() + function.getSource() + spec.getRequires() + spec.getEnsures()
                + spec.getInvariants() + (spec.getVariant() != null ? spec.getVariant() : ""));
    }

    private String canonical(Map<String, Object> components) {
        try {
            return canonicalMapper.writeValueAsString(components);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize hash components", e);
        }
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
