package com.tau.verifier.processor;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.tau.verifier.generator.ArtifactWriter;
import com.tau.verifier.generator.GeneratedModule;
import com.tau.verifier.generator.LeanSkeletonGenerator;
import com.tau.verifier.generator.WhyMLModuleGenerator;
import com.tau.verifier.model.ExternalFunctionContract;
import com.tau.verifier.model.FunctionContract;
import com.tau.verifier.model.FunctionSpecification;
import com.tau.verifier.visitor.FunctionTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Source-to-artifacts pipeline: parse, translate every method, assemble the WhyML
 * module and Lean skeleton, and write both to the output directory.
 */
public class Transpiler {

    private static final Logger logger = LoggerFactory.getLogger(Transpiler.class);

    private final SourceParser parser;
    private final FunctionTranslator functionTranslator;
    private final WhyMLModuleGenerator moduleGenerator;
    private final LeanSkeletonGenerator skeletonGenerator;
    private final ArtifactWriter writer;

    public Transpiler(Path outputDirectory) {
        this(new SourceParser(), new FunctionTranslator(), new WhyMLModuleGenerator(),
                new LeanSkeletonGenerator(), new ArtifactWriter(outputDirectory));
    }

    public Transpiler(SourceParser parser, FunctionTranslator functionTranslator,
                      WhyMLModuleGenerator moduleGenerator, LeanSkeletonGenerator skeletonGenerator,
                      ArtifactWriter writer) {
        this.parser = parser;
        this.functionTranslator = functionTranslator;
        this.moduleGenerator = moduleGenerator;
        this.skeletonGenerator = skeletonGenerator;
        this.writer = writer;
    }

    /**
     * Translates the source without writing anything.
     *
     * @param source Java source holding one or more methods
     * @param specifications Specifications keyed by method name; missing entries are trivial
     * @param externals External contracts keyed by function name; may be null
     * @param moduleName The module name, or null for the default
     * @return The assembled module
     */
    public GeneratedModule generate(String source, Map<String, FunctionSpecification> specifications,
                                    Map<String, ExternalFunctionContract> externals, String moduleName) {
        List<MethodDeclaration> methods = parser.parseMethods(source);
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("No functions found in source");
        }

        Set<String> known = new LinkedHashSet<>();
        methods.forEach(method -> known.add(method.getNameAsString()));
        Set<String> externalNames = externals != null ? externals.keySet() : Collections.emptySet();
        Map<String, FunctionSpecification> specs = specifications != null ? specifications : Collections.emptyMap();

        List<FunctionContract> contracts = new ArrayList<>();
        for (MethodDeclaration method : methods) {
            contracts.add(functionTranslator.translate(method, specs.get(method.getNameAsString()), known, externalNames));
        }
        return moduleGenerator.generate(contracts, externals, moduleName);
    }

    /**
     * Translates the source and writes {@code <baseName>.mlw} and {@code <baseName>.lean}.
     *
     * @param baseName Output file base name, or null for a generated {@code bundle_} name
     * @throws IOException if the artifacts cannot be written
     */
    public TranspileResult transpile(String source, Map<String, FunctionSpecification> specifications,
                                     Map<String, ExternalFunctionContract> externals, String moduleName,
                                     String baseName) throws IOException {
        GeneratedModule module = generate(source, specifications, externals, moduleName);
        String skeleton = skeletonGenerator.generate(module.getContracts(), module.getModuleName());

        String base = ArtifactWriter.resolveBaseName(baseName);
        Path moduleFile = writer.writeModule(base, module.getSource());
        Path skeletonFile = writer.writeSkeleton(base, skeleton);

        logger.info("Transpiled module {} to {}", module.getModuleName(), moduleFile);
        return new TranspileResult(moduleFile, skeletonFile, module.getSource(), skeleton,
                module.getModuleName(), module.getContracts());
    }

    public Path getOutputDirectory() {
        return writer.getOutputDirectory();
    }
}
