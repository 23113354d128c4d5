package com.tau.verifier.processor;

import com.tau.verifier.model.FunctionContract;

import java.nio.file.Path;
import java.util.List;

/**
 * Generated documents of one transpilation and the files they were written to.
 */
public final class TranspileResult {

    private final Path moduleFile;
    private final Path skeletonFile;
    private final String moduleSource;
    private final String skeletonSource;
    private final String moduleName;
    private final List<FunctionContract> functions;

    public TranspileResult(Path moduleFile, Path skeletonFile, String moduleSource, String skeletonSource,
                           String moduleName, List<FunctionContract> functions) {
        this.moduleFile = moduleFile;
        this.skeletonFile = skeletonFile;
        this.moduleSource = moduleSource;
        this.skeletonSource = skeletonSource;
        this.moduleName = moduleName;
        this.functions = List.copyOf(functions);
    }

    public Path getModuleFile() {
        return moduleFile;
    }

    public Path getSkeletonFile() {
        return skeletonFile;
    }

    public String getModuleSource() {
        return moduleSource;
    }

    public String getSkeletonSource() {
        return skeletonSource;
    }

    public String getModuleName() {
        return moduleName;
    }

    public List<FunctionContract> getFunctions() {
        return functions;
    }
}
