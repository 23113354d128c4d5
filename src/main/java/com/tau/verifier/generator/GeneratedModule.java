package com.tau.verifier.generator;

import com.tau.verifier.model.FunctionContract;

import java.util.List;

/**
 * An assembled WhyML module together with the contracts it was built from.
 */
public final class GeneratedModule {

    private final String source;
    private final List<FunctionContract> contracts;
    private final String moduleName;

    public GeneratedModule(String source, List<FunctionContract> contracts, String moduleName) {
        this.source = source;
        this.contracts = List.copyOf(contracts);
        this.moduleName = moduleName;
    }

    public String getSource() {
        return source;
    }

    /**
     * The function contracts, in module order.
     */
    public List<FunctionContract> getContracts() {
        return contracts;
    }

    public String getModuleName() {
        return moduleName;
    }
}
