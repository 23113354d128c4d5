package com.tau.verifier.model;

import java.util.List;

/**
 * Contract of a function that is called from translated code but not defined
 * in the translated module. It is declared as an abstract {@code val}.
 */
public final class ExternalFunctionContract {

    private final List<FunctionParameter> parameters;
    private final String returnType;
    private final String requires;
    private final String ensures;

    public ExternalFunctionContract(List<FunctionParameter> parameters, String returnType,
                                    String requires, String ensures) {
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType;
        this.requires = requires == null ? FunctionSpecification.TRIVIAL : requires;
        this.ensures = ensures == null ? FunctionSpecification.TRIVIAL : ensures;
    }

    public List<FunctionParameter> getParameters() {
        return parameters;
    }

    public String getReturnType() {
        return returnType;
    }

    public String getRequires() {
        return requires;
    }

    public String getEnsures() {
        return ensures;
    }
}
