package com.tau.verifier.model;

import java.util.List;

/**
 * One translated function: its WhyML signature, contract and imperative body.
 */
public final class FunctionContract {

    private final String name;
    private final List<FunctionParameter> parameters;
    private final String returnType;
    private final String requires;
    private final String ensures;
    private final LoopContract loopContract;
    private final String body;

    public FunctionContract(String name, List<FunctionParameter> parameters, String returnType,
                            String requires, String ensures, LoopContract loopContract, String body) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType;
        this.requires = requires;
        this.ensures = ensures;
        this.loopContract = loopContract;
        this.body = body;
    }

    public String getName() {
        return name;
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

    /**
     * @return the loop contract, or null when none was supplied
     */
    public LoopContract getLoopContract() {
        return loopContract;
    }

    public String getBody() {
        return body;
    }
}
