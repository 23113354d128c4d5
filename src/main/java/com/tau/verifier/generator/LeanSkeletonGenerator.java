package com.tau.verifier.generator;

import com.tau.verifier.model.FunctionContract;
import com.tau.verifier.model.FunctionParameter;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits a Lean document restating each function's obligation as an unproved theorem.
 * The theorems are placeholders for human review, not proofs.
 */
public class LeanSkeletonGenerator {

    /**
     * @param functions The translated functions
     * @param moduleName The WhyML module the functions belong to
     * @return The Lean source
     */
    public String generate(List<FunctionContract> functions, String moduleName) {
        List<String> lines = new ArrayList<>();
        lines.add("-- Lean theorems for " + moduleName);
        lines.add("set_option autoImplicit true");
        lines.add("set_option sorryPermitted true");
        lines.add("");

        for (FunctionContract function : functions) {
            StringBuilder header = new StringBuilder("theorem ").append(function.getName()).append("_correct");
            for (FunctionParameter parameter : function.getParameters()) {
                header.append(" (").append(parameter.getName()).append(" : ")
                        .append(toLeanType(parameter.getType())).append(")");
            }
            header.append(" : Prop := by");

            lines.add("-- requires: " + function.getRequires());
            lines.add("-- ensures: " + function.getEnsures());
            lines.add(header.toString());
            lines.add("  admit");
            lines.add("");
        }
        return String.join("\n", lines);
    }

    static String toLeanType(String whyType) {
        return switch (whyType) {
            case "int" -> "Int";
            case "bool" -> "Bool";
            default -> whyType;
        };
    }
}
