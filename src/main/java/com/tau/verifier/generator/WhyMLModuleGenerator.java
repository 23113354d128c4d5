package com.tau.verifier.generator;

import com.tau.verifier.model.ExternalFunctionContract;
import com.tau.verifier.model.FunctionContract;
import com.tau.verifier.model.FunctionParameter;
import com.tau.verifier.visitor.StatementTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assembles translated functions into a WhyML module.
 *
 * External functions are declared as abstract {@code val}s before any definition,
 * so every call site refers to an already declared symbol.
 */
public class WhyMLModuleGenerator {

    private static final Logger logger = LoggerFactory.getLogger(WhyMLModuleGenerator.class);

    static final List<String> IMPORTS = List.of(
            "use int.Int",
            "use bool.Bool",
            "use ref.Ref",
            "use int.ComputerDivision");

    /**
     * Builds the module text.
     *
     * @param functions The translated functions; at least one, with unique names
     * @param externals Contracts of called functions not defined in the module, keyed by name; may be null
     * @param moduleName The module name, or null for {@code M_<first function>}
     * @return The generated module
     * @throws IllegalArgumentException if there are no functions or a name repeats
     */
    public GeneratedModule generate(List<FunctionContract> functions,
                                    Map<String, ExternalFunctionContract> externals,
                                    String moduleName) {
        if (functions == null || functions.isEmpty()) {
            throw new IllegalArgumentException("No functions found in source");
        }
        Set<String> names = new HashSet<>();
        for (FunctionContract function : functions) {
            if (!names.add(function.getName())) {
                throw new IllegalArgumentException("Duplicate function name: " + function.getName());
            }
        }

        String name = moduleName != null && !moduleName.isBlank()
                ? moduleName
                : "M_" + functions.get(0).getName();

        List<String> lines = new ArrayList<>();
        lines.add("module " + name);
        lines.addAll(IMPORTS);
        lines.add("");

        if (externals != null) {
            for (Map.Entry<String, ExternalFunctionContract> entry : externals.entrySet()) {
                ExternalFunctionContract external = entry.getValue();
                lines.add("val " + signature(entry.getKey(), external.getParameters()) + " : " + external.getReturnType());
                lines.add("  requires { " + external.getRequires() + " }");
                lines.add("  ensures  { " + external.getEnsures() + " }");
                lines.add("");
            }
        }

        for (FunctionContract function : functions) {
            lines.add("let " + signature(function.getName(), function.getParameters())
                    + " : " + function.getReturnType() + " =");
            lines.add("  requires { " + function.getRequires() + " }");
            lines.add("  ensures  { " + function.getEnsures() + " }");
            lines.add(StatementTranslator.indent(function.getBody()));
            lines.add("");
        }

        lines.add("end");

        logger.debug("Generated module {} with {} function(s)", name, functions.size());
        return new GeneratedModule(String.join("\n", lines), functions, name);
    }

    private static String signature(String name, List<FunctionParameter> parameters) {
        // a function with a contract needs at least the unit parameter
        if (parameters.isEmpty()) {
            return name + " ()";
        }
        return name + " " + parameters.stream()
                .map(FunctionParameter::toString)
                .collect(Collectors.joining(" "));
    }
}
