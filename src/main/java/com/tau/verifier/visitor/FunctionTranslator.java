package com.tau.verifier.visitor;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.type.Type;
import com.tau.verifier.model.FunctionContract;
import com.tau.verifier.model.FunctionParameter;
import com.tau.verifier.model.FunctionSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Translates one method declaration into a {@link FunctionContract}.
 *
 * Each call uses a fresh {@link TranslationContext}, so ref-cells and the loop
 * count never leak between functions. Any translation error is attributed to the
 * method before it propagates.
 */
public class FunctionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(FunctionTranslator.class);

    private final StatementTranslator statements;

    public FunctionTranslator() {
        this(new StatementTranslator());
    }

    public FunctionTranslator(StatementTranslator statements) {
        this.statements = statements;
    }

    /**
     * Translates a method.
     *
     * @param method The method to translate; must have a body
     * @param specification Its specification, or null for the trivial one
     * @param knownFunctions Names of the functions defined in the same module
     * @param externalFunctions Names of functions with an external contract
     * @return The translated function
     * @throws TranslationException if the method uses anything outside the supported subset
     */
    public FunctionContract translate(MethodDeclaration method, FunctionSpecification specification,
                                      Set<String> knownFunctions, Set<String> externalFunctions) {
        String name = method.getNameAsString();
        FunctionSpecification spec = specification != null ? specification : new FunctionSpecification();
        try {
            List<FunctionParameter> parameters = new ArrayList<>();
            for (Parameter parameter : method.getParameters()) {
                parameters.add(new FunctionParameter(parameter.getNameAsString(), toWhyType(parameter.getType())));
            }
            String returnType = toWhyType(method.getType());

            if (method.getBody().isEmpty()) {
                throw new UnsupportedConstructException("MethodDeclaration", "Method has no body: " + name);
            }

            TranslationContext context = new TranslationContext(knownFunctions, externalFunctions);
            String body = statements.translate(method.getBody().get().getStatements(), context, spec.getLoopContract());

            logger.debug("Translated {} with ref-cells {}", name, context.getRefCells());
            return new FunctionContract(name, parameters, returnType, spec.getRequires(), spec.getEnsures(),
                    spec.getLoopContract(), body);
        } catch (TranslationException e) {
            throw e.inFunction(name);
        }
    }

    /**
     * Maps a source type to its WhyML type. Integral types become {@code int}; booleans become {@code bool}.
     *
     * @param type The declared source type
     * @return The WhyML type name
     * @throws UnsupportedConstructException for any other type
     */
    public static String toWhyType(Type type) {
        String typeName = type.isClassOrInterfaceType()
                ? type.asClassOrInterfaceType().getNameAsString()
                : type.asString();
        return switch (typeName) {
            case "int", "long", "short", "byte", "Integer", "Long", "Short", "Byte", "BigInteger" -> "int";
            case "boolean", "Boolean" -> "bool";
            default -> throw new UnsupportedConstructException(type.getClass().getSimpleName(),
                    "Unsupported type: " + type.asString());
        };
    }
}
