package com.tau.verifier.visitor;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates source expressions to WhyML expression text.
 *
 * Every compound form is fully parenthesized, so the output never relies on WhyML
 * operator precedence. Names bound as reference cells in the {@link TranslationContext}
 * are dereferenced; parameters are emitted bare. Any expression kind without a
 * dedicated visit method is rejected with an {@link UnsupportedConstructException}.
 */
public class ExpressionTranslator extends GenericVisitorWithDefaults<String, TranslationContext> {

    /**
     * Translates one expression.
     *
     * @param expression The source expression
     * @param context The translation state of the enclosing function
     * @return The WhyML expression
     */
    public String translate(Expression expression, TranslationContext context) {
        return expression.accept(this, context);
    }

    @Override
    public String visit(NameExpr n, TranslationContext context) {
        String name = n.getNameAsString();
        return context.isRefCell(name) ? "!" + name : name;
    }

    @Override
    public String visit(IntegerLiteralExpr n, TranslationContext context) {
        return n.asNumber().toString();
    }

    @Override
    public String visit(LongLiteralExpr n, TranslationContext context) {
        return n.asNumber().toString();
    }

    @Override
    public String visit(BooleanLiteralExpr n, TranslationContext context) {
        return n.getValue() ? "true" : "false";
    }

    @Override
    public String visit(EnclosedExpr n, TranslationContext context) {
        // Output is already fully parenthesized
        return n.getInner().accept(this, context);
    }

    @Override
    public String visit(UnaryExpr n, TranslationContext context) {
        String operand = n.getExpression().accept(this, context);
        return switch (n.getOperator()) {
            case MINUS -> "(-" + operand + ")";
            case PLUS -> operand;
            case LOGICAL_COMPLEMENT -> "(not " + operand + ")";
            default -> throw new UnsupportedConstructException("UnaryExpr",
                    "Unsupported unary operator: " + n.getOperator().asString());
        };
    }

    @Override
    public String visit(BinaryExpr n, TranslationContext context) {
        BinaryExpr.Operator operator = n.getOperator();

        if (operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR) {
            List<Expression> operands = new ArrayList<>();
            flatten(n, operator, operands);
            String joiner = operator == BinaryExpr.Operator.AND ? " && " : " || ";
            return operands.stream()
                    .map(operand -> operand.accept(this, context))
                    .collect(Collectors.joining(joiner, "(", ")"));
        }

        String comparison = comparisonOperator(operator);
        if (comparison != null) {
            if (isComparison(n.getLeft()) || isComparison(n.getRight())) {
                throw new ChainedComparisonUnsupportedException(n.toString());
            }
            String left = n.getLeft().accept(this, context);
            String right = n.getRight().accept(this, context);
            return "(" + left + " " + comparison + " " + right + ")";
        }

        String left = n.getLeft().accept(this, context);
        String right = n.getRight().accept(this, context);
        return switch (operator) {
            case PLUS -> "(" + left + " + " + right + ")";
            case MINUS -> "(" + left + " - " + right + ")";
            case MULTIPLY -> "(" + left + " * " + right + ")";
            // int.ComputerDivision truncates toward zero, as Java does
            case DIVIDE -> "(div " + left + " " + right + ")";
            case REMAINDER -> "(mod " + left + " " + right + ")";
            default -> throw new UnsupportedConstructException("BinaryExpr",
                    "Unsupported binary operator: " + operator.asString());
        };
    }

    @Override
    public String visit(ConditionalExpr n, TranslationContext context) {
        String test = n.getCondition().accept(this, context);
        String thenBranch = n.getThenExpr().accept(this, context);
        String elseBranch = n.getElseExpr().accept(this, context);
        return "(if " + test + " then " + thenBranch + " else " + elseBranch + ")";
    }

    @Override
    public String visit(MethodCallExpr n, TranslationContext context) {
        if (n.getScope().isPresent()) {
            throw new UnsupportedConstructException("MethodCallExpr",
                    "Only simple function calls supported: " + n);
        }
        String callee = n.getNameAsString();
        if (!context.isCallable(callee)) {
            throw new UnknownFunctionException(callee);
        }
        String arguments = n.getArguments().stream()
                .map(argument -> argument.accept(this, context))
                .collect(Collectors.joining(", "));
        return callee + "(" + arguments + ")";
    }

    @Override
    public String defaultAction(Node n, TranslationContext context) {
        String kind = n.getClass().getSimpleName();
        throw new UnsupportedConstructException(kind, "Unsupported expression: " + kind);
    }

    @Override
    public String defaultAction(NodeList n, TranslationContext context) {
        throw new UnsupportedConstructException("NodeList", "Unsupported expression list");
    }

    /**
     * Collects the operands of a same-operator chain. Parenthesized operands stay nested.
     */
    private void flatten(Expression expression, BinaryExpr.Operator operator, List<Expression> operands) {
        if (expression.isBinaryExpr() && expression.asBinaryExpr().getOperator() == operator) {
            BinaryExpr binary = expression.asBinaryExpr();
            flatten(binary.getLeft(), operator, operands);
            flatten(binary.getRight(), operator, operands);
        } else {
            operands.add(expression);
        }
    }

    private boolean isComparison(Expression expression) {
        return expression.isBinaryExpr() && comparisonOperator(expression.asBinaryExpr().getOperator()) != null;
    }

    /**
     * Converts a comparison operator to WhyML, or null if the operator is not a comparison.
     */
    private static String comparisonOperator(BinaryExpr.Operator operator) {
        return switch (operator) {
            case EQUALS -> "=";
            case NOT_EQUALS -> "<>";
            case LESS -> "<";
            case LESS_EQUALS -> "<=";
            case GREATER -> ">";
            case GREATER_EQUALS -> ">=";
            default -> null;
        };
    }
}
