package com.tau.verifier.visitor;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.*;
import com.tau.verifier.model.LoopContract;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates a statement sequence to an imperative WhyML body.
 *
 * Supported statements are single-name assignments, two-armed conditionals, one
 * {@code while} loop per function and {@code return} with a value. Branches share
 * the context's ref-cell set, so a name introduced in one arm is a ref-cell afterwards.
 */
public class StatementTranslator {

    private final ExpressionTranslator expressions;

    public StatementTranslator() {
        this(new ExpressionTranslator());
    }

    public StatementTranslator(ExpressionTranslator expressions) {
        this.expressions = expressions;
    }

    /**
     * Translates statements in order.
     *
     * @param statements The statements to translate
     * @param context The translation state of the enclosing function
     * @param loopContract Invariants and variant for the function's loop, or null
     * @return The WhyML body, one construct per line group
     */
    public String translate(List<Statement> statements, TranslationContext context, LoopContract loopContract) {
        List<String> lines = new ArrayList<>();
        for (Statement statement : statements) {
            String translated = translateStatement(statement, context, loopContract);
            if (!translated.isEmpty()) {
                lines.add(translated);
            }
        }
        return String.join("\n", lines);
    }

    private String translateStatement(Statement statement, TranslationContext context, LoopContract loopContract) {
        if (statement instanceof BlockStmt) {
            return translate(((BlockStmt) statement).getStatements(), context, loopContract);
        }
        if (statement instanceof ExpressionStmt) {
            return translateExpressionStatement((ExpressionStmt) statement, context);
        }
        if (statement instanceof IfStmt) {
            return translateIf((IfStmt) statement, context, loopContract);
        }
        if (statement instanceof WhileStmt) {
            context.enterLoop();
            return translateWhile((WhileStmt) statement, context, loopContract);
        }
        if (statement instanceof ForStmt || statement instanceof ForEachStmt || statement instanceof DoStmt) {
            // Counts toward the loop limit before being rejected
            context.enterLoop();
            String kind = statement.getClass().getSimpleName();
            throw new UnsupportedConstructException(kind, "Only while loops supported, found " + kind);
        }
        if (statement instanceof ReturnStmt) {
            ReturnStmt returnStmt = (ReturnStmt) statement;
            Expression value = returnStmt.getExpression()
                    .orElseThrow(() -> new UnsupportedConstructException("ReturnStmt",
                            "Return without a value is not supported"));
            return expressions.translate(value, context);
        }
        if (statement instanceof EmptyStmt) {
            return "";
        }
        String kind = statement.getClass().getSimpleName();
        throw new UnsupportedConstructException(kind, "Unsupported statement: " + kind);
    }

    private String translateExpressionStatement(ExpressionStmt statement, TranslationContext context) {
        Expression expression = statement.getExpression();

        if (expression instanceof VariableDeclarationExpr) {
            VariableDeclarationExpr declaration = (VariableDeclarationExpr) expression;
            if (declaration.getVariables().size() != 1) {
                throw new UnsupportedConstructException("VariableDeclarationExpr",
                        "Only single-variable declarations supported: " + declaration);
            }
            VariableDeclarator variable = declaration.getVariable(0);
            Expression initializer = variable.getInitializer()
                    .orElseThrow(() -> new UnsupportedConstructException("VariableDeclarator",
                            "Declaration without initializer: " + variable.getNameAsString()));
            return assign(variable.getNameAsString(), initializer, context);
        }

        if (expression instanceof AssignExpr) {
            AssignExpr assignment = (AssignExpr) expression;
            if (assignment.getOperator() != AssignExpr.Operator.ASSIGN) {
                throw new UnsupportedConstructException("AssignExpr",
                        "Compound assignment not supported: " + assignment);
            }
            if (!assignment.getTarget().isNameExpr()) {
                throw new UnsupportedConstructException("AssignExpr",
                        "Only simple variable assignments supported: " + assignment);
            }
            if (assignment.getValue().isAssignExpr()) {
                throw new UnsupportedConstructException("AssignExpr",
                        "Chained assignment not supported: " + assignment);
            }
            return assign(assignment.getTarget().asNameExpr().getNameAsString(), assignment.getValue(), context);
        }

        String kind = expression.getClass().getSimpleName();
        throw new UnsupportedConstructException(kind, "Unsupported statement expression: " + kind);
    }

    private String assign(String name, Expression value, TranslationContext context) {
        // The right-hand side reads the name's old binding
        String translated = expressions.translate(value, context);
        if (context.isRefCell(name)) {
            return name + " := " + translated + ";";
        }
        context.addRefCell(name);
        return "let " + name + " = ref " + translated + " in";
    }

    private String translateIf(IfStmt statement, TranslationContext context, LoopContract loopContract) {
        String condition = expressions.translate(statement.getCondition(), context);
        Statement elseStatement = statement.getElseStmt()
                .orElseThrow(() -> new MissingElseBranchException(statement.getCondition().toString()));

        String thenBody = translateStatement(statement.getThenStmt(), context, loopContract);
        String elseBody = translateStatement(elseStatement, context, loopContract);

        return "if " + condition + " then (\n"
                + indent(thenBody) + "\n"
                + ") else (\n"
                + indent(elseBody) + "\n"
                + ")";
    }

    private String translateWhile(WhileStmt statement, TranslationContext context, LoopContract loopContract) {
        String condition = expressions.translate(statement.getCondition(), context);
        String body = translateStatement(statement.getBody(), context, loopContract);

        List<String> parts = new ArrayList<>();
        parts.add("while " + condition + " do");
        if (loopContract != null) {
            for (String invariant : loopContract.getInvariants()) {
                parts.add("  invariant { " + invariant + " }");
            }
            if (loopContract.getVariant() != null) {
                parts.add("  variant { " + loopContract.getVariant() + " }");
            }
        }
        if (!body.isEmpty()) {
            parts.add(indent(body));
        }
        parts.add("done;");
        return String.join("\n", parts);
    }

    /**
     * Indents every non-blank line by two spaces.
     */
    public static String indent(String text) {
        return text.lines()
                .map(line -> line.isBlank() ? line : "  " + line)
                .collect(Collectors.joining("\n"));
    }
}
