package com.tau.verifier.oracle;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.tau.verifier.model.AnnotatedFunction;
import com.tau.verifier.model.BugAnalysis;
import com.tau.verifier.model.GeneratedSpecification;
import com.tau.verifier.model.LoopContract;
import com.tau.verifier.processor.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic fallback oracle that recognizes counting loops.
 *
 * For {@code while (i < n)} it proposes {@code 0 <= !i <= n}, for {@code while (i <= n)}
 * it proposes {@code 0 <= !i <= n + 1}, both with variant {@code n - !i}. A counter
 * {@code c = c + 1} stepping in lockstep with {@code i} from the same start adds
 * {@code !c = !i}. Anything else gets the trivial contract. It never refines,
 * classifies or suggests specifications.
 */
public class HeuristicContractOracle implements ContractOracle {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicContractOracle.class);

    private final SourceParser parser;

    public HeuristicContractOracle() {
        this(new SourceParser());
    }

    public HeuristicContractOracle(SourceParser parser) {
        this.parser = parser;
    }

    @Override
    public Optional<LoopContract> proposeContract(AnnotatedFunction function) {
        LoopContract contract;
        try {
            contract = infer(function);
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot parse {} for loop heuristics: {}", function.getName(), e.getMessage());
            contract = LoopContract.trivial();
        }
        logger.info("Heuristic contract for {}: {}", function.getName(), contract);
        return Optional.of(contract);
    }

    @Override
    public Optional<LoopContract> refineContract(AnnotatedFunction function, LoopContract current, String proverOutput) {
        return Optional.empty();
    }

    @Override
    public Optional<BugAnalysis> classifyBug(AnnotatedFunction function, String proverOutput) {
        return Optional.empty();
    }

    @Override
    public Optional<GeneratedSpecification> suggestSpecification(AnnotatedFunction function) {
        return Optional.empty();
    }

    private LoopContract infer(AnnotatedFunction function) {
        Optional<MethodDeclaration> method = parser.parseMethods(function.getSource()).stream()
                .filter(m -> m.getNameAsString().equals(function.getName()))
                .findFirst();
        if (method.isEmpty()) {
            return LoopContract.trivial();
        }

        LoopShapeVisitor visitor = new LoopShapeVisitor();
        method.get().accept(visitor, null);
        if (visitor.loop == null) {
            return LoopContract.trivial();
        }

        Expression condition = visitor.loop.getCondition();
        while (condition.isEnclosedExpr()) {
            condition = condition.asEnclosedExpr().getInner();
        }
        if (!condition.isBinaryExpr()) {
            return LoopContract.trivial();
        }
        BinaryExpr comparison = condition.asBinaryExpr();
        boolean strict = comparison.getOperator() == BinaryExpr.Operator.LESS;
        if (!strict && comparison.getOperator() != BinaryExpr.Operator.LESS_EQUALS) {
            return LoopContract.trivial();
        }
        if (!comparison.getLeft().isNameExpr() || !isSimpleBound(comparison.getRight())) {
            return LoopContract.trivial();
        }

        String counter = comparison.getLeft().asNameExpr().getNameAsString();
        String bound = comparison.getRight().toString();
        String lower = visitor.initialValues.getOrDefault(counter, "0");

        List<String> invariants = new ArrayList<>();
        invariants.add(lower + " <= !" + counter + " <= " + bound + (strict ? "" : " + 1"));

        // Paired counter: same start, same unit step
        if (visitor.unitIncrements.contains(counter) && visitor.initialValues.containsKey(counter)) {
            for (String other : visitor.unitIncrements) {
                if (!other.equals(counter) && lower.equals(visitor.initialValues.get(other))) {
                    invariants.add("!" + other + " = !" + counter);
                }
            }
        }
        return new LoopContract(invariants, bound + " - !" + counter);
    }

    private static boolean isSimpleBound(Expression bound) {
        return bound.isNameExpr() || bound.isIntegerLiteralExpr();
    }

    /**
     * Records the first while loop, literal initial values of locals declared before it,
     * and the names incremented by one inside it.
     */
    private static class LoopShapeVisitor extends VoidVisitorAdapter<Void> {
        private WhileStmt loop;
        private final Map<String, String> initialValues = new HashMap<>();
        private final List<String> unitIncrements = new ArrayList<>();

        @Override
        public void visit(WhileStmt whileStmt, Void arg) {
            if (loop != null) {
                return;
            }
            loop = whileStmt;
            collectIncrements(whileStmt.getBody());
        }

        @Override
        public void visit(VariableDeclarationExpr declaration, Void arg) {
            if (loop == null) {
                declaration.getVariables().forEach(var -> var.getInitializer().ifPresent(init -> {
                    if (init.isIntegerLiteralExpr()) {
                        initialValues.put(var.getNameAsString(), init.asIntegerLiteralExpr().getValue());
                    }
                }));
            }
            super.visit(declaration, arg);
        }

        private void collectIncrements(Statement body) {
            body.findAll(AssignExpr.class).forEach(assign -> {
                if (assign.getOperator() != AssignExpr.Operator.ASSIGN || !assign.getTarget().isNameExpr()) {
                    return;
                }
                String name = assign.getTarget().asNameExpr().getNameAsString();
                Expression value = assign.getValue();
                if (value.isBinaryExpr()) {
                    BinaryExpr sum = value.asBinaryExpr();
                    if (sum.getOperator() == BinaryExpr.Operator.PLUS
                            && sum.getLeft().isNameExpr()
                            && sum.getLeft().asNameExpr().getNameAsString().equals(name)
                            && sum.getRight().isIntegerLiteralExpr()
                            && sum.getRight().asIntegerLiteralExpr().getValue().equals("1")
                            && !unitIncrements.contains(name)) {
                        unitIncrements.add(name);
                    }
                }
            });
        }
    }
}
