package org.opgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import com.github.javaparser.ast.expr.Expression;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jboss.logging.Logger;
import org.opgraph.lowering.ComplexityGuard;
import org.opgraph.lowering.OperationIds;
import org.opgraph.lowering.OperationLoweringVisitor;
import org.opgraph.model.OperandToken;
import org.opgraph.model.Operation;
import org.opgraph.parser.antlr4.Antlr4ArithmeticParser;
import org.opgraph.parser.antlr4.ExpressionShape;

public class ArithmeticDecomposer implements ExpressionDecomposer {

    private static final Logger LOG = Logger.getLogger(ArithmeticDecomposer.class);

    private final ComplexityGuard complexityGuard;
    private final OperationLoweringVisitor loweringVisitor;

    private ArithmeticDecomposer(int maxOperations, int maxNestingDepth, Supplier<String> idGenerator) {
        this.complexityGuard = new ComplexityGuard(maxOperations, maxNestingDepth);
        this.loweringVisitor = new OperationLoweringVisitor(idGenerator);
    }

    public static ArithmeticDecomposer withDefaults() {
        return builder().build();
    }

    public static ArithmeticDecomposer fromConfig(DecomposerConfig config) {
        return builder()
                .maxOperations(config.maxOperations())
                .maxNestingDepth(config.maxNestingDepth())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxOperations() {
        return complexityGuard.getMaxOperations();
    }

    public int getMaxNestingDepth() {
        return complexityGuard.getMaxNestingDepth();
    }

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    @Override
    public Decomposition decompose(String expression) {
        Parsed parsed = parse(expression);

        List<Operation> operations = new ArrayList<>();
        OperandToken result;
        try {
            // every infix operator emits one operation, so oversized chains fail before the tree walk
            complexityGuard.check(parsed.shape().binaryOperators());
            Expression tree = Antlr4ArithmeticParser.toJavaParserAST(parsed.tree());
            result = tree.accept(loweringVisitor, operations);
            complexityGuard.check(operations.size());
        } catch (OpGraphException e) {
            LOG.debugf("Rejected expression '%s': %s", expression, e.getMessage());
            throw e;
        }

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Decomposed '%s' into %d operation(s), result %s", expression, operations.size(), result.encode());
        }
        return new Decomposition(operations, result);
    }

    @Override
    public void setCalculationId(List<Operation> operations, String calculationId) {
        for (Operation operation : operations) {
            operation.setCalculationId(calculationId);
        }
    }

    private Parsed parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw ExpressionParseException.empty(expression);
        }
        try {
            CommonTokenStream tokens = Antlr4ArithmeticParser.tokenize(expression);
            ExpressionShape shape = ExpressionShape.of(tokens.getTokens());
            complexityGuard.checkNesting(shape.nestingDepth());
            return new Parsed(Antlr4ArithmeticParser.parse(expression, tokens), shape);
        } catch (OpGraphException e) {
            LOG.debugf("Invalid expression '%s': %s", expression, e.getMessage());
            throw e;
        }
    }

    private record Parsed(ParseTree tree, ExpressionShape shape) {
    }

    public static final class Builder {

        private int maxOperations = ComplexityGuard.DEFAULT_MAX_OPERATIONS;
        private int maxNestingDepth = ComplexityGuard.DEFAULT_MAX_NESTING_DEPTH;
        private Supplier<String> idGenerator = OperationIds::next;

        private Builder() {
        }

        /**
         * Zero or negative selects the default limit.
         */
        public Builder maxOperations(int maxOperations) {
            this.maxOperations = maxOperations;
            return this;
        }

        /**
         * Zero or negative selects the default depth.
         */
        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
            return this;
        }

        public ArithmeticDecomposer build() {
            return new ArithmeticDecomposer(maxOperations, maxNestingDepth, idGenerator);
        }
    }
}
