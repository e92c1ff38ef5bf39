package org.opgraph.lowering;

import java.util.List;
import java.util.function.Supplier;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import org.opgraph.ErrorKind;
import org.opgraph.ExpressionLoweringException;
import org.opgraph.model.OperandToken;
import org.opgraph.model.Operation;
import org.opgraph.model.OperationType;
import org.opgraph.parser.util.AstUtils;

/**
 * Post-order walk that lowers an arithmetic tree into three-address style
 * operations. Each visit returns the token holding the node's value and
 * appends any emitted operation to the accumulator passed as argument.
 * <p>
 * The left operand is lowered completely before the right one, so every
 * reference in the accumulator points at an earlier element. The visitor
 * keeps no per-call state and may be shared between threads.
 */
public class OperationLoweringVisitor extends GenericVisitorWithDefaults<OperandToken, List<Operation>> {

    private static final OperandToken.Literal ZERO = OperandToken.literal("0");

    private final Supplier<String> idGenerator;

    public OperationLoweringVisitor(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public OperandToken defaultAction(Node n, List<Operation> operations) {
        throw new ExpressionLoweringException(ErrorKind.INVALID_EXPRESSION, AstUtils.describe(n));
    }

    @Override
    public OperandToken visit(IntegerLiteralExpr n, List<Operation> operations) {
        return literal(n, n.getValue());
    }

    @Override
    public OperandToken visit(DoubleLiteralExpr n, List<Operation> operations) {
        return literal(n, n.getValue());
    }

    @Override
    public OperandToken visit(EnclosedExpr n, List<Operation> operations) {
        return n.getInner().accept(this, operations);
    }

    @Override
    public OperandToken visit(UnaryExpr n, List<Operation> operations) {
        if (n.getOperator() != UnaryExpr.Operator.MINUS) {
            throw new ExpressionLoweringException(ErrorKind.UNSUPPORTED_OPERATOR, AstUtils.describe(n));
        }
        OperandToken operand = n.getExpression().accept(this, operations);

        if (operand instanceof OperandToken.Literal literal && AstUtils.isNumeric(literal.text())) {
            return literal.negate();
        }
        return emit(OperationType.SUBTRACTION, ZERO, operand, operations);
    }

    @Override
    public OperandToken visit(BinaryExpr n, List<Operation> operations) {
        OperandToken left = n.getLeft().accept(this, operations);
        OperandToken right = n.getRight().accept(this, operations);

        OperationType type = AstUtils.getOperationType(n.getOperator());
        if (type == OperationType.DIVISION && right instanceof OperandToken.Literal literal && literal.isZero()) {
            throw new ExpressionLoweringException(ErrorKind.DIVISION_BY_ZERO, AstUtils.describe(n));
        }
        return emit(type, left, right, operations);
    }

    private OperandToken literal(Node n, String text) {
        if (!AstUtils.isDecimalLiteral(text)) {
            throw new ExpressionLoweringException(ErrorKind.INVALID_EXPRESSION, AstUtils.describe(n));
        }
        return OperandToken.literal(text);
    }

    private OperandToken emit(OperationType type, OperandToken left, OperandToken right, List<Operation> operations) {
        Operation operation = new Operation(idGenerator.get(), type, left, right);
        operations.add(operation);
        return operation.asReference();
    }
}
