package org.opgraph.parser.util;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Pattern;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.opgraph.ErrorKind;
import org.opgraph.ExpressionLoweringException;
import org.opgraph.model.OperationType;

public class AstUtils {

    private static final Pattern DECIMAL_LITERAL = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");

    private static final Map<String, BinaryExpr.Operator> OPERATOR_MAP = Map.of(
            "+", BinaryExpr.Operator.PLUS,
            "-", BinaryExpr.Operator.MINUS,
            "*", BinaryExpr.Operator.MULTIPLY,
            "/", BinaryExpr.Operator.DIVIDE,
            "%", BinaryExpr.Operator.REMAINDER,
            "^", BinaryExpr.Operator.XOR
    );

    private static final Map<String, UnaryExpr.Operator> UNARY_OPERATOR_MAP = Map.of(
            "+", UnaryExpr.Operator.PLUS,
            "-", UnaryExpr.Operator.MINUS
    );

    private static final Map<BinaryExpr.Operator, OperationType> OPERATION_TYPES = Map.of(
            BinaryExpr.Operator.PLUS, OperationType.ADDITION,
            BinaryExpr.Operator.MINUS, OperationType.SUBTRACTION,
            BinaryExpr.Operator.MULTIPLY, OperationType.MULTIPLICATION,
            BinaryExpr.Operator.DIVIDE, OperationType.DIVISION
    );

    private AstUtils() {
    }

    public static BinaryExpr.Operator getBinaryExprOperator(String operatorText) {
        BinaryExpr.Operator operator = OPERATOR_MAP.get(operatorText);
        if (operator == null) {
            throw new ExpressionLoweringException(ErrorKind.UNSUPPORTED_OPERATOR, operatorText);
        }
        return operator;
    }

    public static UnaryExpr.Operator getUnaryExprOperator(String operatorText) {
        UnaryExpr.Operator operator = UNARY_OPERATOR_MAP.get(operatorText);
        if (operator == null) {
            throw new ExpressionLoweringException(ErrorKind.UNSUPPORTED_OPERATOR, operatorText);
        }
        return operator;
    }

    public static OperationType getOperationType(BinaryExpr.Operator operator) {
        OperationType type = OPERATION_TYPES.get(operator);
        if (type == null) {
            throw new ExpressionLoweringException(ErrorKind.UNSUPPORTED_OPERATOR, operator.asString());
        }
        return type;
    }

    /**
     * Plain decimal notation only: no exponent, suffix, radix prefix or
     * digit separators.
     */
    public static boolean isDecimalLiteral(String text) {
        return text != null && DECIMAL_LITERAL.matcher(text).matches();
    }

    public static boolean isNumeric(String text) {
        if (!isDecimalLiteral(text)) {
            return false;
        }
        try {
            new BigDecimal(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static String describe(Node node) {
        return node.getClass().getSimpleName() + " '" + node + "'";
    }
}
