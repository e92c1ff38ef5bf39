package org.opgraph.parser.antlr4;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.antlr.v4.runtime.Token;

/**
 * Size measures taken from the token stream before parsing, so oversized
 * input can be rejected without recursing over it.
 *
 * @param binaryOperators operators in infix position; each one yields exactly
 *                        one operation, so this is a lower bound on the
 *                        operations a successful decomposition emits
 * @param nestingDepth    deepest combined count of open parentheses and
 *                        prefix operators still waiting for their operand
 */
public record ExpressionShape(int binaryOperators, int nestingDepth) {

    public static ExpressionShape of(List<? extends Token> tokens) {
        int binaryOperators = 0;
        int depth = 0;
        int maxDepth = 0;
        // prefix operators pending at the current parenthesis level
        int pending = 0;
        Deque<Integer> outerPending = new ArrayDeque<>();
        boolean afterOperand = false;

        for (Token token : tokens) {
            switch (token.getType()) {
                case ArithmeticLexer.PLUS:
                case ArithmeticLexer.MINUS:
                case ArithmeticLexer.STAR:
                case ArithmeticLexer.SLASH:
                case ArithmeticLexer.PERCENT:
                case ArithmeticLexer.CARET:
                    if (afterOperand) {
                        binaryOperators++;
                    } else {
                        pending++;
                        depth++;
                    }
                    afterOperand = false;
                    break;
                case ArithmeticLexer.LPAREN:
                    outerPending.push(pending);
                    pending = 0;
                    depth++;
                    afterOperand = false;
                    break;
                case ArithmeticLexer.NUMBER:
                    depth -= pending;
                    pending = 0;
                    afterOperand = true;
                    break;
                case ArithmeticLexer.RPAREN:
                    if (!outerPending.isEmpty()) {
                        depth -= pending + 1;
                        pending = outerPending.pop();
                        // the closed group is the operand of the outer prefix operators
                        depth -= pending;
                        pending = 0;
                    }
                    afterOperand = true;
                    break;
                default:
                    afterOperand = false;
                    break;
            }
            maxDepth = Math.max(maxDepth, depth);
        }
        return new ExpressionShape(binaryOperators, maxDepth);
    }
}
