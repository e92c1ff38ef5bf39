package org.opgraph.parser.antlr4;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.opgraph.ErrorKind;
import org.opgraph.ExpressionLoweringException;
import org.opgraph.parser.util.AstUtils;

/**
 * Builds the JavaParser tree from an {@link ArithmeticParser} parse tree.
 * Only literals, parentheses, unary and binary operators are produced.
 * <p>
 * Context text is only rendered for error messages: {@code getText()} walks
 * the whole subtree.
 */
class ArithmeticToJavaParserVisitor extends ArithmeticBaseVisitor<Expression> {

    @Override
    public Expression visitParse(ArithmeticParser.ParseContext ctx) {
        if (ctx.expression() == null) {
            throw new ExpressionLoweringException(ErrorKind.INVALID_EXPRESSION, ctx.getText());
        }
        return visit(ctx.expression());
    }

    @Override
    public Expression visitUnary(ArithmeticParser.UnaryContext ctx) {
        if (ctx.expression() == null || ctx.op == null) {
            throw new ExpressionLoweringException(ErrorKind.INVALID_EXPRESSION, ctx.getText());
        }
        UnaryExpr.Operator operator = AstUtils.getUnaryExprOperator(ctx.op.getText());
        return new UnaryExpr(visit(ctx.expression()), operator);
    }

    @Override
    public Expression visitMultiplicative(ArithmeticParser.MultiplicativeContext ctx) {
        return binary(ctx, ctx.left, ctx.op, ctx.right);
    }

    @Override
    public Expression visitAdditive(ArithmeticParser.AdditiveContext ctx) {
        return binary(ctx, ctx.left, ctx.op, ctx.right);
    }

    @Override
    public Expression visitParenthesized(ArithmeticParser.ParenthesizedContext ctx) {
        if (ctx.expression() == null || ctx.RPAREN() == null) {
            throw new ExpressionLoweringException(ErrorKind.INVALID_PAREN_EXPRESSION, ctx.getText());
        }
        return new EnclosedExpr(visit(ctx.expression()));
    }

    @Override
    public Expression visitLiteral(ArithmeticParser.LiteralContext ctx) {
        String text = ctx.NUMBER().getText();
        if (text.indexOf('.') >= 0) {
            return new DoubleLiteralExpr(text);
        }
        return new IntegerLiteralExpr(text);
    }

    private Expression binary(ParserRuleContext ctx, ArithmeticParser.ExpressionContext left, Token op,
                              ArithmeticParser.ExpressionContext right) {
        if (left == null || right == null || op == null) {
            throw new ExpressionLoweringException(ErrorKind.INVALID_BINARY_OPERATION, ctx.getText());
        }
        BinaryExpr.Operator operator = AstUtils.getBinaryExprOperator(op.getText());
        return new BinaryExpr(visit(left), visit(right), operator);
    }
}
