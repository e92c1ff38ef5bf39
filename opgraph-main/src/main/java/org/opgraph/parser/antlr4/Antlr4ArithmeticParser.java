package org.opgraph.parser.antlr4;

import com.github.javaparser.ast.expr.Expression;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.opgraph.ExpressionParseException;

/**
 * Front end for arithmetic expressions: ANTLR does the lexing and parsing,
 * {@link ArithmeticToJavaParserVisitor} turns the parse tree into a JavaParser
 * expression tree for lowering.
 * <p>
 * Lexing and parsing are split so callers can inspect the tokens
 * ({@link ExpressionShape}) before the recursive parse runs.
 */
public final class Antlr4ArithmeticParser {

    private Antlr4ArithmeticParser() {
    }

    /**
     * Lexes the whole input. Unknown characters become tokens the parser
     * rejects, so lexing itself does not fail.
     */
    public static CommonTokenStream tokenize(String expression) {
        ArithmeticLexer lexer = new ArithmeticLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ThrowingErrorListener(expression));

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        return tokens;
    }

    /**
     * Parses previously lexed input as one expression.
     *
     * @throws ExpressionParseException on the first syntax error, with its position
     */
    public static ParseTree parse(String expression, CommonTokenStream tokens) {
        ArithmeticParser parser = new ArithmeticParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ThrowingErrorListener(expression));

        return parser.parse();
    }

    public static ParseTree parseExpressionAsAntlrAST(String expression) {
        return parse(expression, tokenize(expression));
    }

    public static Expression toJavaParserAST(ParseTree tree) {
        return new ArithmeticToJavaParserVisitor().visit(tree);
    }

    public static Expression parseExpression(String expression) {
        return toJavaParserAST(parseExpressionAsAntlrAST(expression));
    }
}
