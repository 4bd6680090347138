package com.robinpath.compiler.parser;

import com.robinpath.compiler.ast.PathSegment;
import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.robinpath.compiler.lexer.TokenType.*;

/**
 * 表达式解析器：命令参数（单个值）和条件表达式（带运算符优先级）
 */
class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 条件表达式 ============

    /**
     * 优先级从低到高：or、and、比较、加减、乘除模、一元 not
     */
    Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (parser.check(KW_OR) || parser.check(OR)) {
            Token op = parser.advance();
            left = new BinaryExpr(left, "or", op.getLexeme(), parseAnd(), false);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseComparison();
        while (parser.check(KW_AND) || parser.check(AND)) {
            Token op = parser.advance();
            left = new BinaryExpr(left, "and", op.getLexeme(), parseComparison(), false);
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        while (parser.current.isOneOf(EQ, NE, LT, GT, LE, GE)) {
            Token op = parser.advance();
            left = new BinaryExpr(left, op.getLexeme(), null, parseAdditive(), false);
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.current.isOneOf(PLUS, MINUS)) {
            Token op = parser.advance();
            left = new BinaryExpr(left, op.getLexeme(), null, parseMultiplicative(), false);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.current.isOneOf(MUL, DIV, MOD)) {
            Token op = parser.advance();
            left = new BinaryExpr(left, op.getLexeme(), null, parseUnary(), false);
        }
        return left;
    }

    private Expression parseUnary() {
        if (parser.check(KW_NOT) || parser.check(NOT)) {
            Token op = parser.advance();
            Expression argument = parseUnary();
            UnaryExpr unary = new UnaryExpr(op.getLexeme(), argument);
            unary.setPosition(parser.span(op));
            return unary;
        }
        return parsePrimary();
    }

    /** 条件中的标识符是函数调用，后面紧跟的值都是它的参数 */
    private Expression parsePrimary() {
        if (parser.check(IDENTIFIER)) {
            Token callee = parser.advance();
            List<Expression> args = new ArrayList<Expression>();
            while (isValueStart(parser.current)) {
                args.add(parseArgument());
            }
            CallExpr call = new CallExpr(callee.getLexeme(), args);
            call.setPosition(parser.span(callee));
            return call;
        }
        return parseArgument();
    }

    // ============ 单个值 ============

    /**
     * 命令参数：字面量、变量、$、子表达式、对象/数组字面量、括号表达式或裸词
     */
    Expression parseArgument() {
        Token token = parser.current;
        Expression expr;
        switch (token.getType()) {
            case STRING:
                parser.advance();
                expr = new StringExpr((String) token.getLiteral());
                break;
            case NUMBER:
                parser.advance();
                expr = new NumberExpr((Double) token.getLiteral());
                break;
            case KW_TRUE:
            case KW_FALSE:
                parser.advance();
                expr = new LiteralExpr(token.is(KW_TRUE));
                break;
            case KW_NULL:
                parser.advance();
                expr = new LiteralExpr(null);
                break;
            case VARIABLE:
                parser.advance();
                expr = variable(token);
                break;
            case LAST_VALUE:
                parser.advance();
                expr = new LastValueExpr();
                break;
            case SUBEXPR_OPEN:
                return parseSubexpression();
            case LBRACE:
                expr = parseObjectLiteral();
                break;
            case LBRACKET:
                expr = parseArrayLiteral();
                break;
            case LPAREN: {
                parser.advance();
                expr = parseExpression();
                parser.expect(RPAREN, ")");
                if (expr instanceof BinaryExpr) {
                    ((BinaryExpr) expr).setParenthesized(true);
                }
                break;
            }
            case IDENTIFIER:
                // 裸词按原样保留
                parser.advance();
                expr = new LiteralExpr(token.getLexeme());
                break;
            default:
                throw parser.error("Unexpected '" + token.getLexeme() + "'", "value");
        }
        expr.setPosition(parser.span(token));
        return expr;
    }

    /** {@code $( ... )}，内容按语句体解析，可跨多行 */
    SubexpressionExpr parseSubexpression() {
        Token open = parser.expect(SUBEXPR_OPEN, "$(");
        List<Statement> body;
        parser.subexpressionDepth++;
        try {
            body = parser.parseBody(RPAREN);
        } finally {
            parser.subexpressionDepth--;
        }
        Token close = parser.expect(RPAREN, ")");
        return new SubexpressionExpr(parser.position(open, close), body);
    }

    private Expression parseObjectLiteral() {
        parser.expect(LBRACE, "{");
        Map<String, Expression> properties = new LinkedHashMap<String, Expression>();
        while (!parser.check(RBRACE)) {
            if (parser.isAtEnd()) {
                throw parser.error("Unclosed object literal", "}");
            }
            if (parser.current.isOneOf(NEWLINE, COMMA, COMMENT)) {
                parser.advance();
                continue;
            }
            Token key = parser.advance();
            String name = key.is(STRING) ? (String) key.getLiteral() : key.getLexeme();
            parser.expect(COLON, ":");
            properties.put(name, parseArgument());
        }
        parser.expect(RBRACE, "}");
        return new ObjectLiteralExpr(properties);
    }

    private Expression parseArrayLiteral() {
        parser.expect(LBRACKET, "[");
        List<Expression> elements = new ArrayList<Expression>();
        while (!parser.check(RBRACKET)) {
            if (parser.isAtEnd()) {
                throw parser.error("Unclosed array literal", "]");
            }
            if (parser.current.isOneOf(NEWLINE, COMMA, COMMENT)) {
                parser.advance();
                continue;
            }
            elements.add(parseArgument());
        }
        parser.expect(RBRACKET, "]");
        return new ArrayLiteralExpr(elements);
    }

    private static boolean isValueStart(Token token) {
        return token.isOneOf(STRING, NUMBER, KW_TRUE, KW_FALSE, KW_NULL, VARIABLE, LAST_VALUE,
                SUBEXPR_OPEN, LBRACE, LBRACKET);
    }

    /**
     * 变量 token 拆分为名称和路径：{@code $user.tags[0]} → user, [.tags, [0]]
     */
    static VarExpr variable(Token token) {
        String text = (String) token.getLiteral();
        int i = 0;
        while (i < text.length() && text.charAt(i) != '.' && text.charAt(i) != '[') {
            i++;
        }
        String name = text.substring(0, i);
        List<PathSegment> path = new ArrayList<PathSegment>();
        while (i < text.length()) {
            if (text.charAt(i) == '.') {
                int end = i + 1;
                while (end < text.length() && text.charAt(end) != '.' && text.charAt(end) != '[') {
                    end++;
                }
                path.add(PathSegment.property(text.substring(i + 1, end)));
                i = end;
            } else {
                int end = text.indexOf(']', i);
                path.add(PathSegment.index(text.substring(i + 1, end)));
                i = end + 1;
            }
        }
        return new VarExpr(name, path);
    }
}
