package com.robinpath.compiler.parser;

import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.comment.CommentClassifier;
import com.robinpath.compiler.formatter.FormatConfig;
import com.robinpath.compiler.lexer.Lexer;
import com.robinpath.compiler.lexer.Token;
import com.robinpath.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.robinpath.compiler.lexer.TokenType.*;

/**
 * RobinPath 语法分析器
 *
 * <p>递归下降，逐行解析。每个语句体解析完成后由 {@link CommentClassifier}
 * 归类该语句体内收集到的注释。生成的位置信息从 0 开始计数。</p>
 */
public class Parser {

    final Lexer lexer;
    final String source;
    private final List<Token> tokens;
    private final int maxDepth;
    private int index = 0;
    Token current;
    Token previous;

    /** 每个正在解析的语句体对应一个注释收集列表，栈顶是当前语句体 */
    private final Deque<List<Comment>> commentSinks = new ArrayDeque<List<Comment>>();
    private int depth = 0;
    int subexpressionDepth = 0;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this(lexer, new FormatConfig().getMaxDepth());
    }

    public Parser(Lexer lexer, int maxDepth) {
        this.lexer = lexer;
        this.source = lexer.getSource();
        this.tokens = lexer.scanTokens();
        this.maxDepth = maxDepth;
        this.current = tokens.get(0);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个程序，遇到第一个错误即抛出 {@link ParseException}
     */
    public List<Statement> parse() {
        return parseBody();
    }

    /**
     * 容错解析：遇到错误时跳到下一行继续解析
     */
    public ParseResult parseTolerant() {
        List<ParseError> errors = new ArrayList<ParseError>();
        List<Statement> program = parseStatements(errors);
        return new ParseResult(program, errors);
    }

    /**
     * 解析语句体直到遇到任一结束 token（不消费）。
     * errors 非空时为容错模式：单条语句出错会被记录并跳到下一行。
     */
    private List<Statement> parseStatements(List<ParseError> errors, TokenType... terminators) {
        if (++depth > maxDepth) {
            depth--;
            throw error("Nesting deeper than " + maxDepth + " levels", null);
        }
        List<Statement> statements = new ArrayList<Statement>();
        List<Comment> comments = new ArrayList<Comment>();
        commentSinks.push(comments);
        try {
            while (true) {
                skipNewlines();
                if (isAtEnd() || checkAny(terminators)) break;
                if (check(COMMENT)) {
                    comments.add(comment(advance()));
                    continue;
                }
                try {
                    Statement stmt = stmtParser.parseStatement();
                    finishLine(stmt, terminators);
                    if (stmt != null) {
                        statements.add(stmt);
                    }
                } catch (ParseException e) {
                    if (errors == null) throw e;
                    errors.add(new ParseError(e.getMessage(), e.getToken()));
                    synchronize();
                }
            }
        } finally {
            commentSinks.pop();
            depth--;
        }
        return CommentClassifier.classify(statements, comments);
    }

    List<Statement> parseBody(TokenType... terminators) {
        return parseStatements(null, terminators);
    }

    /**
     * 语句之后：行尾注释交给当前语句体（块语句结束行上的注释丢弃），然后必须换行
     */
    private void finishLine(Statement stmt, TokenType... terminators) {
        if (check(COMMENT)) {
            Token token = advance();
            if (stmt == null || !stmt.isBlock()) {
                collectComment(token);
            }
        }
        if (!match(NEWLINE) && !isAtEnd() && !checkAny(terminators)) {
            throw error("Expected end of line", "newline");
        }
    }

    /** 块头部之后：行尾注释交给外层语句体 */
    void endHeaderLine() {
        if (check(COMMENT)) {
            collectComment(advance());
        }
        expectLineEnd();
    }

    /** else / elseif / 装饰器等内部行：行尾注释只保留在原文中 */
    void endInteriorLine() {
        match(COMMENT);
        expectLineEnd();
    }

    private void expectLineEnd() {
        if (!match(NEWLINE) && !isAtEnd()) {
            throw error("Expected end of line", "newline");
        }
    }

    private void collectComment(Token token) {
        List<Comment> sink = commentSinks.peek();
        if (sink != null) {
            sink.add(comment(token));
        }
    }

    private Comment comment(Token token) {
        return new Comment((String) token.getLiteral(), position(token, token), false);
    }

    /**
     * 错误恢复：跳过到下一个换行之后
     */
    private void synchronize() {
        while (!isAtEnd() && !check(NEWLINE)) {
            advance();
        }
        match(NEWLINE);
    }

    // ============ Token 操作 ============

    Token advance() {
        previous = current;
        if (index < tokens.size() - 1) {
            index++;
        }
        current = tokens.get(index);
        return previous;
    }

    /** 向前查看第 n 个 token（0 为当前） */
    Token peek(int n) {
        return tokens.get(Math.min(index + n, tokens.size() - 1));
    }

    /** 跳到给定 token 之后 */
    void advancePast(Token token) {
        while (!isAtEnd() && current != token) {
            advance();
        }
        advance();
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        return types != null && current.isOneOf(types);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw error("Unexpected '" + current.getLexeme() + "'", expected);
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipNewlines() {
        while (match(NEWLINE)) {
            // skip
        }
    }

    /** 当前 token 是否结束一条语句 */
    boolean isStatementEnd() {
        return isStatementEnd(current);
    }

    boolean isStatementEnd(Token token) {
        return token.isOneOf(NEWLINE, EOF, COMMENT)
                || (subexpressionDepth > 0 && token.is(RPAREN));
    }

    /** 两个 token 之间没有空白 */
    boolean adjacent(Token a, Token b) {
        return a.getEndOffset() == b.getOffset();
    }

    /**
     * 找到与 open 配对的闭合 token，找不到时抛出异常
     */
    Token findClosing(Token open, TokenType openType, TokenType closeType) {
        int level = 0;
        for (int i = tokens.indexOf(open); i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(openType)) {
                level++;
            } else if (t.is(closeType)) {
                if (--level == 0) return t;
            } else if (t.is(EOF)) {
                break;
            }
        }
        throw error("Unclosed '" + open.getLexeme() + "'", closeType == RBRACE ? "}" : "]");
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, current, expected);
    }

    // ============ 位置 ============

    CodePosition position(Token first, Token last) {
        return new CodePosition(first.getLine() - 1, first.getColumn() - 1,
                last.getEndLine() - 1, last.getEndColumn() - 1);
    }

    /** 从 first 到上一个已消费 token 的位置 */
    CodePosition span(Token first) {
        return position(first, previous);
    }
}
