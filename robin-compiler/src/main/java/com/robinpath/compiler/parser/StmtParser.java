package com.robinpath.compiler.parser;

import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Decorator;
import com.robinpath.compiler.ast.IntoTarget;
import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.*;
import com.robinpath.compiler.lexer.Token;
import com.robinpath.compiler.serialization.ModuleResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.robinpath.compiler.lexer.TokenType.*;

/**
 * 语句解析器
 */
class StmtParser {

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一条语句。对没有效果的行（单独的 $ 或带路径的变量）返回 null。
     */
    Statement parseStatement() {
        switch (parser.current.getType()) {
            case KW_IF: return parseIf();
            case KW_IFTRUE:
            case KW_IFFALSE: return parseIfTrueFalse();
            case KW_DEF: return parseDefine(Collections.<Decorator>emptyList());
            case KW_ON: return parseOnBlock(Collections.<Decorator>emptyList());
            case DECORATOR: return parseDecorated();
            case KW_DO: return parseDo();
            case KW_TOGETHER: return parseTogether();
            case KW_FOR: return parseForLoop();
            case CHUNK: return parseChunkMarker();
            case CELL: return parseCell();
            case CELL_START: return parseCodeCell();
            case PROMPT_BLOCK: return parsePromptBlock();
            default: return parseSimpleStatement();
        }
    }

    /** 单行语句：赋值、命令、return/break/continue */
    Statement parseSimpleStatement() {
        Token first = parser.current;
        switch (first.getType()) {
            case KW_SET:
            case VARIABLE:
                return parseAssignment();
            case LAST_VALUE:
                parser.advance();
                if (!parser.isStatementEnd()) {
                    throw parser.error("Unexpected '" + parser.current.getLexeme() + "' after '$'", "end of line");
                }
                return null;
            case KW_RETURN: {
                parser.advance();
                Expression value = parser.isStatementEnd() ? null : parser.exprParser.parseExpression();
                return new ReturnStmt(parser.span(first), value);
            }
            case KW_BREAK:
                parser.advance();
                return new BreakStmt(parser.span(first));
            case KW_CONTINUE:
                parser.advance();
                return new ContinueStmt(parser.span(first));
            case SUBEXPR_OPEN: {
                Expression sub = parser.exprParser.parseSubexpression();
                return sugar("_subexpr", sub, parser.span(first));
            }
            case IDENTIFIER:
                return parseCommand();
            default:
                throw parser.error("Unexpected '" + first.getLexeme() + "'", "statement");
        }
    }

    // ============ 命令 ============

    /**
     * 命令：{@code name a b}、{@code name(a b)}、{@code name($k=v)} 或多行括号形式，
     * 可带 {@code into $t} 和 {@code with ... endwith} 回调
     */
    CommandStmt parseCommand() {
        Token nameToken = parser.expect(IDENTIFIER, "command name");
        String name = nameToken.getLexeme();
        String module = ModuleResolver.moduleOf(name);

        List<Expression> args = new ArrayList<Expression>();
        CommandStmt.SyntaxType syntaxType = CommandStmt.SyntaxType.SPACE;
        if (parser.check(LPAREN) && parser.adjacent(nameToken, parser.current)) {
            syntaxType = parseParenthesizedArgs(args);
        } else {
            while (!parser.isStatementEnd() && !parser.checkAny(KW_INTO, KW_WITH)) {
                args.add(parser.exprParser.parseArgument());
            }
        }

        IntoTarget into = null;
        if (parser.match(KW_INTO)) {
            into = parseIntoTarget();
        }

        CommandStmt command = new CommandStmt(null, name, module, args, into, syntaxType, null);
        if (parser.check(KW_WITH)) {
            command.setCallback(parseCallback());
        }
        command.setPosition(parser.span(nameToken));
        return command;
    }

    private CommandStmt.SyntaxType parseParenthesizedArgs(List<Expression> args) {
        parser.expect(LPAREN, "(");
        boolean multiline = false;
        Map<String, Expression> named = new LinkedHashMap<String, Expression>();
        while (!parser.check(RPAREN)) {
            if (parser.isAtEnd()) {
                throw parser.error("Unclosed argument list", ")");
            }
            if (parser.check(NEWLINE)) {
                multiline = true;
                parser.advance();
            } else if (parser.check(COMMA) || parser.check(COMMENT)) {
                parser.advance();
            } else if (parser.check(VARIABLE) && parser.peek(1).is(ASSIGN)
                    && parser.adjacent(parser.current, parser.peek(1))) {
                String key = (String) parser.advance().getLiteral();
                parser.advance();
                named.put(key, parser.exprParser.parseArgument());
            } else {
                args.add(parser.exprParser.parseArgument());
            }
        }
        parser.expect(RPAREN, ")");
        if (!named.isEmpty()) {
            args.add(new NamedArgsExpr(named));
        }
        if (multiline) {
            return CommandStmt.SyntaxType.MULTILINE_PARENTHESES;
        }
        return named.isEmpty() ? CommandStmt.SyntaxType.PARENTHESES : CommandStmt.SyntaxType.NAMED_PARENTHESES;
    }

    /** {@code with $a $b [into $t]} 换行，语句体，{@code endwith} */
    private DoStmt parseCallback() {
        Token with = parser.expect(KW_WITH, "with");
        List<String> params = parseParams();
        IntoTarget into = parser.match(KW_INTO) ? parseIntoTarget() : null;
        parser.endHeaderLine();
        List<Statement> body = parser.parseBody(KW_ENDWITH);
        parser.expect(KW_ENDWITH, "endwith");
        return new DoStmt(parser.span(with), params, into, body);
    }

    private IntoTarget parseIntoTarget() {
        Token target = parser.expect(VARIABLE, "variable after 'into'");
        VarExpr var = ExprParser.variable(target);
        return new IntoTarget(var.getName(), var.getPath());
    }

    private List<String> parseParams() {
        List<String> params = new ArrayList<String>();
        while (parser.check(VARIABLE)) {
            params.add((String) parser.advance().getLiteral());
        }
        return params;
    }

    private CommandStmt sugar(String name, Expression value, CodePosition position) {
        List<Expression> args = new ArrayList<Expression>();
        args.add(value);
        return new CommandStmt(position, name, args);
    }

    // ============ 赋值 ============

    /**
     * {@code [set ]$target[.path] (= | as | 空格) value}；单独一行的 {@code $x} 是 shorthand
     */
    private Statement parseAssignment() {
        Token first = parser.current;
        boolean set = parser.match(KW_SET);
        Token target = parser.expect(VARIABLE, "variable");
        VarExpr var = ExprParser.variable(target);

        if (!set && parser.isStatementEnd()) {
            return var.hasPath() ? null : new ShorthandStmt(parser.span(first), var.getName());
        }

        AssignmentStmt assignment = new AssignmentStmt(null, var.getName());
        assignment.setTargetPath(var.getPath());
        assignment.setSet(set);
        if (parser.match(ASSIGN)) {
            // 显式 =
        } else if (parser.match(KW_AS)) {
            assignment.setHasAs(true);
        } else if (set) {
            assignment.setImplicit(true);
        } else {
            throw parser.error("Unexpected '" + parser.current.getLexeme() + "'", "'=' or 'as'");
        }
        parseAssignmentValue(assignment);
        assignment.setPosition(parser.span(first));
        return assignment;
    }

    private void parseAssignmentValue(AssignmentStmt assignment) {
        Token value = parser.current;
        boolean single = parser.isStatementEnd(parser.peek(1));
        switch (value.getType()) {
            case LAST_VALUE:
                if (single) {
                    parser.advance();
                    assignment.setLastValue(true);
                    return;
                }
                break;
            case VARIABLE:
                if (single) {
                    parser.advance();
                    assignment.setCommand(sugar("_var", ExprParser.variable(value), parser.span(value)));
                    return;
                }
                break;
            case SUBEXPR_OPEN: {
                Expression sub = parser.exprParser.parseSubexpression();
                requireValueEnd();
                assignment.setCommand(sugar("_subexpr", sub, parser.span(value)));
                return;
            }
            case LBRACE: {
                Token close = parser.findClosing(value, LBRACE, RBRACE);
                String code = parser.source.substring(value.getEndOffset(), close.getOffset());
                parser.advancePast(close);
                requireValueEnd();
                assignment.setCommand(sugar("_object", new ObjectCodeExpr(code), parser.span(value)));
                return;
            }
            case LBRACKET: {
                Token close = parser.findClosing(value, LBRACKET, RBRACKET);
                String code = parser.source.substring(value.getEndOffset(), close.getOffset());
                parser.advancePast(close);
                requireValueEnd();
                assignment.setCommand(sugar("_array", new ArrayCodeExpr(code), parser.span(value)));
                return;
            }
            case STRING:
            case NUMBER:
                if (single) {
                    assignment.setLiteralValue(parser.advance().getLiteral());
                    return;
                }
                break;
            case KW_TRUE:
            case KW_FALSE:
                if (single) {
                    assignment.setLiteralValue(parser.advance().is(KW_TRUE));
                    return;
                }
                break;
            case KW_NULL:
                if (single) {
                    parser.advance();
                    assignment.setLiteralValue(null);
                    return;
                }
                break;
            default:
                break;
        }
        if (!parser.check(IDENTIFIER)) {
            throw parser.error("Unexpected '" + value.getLexeme() + "' in assignment value", "value or command");
        }
        assignment.setCommand(parseCommand());
    }

    private void requireValueEnd() {
        if (!parser.isStatementEnd()) {
            throw parser.error("Unexpected '" + parser.current.getLexeme() + "' after assignment value", "end of line");
        }
    }

    // ============ 条件 ============

    /**
     * {@code if cond [then] command} 为单行 if；{@code if cond [then]} 换行开始 if 块
     */
    private Statement parseIf() {
        Token ifToken = parser.expect(KW_IF, "if");
        Expression condition = parser.exprParser.parseExpression();
        boolean hasThen = parser.match(KW_THEN);

        if (!parser.isStatementEnd()) {
            Statement command = parseSimpleStatement();
            return new InlineIfStmt(parser.span(ifToken), condition, command);
        }

        parser.endHeaderLine();
        List<Statement> thenBranch = parser.parseBody(KW_ELSEIF, KW_ELSE, KW_ENDIF);

        List<ElseIfBranch> elseifBranches = new ArrayList<ElseIfBranch>();
        while (parser.check(KW_ELSEIF)) {
            Token elseif = parser.advance();
            Expression branchCondition = parser.exprParser.parseExpression();
            parser.match(KW_THEN);
            CodePosition branchPosition = parser.span(elseif);
            parser.endInteriorLine();
            List<Statement> body = parser.parseBody(KW_ELSEIF, KW_ELSE, KW_ENDIF);
            elseifBranches.add(new ElseIfBranch(branchCondition, body, branchPosition));
        }

        List<Statement> elseBranch = null;
        CodePosition elsePosition = null;
        if (parser.check(KW_ELSE)) {
            Token elseToken = parser.advance();
            elsePosition = parser.span(elseToken);
            parser.endInteriorLine();
            elseBranch = parser.parseBody(KW_ENDIF);
        }
        parser.expect(KW_ENDIF, "endif");

        IfBlockStmt block = new IfBlockStmt(parser.span(ifToken), condition, hasThen,
                thenBranch, elseifBranches, elseBranch);
        block.setElsePosition(elsePosition);
        return block;
    }

    private Statement parseIfTrueFalse() {
        Token keyword = parser.advance();
        Statement command = parseSimpleStatement();
        if (command == null) {
            throw parser.error("Missing command after '" + keyword.getLexeme() + "'", "command");
        }
        return keyword.is(KW_IFTRUE)
                ? new IfTrueStmt(parser.span(keyword), command)
                : new IfFalseStmt(parser.span(keyword), command);
    }

    // ============ 块 ============

    private Statement parseDecorated() {
        List<Decorator> decorators = new ArrayList<Decorator>();
        while (parser.check(DECORATOR)) {
            Token at = parser.advance();
            List<Expression> args = new ArrayList<Expression>();
            while (!parser.isStatementEnd()) {
                args.add(parser.exprParser.parseArgument());
            }
            decorators.add(new Decorator((String) at.getLiteral(), args, parser.span(at)));
            parser.endInteriorLine();
            while (parser.match(NEWLINE) || parser.match(COMMENT)) {
                // 装饰器之间的空行和注释
            }
        }
        if (parser.check(KW_DEF)) {
            return parseDefine(decorators);
        }
        if (parser.check(KW_ON)) {
            return parseOnBlock(decorators);
        }
        throw parser.error("Decorators must be followed by 'def' or 'on'", "def or on");
    }

    private Statement parseDefine(List<Decorator> decorators) {
        Token def = parser.expect(KW_DEF, "def");
        Token name = parser.expect(IDENTIFIER, "function name");
        List<String> params = parseParams();
        parser.endHeaderLine();
        List<Statement> body = parser.parseBody(KW_ENDDEF);
        parser.expect(KW_ENDDEF, "enddef");
        return new DefineStmt(parser.span(def), name.getLexeme(), params,
                new ArrayList<Decorator>(decorators), body);
    }

    private Statement parseOnBlock(List<Decorator> decorators) {
        Token on = parser.expect(KW_ON, "on");
        String eventName;
        if (parser.check(STRING)) {
            eventName = (String) parser.advance().getLiteral();
        } else {
            eventName = parser.expect(IDENTIFIER, "event name").getLexeme();
        }
        parser.endHeaderLine();
        List<Statement> body = parser.parseBody(KW_ENDON);
        parser.expect(KW_ENDON, "endon");
        return new OnBlockStmt(parser.span(on), eventName, new ArrayList<Decorator>(decorators), body);
    }

    private Statement parseDo() {
        Token doToken = parser.expect(KW_DO, "do");
        List<String> params = parseParams();
        IntoTarget into = parser.match(KW_INTO) ? parseIntoTarget() : null;
        parser.endHeaderLine();
        List<Statement> body = parser.parseBody(KW_ENDDO);
        parser.expect(KW_ENDDO, "enddo");
        return new DoStmt(parser.span(doToken), params, into, body);
    }

    private Statement parseTogether() {
        Token together = parser.expect(KW_TOGETHER, "together");
        parser.endHeaderLine();
        List<Statement> blocks = parser.parseBody(KW_ENDTOGETHER);
        parser.expect(KW_ENDTOGETHER, "endtogether");
        return new TogetherStmt(parser.span(together), blocks);
    }

    /** {@code for $v in range a b} 或 {@code for $v in <iterable>} */
    private Statement parseForLoop() {
        Token forToken = parser.expect(KW_FOR, "for");
        String varName = (String) parser.expect(VARIABLE, "loop variable").getLiteral();
        parser.expect(KW_IN, "in");

        RangeExpr range = null;
        Expression iterable = null;
        if (parser.check(IDENTIFIER) && parser.current.getLexeme().equals("range")) {
            Token rangeToken = parser.advance();
            Expression from = parser.exprParser.parseArgument();
            Expression to = parser.exprParser.parseArgument();
            range = new RangeExpr(from, to);
            range.setPosition(parser.span(rangeToken));
        } else {
            iterable = parser.exprParser.parseExpression();
        }
        parser.endHeaderLine();
        List<Statement> body = parser.parseBody(KW_ENDFOR);
        parser.expect(KW_ENDFOR, "endfor");
        return new ForLoopStmt(parser.span(forToken), varName, range, iterable, body);
    }

    // ============ 围栏块 ============

    private Statement parseChunkMarker() {
        Token token = parser.advance();
        String inner = stripFence(token.getLexeme());
        List<String[]> pairs = FenceMeta.parse(inner);
        if (pairs.isEmpty() || !pairs.get(0)[0].equals("chunk")) {
            throw new ParseException("Malformed chunk marker", token, "--- chunk:<id> ---");
        }
        Map<String, String> meta = new LinkedHashMap<String, String>();
        for (int i = 1; i < pairs.size(); i++) {
            meta.put(pairs.get(i)[0], pairs.get(i)[1]);
        }
        return new ChunkMarkerStmt(parser.position(token, token), pairs.get(0)[1], meta);
    }

    /** 非代码单元格：原文保存在 rawBody 中 */
    private Statement parseCell() {
        Token token = parser.advance();
        String lexeme = token.getLexeme();
        int headerEnd = lexeme.indexOf('\n');
        String header = lexeme.substring(0, headerEnd);
        int lastLine = lexeme.lastIndexOf('\n');
        String rawBody = lexeme.substring(headerEnd + 1, lastLine + 1);

        List<String[]> pairs = FenceMeta.parse(stripCellHeader(header));
        String cellType = pairs.isEmpty() ? "" : pairs.get(0)[0];
        return new CellStmt(parser.position(token, token), cellType, cellMeta(pairs), null, rawBody);
    }

    /** 代码单元格：内容按普通语句解析 */
    private Statement parseCodeCell() {
        Token start = parser.advance();
        List<String[]> pairs = FenceMeta.parse(stripCellHeader(start.getLexeme()));
        parser.endInteriorLine();
        List<Statement> body = parser.parseBody(CELL_END);
        parser.expect(CELL_END, "---end---");
        return new CellStmt(parser.span(start), CellStmt.CODE, cellMeta(pairs), body, null);
    }

    private Statement parsePromptBlock() {
        Token token = parser.advance();
        String lexeme = token.getLexeme();
        int first = lexeme.indexOf('\n');
        int last = lexeme.lastIndexOf('\n');
        String rawText = lexeme.substring(first + 1, last + 1);

        CodePosition pos = parser.position(token, token);
        CodePosition bodyPos = null;
        if (pos.getEndRow() - pos.getStartRow() > 1) {
            String lastContentLine = rawText.substring(0, rawText.length() - 1);
            lastContentLine = lastContentLine.substring(lastContentLine.lastIndexOf('\n') + 1);
            bodyPos = new CodePosition(pos.getStartRow() + 1, 0, pos.getEndRow() - 1,
                    Math.max(lastContentLine.length() - 1, 0));
        }
        return new PromptBlockStmt(pos, rawText, bodyPos);
    }

    private static Map<String, String> cellMeta(List<String[]> pairs) {
        Map<String, String> meta = new LinkedHashMap<String, String>();
        for (int i = 1; i < pairs.size(); i++) {
            meta.put(pairs.get(i)[0], pairs.get(i)[1]);
        }
        return meta;
    }

    private static String stripFence(String line) {
        String inner = line.trim();
        if (inner.startsWith("---")) inner = inner.substring(3);
        if (inner.endsWith("---")) inner = inner.substring(0, inner.length() - 3);
        return inner.trim();
    }

    private static String stripCellHeader(String header) {
        String inner = header.trim().substring("---cell".length());
        if (inner.endsWith("---")) inner = inner.substring(0, inner.length() - 3);
        return inner.trim();
    }
}
