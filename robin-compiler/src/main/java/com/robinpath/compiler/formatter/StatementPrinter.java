package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.AstNode;
import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.Decorator;
import com.robinpath.compiler.ast.LiteralType;
import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.*;
import com.robinpath.compiler.serialization.JsonValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 语句打印器：按规范格式把语句树渲染为源码。
 *
 * <p>每个 visit 方法返回该语句的完整文本（每行以换行结尾）。打印器本身无状态，
 * 缩进、模式和诊断都由 {@link PrintContext} 携带。</p>
 */
public class StatementPrinter implements AstVisitor<String, PrintContext> {

    private static final Logger LOG = Logger.getLogger(StatementPrinter.class.getName());

    private static final Pattern META_NEEDS_QUOTES = Pattern.compile("[\\s:=\"\\\\-]");

    private final ExpressionPrinter expressions = new ExpressionPrinter(this);

    public ExpressionPrinter getExpressionPrinter() {
        return expressions;
    }

    /**
     * 使用默认配置打印整个程序
     */
    public String print(List<Statement> program) {
        return print(program, new FormatConfig());
    }

    public String print(List<Statement> program, FormatConfig config) {
        return printBody(program, PrintContext.create(config));
    }

    /**
     * 打印同级语句列表，语句之间按位置推断空行
     */
    public String printBody(List<Statement> statements, PrintContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (statements == null) {
            return "";
        }
        Statement prev = null;
        for (Statement stmt : statements) {
            if (stmt instanceof CommentStmt && ((CommentStmt) stmt).isEmpty()) {
                continue;
            }
            if (prev != null && stmt != null) {
                sb.append(printSiblingGap(prev, stmt));
            }
            sb.append(printStatement(stmt, ctx));
            if (stmt != null) {
                prev = stmt;
            }
        }
        return sb.toString();
    }

    /**
     * 两个相邻语句之间是否需要空行：后者（含前导注释）起始行与前者结束行相差超过一行
     */
    public String printSiblingGap(Statement prev, Statement next) {
        if (prev.getPosition() == null || next.getPosition() == null) {
            return "";
        }
        return next.getExtentStartRow() - prev.getPosition().getEndRow() > 1 ? "\n" : "";
    }

    public String printStatement(Statement stmt, PrintContext ctx) {
        if (stmt == null) {
            ctx.report(PrintDiagnostic.Kind.UNKNOWN_NODE_KIND, "Null statement", null);
            return "";
        }
        if (ctx.isTooDeep()) {
            ctx.report(PrintDiagnostic.Kind.NESTING_TOO_DEEP,
                    "Nesting deeper than " + ctx.getConfig().getMaxDepth(), stmt.getPosition());
            return "";
        }
        String text = stmt.accept(this, ctx);
        return text != null ? text : "";
    }

    /**
     * 只打印头部（不含注释、语句体和结束关键字），不带结尾换行
     */
    public String printHeader(Statement stmt, PrintContext ctx) {
        return stripTrailingNewline(printStatement(stmt, ctx.headerOnly()));
    }

    /** 把语句打印为去掉首尾空白的单段文本（用于赋值值、单行 if 的命令） */
    public String printInline(Statement stmt, PrintContext ctx) {
        return stripTrailingNewline(stripLeading(printStatement(stmt, ctx.withoutComments())));
    }

    @Override
    public String visitNode(AstNode node, PrintContext ctx) {
        String kind = node != null ? node.getClass().getSimpleName() : "null";
        LOG.warning("No printer for statement kind " + kind);
        ctx.report(PrintDiagnostic.Kind.UNKNOWN_NODE_KIND, "No printer for statement kind " + kind,
                node != null ? node.getPosition() : null);
        return "";
    }

    // ============ 命令 ============

    @Override
    public String visitCommand(CommandStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);

        String sugar = printSugar(node, ctx);
        if (sugar != null) {
            w.pushLine(sugar + inlineComment(node, ctx));
            return w.toString();
        }

        StringBuilder suffix = new StringBuilder();
        if (node.getInto() != null) {
            suffix.append(" into ").append(node.getInto().toSource());
        }
        DoStmt callback = node.getCallback();
        if (callback != null) {
            suffix.append(" with").append(params(callback.getParamNames()));
            if (callback.getInto() != null) {
                suffix.append(" into ").append(callback.getInto().toSource());
            }
        }
        suffix.append(inlineComment(node, ctx));

        writeCommandLine(node, suffix.toString(), w, ctx);

        if (callback != null && !ctx.isHeaderOnly()) {
            w.push(printBody(callback.getBody(), ctx.nested()));
            w.pushLine("endwith");
        }
        return w.toString();
    }

    private void writeCommandLine(CommandStmt node, String suffix, CodeWriter w, PrintContext ctx) {
        String name = qualifiedName(node);
        List<Expression> positional = node.getPositionalArgs();
        NamedArgsExpr named = node.getNamedArgs();

        switch (node.getSyntaxType()) {
            case PARENTHESES:
                w.pushLine(name + "(" + expressions.printJoined(positional, " ", ctx) + ")" + suffix);
                break;
            case NAMED_PARENTHESES: {
                List<String> parts = argParts(positional, named, ctx);
                w.pushLine(name + "(" + String.join(" ", parts) + ")" + suffix);
                break;
            }
            case MULTILINE_PARENTHESES: {
                int level = ctx.getIndentLevel();
                List<String> parts = argParts(positional, named, ctx.withIndent(level + 1));
                if (parts.isEmpty()) {
                    w.pushLine(name + "()" + suffix);
                    break;
                }
                w.pushLine(name + "(");
                w.indent(level + 1);
                for (String part : parts) {
                    w.pushLine(part);
                }
                w.indent(level);
                w.pushLine(")" + suffix);
                break;
            }
            case SPACE:
            default: {
                String args = expressions.printJoined(positional, " ", ctx);
                w.pushLine(name + (args.isEmpty() ? "" : " " + args) + suffix);
                break;
            }
        }
    }

    private List<String> argParts(List<Expression> positional, NamedArgsExpr named, PrintContext ctx) {
        List<String> parts = new ArrayList<String>();
        for (Expression arg : positional) {
            String text = expressions.print(arg, ctx);
            if (!text.isEmpty()) parts.add(text);
        }
        if (named != null) {
            parts.addAll(expressions.printNamedEntries(named, ctx));
        }
        return parts;
    }

    /**
     * 内部语法糖命令：_var、_subexpr、_object、_array。不是语法糖时返回 null。
     */
    private String printSugar(CommandStmt node, PrintContext ctx) {
        List<Expression> args = node.getArgs();
        Expression first = args.size() == 1 ? args.get(0) : null;
        switch (node.getName()) {
            case "_var":
                return first instanceof VarExpr ? expressions.print(first, ctx) : null;
            case "_subexpr":
                if (first instanceof SubexprCodeExpr || first instanceof SubexpressionExpr) {
                    return expressions.print(first, ctx);
                }
                return null;
            case "_object":
                return first instanceof ObjectCodeExpr || first instanceof ObjectLiteralExpr
                        ? expressions.print(first, ctx) : "{}";
            case "_array":
                return first instanceof ArrayCodeExpr || first instanceof ArrayLiteralExpr
                        ? expressions.print(first, ctx) : "[]";
            default:
                return null;
        }
    }

    private static String qualifiedName(CommandStmt node) {
        String name = node.getName();
        String module = node.getModule();
        if (module == null || module.isEmpty()) {
            return name;
        }
        // name 已带模块前缀时不再重复
        return name.startsWith(module + ".") ? name : module + "." + name;
    }

    // ============ 赋值 ============

    @Override
    public String visitAssignment(AssignmentStmt node, PrintContext ctx) {
        String value = assignmentValue(node, ctx);
        if (value == null) {
            return "";
        }
        String operator = node.isImplicit() ? "" : node.isHasAs() ? " as" : " =";
        String line = (node.isSet() ? "set " : "")
                + ExpressionPrinter.printVarRef(node.getTargetName(), node.getTargetPath())
                + operator + " " + value + inlineComment(node, ctx);

        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        w.pushLine(line);
        return w.toString();
    }

    private String assignmentValue(AssignmentStmt node, PrintContext ctx) {
        if (node.isLastValue()) {
            return "$";
        }
        if (node.getCommand() != null) {
            return printInline(node.getCommand(), ctx);
        }
        if (node.hasLiteralValue()) {
            return literalText(node, ctx);
        }
        return null;
    }

    private String literalText(AssignmentStmt node, PrintContext ctx) {
        Object value = node.getLiteralValue();
        LiteralType type = LiteralType.of(value);
        LiteralType declared = node.getLiteralValueType();
        if (declared != null && declared != type) {
            ValueConversion.Result converted = ValueConversion.convert(value, declared);
            if (converted.isSuccess()) {
                value = converted.getValue();
                type = declared;
            } else {
                String message = "Cannot convert " + ValueConversion.toStringValue(value)
                        + " to " + declared.getLabel() + ", keeping " + type.getLabel();
                LOG.fine(message);
                ctx.report(PrintDiagnostic.Kind.TYPE_CONVERSION_FAILURE, message, node.getPosition());
            }
        }
        switch (type) {
            case STRING:
                return RobinStringUtils.quote(String.valueOf(value));
            case NULL:
                return "null";
            case NUMBER:
                return RobinStringUtils.formatNumber(((Number) value).doubleValue());
            case ARRAY:
            case OBJECT:
                return JsonValues.stringify(value);
            case BOOLEAN:
            default:
                return String.valueOf(value);
        }
    }

    @Override
    public String visitShorthand(ShorthandStmt node, PrintContext ctx) {
        return singleLine(node, "$" + node.getTargetName() + " = $", ctx);
    }

    // ============ 条件 ============

    @Override
    public String visitInlineIf(InlineIfStmt node, PrintContext ctx) {
        String line = "if " + expressions.print(node.getConditionExpr(), ctx) + " "
                + printInline(node.getCommand(), ctx);
        return singleLine(node, line, ctx);
    }

    @Override
    public String visitIfTrue(IfTrueStmt node, PrintContext ctx) {
        return singleLine(node, "iftrue " + printInline(node.getCommand(), ctx), ctx);
    }

    @Override
    public String visitIfFalse(IfFalseStmt node, PrintContext ctx) {
        return singleLine(node, "iffalse " + printInline(node.getCommand(), ctx), ctx);
    }

    @Override
    public String visitIfBlock(IfBlockStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        w.pushLine(ifHeader(node, ctx) + inlineComment(node, ctx));
        if (ctx.isHeaderOnly()) {
            return w.toString();
        }
        PrintContext inner = ctx.nested();
        w.push(printBody(node.getThenBranch(), inner));
        for (ElseIfBranch branch : node.getElseifBranches()) {
            w.pushLine(elseIfHeader(branch, ctx));
            w.push(printBody(branch.getBody(), inner));
        }
        if (node.hasElse()) {
            w.pushLine("else");
            w.push(printBody(node.getElseBranch(), inner));
        }
        w.pushLine("endif");
        return w.toString();
    }

    public String ifHeader(IfBlockStmt node, PrintContext ctx) {
        return "if " + expressions.print(node.getConditionExpr(), ctx) + (node.isHasThen() ? " then" : "");
    }

    public String elseIfHeader(ElseIfBranch branch, PrintContext ctx) {
        return "elseif " + expressions.print(branch.getConditionExpr(), ctx);
    }

    // ============ 块 ============

    @Override
    public String visitDefine(DefineStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        if (!ctx.isHeaderOnly()) {
            writeDecorators(node.getDecorators(), w, ctx);
        }
        w.pushLine("def " + node.getName() + params(node.getParamNames()) + inlineComment(node, ctx));
        return finishBlock(w, node.getBody(), "enddef", ctx);
    }

    @Override
    public String visitDo(DoStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        String into = node.getInto() != null ? " into " + node.getInto().toSource() : "";
        w.pushLine("do" + params(node.getParamNames()) + into + inlineComment(node, ctx));
        return finishBlock(w, node.getBody(), "enddo", ctx);
    }

    @Override
    public String visitTogether(TogetherStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        w.pushLine("together" + inlineComment(node, ctx));
        return finishBlock(w, node.getBlocks(), "endtogether", ctx);
    }

    @Override
    public String visitForLoop(ForLoopStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        Expression source = node.getRange() != null ? node.getRange() : node.getIterable();
        w.pushLine("for $" + node.getVarName() + " in " + expressions.print(source, ctx) + inlineComment(node, ctx));
        return finishBlock(w, node.getBody(), "endfor", ctx);
    }

    @Override
    public String visitOnBlock(OnBlockStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        if (!ctx.isHeaderOnly()) {
            writeDecorators(node.getDecorators(), w, ctx);
        }
        w.pushLine("on " + RobinStringUtils.quote(node.getEventName()) + inlineComment(node, ctx));
        return finishBlock(w, node.getBody(), "endon", ctx);
    }

    private String finishBlock(CodeWriter w, List<Statement> body, String terminator, PrintContext ctx) {
        if (ctx.isHeaderOnly()) {
            return w.toString();
        }
        w.push(printBody(body, ctx.nested()));
        w.pushLine(terminator);
        return w.toString();
    }

    // ============ 简单语句 ============

    @Override
    public String visitReturn(ReturnStmt node, PrintContext ctx) {
        String value = node.hasValue() ? " " + expressions.print(node.getValue(), ctx) : "";
        return singleLine(node, "return" + value, ctx);
    }

    @Override
    public String visitBreak(BreakStmt node, PrintContext ctx) {
        return singleLine(node, "break", ctx);
    }

    @Override
    public String visitContinue(ContinueStmt node, PrintContext ctx) {
        return singleLine(node, "continue", ctx);
    }

    /** 独立注释组的内容就是语句本身，任何模式下都输出 */
    @Override
    public String visitComment(CommentStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        for (Comment comment : node.getComments()) {
            if (!comment.isDeleted()) {
                writeCommentLines(comment.getText(), w);
            }
        }
        return w.toString();
    }

    // ============ 文档块 ============

    @Override
    public String visitChunkMarker(ChunkMarkerStmt node, PrintContext ctx) {
        StringBuilder line = new StringBuilder("--- chunk:").append(node.getId());
        Map<String, String> sorted = new TreeMap<String, String>(node.getMeta());
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            line.append(' ').append(metaPair(e.getKey(), e.getValue()));
        }
        line.append(" ---");
        CodeWriter w = ctx.newWriter();
        w.pushLine(line.toString());
        return w.toString();
    }

    @Override
    public String visitCell(CellStmt node, PrintContext ctx) {
        StringBuilder header = new StringBuilder("---cell ").append(node.getCellType());
        Map<String, String> meta = node.getMeta();
        if (meta.containsKey("id")) {
            header.append(' ').append(metaPair("id", meta.get("id")));
        }
        for (Map.Entry<String, String> e : new TreeMap<String, String>(meta).entrySet()) {
            if (!e.getKey().equals("id")) {
                header.append(' ').append(metaPair(e.getKey(), e.getValue()));
            }
        }
        header.append("---");

        CodeWriter w = ctx.newWriter();
        w.pushLine(header.toString());
        if (ctx.isHeaderOnly()) {
            return w.toString();
        }
        if (node.isCode() && node.getBody() != null && !node.getBody().isEmpty()) {
            w.push(printBody(node.getBody(), ctx.full()));
        } else if (node.getRawBody() != null && !node.getRawBody().isEmpty()) {
            w.push(node.getRawBody());
            if (!node.getRawBody().endsWith("\n")) {
                w.newline();
            }
        }
        w.pushLine("---end---");
        return w.toString();
    }

    @Override
    public String visitPromptBlock(PromptBlockStmt node, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        w.pushLine("---");
        String raw = node.getRawText();
        if (raw != null && !raw.isEmpty()) {
            w.push(raw);
            if (!raw.endsWith("\n")) {
                w.newline();
            }
        } else if (raw != null && node.getBodyPos() != null) {
            w.newline();
        }
        w.pushLine("---");
        return w.toString();
    }

    private static String metaPair(String key, String value) {
        String v = value != null ? value : "";
        return META_NEEDS_QUOTES.matcher(v).find() ? key + ":" + RobinStringUtils.quote(v) : key + ":" + v;
    }

    // ============ 注释与通用片段 ============

    private String singleLine(Statement node, String line, PrintContext ctx) {
        CodeWriter w = ctx.newWriter();
        writeLeadingComments(node, w, ctx);
        w.pushLine(line + inlineComment(node, ctx));
        return w.toString();
    }

    private void writeLeadingComments(Statement node, CodeWriter w, PrintContext ctx) {
        if (!ctx.isWithComments()) {
            return;
        }
        for (Comment comment : node.getLeadingComments()) {
            if (!comment.isDeleted()) {
                writeCommentLines(comment.getText(), w);
            }
        }
    }

    /** 每个逻辑行输出为 {@code # text}，空行输出为单独的 {@code #} */
    static void writeCommentLines(String text, CodeWriter w) {
        for (String line : text.split("\n", -1)) {
            String cleaned = line.replace("\r", "");
            w.pushLine(cleaned.trim().isEmpty() ? "#" : "# " + cleaned);
        }
    }

    /** 行尾注释后缀，没有时返回空串 */
    public String inlineComment(Statement node, PrintContext ctx) {
        if (!ctx.isWithComments()) {
            return "";
        }
        Comment inline = node.getInlineComment();
        if (inline == null || inline.isDeleted() || inline.getText().trim().isEmpty()) {
            return "";
        }
        return "  # " + inline.getText();
    }

    private void writeDecorators(List<Decorator> decorators, CodeWriter w, PrintContext ctx) {
        for (Decorator decorator : decorators) {
            w.pushLine(printDecorator(decorator, ctx));
        }
    }

    public String printDecorator(Decorator decorator, PrintContext ctx) {
        String args = expressions.printJoined(decorator.getArgs(), " ", ctx);
        return "@" + decorator.getName() + (args.isEmpty() ? "" : " " + args);
    }

    private static String params(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (String name : names) {
            sb.append(" $").append(name);
        }
        return sb.toString();
    }

    static String stripTrailingNewline(String s) {
        return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            i++;
        }
        return s.substring(i);
    }
}
