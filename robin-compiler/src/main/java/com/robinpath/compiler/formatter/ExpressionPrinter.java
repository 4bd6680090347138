package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.AstNode;
import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.PathSegment;
import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 表达式打印器：把表达式节点渲染为规范的最简源码。
 *
 * <p>除子表达式（需要递归打印语句）外都是纯函数。</p>
 */
public class ExpressionPrinter implements AstVisitor<String, PrintContext> {

    private static final Logger LOG = Logger.getLogger(ExpressionPrinter.class.getName());

    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final StatementPrinter statementPrinter;

    ExpressionPrinter(StatementPrinter statementPrinter) {
        this.statementPrinter = statementPrinter;
    }

    public String print(Expression expr, PrintContext ctx) {
        if (expr == null) {
            return "";
        }
        return expr.accept(this, ctx);
    }

    /** 用空格连接多个表达式，跳过打印结果为空的项 */
    public String printJoined(List<? extends Expression> exprs, String separator, PrintContext ctx) {
        List<String> parts = new ArrayList<String>();
        for (Expression e : exprs) {
            String text = print(e, ctx);
            if (!text.isEmpty()) parts.add(text);
        }
        return String.join(separator, parts);
    }

    public static String printVarRef(String name, List<PathSegment> path) {
        StringBuilder sb = new StringBuilder("$").append(name);
        if (path != null) {
            for (PathSegment seg : path) {
                sb.append(seg.toSource());
            }
        }
        return sb.toString();
    }

    @Override
    public String visitNode(AstNode node, PrintContext ctx) {
        String kind = node != null ? node.getClass().getSimpleName() : "null";
        LOG.warning("No printer for expression kind " + kind);
        ctx.report(PrintDiagnostic.Kind.UNKNOWN_NODE_KIND, "No printer for expression kind " + kind,
                node != null ? node.getPosition() : null);
        return "";
    }

    // ============ 基础值 ============

    @Override
    public String visitVar(VarExpr node, PrintContext ctx) {
        return printVarRef(node.getName(), node.getPath());
    }

    @Override
    public String visitString(StringExpr node, PrintContext ctx) {
        return RobinStringUtils.quote(node.getValue() != null ? node.getValue() : "");
    }

    @Override
    public String visitNumber(NumberExpr node, PrintContext ctx) {
        return RobinStringUtils.formatNumber(node.getValue());
    }

    @Override
    public String visitLiteral(LiteralExpr node, PrintContext ctx) {
        Object value = node.getValue();
        if (value instanceof Number) {
            return RobinStringUtils.formatNumber(((Number) value).doubleValue());
        }
        return String.valueOf(value);
    }

    @Override
    public String visitLastValue(LastValueExpr node, PrintContext ctx) {
        return "$";
    }

    @Override
    public String visitRaw(RawExpr node, PrintContext ctx) {
        return node.getCode() != null ? node.getCode() : "";
    }

    // ============ 旧格式原始代码 ============

    @Override
    public String visitSubexprCode(SubexprCodeExpr node, PrintContext ctx) {
        return "$(" + nullToEmpty(node.getCode()) + ")";
    }

    @Override
    public String visitObjectCode(ObjectCodeExpr node, PrintContext ctx) {
        return "{" + nullToEmpty(node.getCode()) + "}";
    }

    @Override
    public String visitArrayCode(ArrayCodeExpr node, PrintContext ctx) {
        return "[" + nullToEmpty(node.getCode()) + "]";
    }

    // ============ 复合表达式 ============

    @Override
    public String visitSubexpression(SubexpressionExpr node, PrintContext ctx) {
        List<Statement> body = node.getBody();
        if (body == null || body.isEmpty()) {
            return "$()";
        }
        if (ctx.isTooDeep()) {
            ctx.report(PrintDiagnostic.Kind.NESTING_TOO_DEEP, "Subexpression nesting too deep", node.getPosition());
            return "$()";
        }
        if (isSingleLine(node)) {
            String inner = statementPrinter.printStatement(body.get(0), ctx.full().withoutComments().withIndent(0));
            return "$(" + inner.trim() + ")";
        }

        PrintContext inner = ctx.nested();
        StringBuilder sb = new StringBuilder("$(");
        List<Statement> rest = body;
        if (startsOnSameLine(node)) {
            String first = statementPrinter.printStatement(body.get(0), inner);
            sb.append(stripLeadingWhitespace(first));
            rest = body.subList(1, body.size());
            if (!rest.isEmpty()) {
                sb.append(statementPrinter.printSiblingGap(body.get(0), rest.get(0)));
            }
        } else {
            sb.append('\n');
        }
        sb.append(statementPrinter.printBody(rest, inner));
        sb.append(ctx.indentString()).append(')');
        return sb.toString();
    }

    @Override
    public String visitObjectLiteral(ObjectLiteralExpr node, PrintContext ctx) {
        List<String> parts = new ArrayList<String>();
        for (Map.Entry<String, Expression> e : node.getProperties().entrySet()) {
            String key = BARE_KEY.matcher(e.getKey()).matches() ? e.getKey() : RobinStringUtils.quote(e.getKey());
            parts.add(key + ": " + print(e.getValue(), ctx));
        }
        return "{" + String.join(", ", parts) + "}";
    }

    @Override
    public String visitArrayLiteral(ArrayLiteralExpr node, PrintContext ctx) {
        List<String> parts = new ArrayList<String>();
        for (Expression e : node.getElements()) {
            parts.add(print(e, ctx));
        }
        return "[" + String.join(", ", parts) + "]";
    }

    @Override
    public String visitBinary(BinaryExpr node, PrintContext ctx) {
        String text = print(node.getLeft(), ctx) + " " + node.getDisplayOperator() + " " + print(node.getRight(), ctx);
        return node.isParenthesized() ? "(" + text + ")" : text;
    }

    @Override
    public String visitUnary(UnaryExpr node, PrintContext ctx) {
        return node.getOperator() + " " + print(node.getArgument(), ctx);
    }

    @Override
    public String visitCall(CallExpr node, PrintContext ctx) {
        String args = printJoined(node.getArgs(), " ", ctx);
        String callee = nullToEmpty(node.getCallee());
        return args.isEmpty() ? callee : callee + " " + args;
    }

    /** 命名参数通常由命令打印器展开，这里只作兜底 */
    @Override
    public String visitNamedArgs(NamedArgsExpr node, PrintContext ctx) {
        return String.join(" ", printNamedEntries(node, ctx));
    }

    @Override
    public String visitRange(RangeExpr node, PrintContext ctx) {
        return "range " + print(node.getFrom(), ctx) + " " + print(node.getTo(), ctx);
    }

    /** 命名参数条目：{@code $key=value} */
    List<String> printNamedEntries(NamedArgsExpr node, PrintContext ctx) {
        List<String> parts = new ArrayList<String>();
        for (Map.Entry<String, Expression> e : node.getArgs().entrySet()) {
            String value = print(e.getValue(), ctx);
            if (!value.isEmpty()) {
                parts.add("$" + e.getKey() + "=" + value);
            }
        }
        return parts;
    }

    // ============ 辅助方法 ============

    private static boolean isSingleLine(SubexpressionExpr node) {
        if (node.getBody().size() != 1) {
            return false;
        }
        if (node.getPosition() != null && !node.getPosition().isSingleLine()) {
            return false;
        }
        Statement only = node.getBody().get(0);
        return only.getPosition() == null || only.getPosition().isSingleLine();
    }

    private static boolean startsOnSameLine(SubexpressionExpr node) {
        Statement first = node.getBody().get(0);
        return node.getPosition() != null && first.getPosition() != null
                && first.getPosition().getStartRow() == node.getPosition().getStartRow();
    }

    private static String stripLeadingWhitespace(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            i++;
        }
        return s.substring(i);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
