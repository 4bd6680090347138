package com.robinpath.compiler;

import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.formatter.FormatConfig;
import com.robinpath.compiler.formatter.StatementPrinter;
import com.robinpath.compiler.lexer.Lexer;
import com.robinpath.compiler.parser.ParseResult;
import com.robinpath.compiler.parser.Parser;
import com.robinpath.compiler.regen.RegenerationResult;
import com.robinpath.compiler.regen.SourceRegenerator;
import com.robinpath.compiler.serialization.AstJsonSerializer;

import java.util.List;

/**
 * RobinPath 源码工具入口
 *
 * <pre>
 * List&lt;Statement&gt; tree = RobinPath.parse(source);
 * ((CommandStmt) tree.get(0)).setName("print");
 * String updated = RobinPath.regenerate(source, tree).getSource();
 * </pre>
 */
public final class RobinPath {

    private RobinPath() {}

    /**
     * 解析源码，出错时抛出 {@link com.robinpath.compiler.parser.ParseException}
     */
    public static List<Statement> parse(String source) {
        return new Parser(new Lexer(source)).parse();
    }

    public static List<Statement> parse(String source, String fileName) {
        return new Parser(new Lexer(source, fileName)).parse();
    }

    /**
     * 容错解析，错误记录在结果中
     */
    public static ParseResult parseTolerant(String source) {
        return new Parser(new Lexer(source)).parseTolerant();
    }

    public static RegenerationResult regenerate(String source, List<Statement> tree) {
        return new SourceRegenerator().regenerate(source, tree);
    }

    public static RegenerationResult regenerate(String source, List<Statement> original, List<Statement> mutated) {
        return new SourceRegenerator().regenerate(source, original, mutated);
    }

    /**
     * 规范格式打印
     */
    public static String print(List<Statement> tree) {
        return new StatementPrinter().print(tree);
    }

    public static String print(List<Statement> tree, FormatConfig config) {
        return new StatementPrinter().print(tree, config);
    }

    public static String toJson(List<Statement> tree) {
        return new AstJsonSerializer().toJsonString(tree, false);
    }

    public static String toJson(List<Statement> tree, boolean pretty) {
        return new AstJsonSerializer().toJsonString(tree, pretty);
    }

    public static List<Statement> fromJson(String json) {
        return new AstJsonSerializer().fromJson(json);
    }
}
