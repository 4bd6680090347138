package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.PathSegment;
import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.CommandStmt;
import com.robinpath.compiler.ast.stmt.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionPrinter 单元测试
 */
class ExpressionPrinterTest {

    private ExpressionPrinter printer;
    private PrintContext ctx;

    @BeforeEach
    void setUp() {
        printer = new StatementPrinter().getExpressionPrinter();
        ctx = PrintContext.create();
    }

    private String print(Expression expr) {
        return printer.print(expr, ctx);
    }

    private static NumberExpr num(double value) {
        return new NumberExpr(value);
    }

    @Nested
    @DisplayName("基础值")
    class BasicTests {

        @Test
        @DisplayName("变量路径")
        void testVar() {
            VarExpr var = new VarExpr("user", Arrays.asList(PathSegment.property("tags"), PathSegment.index("0")));
            assertEquals("$user.tags[0]", print(var));
            assertEquals("$x", print(new VarExpr("x")));
        }

        @Test
        @DisplayName("字符串统一用双引号并转义")
        void testString() {
            assertEquals("\"hello\"", print(new StringExpr("hello")));
            assertEquals("\"say \\\"hi\\\"\\n\"", print(new StringExpr("say \"hi\"\n")));
        }

        @Test
        @DisplayName("整数不带小数点")
        void testNumber() {
            assertEquals("3", print(num(3)));
            assertEquals("-2.5", print(num(-2.5)));
            assertEquals("0.1", print(num(0.1)));
        }

        @Test
        @DisplayName("字面量与裸词")
        void testLiteral() {
            assertEquals("true", print(new LiteralExpr(true)));
            assertEquals("null", print(new LiteralExpr(null)));
            assertEquals("bare", print(new LiteralExpr("bare")));
            assertEquals("$", print(new LastValueExpr()));
        }

        @Test
        @DisplayName("原始代码片段")
        void testRawCode() {
            assertEquals("{a: 1}", print(new ObjectCodeExpr("a: 1")));
            assertEquals("[1, 2]", print(new ArrayCodeExpr("1, 2")));
            assertEquals("$(add 1 2)", print(new SubexprCodeExpr("add 1 2")));
            assertEquals("$x > 1", print(new RawExpr("$x > 1")));
        }
    }

    @Nested
    @DisplayName("复合表达式")
    class CompoundTests {

        @Test
        @DisplayName("对象字面量的键按需加引号")
        void testObjectLiteral() {
            Map<String, Expression> props = new LinkedHashMap<String, Expression>();
            props.put("name", new StringExpr("a"));
            props.put("full name", num(1));
            assertEquals("{name: \"a\", \"full name\": 1}", print(new ObjectLiteralExpr(props)));
        }

        @Test
        @DisplayName("数组字面量")
        void testArrayLiteral() {
            assertEquals("[1, \"b\"]", print(new ArrayLiteralExpr(Arrays.<Expression>asList(num(1), new StringExpr("b")))));
            assertEquals("[]", print(new ArrayLiteralExpr(new ArrayList<Expression>())));
        }

        @Test
        @DisplayName("二元运算保留原始写法和括号")
        void testBinary() {
            BinaryExpr and = new BinaryExpr(new VarExpr("a"), "and", "&&", new VarExpr("b"), false);
            assertEquals("$a && $b", print(and));
            and.setParenthesized(true);
            assertEquals("($a && $b)", print(and));
            assertEquals("$a > 5", print(new BinaryExpr(new VarExpr("a"), ">", num(5))));
        }

        @Test
        @DisplayName("一元运算、调用与 range")
        void testUnaryCallRange() {
            assertEquals("not $x", print(new UnaryExpr("not", new VarExpr("x"))));
            assertEquals("empty $x", print(new CallExpr("empty", Arrays.<Expression>asList(new VarExpr("x")))));
            assertEquals("ready", print(new CallExpr("ready", new ArrayList<Expression>())));
            assertEquals("range 1 5", print(new RangeExpr(num(1), num(5))));
        }

        @Test
        @DisplayName("单行子表达式")
        void testSubexpression() {
            List<Statement> body = new ArrayList<Statement>();
            body.add(new CommandStmt(null, "add", Arrays.<Expression>asList(num(5), num(2))));
            assertEquals("$(add 5 2)", print(new SubexpressionExpr(body)));
            assertEquals("$()", print(new SubexpressionExpr(Collections.<Statement>emptyList())));
        }

        @Test
        @DisplayName("命名参数兜底打印")
        void testNamedArgs() {
            Map<String, Expression> args = new LinkedHashMap<String, Expression>();
            args.put("url", new StringExpr("x"));
            args.put("timeout", num(5));
            assertEquals("$url=\"x\" $timeout=5", print(new NamedArgsExpr(args)));
        }
    }

    @Test
    @DisplayName("未知表达式输出为空并记录诊断")
    void testUnknownKind() {
        Expression mystery = new Expression() {
            @Override
            public String getKind() {
                return "mystery";
            }

            @Override
            public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
                return visitor.visitNode(this, context);
            }
        };
        assertEquals("", print(mystery));
        assertEquals(1, ctx.getDiagnostics().size());
        assertEquals(PrintDiagnostic.Kind.UNKNOWN_NODE_KIND, ctx.getDiagnostics().get(0).getKind());
        assertEquals("", print(null));
    }
}
