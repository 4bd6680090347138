package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.LiteralType;
import com.robinpath.compiler.ast.expr.Expression;
import com.robinpath.compiler.ast.expr.NumberExpr;
import com.robinpath.compiler.ast.stmt.*;
import com.robinpath.compiler.lexer.Lexer;
import com.robinpath.compiler.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatementPrinter 单元测试
 */
class StatementPrinterTest {

    private StatementPrinter printer;

    @BeforeEach
    void setUp() {
        printer = new StatementPrinter();
    }

    private static List<Statement> parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    private String print(String source) {
        return printer.print(parse(source));
    }

    private void assertRoundTrip(String source) {
        assertEquals(source, print(source), "Round trip failed for: " + source);
    }

    // ================================================================
    // 规范格式
    // ================================================================

    @Nested
    @DisplayName("规范格式的源码打印后不变")
    class CanonicalTests {

        @Test
        @DisplayName("注释、行尾注释与子表达式")
        void testCommentsAndSubexpression() {
            assertRoundTrip("# header\nlog \"hello\"  # greet\n\n$a = $(add 5 2)\n");
        }

        @Test
        @DisplayName("if / elseif / else")
        void testIfBlock() {
            assertRoundTrip("if $x > 5\n  log 1\nelseif $x > 2\n  log 2\nelse\n  log 3\nendif\n");
        }

        @Test
        @DisplayName("装饰器与 def")
        void testDefine() {
            assertRoundTrip("@cache 60\ndef greet $name\n  log $name\n  return $name\nenddef\n");
        }

        @Test
        @DisplayName("with 回调")
        void testCallback() {
            assertRoundTrip("each $items with $item\n  log $item\nendwith\n");
        }

        @Test
        @DisplayName("chunk、单元格与提示块")
        void testFences() {
            assertRoundTrip("--- chunk:intro ---\n---cell md id:notes---\n# Title\n---end---\n---\nSummarize\n---\n");
        }

        @Test
        @DisplayName("三种括号语法与 into")
        void testParenthesesSyntax() {
            assertRoundTrip("fetch($url=\"x\" $timeout=5)\nlog(\n  1\n  2\n)\nmath.add(1 2) into $sum\n");
        }

        @Test
        @DisplayName("for、together、on")
        void testLoopsAndEvents() {
            assertRoundTrip("for $i in range 1 5\n  log $i\nendfor\ntogether\n  do\n    log 1\n  enddo\nendtogether\non \"ready\"\n  log 2\nendon\n");
        }

        @Test
        @DisplayName("各种赋值形式")
        void testAssignments() {
            assertRoundTrip("set $x 5\n$y as \"s\"\n$z = null\n$r = $\n$v = $other\n$o = {a: 1}\n$t = true\n");
        }

        @Test
        @DisplayName("代码单元格")
        void testCodeCell() {
            assertRoundTrip("---cell code id:c1---\nlog 1\n---end---\n");
        }

        @Test
        @DisplayName("条件运算保留原始写法")
        void testConditionOperators() {
            assertRoundTrip("if $a && ($b or $c) then\n  iftrue log 1\nendif\n");
        }

        @Test
        @DisplayName("do 带参数和 into")
        void testDo() {
            assertRoundTrip("do $a into $out\n  log $a\n  break\nenddo\n");
        }

        @Test
        @DisplayName("单行 if 与 iffalse")
        void testInlineConditions() {
            assertRoundTrip("if $ready log 1\niffalse $x = 2\n");
        }

        @Test
        @DisplayName("单独的变量打印为 $x = $")
        void testShorthand() {
            assertEquals("$x = $\n", print("$x"));
        }

        @Test
        @DisplayName("不规范的空白被规范化")
        void testNormalize() {
            assertEquals("log 1 2\n", print("log   1    2"));
            assertEquals("def f\n  log 1\nenddef\n", print("def f\n        log 1\nenddef"));
        }

        @Test
        @DisplayName("格式化结果再次格式化不变")
        void testIdempotent() {
            String once = print("#note\nlog   1  #tail\nif $x>1   then\n      log 2\n\n\n    log 3\nendif");
            assertEquals(once, print(once));
        }

        @Test
        @DisplayName("Tab 缩进")
        void testTabs() {
            FormatConfig config = new FormatConfig();
            config.setUseSpaces(false);
            assertEquals("def f\n\tlog 1\nenddef\n", printer.print(parse("def f\n  log 1\nenddef\n"), config));
        }

        @Test
        @DisplayName("多个空行压缩为一个")
        void testBlankLines() {
            assertEquals("log 1\n\nlog 2\n", print("log 1\n\n\n\nlog 2\n"));
        }
    }

    // ================================================================
    // 赋值字面量
    // ================================================================

    @Nested
    @DisplayName("赋值字面量类型")
    class LiteralTypeTests {

        @Test
        @DisplayName("按声明类型转换")
        void testConversion() {
            AssignmentStmt stmt = new AssignmentStmt(null, "flag");
            stmt.setLiteralValue(1.0);
            stmt.setLiteralValueType(LiteralType.BOOLEAN);
            assertEquals("$flag = true\n", printer.printStatement(stmt, PrintContext.create()));
        }

        @Test
        @DisplayName("数组与对象字面量输出为 JSON")
        void testStructured() {
            AssignmentStmt stmt = new AssignmentStmt(null, "list");
            stmt.setLiteralValue(Arrays.<Object>asList(1.0, "a"));
            assertEquals("$list = [1,\"a\"]\n", printer.printStatement(stmt, PrintContext.create()));
        }

        @Test
        @DisplayName("转换失败时保留原类型并记录诊断")
        void testConversionFailure() {
            AssignmentStmt stmt = new AssignmentStmt(null, "n");
            stmt.setLiteralValue("hello");
            stmt.setLiteralValueType(LiteralType.NUMBER);
            PrintContext ctx = PrintContext.create();
            assertEquals("$n = \"hello\"\n", printer.printStatement(stmt, ctx));
            assertEquals(1, ctx.getDiagnostics().size());
            assertEquals(PrintDiagnostic.Kind.TYPE_CONVERSION_FAILURE, ctx.getDiagnostics().get(0).getKind());
        }

        @Test
        @DisplayName("没有值的赋值不输出")
        void testNoValue() {
            assertEquals("", printer.printStatement(new AssignmentStmt(null, "x"), PrintContext.create()));
        }
    }

    // ================================================================
    // 注释
    // ================================================================

    @Nested
    @DisplayName("注释")
    class CommentTests {

        @Test
        @DisplayName("清空文本的注释被删除")
        void testDeletedComments() {
            List<Statement> tree = parse("# old\nlog 1  # note\n");
            Statement log = tree.get(0);
            log.getLeadingComments().get(0).setText("");
            log.getInlineComment().setText("");
            assertEquals("log 1\n", printer.print(tree));
        }

        @Test
        @DisplayName("多行注释中的空行输出为单独的 #")
        void testMultilineComment() {
            CommandStmt cmd = new CommandStmt(null, "log", new ArrayList<Expression>(Arrays.<Expression>asList(new NumberExpr(1))));
            cmd.getComments().add(new Comment("a\n\nb", null, false));
            cmd.setInlineComment(new Comment("end", null, true));
            assertEquals("# a\n#\n# b\nlog 1  # end\n", printer.printStatement(cmd, PrintContext.create()));
        }

        @Test
        @DisplayName("独立注释组")
        void testStandalone() {
            assertEquals("# a\n# b\n\nlog 1\n", print("# a\n# b\n\nlog 1\n"));
        }
    }

    // ================================================================
    // 头部与其他
    // ================================================================

    @Nested
    @DisplayName("头部与元数据")
    class HeaderTests {

        @Test
        @DisplayName("头部不含注释、装饰器和语句体")
        void testHeader() {
            PrintContext ctx = PrintContext.create();
            Statement def = parse("@cache\ndef greet $name  # hi\n  log $name\nenddef").get(0);
            assertEquals("def greet $name", printer.printHeader(def, ctx));
            Statement ifBlock = parse("if $x then\n  log 1\nendif").get(0);
            assertEquals("if $x then", printer.printHeader(ifBlock, ctx));
            assertEquals("  if $x then", printer.printHeader(ifBlock, ctx.withBasePrefix("  ")));
        }

        @Test
        @DisplayName("elseif 头部不输出 then")
        void testElseIfHeader() {
            IfBlockStmt stmt = (IfBlockStmt) parse("if $a\n  log 1\nelseif $b then\n  log 2\nendif").get(0);
            assertEquals("elseif $b", printer.elseIfHeader(stmt.getElseifBranches().get(0), PrintContext.create()));
        }

        @Test
        @DisplayName("chunk 元数据排序，含空白的值加引号")
        void testChunkMeta() {
            Map<String, String> meta = new LinkedHashMap<String, String>();
            meta.put("title", "Hello world");
            meta.put("a", "b");
            ChunkMarkerStmt chunk = new ChunkMarkerStmt(null, "intro", meta);
            assertEquals("--- chunk:intro a:b title:\"Hello world\" ---\n",
                    printer.printStatement(chunk, PrintContext.create()));
        }

        @Test
        @DisplayName("元数据值中的引号被转义，可以重新解析")
        void testChunkMetaWithQuote() {
            Map<String, String> meta = new LinkedHashMap<String, String>();
            meta.put("title", "say \"hi\"");
            ChunkMarkerStmt chunk = new ChunkMarkerStmt(null, "intro", meta);
            String out = printer.printStatement(chunk, PrintContext.create());
            assertEquals("--- chunk:intro title:\"say \\\"hi\\\"\" ---\n", out);
            ChunkMarkerStmt reparsed = (ChunkMarkerStmt) parse(out).get(0);
            assertEquals("say \"hi\"", reparsed.getMeta().get("title"));
        }

        @Test
        @DisplayName("新语句之间没有空行")
        void testSiblingGapWithoutPositions() {
            CommandStmt a = new CommandStmt(null, "log", new ArrayList<Expression>());
            CommandStmt b = new CommandStmt(new CodePosition(5, 0, 5, 2), "log", new ArrayList<Expression>());
            assertEquals("", printer.printSiblingGap(a, b));
        }
    }

    // ================================================================
    // 降级
    // ================================================================

    @Nested
    @DisplayName("降级处理")
    class FallbackTests {

        @Test
        @DisplayName("未知语句输出为空并记录诊断")
        void testUnknownStatement() {
            Statement mystery = new Statement(null) {
                @Override
                public String getKind() {
                    return "mystery";
                }

                @Override
                public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
                    return visitor.visitNode(this, context);
                }
            };
            PrintContext ctx = PrintContext.create();
            assertEquals("", printer.printStatement(mystery, ctx));
            assertEquals(PrintDiagnostic.Kind.UNKNOWN_NODE_KIND, ctx.getDiagnostics().get(0).getKind());
        }

        @Test
        @DisplayName("超过最大深度的语句体不再打印")
        void testTooDeep() {
            FormatConfig config = new FormatConfig();
            config.setMaxDepth(1);
            PrintContext ctx = PrintContext.create(config);
            String out = printer.printBody(parse("if $a\n  if $b\n    log 1\n  endif\nendif\n"), ctx);
            assertEquals("if $a\n  if $b\n  endif\nendif\n", out);
            assertEquals(PrintDiagnostic.Kind.NESTING_TOO_DEEP, ctx.getDiagnostics().get(0).getKind());
        }

        @Test
        @DisplayName("null 语句记录诊断")
        void testNullStatement() {
            PrintContext ctx = PrintContext.create();
            assertEquals("", printer.printStatement(null, ctx));
            assertFalse(ctx.getDiagnostics().isEmpty());
        }
    }
}
