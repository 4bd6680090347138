package com.robinpath.compiler.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.robinpath.compiler.ast.expr.RawExpr;
import com.robinpath.compiler.ast.stmt.AssignmentStmt;
import com.robinpath.compiler.ast.stmt.CommandStmt;
import com.robinpath.compiler.ast.stmt.InlineIfStmt;
import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.formatter.StatementPrinter;
import com.robinpath.compiler.lexer.Lexer;
import com.robinpath.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstJsonSerializer 语法树 JSON")
class AstJsonSerializerTest {

    private final AstJsonSerializer serializer = new AstJsonSerializer();

    private static List<Statement> parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    private JsonObject first(String source) {
        return serializer.toJson(parse(source)).get(0).getAsJsonObject();
    }

    @Nested
    @DisplayName("输出")
    class WriteTests {

        @Test
        @DisplayName("命令节点的种类、位置和参数")
        void testCommand() {
            JsonObject json = first("log \"hello\"");
            assertThat(json.get("type").getAsString()).isEqualTo("command");
            assertThat(json.get("name").getAsString()).isEqualTo("log");
            assertThat(json.has("module")).isFalse();
            assertThat(json.get("syntaxType").getAsString()).isEqualTo("space");

            JsonObject pos = json.getAsJsonObject("codePos");
            assertThat(pos.get("startRow").getAsInt()).isZero();
            assertThat(pos.get("startCol").getAsInt()).isZero();
            assertThat(pos.get("endRow").getAsInt()).isZero();
            assertThat(pos.get("endCol").getAsInt()).isEqualTo(10);

            JsonObject arg = json.getAsJsonArray("args").get(0).getAsJsonObject();
            assertThat(arg.get("type").getAsString()).isEqualTo("string");
            assertThat(arg.get("value").getAsString()).isEqualTo("hello");
        }

        @Test
        @DisplayName("带点号的命令名推断出模块")
        void testDottedModule() {
            assertThat(first("math.add 1 2").get("module").getAsString()).isEqualTo("math");
        }

        @Test
        @DisplayName("注册过的函数解析到模块")
        void testRegisteredModule() {
            ModuleResolver resolver = new ModuleResolver();
            resolver.register("array", "create");
            JsonObject json = new AstJsonSerializer(resolver).toJson(parse("create 1")).get(0).getAsJsonObject();
            assertThat(json.get("module").getAsString()).isEqualTo("array");
        }

        @Test
        @DisplayName("整数输出不带小数点")
        void testIntegralNumber() {
            assertThat(serializer.toJsonString(parse("log 5"), false)).contains("\"value\":5");
            assertThat(serializer.toJsonString(parse("log 2.5"), false)).contains("\"value\":2.5");
        }

        @Test
        @DisplayName("布尔标志只在为 true 时输出")
        void testFlags() {
            JsonObject plain = first("$x = 5");
            assertThat(plain.has("isSet")).isFalse();
            assertThat(plain.has("hasAs")).isFalse();
            assertThat(plain.get("literalValue").getAsDouble()).isEqualTo(5.0);

            JsonObject set = first("set $x 5");
            assertThat(set.get("isSet").getAsBoolean()).isTrue();
        }

        @Test
        @DisplayName("null 字面量输出为 JSON null")
        void testNullLiteral() {
            JsonObject json = first("$z = null");
            assertThat(json.has("literalValue")).isTrue();
            assertThat(json.get("literalValue").isJsonNull()).isTrue();
        }

        @Test
        @DisplayName("注释带位置和行尾标志")
        void testComments() {
            JsonArray comments = first("# a\nlog 1  # b").getAsJsonArray("comments");
            assertThat(comments.size()).isEqualTo(2);
            assertThat(comments.get(0).getAsJsonObject().get("text").getAsString()).isEqualTo("a");
            assertThat(comments.get(0).getAsJsonObject().get("inline").getAsBoolean()).isFalse();
            assertThat(comments.get(1).getAsJsonObject().get("inline").getAsBoolean()).isTrue();
        }

        @Test
        @DisplayName("elseif 分支的条件字段名")
        void testElseIfBranches() {
            JsonObject json = first("if $a\n  log 1\nelseif $b\n  log 2\nendif");
            JsonObject branch = json.getAsJsonArray("elseifBranches").get(0).getAsJsonObject();
            assertThat(branch.getAsJsonObject("conditionExpr").get("type").getAsString()).isEqualTo("var");
            assertThat(branch.getAsJsonArray("body").size()).isEqualTo(1);
        }

        @Test
        @DisplayName("美化输出带换行")
        void testPretty() {
            assertThat(serializer.toJsonString(parse("log 1"), true)).contains("\n");
            assertThat(serializer.toJsonString(parse("log 1"), false)).doesNotContain("\n");
        }
    }

    @Nested
    @DisplayName("读取")
    class ReadTests {

        private void assertJsonRoundTrip(String source) {
            String json = serializer.toJsonString(parse(source), false);
            List<Statement> restored = serializer.fromJson(json);
            assertThat(serializer.toJsonString(restored, false)).isEqualTo(json);
            assertThat(new StatementPrinter().print(restored)).isEqualTo(new StatementPrinter().print(parse(source)));
        }

        @Test
        @DisplayName("读回后结构不变")
        void testRoundTrip() {
            assertJsonRoundTrip("# header\nlog \"hello\"  # greet\n\n$a = $(add 5 2)\n");
            assertJsonRoundTrip("@cache 60\ndef greet $name\n  log $name\n  return $name\nenddef\n");
            assertJsonRoundTrip("if $x > 5\n  log 1\nelseif $x > 2\n  log 2\nelse\n  log 3\nendif\n");
            assertJsonRoundTrip("each $items with $item\n  log $item\nendwith\n");
            assertJsonRoundTrip("for $i in range 1 5\n  log $i\nendfor\n");
            assertJsonRoundTrip("set $x 5\n$y as \"s\"\n$z = null\n$r = $\n$o = {a: 1}\n");
            assertJsonRoundTrip("--- chunk:intro ---\n---cell md id:notes---\n# Title\n---end---\n---\nSummarize\n---\n");
            assertJsonRoundTrip("math.add(1 2) into $sum\nfetch($url=\"x\" $timeout=5)\n");
        }

        @Test
        @DisplayName("缺少 module 时由名称推断")
        void testModuleFromName() {
            List<Statement> tree = serializer.fromJson("[{\"type\":\"command\",\"name\":\"math.add\",\"args\":[]}]");
            CommandStmt cmd = (CommandStmt) tree.get(0);
            assertThat(cmd.getModule()).isEqualTo("math");
            assertThat(cmd.getSyntaxType()).isEqualTo(CommandStmt.SyntaxType.SPACE);
        }

        @Test
        @DisplayName("字符串形式的条件读为原始表达式")
        void testStringCondition() {
            List<Statement> tree = serializer.fromJson("[{\"type\":\"inlineIf\",\"conditionExpr\":\"$x > 1\","
                    + "\"command\":{\"type\":\"command\",\"name\":\"log\","
                    + "\"args\":[{\"type\":\"number\",\"value\":1}]}}]");
            InlineIfStmt stmt = (InlineIfStmt) tree.get(0);
            assertThat(stmt.getConditionExpr()).isInstanceOf(RawExpr.class);
            assertThat(new StatementPrinter().print(tree)).isEqualTo("if $x > 1 log 1\n");
        }

        @Test
        @DisplayName("literalValue 为 null 时仍视为已设置")
        void testNullLiteral() {
            List<Statement> tree = serializer.fromJson(
                    "[{\"type\":\"assignment\",\"targetName\":\"z\",\"literalValue\":null}]");
            AssignmentStmt a = (AssignmentStmt) tree.get(0);
            assertThat(a.hasLiteralValue()).isTrue();
            assertThat(a.getLiteralValue()).isNull();
        }

        @Test
        @DisplayName("根节点不是数组时报错")
        void testNotArray() {
            assertThatThrownBy(() -> serializer.fromJson("{}")).isInstanceOf(JsonParseException.class);
        }

        @Test
        @DisplayName("未知或缺少类型时报错")
        void testUnknownType() {
            assertThatThrownBy(() -> serializer.fromJson("[{\"type\":\"bogus\"}]"))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("bogus");
            assertThatThrownBy(() -> serializer.fromJson("[{}]")).isInstanceOf(JsonParseException.class);
            assertThatThrownBy(() -> serializer.fromJson(
                    "[{\"type\":\"command\",\"name\":\"log\",\"args\":[{\"type\":\"nope\"}]}]"))
                    .isInstanceOf(JsonParseException.class);
        }
    }
}
