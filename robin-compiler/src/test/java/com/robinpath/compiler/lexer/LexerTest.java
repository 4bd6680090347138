package com.robinpath.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 非 NEWLINE 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF && t.getType() != TokenType.NEWLINE)
                .collect(Collectors.toList());
    }

    /** 扫描源码（保留 NEWLINE），返回非 EOF 的 token 类型 */
    private List<TokenType> typesWithNewline(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .map(Token::getType)
                .collect(Collectors.toList());
    }

    /** 扫描源码，捕获错误输出 */
    private String scanWithErrors(String source) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        new Lexer(source, "<test>", ps).scanTokens();
        return baos.toString(StandardCharsets.UTF_8);
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    // ================================================================
    // 运算符与分隔符
    // ================================================================

    @Nested
    @DisplayName("运算符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("括号类 token")
        void testBrackets() {
            assertSingleToken("(", TokenType.LPAREN);
            assertSingleToken(")", TokenType.RPAREN);
            assertSingleToken("{", TokenType.LBRACE);
            assertSingleToken("}", TokenType.RBRACE);
            assertSingleToken("[", TokenType.LBRACKET);
            assertSingleToken("]", TokenType.RBRACKET);
        }

        @Test
        @DisplayName("双字符比较运算符")
        void testComparison() {
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">=", TokenType.GE);
            assertSingleToken("<", TokenType.LT);
            assertSingleToken(">", TokenType.GT);
            assertSingleToken("=", TokenType.ASSIGN);
        }

        @Test
        @DisplayName("逻辑运算符")
        void testLogical() {
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("!", TokenType.NOT);
        }

        @Test
        @DisplayName("单个 & 报错")
        void testSingleAmpersand() {
            String err = scanWithErrors("&");
            assertTrue(err.contains("Lexer error"));
            assertTrue(err.startsWith("[<test>:1:"));
            assertSingleToken("&", TokenType.ERROR);
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("数字字面量为 Double")
        void testNumber() {
            assertSingleToken("42", TokenType.NUMBER, 42.0);
            assertSingleToken("3.14", TokenType.NUMBER, 3.14);
        }

        @Test
        @DisplayName("空白后的负号是负数")
        void testNegativeNumber() {
            List<Token> toks = tokens("add -3 5");
            assertEquals(3, toks.size());
            assertEquals(TokenType.NUMBER, toks.get(1).getType());
            assertEquals(-3.0, toks.get(1).getLiteral());
        }

        @Test
        @DisplayName("紧跟操作数的负号是减号")
        void testMinus() {
            List<Token> toks = tokens("5-3");
            assertEquals(TokenType.NUMBER, toks.get(0).getType());
            assertEquals(TokenType.MINUS, toks.get(1).getType());
            assertEquals(3.0, toks.get(2).getLiteral());
        }

        @Test
        @DisplayName("三种引号的字符串")
        void testStrings() {
            assertSingleToken("\"hello\"", TokenType.STRING, "hello");
            assertSingleToken("'hello'", TokenType.STRING, "hello");
            assertSingleToken("`hello`", TokenType.STRING, "hello");
        }

        @Test
        @DisplayName("字符串转义")
        void testEscape() {
            assertSingleToken("\"a\\nb\"", TokenType.STRING, "a\nb");
            assertSingleToken("\"say \\\"hi\\\"\"", TokenType.STRING, "say \"hi\"");
        }

        @Test
        @DisplayName("未闭合的字符串报错")
        void testUnterminatedString() {
            String err = scanWithErrors("\"abc");
            assertTrue(err.contains("Unterminated string"));
        }
    }

    // ================================================================
    // 标识符、变量与关键词
    // ================================================================

    @Nested
    @DisplayName("标识符与变量")
    class IdentifierTests {

        @Test
        @DisplayName("关键词")
        void testKeywords() {
            assertSingleToken("if", TokenType.KW_IF);
            assertSingleToken("endwith", TokenType.KW_ENDWITH);
            assertSingleToken("together", TokenType.KW_TOGETHER);
            assertTrue(Lexer.getKeywords().contains("enddef"));
        }

        @Test
        @DisplayName("带模块前缀的命令名是一个标识符")
        void testDottedIdentifier() {
            assertSingleToken("array.create", TokenType.IDENTIFIER);
            // 带点号时不识别为关键词
            assertSingleToken("if.x", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("变量带属性和索引路径")
        void testVariablePath() {
            assertSingleToken("$name", TokenType.VARIABLE, "name");
            assertSingleToken("$user.tags[0]", TokenType.VARIABLE, "user.tags[0]");
        }

        @Test
        @DisplayName("单独的 $ 和 $(")
        void testDollar() {
            assertSingleToken("$", TokenType.LAST_VALUE);
            List<Token> toks = tokens("$(add 1 2)");
            assertEquals(TokenType.SUBEXPR_OPEN, toks.get(0).getType());
            assertEquals(TokenType.RPAREN, toks.get(toks.size() - 1).getType());
        }

        @Test
        @DisplayName("装饰器")
        void testDecorator() {
            assertSingleToken("@cache", TokenType.DECORATOR, "cache");
        }
    }

    // ================================================================
    // 注释与换行
    // ================================================================

    @Nested
    @DisplayName("注释与换行")
    class CommentTests {

        @Test
        @DisplayName("注释文本去掉 # 和一个空格以及行尾空白")
        void testCommentText() {
            assertSingleToken("# hello  ", TokenType.COMMENT, "hello");
            assertSingleToken("#  indented", TokenType.COMMENT, " indented");
        }

        @Test
        @DisplayName("行尾注释的列号")
        void testInlineCommentColumn() {
            List<Token> toks = tokens("add 1 2  # sum");
            Token comment = toks.get(toks.size() - 1);
            assertEquals(TokenType.COMMENT, comment.getType());
            assertEquals(10, comment.getColumn());
        }

        @Test
        @DisplayName("反斜杠续行不产生换行")
        void testLineContinuation() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.NUMBER),
                    typesWithNewline("log 1 \\\n  2"));
        }

        @Test
        @DisplayName("行号与列号从 1 开始")
        void testPositions() {
            List<Token> toks = tokens("log 1\n  log \"hello\"");
            Token second = toks.get(2);
            assertEquals(2, second.getLine());
            assertEquals(3, second.getColumn());
            Token str = toks.get(3);
            assertEquals(7, str.getColumn());
            assertEquals(13, str.getEndColumn());
        }
    }

    // ================================================================
    // 围栏块
    // ================================================================

    @Nested
    @DisplayName("围栏块")
    class FenceTests {

        @Test
        @DisplayName("chunk 标记")
        void testChunk() {
            assertSingleToken("--- chunk:intro ---", TokenType.CHUNK);
        }

        @Test
        @DisplayName("非代码单元格整体一个 token")
        void testCell() {
            List<Token> toks = tokens("---cell md id:notes---\n# Title\n---end---");
            assertEquals(1, toks.size());
            assertEquals(TokenType.CELL, toks.get(0).getType());
            assertEquals(3, toks.get(0).getEndLine());
        }

        @Test
        @DisplayName("代码单元格的内容按普通 token 切分")
        void testCodeCell() {
            assertEquals(List.of(TokenType.CELL_START, TokenType.NEWLINE,
                            TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.NEWLINE,
                            TokenType.CELL_END),
                    typesWithNewline("---cell code---\nlog 1\n---end---"));
        }

        @Test
        @DisplayName("提示块")
        void testPromptBlock() {
            List<Token> toks = tokens("---\nSummarize this\n---\nlog 1");
            assertEquals(TokenType.PROMPT_BLOCK, toks.get(0).getType());
            assertEquals(TokenType.IDENTIFIER, toks.get(1).getType());
            assertEquals(4, toks.get(1).getLine());
        }

        @Test
        @DisplayName("未闭合的提示块报错")
        void testUnterminatedPrompt() {
            String err = scanWithErrors("---\nabc");
            assertTrue(err.contains("Unterminated prompt block"));
        }
    }
}
