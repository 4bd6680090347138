package com.robinpath.compiler.formatter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CodeWriter 单元测试
 */
class CodeWriterTest {

    @Test
    @DisplayName("按层级缩进")
    void testIndent() {
        CodeWriter w = new CodeWriter();
        w.pushLine("def f");
        w.indent(1);
        w.pushLine("log 1");
        w.indent(0);
        w.pushLine("enddef");
        assertEquals("def f\n  log 1\nenddef\n", w.toString());
    }

    @Test
    @DisplayName("Tab 缩进与基础前缀")
    void testTabsWithBasePrefix() {
        FormatConfig config = new FormatConfig();
        config.setUseSpaces(false);
        CodeWriter w = new CodeWriter(config, "    ");
        w.indent(2);
        assertEquals("    \t\t", w.indentString());
        w.pushLine("x");
        assertEquals("    \t\tx\n", w.toString());
    }

    @Test
    @DisplayName("空行会先补齐未结束的行")
    void testBlankLine() {
        CodeWriter w = new CodeWriter();
        w.push("x");
        w.pushBlankLine();
        assertEquals("x\n\n", w.toString());
    }

    @Test
    @DisplayName("负数层级按 0 处理")
    void testNegativeDepth() {
        CodeWriter w = new CodeWriter();
        w.indent(-3);
        assertEquals(0, w.getDepth());
        assertTrue(w.isEmpty());
    }
}
