package com.robinpath.compiler.formatter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LineIndex 单元测试
 */
class LineIndexTest {

    private final LineIndex index = new LineIndex("ab\n  cd\n");

    @Test
    @DisplayName("行数包含末尾换行后的空行")
    void testLineCount() {
        assertEquals(3, index.lineCount());
        assertEquals(1, new LineIndex("").lineCount());
        assertEquals(1, new LineIndex(null).lineCount());
    }

    @Test
    @DisplayName("行列转偏移量")
    void testOffsetAt() {
        assertEquals(5, index.offsetAt(1, 2, false));
        assertEquals(6, index.offsetAt(1, 2, true));
        // 列可以指向行尾
        assertEquals(2, index.offsetAt(0, 2, false));
    }

    @Test
    @DisplayName("行首与行尾偏移量")
    void testLineOffsets() {
        assertEquals(3, index.lineStartOffset(1));
        assertEquals(7, index.lineEndOffset(1));
        assertEquals(8, index.nextLineStartOffset(1));
        assertEquals(8, index.lineEndOffset(2));
    }

    @Test
    @DisplayName("行文本与缩进")
    void testLines() {
        assertEquals("  cd", index.getLine(1));
        assertEquals("  ", index.leadingWhitespace(1));
        assertEquals("", index.leadingWhitespace(0));
        assertEquals("ab\n  cd\n", index.lines(0, 1));
    }

    @Test
    @DisplayName("越界位置抛出 PositionOutOfRangeException")
    void testOutOfRange() {
        PositionOutOfRangeException e = assertThrows(PositionOutOfRangeException.class,
                () -> index.offsetAt(5, 0, false));
        assertEquals(5, e.getRow());
        assertThrows(PositionOutOfRangeException.class, () -> index.offsetAt(0, 3, false));
        assertThrows(PositionOutOfRangeException.class, () -> index.offsetAt(0, -1, false));
        assertThrows(PositionOutOfRangeException.class, () -> index.getLine(-1));
    }
}
