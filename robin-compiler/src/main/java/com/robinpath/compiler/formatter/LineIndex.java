package com.robinpath.compiler.formatter;

import java.util.ArrayList;
import java.util.List;

/**
 * 行列与偏移量的双向映射。每份源码构建一次。
 */
public final class LineIndex {
    private final String source;
    private final int[] lineStarts;

    public LineIndex(String source) {
        this.source = source != null ? source : "";
        List<Integer> starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < this.source.length(); i++) {
            if (this.source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        lineStarts = new int[starts.size()];
        for (int i = 0; i < lineStarts.length; i++) {
            lineStarts[i] = starts.get(i);
        }
    }

    public String getSource() {
        return source;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * 行列转偏移量
     *
     * @param exclusive 为 true 时返回 col 之后紧邻的偏移量
     */
    public int offsetAt(int row, int col, boolean exclusive) {
        checkRow(row, col);
        int length = lineEndOffset(row) - lineStarts[row];
        if (col < 0 || col > length) {
            throw new PositionOutOfRangeException("Column out of range", row, col);
        }
        int offset = lineStarts[row] + col;
        return exclusive ? Math.min(offset + 1, source.length()) : offset;
    }

    /** 行首偏移量 */
    public int lineStartOffset(int row) {
        checkRow(row, 0);
        return lineStarts[row];
    }

    /** 行尾换行符的偏移量；最后一行返回源码长度 */
    public int lineEndOffset(int row) {
        checkRow(row, 0);
        return row + 1 < lineStarts.length ? lineStarts[row + 1] - 1 : source.length();
    }

    /** 下一行的行首偏移量（含本行换行符）；最后一行返回源码长度 */
    public int nextLineStartOffset(int row) {
        checkRow(row, 0);
        return row + 1 < lineStarts.length ? lineStarts[row + 1] : source.length();
    }

    public String getLine(int row) {
        return source.substring(lineStartOffset(row), lineEndOffset(row));
    }

    /** 行首空白（缩进） */
    public String leadingWhitespace(int row) {
        String line = getLine(row);
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }

    /** 整行文本片段 [fromRow, toRow]，包含 toRow 的换行符 */
    public String lines(int fromRow, int toRow) {
        return source.substring(lineStartOffset(fromRow), nextLineStartOffset(toRow));
    }

    private void checkRow(int row, int col) {
        if (row < 0 || row >= lineStarts.length) {
            throw new PositionOutOfRangeException("Row out of range", row, col);
        }
    }
}
