package com.robinpath.compiler.ast;

/**
 * 源码位置（行列均从 0 开始，endCol 包含最后一个字符，不含行尾注释）
 */
public final class CodePosition {
    private final int startRow;
    private final int startCol;
    private final int endRow;
    private final int endCol;

    public CodePosition(int startRow, int startCol, int endRow, int endCol) {
        if (endRow < startRow || (endRow == startRow && endCol < startCol)) {
            throw new IllegalArgumentException("Invalid position: " + startRow + ":" + startCol
                    + "-" + endRow + ":" + endCol);
        }
        this.startRow = startRow;
        this.startCol = startCol;
        this.endRow = endRow;
        this.endCol = endCol;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getEndCol() {
        return endCol;
    }

    public boolean isSingleLine() {
        return startRow == endRow;
    }

    /** 合并两个位置，覆盖从 this 开始到 other 结束的范围 */
    public CodePosition spanTo(CodePosition other) {
        return new CodePosition(startRow, startCol, other.endRow, other.endCol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodePosition)) return false;
        CodePosition that = (CodePosition) o;
        return startRow == that.startRow && startCol == that.startCol
                && endRow == that.endRow && endCol == that.endCol;
    }

    @Override
    public int hashCode() {
        int result = startRow;
        result = 31 * result + startCol;
        result = 31 * result + endRow;
        result = 31 * result + endCol;
        return result;
    }

    @Override
    public String toString() {
        return startRow + ":" + startCol + "-" + endRow + ":" + endCol;
    }
}
