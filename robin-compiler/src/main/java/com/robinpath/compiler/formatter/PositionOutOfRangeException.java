package com.robinpath.compiler.formatter;

/**
 * 行列位置超出源码范围。说明节点位置与提供的源码不一致。
 */
public class PositionOutOfRangeException extends RuntimeException {
    private final int row;
    private final int col;

    public PositionOutOfRangeException(String message, int row, int col) {
        super(message);
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " (row " + row + ", col " + col + ")";
    }
}
