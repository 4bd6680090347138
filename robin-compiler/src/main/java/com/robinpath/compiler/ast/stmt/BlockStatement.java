package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.CodePosition;

/**
 * 块语句：头部一行，缩进的语句体，以 end 关键字结束
 */
public abstract class BlockStatement extends Statement {

    protected BlockStatement(CodePosition position) {
        super(position);
    }

    @Override
    public int getHeaderEndRow() {
        return position.getStartRow();
    }

    @Override
    public boolean isBlock() {
        return true;
    }
}
