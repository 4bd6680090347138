package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

/**
 * 简写赋值：单独一行的 {@code $x}，把上一个结果存入变量
 */
public class ShorthandStmt extends Statement {
    private String targetName;

    public ShorthandStmt(CodePosition position, String targetName) {
        super(position);
        this.targetName = targetName;
    }

    public String getTargetName() {
        return targetName;
    }

    public void setTargetName(String targetName) {
        this.targetName = targetName;
    }

    @Override
    public String getKind() {
        return "shorthand";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitShorthand(this, context);
    }
}
