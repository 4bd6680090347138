package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

/**
 * break 语句
 */
public class BreakStmt extends Statement {

    public BreakStmt(CodePosition position) {
        super(position);
    }

    @Override
    public String getKind() {
        return "break";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBreak(this, context);
    }
}
