package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

/**
 * continue 语句
 */
public class ContinueStmt extends Statement {

    public ContinueStmt(CodePosition position) {
        super(position);
    }

    @Override
    public String getKind() {
        return "continue";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContinue(this, context);
    }
}
