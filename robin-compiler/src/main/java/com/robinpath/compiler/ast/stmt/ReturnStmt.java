package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.expr.Expression;

/**
 * return 语句
 */
public class ReturnStmt extends Statement {
    private Expression value;  // 可选

    public ReturnStmt(CodePosition position, Expression value) {
        super(position);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String getKind() {
        return "return";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
